package com.unihousing.backend.modules.complaint.domain;

import com.unihousing.backend.global.jpa.AbstractTimestampedEntity;
import com.unihousing.backend.modules.student.domain.Student;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Complaint filed by a student. Status and reply are changed by staff tooling only.
 */
@Entity
@Table(name = "complaints")
public class Complaint extends AbstractTimestampedEntity {

    public static final String DEFAULT_RECIPIENT = "Management";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private Student student;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", nullable = false, length = 5000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 10)
    private ComplaintType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private ComplaintStatus status = ComplaintStatus.PENDING;

    @Column(name = "is_secret", nullable = false)
    private boolean secret;

    @Column(name = "recipient", nullable = false, length = 100)
    private String recipient = DEFAULT_RECIPIENT;

    @Column(name = "admin_reply")
    private String adminReply;

    protected Complaint() {
    }

    public Complaint(Student student, String title, String description, ComplaintType type, boolean secret, String recipient) {
        this.student = student;
        this.title = title;
        this.description = description;
        this.type = type;
        this.secret = secret;
        this.recipient = recipient != null ? recipient : DEFAULT_RECIPIENT;
    }

    public Long getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public ComplaintType getType() {
        return type;
    }

    public ComplaintStatus getStatus() {
        return status;
    }

    public boolean isSecret() {
        return secret;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getAdminReply() {
        return adminReply;
    }
}
