package com.unihousing.backend.modules.permission.domain;

import java.time.LocalDate;

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
 * Late-return or travel permission. {@code end_date >= start_date} is also checked by the schema.
 */
@Entity
@Table(name = "permissions")
public class PermissionRequest extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private Student student;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 10)
    private PermissionType type;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "reason", nullable = false, length = 5000)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private PermissionStatus status = PermissionStatus.PENDING;

    @Column(name = "admin_remarks")
    private String adminRemarks;

    protected PermissionRequest() {
    }

    public PermissionRequest(Student student, PermissionType type, LocalDate startDate, LocalDate endDate, String reason) {
        this.student = student;
        this.type = type;
        this.startDate = startDate;
        this.endDate = endDate;
        this.reason = reason;
    }

    public Long getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public PermissionType getType() {
        return type;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public String getReason() {
        return reason;
    }

    public PermissionStatus getStatus() {
        return status;
    }

    public String getAdminRemarks() {
        return adminRemarks;
    }
}
