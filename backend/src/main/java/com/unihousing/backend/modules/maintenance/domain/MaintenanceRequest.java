package com.unihousing.backend.modules.maintenance.domain;

import com.unihousing.backend.global.jpa.AbstractTimestampedEntity;
import com.unihousing.backend.modules.student.domain.Room;
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
 * Repair request against a room. The filing student is kept as owner, but every resident of
 * the room sees it.
 */
@Entity
@Table(name = "maintenance_requests")
public class MaintenanceRequest extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private Student student;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id", nullable = false, updatable = false)
    private Room room;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private MaintenanceCategory category;

    @Column(name = "description", nullable = false, length = 5000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MaintenanceStatus status = MaintenanceStatus.OPEN;

    @Column(name = "supervisor_reply")
    private String supervisorReply;

    protected MaintenanceRequest() {
    }

    public MaintenanceRequest(Student student, Room room, MaintenanceCategory category, String description) {
        this.student = student;
        this.room = room;
        this.category = category;
        this.description = description;
    }

    public Long getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public Room getRoom() {
        return room;
    }

    public MaintenanceCategory getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public MaintenanceStatus getStatus() {
        return status;
    }

    public String getSupervisorReply() {
        return supervisorReply;
    }
}
