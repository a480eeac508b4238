package com.unihousing.backend.modules.clearance.domain;

import java.time.OffsetDateTime;

import com.unihousing.backend.global.jpa.AbstractTimestampedEntity;
import com.unihousing.backend.modules.student.domain.Student;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "clearance_process")
public class ClearanceProcess extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false, unique = true)
    private Student student;

    @Column(name = "room_check_passed", nullable = false)
    private boolean roomCheckPassed;

    @Column(name = "keys_returned", nullable = false)
    private boolean keysReturned;

    @Column(name = "initiated_at", nullable = false, updatable = false)
    private OffsetDateTime initiatedAt;

    protected ClearanceProcess() {
    }

    public ClearanceProcess(Student student, OffsetDateTime initiatedAt) {
        this.student = student;
        this.initiatedAt = initiatedAt;
    }

    public Long getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public boolean isRoomCheckPassed() {
        return roomCheckPassed;
    }

    public void setRoomCheckPassed(boolean roomCheckPassed) {
        this.roomCheckPassed = roomCheckPassed;
    }

    public boolean isKeysReturned() {
        return keysReturned;
    }

    public void setKeysReturned(boolean keysReturned) {
        this.keysReturned = keysReturned;
    }

    public OffsetDateTime getInitiatedAt() {
        return initiatedAt;
    }

    public ClearanceProgress progress() {
        return ClearanceProgress.of(this);
    }
}
