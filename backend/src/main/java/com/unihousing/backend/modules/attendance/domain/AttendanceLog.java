package com.unihousing.backend.modules.attendance.domain;

import java.time.LocalDate;

import com.unihousing.backend.global.jpa.AbstractCreatedEntity;
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
 * One row per student per day; {@code (student_id, log_date)} is unique in the schema.
 */
@Entity
@Table(name = "attendance_logs")
public class AttendanceLog extends AbstractCreatedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private Student student;

    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private AttendanceStatus status;

    protected AttendanceLog() {
    }

    public AttendanceLog(Student student, LocalDate logDate, AttendanceStatus status) {
        this.student = student;
        this.logDate = logDate;
        this.status = status;
    }

    public Long getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public LocalDate getLogDate() {
        return logDate;
    }

    public AttendanceStatus getStatus() {
        return status;
    }
}
