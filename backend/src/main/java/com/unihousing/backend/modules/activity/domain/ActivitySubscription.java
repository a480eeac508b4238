package com.unihousing.backend.modules.activity.domain;

import com.unihousing.backend.global.jpa.AbstractCreatedEntity;
import com.unihousing.backend.modules.student.domain.Student;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
        name = "activity_subscriptions",
        uniqueConstraints = @UniqueConstraint(
                name = ActivitySubscription.UNIQUE_STUDENT_ACTIVITY,
                columnNames = {"student_id", "activity_id"}
        )
)
public class ActivitySubscription extends AbstractCreatedEntity {

    public static final String UNIQUE_STUDENT_ACTIVITY = "uq_activity_subscription_student_activity";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private Student student;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "activity_id", nullable = false, updatable = false)
    private Activity activity;

    protected ActivitySubscription() {
    }

    public ActivitySubscription(Student student, Activity activity) {
        this.student = student;
        this.activity = activity;
    }

    public Long getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public Activity getActivity() {
        return activity;
    }
}
