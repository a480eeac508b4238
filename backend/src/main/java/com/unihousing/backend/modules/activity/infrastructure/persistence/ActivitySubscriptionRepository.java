package com.unihousing.backend.modules.activity.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.unihousing.backend.modules.activity.domain.ActivitySubscription;

public interface ActivitySubscriptionRepository extends JpaRepository<ActivitySubscription, Long> {

    long countByActivityId(Long activityId);

    boolean existsByStudentIdAndActivityId(Long studentId, Long activityId);

    @Modifying
    @Query("delete from ActivitySubscription s where s.student.id = :studentId and s.activity.id = :activityId")
    int deleteByStudentIdAndActivityId(@Param("studentId") Long studentId, @Param("activityId") Long activityId);
}
