package com.unihousing.backend.modules.activity.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.unihousing.backend.modules.activity.domain.Activity;

public interface ActivityRepository extends JpaRepository<Activity, Long> {

    /**
     * Serializes subscriptions to one activity so the capacity check and the insert cannot
     * interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Activity a where a.id = :id")
    Optional<Activity> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select new com.unihousing.backend.modules.activity.infrastructure.persistence.ActivityParticipationRow(
                       a.id, a.title, a.description, a.location, a.eventDate, a.maxParticipants,
                       count(s.id),
                       sum(case when s.student.id = :viewerId then 1L else 0L end))
              from Activity a
              left join ActivitySubscription s on s.activity = a
             where a.eventDate > :now
             group by a.id, a.title, a.description, a.location, a.eventDate, a.maxParticipants
             order by a.eventDate asc, a.id asc
            """)
    List<ActivityParticipationRow> findUpcomingWithParticipation(
            @Param("viewerId") Long viewerId,
            @Param("now") OffsetDateTime now,
            Pageable pageable
    );
}
