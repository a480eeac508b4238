package com.unihousing.backend.modules.activity.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.unihousing.backend.global.error.ProblemException;
import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.activity.domain.Activity;
import com.unihousing.backend.modules.activity.domain.ActivitySubscription;
import com.unihousing.backend.modules.activity.infrastructure.persistence.ActivityRepository;
import com.unihousing.backend.modules.activity.infrastructure.persistence.ActivitySubscriptionRepository;
import com.unihousing.backend.modules.activity.presentation.dto.ActivityResponse;
import com.unihousing.backend.modules.activity.presentation.dto.SubscriptionResponse;
import com.unihousing.backend.modules.student.application.StudentSupport;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ActivityService {

    private static final Logger log = LoggerFactory.getLogger(ActivityService.class);

    public static final String ACTIVITY_NOT_FOUND = "ACTIVITY_NOT_FOUND";
    public static final String ACTIVITY_FULL = "ACTIVITY_FULL";
    public static final String ALREADY_SUBSCRIBED = "ALREADY_SUBSCRIBED";
    public static final String SUBSCRIPTION_NOT_FOUND = "SUBSCRIPTION_NOT_FOUND";

    private final ActivityRepository activityRepository;
    private final ActivitySubscriptionRepository subscriptionRepository;
    private final StudentRepository studentRepository;
    private final Clock clock;

    public ActivityService(
            ActivityRepository activityRepository,
            ActivitySubscriptionRepository subscriptionRepository,
            StudentRepository studentRepository,
            Clock clock
    ) {
        this.activityRepository = activityRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.studentRepository = studentRepository;
        this.clock = clock;
    }

    /**
     * Upcoming activities, soonest first, each with its participant count and whether the
     * viewer is subscribed.
     */
    @Transactional(readOnly = true)
    public List<ActivityResponse> getUpcomingActivities(Long studentId, String rawLimit) {
        Integer limit = RequestValidation.parseLimit(rawLimit);
        Pageable page = limit == null ? Pageable.unpaged() : PageRequest.of(0, limit);
        return activityRepository.findUpcomingWithParticipation(studentId, OffsetDateTime.now(clock), page).stream()
                .map(ActivityResponse::from)
                .toList();
    }

    /**
     * Checks run against the locked activity row in this order: existence, capacity, duplicate.
     * The unique constraint on (student, activity) backs up the duplicate check.
     */
    @Transactional
    public SubscriptionResult subscribe(Long studentId, Long activityId) {
        Activity activity = activityRepository.findByIdForUpdate(activityId)
                .orElseThrow(() -> ProblemException.notFound(ACTIVITY_NOT_FOUND, "Activity not found"));

        long current = subscriptionRepository.countByActivityId(activityId);
        if (!activity.hasRoomFor(current)) {
            throw ProblemException.badRequest(ACTIVITY_FULL,
                    "Activity is full (" + current + "/" + activity.getMaxParticipants() + ")");
        }
        if (subscriptionRepository.existsByStudentIdAndActivityId(studentId, activityId)) {
            throw alreadySubscribed();
        }

        Student student = StudentSupport.requireStudent(studentRepository, studentId);
        try {
            ActivitySubscription saved = subscriptionRepository.saveAndFlush(new ActivitySubscription(student, activity));
            log.info("Student {} subscribed to activity {} ({}/{})", studentId, activityId,
                    current + 1, activity.getMaxParticipants());
            return new SubscriptionResult(activity.getTitle(), SubscriptionResponse.from(saved));
        } catch (DataIntegrityViolationException ex) {
            if (isDuplicateSubscription(ex)) {
                throw alreadySubscribed();
            }
            throw ex;
        }
    }

    @Transactional
    public String unsubscribe(Long studentId, Long activityId) {
        Activity activity = activityRepository.findById(activityId)
                .orElseThrow(() -> ProblemException.notFound(ACTIVITY_NOT_FOUND, "Activity not found"));
        int removed = subscriptionRepository.deleteByStudentIdAndActivityId(studentId, activityId);
        if (removed == 0) {
            throw ProblemException.notFound(SUBSCRIPTION_NOT_FOUND, "You are not subscribed to this activity");
        }
        log.info("Student {} unsubscribed from activity {}", studentId, activityId);
        return activity.getTitle();
    }

    private static ProblemException alreadySubscribed() {
        return ProblemException.conflict(ALREADY_SUBSCRIBED, "You are already subscribed to this activity");
    }

    private static boolean isDuplicateSubscription(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains(ActivitySubscription.UNIQUE_STUDENT_ACTIVITY);
    }

    public record SubscriptionResult(String activityTitle, SubscriptionResponse subscription) {
    }
}
