package com.unihousing.backend.modules.activity.presentation.dto;

import java.time.OffsetDateTime;

import com.unihousing.backend.modules.activity.domain.ActivitySubscription;

public record SubscriptionResponse(Long id, Long activityId, Long studentId, OffsetDateTime createdAt) {

    public static SubscriptionResponse from(ActivitySubscription subscription) {
        return new SubscriptionResponse(
                subscription.getId(),
                subscription.getActivity().getId(),
                subscription.getStudent().getId(),
                subscription.getCreatedAt()
        );
    }
}
