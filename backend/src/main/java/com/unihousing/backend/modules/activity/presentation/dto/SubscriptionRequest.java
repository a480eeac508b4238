package com.unihousing.backend.modules.activity.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record SubscriptionRequest(
        @NotNull(message = "activity_id is required") Long activityId
) {
}
