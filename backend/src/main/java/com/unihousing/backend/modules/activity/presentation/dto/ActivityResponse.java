package com.unihousing.backend.modules.activity.presentation.dto;

import java.time.OffsetDateTime;

import com.unihousing.backend.modules.activity.infrastructure.persistence.ActivityParticipationRow;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ActivityResponse(
        Long id,
        String title,
        String description,
        String location,
        OffsetDateTime eventDate,
        int maxParticipants,
        long participantCount,
        @JsonProperty("is_subscribed") boolean isSubscribed
) {

    public static ActivityResponse from(ActivityParticipationRow row) {
        return new ActivityResponse(
                row.id(),
                row.title(),
                row.description(),
                row.location(),
                row.eventDate(),
                row.maxParticipants(),
                row.participantCount() == null ? 0L : row.participantCount(),
                row.subscribed()
        );
    }
}
