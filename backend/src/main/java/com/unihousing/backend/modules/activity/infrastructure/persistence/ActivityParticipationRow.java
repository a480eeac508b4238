package com.unihousing.backend.modules.activity.infrastructure.persistence;

import java.time.OffsetDateTime;

/**
 * Projection of one activity with its subscription aggregates for a given viewer.
 * {@code viewerSubscriptions} is 0 or 1.
 */
public record ActivityParticipationRow(
        Long id,
        String title,
        String description,
        String location,
        OffsetDateTime eventDate,
        Integer maxParticipants,
        Long participantCount,
        Long viewerSubscriptions
) {

    public boolean subscribed() {
        return viewerSubscriptions != null && viewerSubscriptions > 0;
    }
}
