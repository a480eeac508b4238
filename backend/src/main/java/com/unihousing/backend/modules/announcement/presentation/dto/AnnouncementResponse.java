package com.unihousing.backend.modules.announcement.presentation.dto;

import java.time.OffsetDateTime;

import com.unihousing.backend.modules.announcement.domain.Announcement;

public record AnnouncementResponse(
        Long id,
        String title,
        String body,
        String category,
        String priority,
        OffsetDateTime createdAt
) {

    public static AnnouncementResponse from(Announcement announcement) {
        return new AnnouncementResponse(
                announcement.getId(),
                announcement.getTitle(),
                announcement.getBody(),
                announcement.getCategory(),
                announcement.getPriority(),
                announcement.getCreatedAt()
        );
    }
}
