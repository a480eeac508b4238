package com.unihousing.backend.modules.complaint.presentation.dto;

import java.time.OffsetDateTime;

import com.unihousing.backend.modules.complaint.domain.Complaint;
import com.unihousing.backend.modules.complaint.domain.ComplaintStatus;
import com.unihousing.backend.modules.complaint.domain.ComplaintType;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ComplaintResponse(
        Long id,
        Long studentId,
        String title,
        String description,
        ComplaintType type,
        ComplaintStatus status,
        @JsonProperty("is_secret") boolean isSecret,
        String recipient,
        String adminReply,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ComplaintResponse from(Complaint complaint) {
        return new ComplaintResponse(
                complaint.getId(),
                complaint.getStudent().getId(),
                complaint.getTitle(),
                complaint.getDescription(),
                complaint.getType(),
                complaint.getStatus(),
                complaint.isSecret(),
                complaint.getRecipient(),
                complaint.getAdminReply(),
                complaint.getCreatedAt(),
                complaint.getUpdatedAt()
        );
    }
}
