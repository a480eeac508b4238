package com.unihousing.backend.modules.permission.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.unihousing.backend.modules.permission.domain.PermissionRequest;
import com.unihousing.backend.modules.permission.domain.PermissionStatus;
import com.unihousing.backend.modules.permission.domain.PermissionType;

public record PermissionRequestResponse(
        Long id,
        Long studentId,
        PermissionType type,
        LocalDate startDate,
        LocalDate endDate,
        String reason,
        PermissionStatus status,
        String adminRemarks,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PermissionRequestResponse from(PermissionRequest request) {
        return new PermissionRequestResponse(
                request.getId(),
                request.getStudent().getId(),
                request.getType(),
                request.getStartDate(),
                request.getEndDate(),
                request.getReason(),
                request.getStatus(),
                request.getAdminRemarks(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
