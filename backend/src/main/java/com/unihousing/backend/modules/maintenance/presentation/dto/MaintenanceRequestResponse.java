package com.unihousing.backend.modules.maintenance.presentation.dto;

import java.time.OffsetDateTime;

import com.unihousing.backend.modules.maintenance.domain.MaintenanceCategory;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceRequest;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceStatus;

public record MaintenanceRequestResponse(
        Long id,
        Long studentId,
        Long roomId,
        String roomNumber,
        MaintenanceCategory category,
        String description,
        MaintenanceStatus status,
        String supervisorReply,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static MaintenanceRequestResponse from(MaintenanceRequest request) {
        return new MaintenanceRequestResponse(
                request.getId(),
                request.getStudent().getId(),
                request.getRoom().getId(),
                request.getRoom().getRoomNumber(),
                request.getCategory(),
                request.getDescription(),
                request.getStatus(),
                request.getSupervisorReply(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
