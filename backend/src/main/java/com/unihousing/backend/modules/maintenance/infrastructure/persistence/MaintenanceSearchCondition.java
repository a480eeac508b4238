package com.unihousing.backend.modules.maintenance.infrastructure.persistence;

import java.util.Objects;

import com.unihousing.backend.modules.maintenance.domain.MaintenanceCategory;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceStatus;

public record MaintenanceSearchCondition(Long roomId, MaintenanceStatus status, MaintenanceCategory category) {

    public MaintenanceSearchCondition {
        Objects.requireNonNull(roomId, "roomId must not be null");
    }
}
