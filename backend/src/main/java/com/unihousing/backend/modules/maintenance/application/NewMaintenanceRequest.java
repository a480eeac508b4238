package com.unihousing.backend.modules.maintenance.application;

import com.unihousing.backend.modules.maintenance.domain.MaintenanceCategory;

public record NewMaintenanceRequest(MaintenanceCategory category, String description) {
}
