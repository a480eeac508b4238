package com.unihousing.backend.modules.maintenance.presentation.dto;

public record CreateMaintenanceRequest(String category, String description) {
}
