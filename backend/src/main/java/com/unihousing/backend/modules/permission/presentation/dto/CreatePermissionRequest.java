package com.unihousing.backend.modules.permission.presentation.dto;

/**
 * Dates arrive as {@code YYYY-MM-DD} strings so malformed values map to {@code INVALID_DATE}.
 */
public record CreatePermissionRequest(String type, String startDate, String endDate, String reason) {
}
