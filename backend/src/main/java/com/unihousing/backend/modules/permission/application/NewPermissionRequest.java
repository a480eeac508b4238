package com.unihousing.backend.modules.permission.application;

import java.time.LocalDate;

import com.unihousing.backend.modules.permission.domain.PermissionType;

public record NewPermissionRequest(PermissionType type, LocalDate startDate, LocalDate endDate, String reason) {
}
