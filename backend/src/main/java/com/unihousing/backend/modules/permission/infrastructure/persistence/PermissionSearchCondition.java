package com.unihousing.backend.modules.permission.infrastructure.persistence;

import java.util.Objects;

import com.unihousing.backend.modules.permission.domain.PermissionStatus;
import com.unihousing.backend.modules.permission.domain.PermissionType;

public record PermissionSearchCondition(Long studentId, PermissionStatus status, PermissionType type) {

    public PermissionSearchCondition {
        Objects.requireNonNull(studentId, "studentId must not be null");
    }
}
