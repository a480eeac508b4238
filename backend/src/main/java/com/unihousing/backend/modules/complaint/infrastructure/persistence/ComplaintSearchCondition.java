package com.unihousing.backend.modules.complaint.infrastructure.persistence;

import java.util.Objects;

import com.unihousing.backend.modules.complaint.domain.ComplaintStatus;
import com.unihousing.backend.modules.complaint.domain.ComplaintType;

public record ComplaintSearchCondition(Long studentId, ComplaintStatus status, ComplaintType type) {

    public ComplaintSearchCondition {
        Objects.requireNonNull(studentId, "studentId must not be null");
    }
}
