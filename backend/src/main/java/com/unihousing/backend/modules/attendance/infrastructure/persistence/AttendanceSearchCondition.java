package com.unihousing.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Either an exact {@code date} or a half-open {@code [from, toExclusive)} range; both may be
 * absent for the full history.
 */
public record AttendanceSearchCondition(
        Long studentId,
        LocalDate date,
        LocalDate from,
        LocalDate toExclusive
) {

    public AttendanceSearchCondition {
        Objects.requireNonNull(studentId, "studentId must not be null");
    }

    public static AttendanceSearchCondition all(Long studentId) {
        return new AttendanceSearchCondition(studentId, null, null, null);
    }
}
