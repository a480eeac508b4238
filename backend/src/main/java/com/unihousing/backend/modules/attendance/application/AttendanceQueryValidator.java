package com.unihousing.backend.modules.attendance.application;

import java.time.LocalDate;
import java.time.YearMonth;

import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.attendance.infrastructure.persistence.AttendanceSearchCondition;

/**
 * Turns the raw {@code month} / {@code date} query parameters into a search condition.
 * {@code date} takes precedence when both are given.
 */
public final class AttendanceQueryValidator {

    private AttendanceQueryValidator() {
    }

    public static AttendanceSearchCondition validate(Long studentId, String month, String date) {
        if (date != null && !date.isBlank()) {
            LocalDate day = RequestValidation.parseDate("date", date);
            return new AttendanceSearchCondition(studentId, day, null, null);
        }
        if (month != null && !month.isBlank()) {
            YearMonth yearMonth = RequestValidation.parseMonth("month", month);
            return new AttendanceSearchCondition(
                    studentId,
                    null,
                    yearMonth.atDay(1),
                    yearMonth.plusMonths(1).atDay(1)
            );
        }
        return AttendanceSearchCondition.all(studentId);
    }
}
