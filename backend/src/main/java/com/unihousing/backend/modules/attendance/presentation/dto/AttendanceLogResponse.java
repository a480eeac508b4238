package com.unihousing.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.unihousing.backend.modules.attendance.domain.AttendanceLog;
import com.unihousing.backend.modules.attendance.domain.AttendanceStatus;

public record AttendanceLogResponse(Long id, LocalDate date, AttendanceStatus status, OffsetDateTime createdAt) {

    public static AttendanceLogResponse from(AttendanceLog log) {
        return new AttendanceLogResponse(log.getId(), log.getLogDate(), log.getStatus(), log.getCreatedAt());
    }
}
