package com.unihousing.backend.modules.attendance.application;

import java.time.LocalDate;
import java.util.List;

import com.unihousing.backend.modules.attendance.infrastructure.persistence.AttendanceLogRepository;
import com.unihousing.backend.modules.attendance.infrastructure.persistence.AttendanceSearchCondition;
import com.unihousing.backend.modules.attendance.presentation.dto.AttendanceLogResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AttendanceService {

    private final AttendanceLogRepository attendanceLogRepository;

    public AttendanceService(AttendanceLogRepository attendanceLogRepository) {
        this.attendanceLogRepository = attendanceLogRepository;
    }

    @Transactional(readOnly = true)
    public List<AttendanceLogResponse> getAttendance(Long studentId, String month, String date) {
        AttendanceSearchCondition condition = AttendanceQueryValidator.validate(studentId, month, date);
        return attendanceLogRepository.search(condition).stream()
                .map(AttendanceLogResponse::from)
                .toList();
    }

    /**
     * @return number of absence rows written for {@code day}
     */
    @Transactional
    public int markMissingAsAbsent(LocalDate day) {
        return attendanceLogRepository.insertMissingAbsences(day);
    }
}
