package com.unihousing.backend.modules.attendance.infrastructure.persistence;

import java.util.List;

import com.unihousing.backend.modules.attendance.domain.AttendanceLog;

public interface AttendanceLogRepositoryCustom {

    List<AttendanceLog> search(AttendanceSearchCondition condition);
}
