package com.unihousing.backend.modules.attendance.application;

import java.time.Clock;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AttendanceAbsenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(AttendanceAbsenceScheduler.class);

    private final AttendanceService attendanceService;
    private final Clock clock;

    public AttendanceAbsenceScheduler(AttendanceService attendanceService, Clock clock) {
        this.attendanceService = attendanceService;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.attendance.absence-cron:0 0 23 * * *}", zone = "${app.attendance.zone:UTC}")
    public void markAbsentees() {
        LocalDate today = LocalDate.now(clock);
        int marked = attendanceService.markMissingAsAbsent(today);
        log.info("Nightly attendance check for {} marked {} students absent", today, marked);
    }
}
