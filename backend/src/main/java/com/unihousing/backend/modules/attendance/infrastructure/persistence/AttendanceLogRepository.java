package com.unihousing.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.unihousing.backend.modules.attendance.domain.AttendanceLog;

public interface AttendanceLogRepository extends JpaRepository<AttendanceLog, Long>, AttendanceLogRepositoryCustom {

    boolean existsByStudentIdAndLogDate(Long studentId, LocalDate logDate);

    /**
     * Records {@code ABSENT} for every active student who has no row for {@code day}.
     * Rows written concurrently by the check-in flow win.
     */
    @Modifying
    @Query(value = """
            INSERT INTO attendance_logs (student_id, log_date, status, created_at)
            SELECT s.id, CAST(:day AS DATE), 'ABSENT', CURRENT_TIMESTAMP
              FROM students s
             WHERE s.is_suspended = FALSE
               AND NOT EXISTS (
                   SELECT 1 FROM attendance_logs a
                    WHERE a.student_id = s.id
                      AND a.log_date = :day
               )
            ON CONFLICT (student_id, log_date) DO NOTHING
            """, nativeQuery = true)
    int insertMissingAbsences(@Param("day") LocalDate day);
}
