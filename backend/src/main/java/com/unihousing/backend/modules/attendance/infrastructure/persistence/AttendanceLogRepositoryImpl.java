package com.unihousing.backend.modules.attendance.infrastructure.persistence;

import java.util.List;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import com.unihousing.backend.global.jpa.JpqlConditions;
import com.unihousing.backend.modules.attendance.domain.AttendanceLog;

@Repository
public class AttendanceLogRepositoryImpl implements AttendanceLogRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<AttendanceLog> search(AttendanceSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        JpqlConditions conditions = conditionsFor(condition);
        TypedQuery<AttendanceLog> query = entityManager.createQuery(
                "select a from AttendanceLog a" + conditions.toWhereClause()
                        + " order by a.logDate desc, a.id desc",
                AttendanceLog.class);
        conditions.applyTo(query);
        return query.getResultList();
    }

    static JpqlConditions conditionsFor(AttendanceSearchCondition condition) {
        return new JpqlConditions()
                .and("a.student.id = :studentId", "studentId", condition.studentId())
                .andIfPresent("a.logDate = :logDate", "logDate", condition.date())
                .andIfPresent("a.logDate >= :fromDate", "fromDate", condition.from())
                .andIfPresent("a.logDate < :toDate", "toDate", condition.toExclusive());
    }
}
