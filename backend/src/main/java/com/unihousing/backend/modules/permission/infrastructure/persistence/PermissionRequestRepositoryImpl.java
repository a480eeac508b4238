package com.unihousing.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import com.unihousing.backend.global.jpa.JpqlConditions;
import com.unihousing.backend.modules.permission.domain.PermissionRequest;

@Repository
public class PermissionRequestRepositoryImpl implements PermissionRequestRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<PermissionRequest> search(PermissionSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        JpqlConditions conditions = conditionsFor(condition);
        // upcoming leave first
        TypedQuery<PermissionRequest> query = entityManager.createQuery(
                "select p from PermissionRequest p" + conditions.toWhereClause()
                        + " order by p.startDate asc, p.id asc",
                PermissionRequest.class);
        conditions.applyTo(query);
        return query.getResultList();
    }

    static JpqlConditions conditionsFor(PermissionSearchCondition condition) {
        return new JpqlConditions()
                .and("p.student.id = :studentId", "studentId", condition.studentId())
                .andIfPresent("p.status = :status", "status", condition.status())
                .andIfPresent("p.type = :type", "type", condition.type());
    }
}
