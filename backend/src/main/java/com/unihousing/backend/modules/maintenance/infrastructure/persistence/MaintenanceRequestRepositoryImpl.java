package com.unihousing.backend.modules.maintenance.infrastructure.persistence;

import java.util.List;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import com.unihousing.backend.global.jpa.JpqlConditions;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceRequest;

@Repository
public class MaintenanceRequestRepositoryImpl implements MaintenanceRequestRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<MaintenanceRequest> search(MaintenanceSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        JpqlConditions conditions = conditionsFor(condition);
        TypedQuery<MaintenanceRequest> query = entityManager.createQuery(
                "select m from MaintenanceRequest m join fetch m.room" + conditions.toWhereClause()
                        + " order by m.createdAt desc, m.id desc",
                MaintenanceRequest.class);
        conditions.applyTo(query);
        return query.getResultList();
    }

    static JpqlConditions conditionsFor(MaintenanceSearchCondition condition) {
        return new JpqlConditions()
                .and("m.room.id = :roomId", "roomId", condition.roomId())
                .andIfPresent("m.status = :status", "status", condition.status())
                .andIfPresent("m.category = :category", "category", condition.category());
    }
}
