package com.unihousing.backend.modules.announcement.infrastructure.persistence;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.unihousing.backend.global.jpa.JpqlConditions;
import com.unihousing.backend.modules.announcement.domain.Announcement;

@Repository
public class AnnouncementRepositoryImpl implements AnnouncementRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Announcement> search(AnnouncementSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        JpqlConditions conditions = conditionsFor(condition);
        TypedQuery<Announcement> query = entityManager.createQuery(
                "select a from Announcement a" + conditions.toWhereClause()
                        + " order by a.createdAt desc, a.id desc",
                Announcement.class);
        conditions.applyTo(query);
        if (condition.limit() != null) {
            query.setMaxResults(condition.limit());
        }
        return query.getResultList();
    }

    static JpqlConditions conditionsFor(AnnouncementSearchCondition condition) {
        JpqlConditions conditions = new JpqlConditions();
        if (StringUtils.hasText(condition.category())) {
            conditions.and("lower(a.category) = :category", "category",
                    condition.category().trim().toLowerCase(Locale.ROOT));
        }
        return conditions;
    }
}
