package com.unihousing.backend.modules.complaint.infrastructure.persistence;

import java.util.List;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import com.unihousing.backend.global.jpa.JpqlConditions;
import com.unihousing.backend.modules.complaint.domain.Complaint;

@Repository
public class ComplaintRepositoryImpl implements ComplaintRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Complaint> search(ComplaintSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        JpqlConditions conditions = conditionsFor(condition);
        TypedQuery<Complaint> query = entityManager.createQuery(
                "select c from Complaint c" + conditions.toWhereClause()
                        + " order by c.createdAt desc, c.id desc",
                Complaint.class);
        conditions.applyTo(query);
        return query.getResultList();
    }

    static JpqlConditions conditionsFor(ComplaintSearchCondition condition) {
        return new JpqlConditions()
                .and("c.student.id = :studentId", "studentId", condition.studentId())
                .andIfPresent("c.status = :status", "status", condition.status())
                .andIfPresent("c.type = :type", "type", condition.type());
    }
}
