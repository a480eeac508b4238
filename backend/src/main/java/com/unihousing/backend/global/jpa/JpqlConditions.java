package com.unihousing.backend.global.jpa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.persistence.Query;

/**
 * Collects {@code AND}-joined predicates with their named parameters for the custom search
 * repositories. Values are only ever bound, never concatenated into the query text.
 */
public final class JpqlConditions {

    private final List<String> clauses = new ArrayList<>();
    private final Map<String, Object> params = new LinkedHashMap<>();

    public JpqlConditions and(String clause, String paramName, Object value) {
        if (params.containsKey(paramName)) {
            throw new IllegalArgumentException("Duplicate parameter: " + paramName);
        }
        clauses.add(clause);
        params.put(paramName, value);
        return this;
    }

    /** Adds the predicate only when {@code value} is non-null. */
    public JpqlConditions andIfPresent(String clause, String paramName, Object value) {
        if (value != null) {
            and(clause, paramName, value);
        }
        return this;
    }

    public String toWhereClause() {
        return clauses.isEmpty() ? "" : " where " + String.join(" and ", clauses);
    }

    public void applyTo(Query query) {
        params.forEach(query::setParameter);
    }

    public List<String> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    public Map<String, Object> params() {
        return Collections.unmodifiableMap(params);
    }
}
