package com.cadastral.lookup.infrastructure.persistence;

import com.cadastral.lookup.domain.model.QueryHistory;
import jakarta.persistence.EntityManager;

/**
 * Overwrites the managed instance with the stored column values, so callers see
 * the database's numeric scale and timestamp precision rather than what was submitted.
 */
public class QueryHistoryRefresherImpl implements QueryHistoryRefresher {

    private final EntityManager entityManager;

    public QueryHistoryRefresherImpl(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    @Override
    public QueryHistory refresh(QueryHistory queryHistory) {
        entityManager.refresh(queryHistory);
        return queryHistory;
    }
}
