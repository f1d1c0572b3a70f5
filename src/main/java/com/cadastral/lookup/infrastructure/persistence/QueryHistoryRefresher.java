package com.cadastral.lookup.infrastructure.persistence;

import com.cadastral.lookup.domain.model.QueryHistory;

/**
 * Repository fragment that reloads a row from the database.
 */
public interface QueryHistoryRefresher {

    QueryHistory refresh(QueryHistory queryHistory);
}
