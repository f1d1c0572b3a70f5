package com.cadastral.lookup.application.port.out;

import com.cadastral.lookup.domain.model.QueryHistory;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output port for query history persistence.
 * Rows are only ever inserted, read, or removed together with their user.
 */
public interface QueryHistoryRepository {

  /**
   * Insert a row and flush so constraint violations surface inside the caller's transaction.
   */
  QueryHistory saveAndFlush(QueryHistory queryHistory);

  /**
   * Reload a flushed row so it carries the values as stored.
   */
  QueryHistory refresh(QueryHistory queryHistory);

  /**
   * Page through one user's history. Ordering comes from the pageable's sort.
   */
  List<QueryHistory> findByUserId(Long userId, Pageable pageable);

  /**
   * Page through one user's history for a single cadastral number.
   */
  List<QueryHistory> findByUserIdAndCadastralNumber(Long userId, String cadastralNumber, Pageable pageable);

  boolean existsByLatitudeAndLongitude(BigDecimal latitude, BigDecimal longitude);

  long countByUserId(Long userId);

  /**
   * Remove every history row owned by the user. Returns the number of rows removed.
   */
  int deleteByUserId(Long userId);
}
