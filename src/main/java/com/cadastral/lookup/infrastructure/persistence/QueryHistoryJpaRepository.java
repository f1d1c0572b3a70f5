package com.cadastral.lookup.infrastructure.persistence;

import com.cadastral.lookup.application.port.out.QueryHistoryRepository;
import com.cadastral.lookup.domain.model.QueryHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * JPA implementation of QueryHistoryRepository output port.
 */
@Repository
public interface QueryHistoryJpaRepository extends JpaRepository<QueryHistory, Long>, QueryHistoryRepository,
        QueryHistoryRefresher {

    @Override
    List<QueryHistory> findByUserId(Long userId, Pageable pageable);

    @Override
    List<QueryHistory> findByUserIdAndCadastralNumber(Long userId, String cadastralNumber, Pageable pageable);

    @Override
    boolean existsByLatitudeAndLongitude(BigDecimal latitude, BigDecimal longitude);

    @Override
    long countByUserId(Long userId);

    /**
     * Bulk delete; bypasses the persistence context, so callers must not reuse loaded rows.
     */
    @Override
    @Modifying
    @Query("DELETE FROM QueryHistory qh WHERE qh.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
