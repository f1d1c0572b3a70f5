package com.cadastral.lookup.application.service;

import com.cadastral.lookup.api.dto.QueryHistoryResponseDto;
import com.cadastral.lookup.application.mapper.QueryHistoryMapper;
import com.cadastral.lookup.application.port.in.QueryHistoryUseCase;
import com.cadastral.lookup.application.port.out.QueryHistoryRepository;
import com.cadastral.lookup.domain.model.QueryHistory;
import com.cadastral.lookup.domain.service.CadastralNumberValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Application service for reading query history.
 *
 * Every read is scoped to the calling user. An empty page is reported as not found,
 * whether nothing matched or the page lies past the last record.
 */
@Service
public class HistoryQueryService implements QueryHistoryUseCase {

  private static final Logger logger = LoggerFactory.getLogger(HistoryQueryService.class);

  public static final int MAX_PAGE_SIZE = 100;
  static final String NOT_FOUND_MESSAGE = "no records found";

  // id breaks ties between rows created within the same clock tick
  private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
      .and(Sort.by(Sort.Direction.DESC, "id"));

  private final QueryHistoryRepository queryHistoryRepository;
  private final CadastralNumberValidator cadastralNumberValidator;
  private final QueryHistoryMapper queryHistoryMapper;

  public HistoryQueryService(
      QueryHistoryRepository queryHistoryRepository,
      CadastralNumberValidator cadastralNumberValidator,
      QueryHistoryMapper queryHistoryMapper) {
    this.queryHistoryRepository = queryHistoryRepository;
    this.cadastralNumberValidator = cadastralNumberValidator;
    this.queryHistoryMapper = queryHistoryMapper;
  }

  @Override
  @Transactional(readOnly = true)
  public List<QueryHistoryResponseDto> list(Long userId, String cadastralNumber, int page, int size) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    if (size < 1 || size > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
    }

    boolean filtered = cadastralNumber != null && !cadastralNumber.isEmpty();
    if (filtered) {
      cadastralNumberValidator.validate(cadastralNumber);
    }

    long offset = (long) (page - 1) * size;
    if (offset > Integer.MAX_VALUE) {
      // beyond any row offset the store can address
      logger.info("History for user {}: page {} (size {}) lies past the last record", userId, page, size);
      throw new HistoryNotFoundException(NOT_FOUND_MESSAGE);
    }

    Pageable pageable = PageRequest.of(page - 1, size, NEWEST_FIRST);
    List<QueryHistory> records = filtered
        ? queryHistoryRepository.findByUserIdAndCadastralNumber(userId, cadastralNumber, pageable)
        : queryHistoryRepository.findByUserId(userId, pageable);

    logger.info("History for user {} (filter={}, page={}, size={}): {} records",
        userId, filtered ? cadastralNumber : "none", page, size, records.size());

    if (records.isEmpty()) {
      throw new HistoryNotFoundException(NOT_FOUND_MESSAGE);
    }
    return queryHistoryMapper.toDtoList(records);
  }

  /**
   * Thrown when the requested history page holds no records.
   */
  public static class HistoryNotFoundException extends RuntimeException {
    public HistoryNotFoundException(String message) {
      super(message);
    }
  }
}
