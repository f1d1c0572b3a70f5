package com.cadastral.lookup.application.port.in;

import com.cadastral.lookup.api.dto.QueryHistoryResponseDto;

import java.util.List;

/**
 * Input port for reading a user's query history.
 */
public interface QueryHistoryUseCase {

  /**
   * List the caller's history, newest first.
   *
   * @param userId caller; rows of other users are never returned
   * @param cadastralNumber optional exact-match filter, validated before querying
   * @param page 1-based page number
   * @param size page size, 1 to 100
   * @return a non-empty page of records
   */
  List<QueryHistoryResponseDto> list(Long userId, String cadastralNumber, int page, int size);
}
