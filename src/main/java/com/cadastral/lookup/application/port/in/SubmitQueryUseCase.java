package com.cadastral.lookup.application.port.in;

import com.cadastral.lookup.api.dto.QueryHistoryResponseDto;

import java.math.BigDecimal;

/**
 * Input port for submitting a cadastral query.
 */
public interface SubmitQueryUseCase {

  /**
   * Resolve the cadastral number and record the outcome for the user.
   *
   * The resolver is consulted first (bounded by its timeout); the history row is
   * written afterwards in its own transaction. A missing resolver answer is stored
   * as {@code result = false}.
   *
   * @param userId owner of the new history row
   * @param cadastralNumber already validated cadastral number
   * @param latitude optional latitude, stored as given
   * @param longitude optional longitude, stored as given
   * @param authorization caller's Authorization header, forwarded to the resolver
   * @return the stored record with its server-assigned id and creation time
   */
  QueryHistoryResponseDto submit(Long userId, String cadastralNumber, BigDecimal latitude, BigDecimal longitude,
      String authorization);
}
