package com.cadastral.lookup.application.port.out;

import com.cadastral.lookup.domain.model.ResolutionResult;

import java.util.Optional;

/**
 * Output port for the external service that decides whether a cadastral number resolves.
 *
 * Implementations are best-effort: they never throw for timeouts or transport failures
 * and return an empty result instead.
 */
public interface CadastralResolver {

  /**
   * @param cadastralNumber number to resolve
   * @param authorization caller's Authorization header value to forward, may be null
   * @return the resolver's answer, or empty if none arrived in time
   */
  Optional<ResolutionResult> resolve(String cadastralNumber, String authorization);
}
