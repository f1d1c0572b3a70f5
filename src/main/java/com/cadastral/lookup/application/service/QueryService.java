package com.cadastral.lookup.application.service;

import com.cadastral.lookup.api.dto.QueryHistoryResponseDto;
import com.cadastral.lookup.application.mapper.QueryHistoryMapper;
import com.cadastral.lookup.application.port.in.SubmitQueryUseCase;
import com.cadastral.lookup.application.port.out.CadastralResolver;
import com.cadastral.lookup.application.port.out.QueryHistoryRepository;
import com.cadastral.lookup.domain.model.QueryHistory;
import com.cadastral.lookup.domain.model.ResolutionResult;
import com.cadastral.lookup.infrastructure.config.QueryProperties;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Application service handling query submission: resolve, then record.
 *
 * The resolver call runs outside any transaction so a slow resolver never holds a
 * database connection. Persistence is a single insert committed in its own transaction.
 */
@Service
public class QueryService implements SubmitQueryUseCase {

  private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

  static final String COORDINATES_CONSTRAINT = "uq_queryhistory_coordinates";
  static final String CADASTRAL_NUMBER_CONSTRAINT = "uq_queryhistory_cadastral_number";

  static final String DUPLICATE_COORDINATES = "A record with these coordinates already exists";
  static final String DUPLICATE_CADASTRAL_NUMBER = "A record with this cadastral number already exists";

  private final CadastralResolver cadastralResolver;
  private final QueryHistoryRepository queryHistoryRepository;
  private final QueryHistoryMapper queryHistoryMapper;
  private final TransactionTemplate transactionTemplate;
  private final boolean enforceUniqueCoordinates;

  public QueryService(
      CadastralResolver cadastralResolver,
      QueryHistoryRepository queryHistoryRepository,
      QueryHistoryMapper queryHistoryMapper,
      PlatformTransactionManager transactionManager,
      QueryProperties queryProperties) {
    this.cadastralResolver = cadastralResolver;
    this.queryHistoryRepository = queryHistoryRepository;
    this.queryHistoryMapper = queryHistoryMapper;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.enforceUniqueCoordinates = queryProperties.isEnforceUniqueCoordinates();
  }

  @Override
  public QueryHistoryResponseDto submit(Long userId, String cadastralNumber, BigDecimal latitude,
      BigDecimal longitude, String authorization) {
    logger.info("Submitting query for cadastral number {} (user {})", cadastralNumber, userId);

    boolean matched = cadastralResolver.resolve(cadastralNumber, authorization)
        .map(ResolutionResult::isMatched)
        .orElse(false);

    QueryHistory record = new QueryHistory(userId, cadastralNumber, latitude, longitude, matched);
    QueryHistory saved = transactionTemplate.execute(status -> persist(record));

    logger.info("Recorded query {} for cadastral number {}: result={}", saved.getId(), cadastralNumber, matched);
    return queryHistoryMapper.toDto(saved);
  }

  private QueryHistory persist(QueryHistory record) {
    if (enforceUniqueCoordinates
        && record.getLatitude() != null
        && record.getLongitude() != null
        && queryHistoryRepository.existsByLatitudeAndLongitude(record.getLatitude(), record.getLongitude())) {
      throw new UniquenessConflictException(DUPLICATE_COORDINATES);
    }

    QueryHistory saved;
    try {
      saved = queryHistoryRepository.saveAndFlush(record);
    } catch (DataIntegrityViolationException e) {
      String constraint = violatedConstraint(e);
      if (constraint.contains(COORDINATES_CONSTRAINT)) {
        logger.info("Duplicate coordinates rejected for {}", record.getCadastralNumber());
        throw new UniquenessConflictException(DUPLICATE_COORDINATES, e);
      }
      if (constraint.contains(CADASTRAL_NUMBER_CONSTRAINT)) {
        logger.info("Duplicate cadastral number rejected: {}", record.getCadastralNumber());
        throw new UniquenessConflictException(DUPLICATE_CADASTRAL_NUMBER, e);
      }
      throw e;
    }
    return queryHistoryRepository.refresh(saved);
  }

  private static String violatedConstraint(DataIntegrityViolationException e) {
    String name = null;
    if (e.getCause() instanceof ConstraintViolationException violation) {
      name = violation.getConstraintName();
    }
    if (name == null) {
      name = e.getMostSpecificCause().getMessage();
    }
    return name == null ? "" : name.toLowerCase(Locale.ROOT);
  }

  /**
   * Thrown when a submission collides with a uniqueness rule.
   */
  public static class UniquenessConflictException extends RuntimeException {
    public UniquenessConflictException(String message) {
      super(message);
    }

    public UniquenessConflictException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
