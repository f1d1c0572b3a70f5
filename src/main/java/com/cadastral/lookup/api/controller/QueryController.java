package com.cadastral.lookup.api.controller;

import com.cadastral.lookup.api.dto.QueryHistoryResponseDto;
import com.cadastral.lookup.api.dto.QueryRequestDto;
import com.cadastral.lookup.application.port.in.QueryHistoryUseCase;
import com.cadastral.lookup.application.port.in.SubmitQueryUseCase;
import com.cadastral.lookup.infrastructure.security.AuthenticatedUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for query submission and history retrieval.
 * Both endpoints require a bearer token and act on behalf of the caller.
 */
@RestController
@Validated
public class QueryController {

    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);

    private final SubmitQueryUseCase submitQueryUseCase;
    private final QueryHistoryUseCase queryHistoryUseCase;

    public QueryController(SubmitQueryUseCase submitQueryUseCase, QueryHistoryUseCase queryHistoryUseCase) {
        this.submitQueryUseCase = submitQueryUseCase;
        this.queryHistoryUseCase = queryHistoryUseCase;
    }

    /**
     * POST /query
     *
     * Resolves the cadastral number and records the outcome in the caller's history.
     *
     * @param request validated cadastral number and optional coordinates
     * @return the stored history record
     */
    @PostMapping("/query")
    public ResponseEntity<QueryHistoryResponseDto> submitQuery(
            @Valid @RequestBody QueryRequestDto request,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user,
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        logger.info("Received query: cadastralNumber={}, lat={}, lng={}",
                request.getCadastralNumber(), request.getLatitude(), request.getLongitude());

        QueryHistoryResponseDto response = submitQueryUseCase.submit(
                user.getId(),
                request.getCadastralNumber(),
                request.getLatitude(),
                request.getLongitude(),
                authorization);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /history?cadastralNumber=X&page=1&size=10
     *
     * @return the caller's records, newest first; 404 when the page is empty
     */
    @GetMapping("/history")
    public ResponseEntity<List<QueryHistoryResponseDto>> getHistory(
            @RequestParam(required = false) String cadastralNumber,
            @RequestParam(defaultValue = "1") @Min(value = 1, message = "page must be at least 1") int page,
            @RequestParam(defaultValue = "10")
            @Min(value = 1, message = "size must be between 1 and 100")
            @Max(value = 100, message = "size must be between 1 and 100") int size,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        return ResponseEntity.ok(queryHistoryUseCase.list(user.getId(), cadastralNumber, page, size));
    }
}
