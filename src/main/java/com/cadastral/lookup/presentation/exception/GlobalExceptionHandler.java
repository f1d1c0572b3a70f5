package com.cadastral.lookup.presentation.exception;

import com.cadastral.lookup.application.service.AuthenticationService;
import com.cadastral.lookup.application.service.HistoryQueryService;
import com.cadastral.lookup.application.service.QueryService;
import com.cadastral.lookup.application.service.UserAccountService;
import com.cadastral.lookup.domain.service.CadastralNumberValidator;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler providing consistent JSON error responses:
 * {@code {"error": CODE, "detail": message}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        logger.debug("Validation error", ex);

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError ->
                fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage()));

        Map<String, Object> error = body("VALIDATION_ERROR", "Validation failed");
        error.put("fieldErrors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        logger.debug("Parameter constraint violation", ex);
        String detail = ex.getConstraintViolations().stream()
                .map(violation -> violation.getMessage())
                .findFirst()
                .orElse("Invalid parameter");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("INVALID_PARAMETER", detail));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleMethodValidation(HandlerMethodValidationException ex) {
        logger.debug("Parameter validation error", ex);
        String detail = ex.getAllErrors().stream()
                .map(err -> err.getDefaultMessage())
                .findFirst()
                .orElse("Invalid parameter");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("INVALID_PARAMETER", detail));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        logger.debug("Type mismatch error", ex);

        Map<String, Object> error = body("INVALID_PARAMETER", "Invalid parameter type: " + ex.getName());
        error.put("parameter", ex.getName());
        error.put("expectedType", ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("INVALID_PARAMETER", "Missing parameter: " + ex.getParameterName()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(Exception ex) {
        logger.debug("Unreadable request body", ex);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("VALIDATION_ERROR", "Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.debug("Illegal argument error", ex);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("INVALID_INPUT", ex.getMessage()));
    }

    @ExceptionHandler(CadastralNumberValidator.CadastralNumberFormatException.class)
    public ResponseEntity<Map<String, Object>> handleCadastralNumberFormat(
            CadastralNumberValidator.CadastralNumberFormatException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("INVALID_CADASTRAL_NUMBER", ex.getMessage()));
    }

    @ExceptionHandler(QueryService.UniquenessConflictException.class)
    public ResponseEntity<Map<String, Object>> handleUniquenessConflict(QueryService.UniquenessConflictException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("DUPLICATE_RECORD", ex.getMessage()));
    }

    @ExceptionHandler(HistoryQueryService.HistoryNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleHistoryNotFound(HistoryQueryService.HistoryNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(UserAccountService.UserAlreadyExistsException.class)
    public ResponseEntity<Map<String, Object>> handleUserAlreadyExists(UserAccountService.UserAlreadyExistsException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(ex.getMessage(), "A user with this email already exists"));
    }

    @ExceptionHandler(AuthenticationService.InvalidCredentialsException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidCredentials(AuthenticationService.InvalidCredentialsException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(ex.getMessage(), "Bad credentials or inactive user"));
    }

    @ExceptionHandler(UserAccountService.UserNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleUserNotFound(UserAccountService.UserNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(UserAccountService.InsufficientPrivilegesException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientPrivileges(
            UserAccountService.InsufficientPrivilegesException ex) {
        logger.warn("Forbidden: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("FORBIDDEN", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            logger.debug("Framework error response", ex);
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            return ResponseEntity.status(status).body(body(status.name(), status.getReasonPhrase()));
        }
        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static Map<String, Object> body(String error, String detail) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("detail", detail);
        return body;
    }
}
