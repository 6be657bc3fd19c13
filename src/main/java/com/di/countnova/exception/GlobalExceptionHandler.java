package com.di.countnova.exception;

import com.di.countnova.aggregation.AggregationInterruptedException;
import com.di.countnova.aggregation.BaselineUnavailableException;
import com.di.countnova.aggregation.InvalidAggregationConfigException;
import com.di.countnova.store.IndexStoreException;
import com.di.countnova.store.QueryTimeoutException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application.
 *
 * <p>Maps the aggregation error taxonomy to HTTP:
 * <ul>
 *   <li>{@link InvalidAggregationConfigException}, bad request bodies → 400</li>
 *   <li>{@link BaselineUnavailableException}, {@link IndexStoreException} → 502</li>
 *   <li>{@link QueryTimeoutException} → 504</li>
 *   <li>{@link AggregationInterruptedException} → 503</li>
 *   <li>anything else → 500</li>
 * </ul>
 * Per-key query failures never reach this handler; the worker pool drops them and the report
 * counts them.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles rejected aggregation requests and other validation errors.
     */
    @ExceptionHandler({InvalidAggregationConfigException.class,
                       IllegalArgumentException.class,
                       IllegalStateException.class,
                       HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    /**
     * Handles bean validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ResponseEntity<ErrorResponse> response = respond(HttpStatus.BAD_REQUEST, e);
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            response.getBody().addDetail(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return response;
    }

    /**
     * Handles a baseline that could not be computed.
     */
    @ExceptionHandler(BaselineUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBaselineUnavailable(BaselineUnavailableException e) {
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    /**
     * Handles a run abandoned because its thread was interrupted (e.g. during shutdown).
     */
    @ExceptionHandler(AggregationInterruptedException.class)
    public ResponseEntity<ErrorResponse> handleInterrupted(AggregationInterruptedException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    /**
     * Handles a single-query report whose query timed out.
     */
    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleQueryTimeout(QueryTimeoutException e) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, e);
    }

    /**
     * Handles a single-query report whose query failed.
     */
    @ExceptionHandler(IndexStoreException.class)
    public ResponseEntity<ErrorResponse> handleIndexStoreException(IndexStoreException e) {
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    /**
     * Handles all other unhandled exceptions (catch-all).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, Throwable e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (status.is5xxServerError()) {
            log.error("GlobalExceptionHandler caught exception: {} [{}]",
                    e.getClass().getSimpleName(), category.getName(), e);
        } else {
            log.warn("GlobalExceptionHandler rejected request: {} [{}]: {}",
                    e.getClass().getSimpleName(), category.getName(), e.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    /**
     * Builds a structured error response.
     */
    static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Gets the request path from MDC or returns default.
     */
    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
