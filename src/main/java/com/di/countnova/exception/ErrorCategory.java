package com.di.countnova.exception;

import com.di.countnova.aggregation.AggregationInterruptedException;
import com.di.countnova.aggregation.BaselineUnavailableException;
import com.di.countnova.aggregation.InvalidAggregationConfigException;
import com.di.countnova.store.IndexStoreException;
import com.di.countnova.store.QueryTimeoutException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for error responses and logging.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Aggregation request or application configuration is invalid"),
    BASELINE_UNAVAILABLE("Baseline unavailable", "Dataset baseline could not be computed"),
    INTERRUPTED("Interrupted", "Run was interrupted before it finished"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    INDEX_STORE_ERROR("Index store error", "Query against the index store failed"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof BaselineUnavailableException, BASELINE_UNAVAILABLE);
        MATCHERS.put(ErrorCategory::isInterrupted, INTERRUPTED);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(t -> t instanceof IndexStoreException, INDEX_STORE_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof InvalidAggregationConfigException
                || t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isInterrupted(Throwable t) {
        return t instanceof AggregationInterruptedException
                || t instanceof InterruptedException
                || t.getCause() instanceof InterruptedException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof QueryTimeoutException
                || t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.http.HttpTimeoutException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || t instanceof org.springframework.web.client.ResourceAccessException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof org.springframework.web.bind.MethodArgumentNotValidException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException;
    }

    @Override
    public String toString() {
        return name();
    }
}
