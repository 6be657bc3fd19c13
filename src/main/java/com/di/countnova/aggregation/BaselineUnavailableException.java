package com.di.countnova.aggregation;

/**
 * The baseline record count could not be computed because one of its sub-queries failed.
 * Fatal for the run: without a baseline there is no denominator for the coverage threshold.
 * <p>
 * Handled by {@link com.di.countnova.exception.GlobalExceptionHandler} as a 502 Bad Gateway.
 */
public class BaselineUnavailableException extends RuntimeException {

    public BaselineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
