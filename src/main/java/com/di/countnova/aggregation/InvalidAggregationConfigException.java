package com.di.countnova.aggregation;

/**
 * An aggregation request was rejected before any work started: empty or invalid dimension
 * ranges, a threshold outside (0, 1], a non-positive pool size, or a zero baseline.
 * <p>
 * Handled by {@link com.di.countnova.exception.GlobalExceptionHandler} as a 400 Bad Request.
 */
public class InvalidAggregationConfigException extends RuntimeException {

    public InvalidAggregationConfigException(String message) {
        super(message);
    }
}
