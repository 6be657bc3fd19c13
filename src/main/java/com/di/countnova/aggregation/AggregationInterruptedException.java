package com.di.countnova.aggregation;

/**
 * The thread waiting on a run was interrupted before the run finished. The run is cancelled and
 * no report is produced. Mapped to HTTP 503 by the global exception handler.
 */
public class AggregationInterruptedException extends RuntimeException {

    public AggregationInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
