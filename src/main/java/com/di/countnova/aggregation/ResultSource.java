package com.di.countnova.aggregation;

/**
 * Stream of result rows consumed by the {@link EarlyStopCollector}.
 */
@FunctionalInterface
public interface ResultSource {

    /**
     * Blocks until the next row is available.
     *
     * @return the next row, or {@code null} once every producer has finished
     */
    ResultRow next() throws InterruptedException;
}
