package com.di.countnova.aggregation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single consumer of a {@link ResultSource}. Accumulates rows in arrival order and a running
 * total, and stops reading as soon as {@code runningTotal / baseline >= thresholdFraction}.
 * A threshold of {@code 1.0} disables early stop: every row is read until the source ends.
 * <p>
 * Single use and not thread-safe: the running total and the working set belong to the thread
 * calling {@link #collect(ResultSource)}.
 */
@Slf4j
public class EarlyStopCollector {

    private final long baseline;
    private final double thresholdFraction;

    private final List<ResultRow> rows = new ArrayList<>();
    private long runningTotal;
    private boolean stoppedEarly;
    private boolean collected;

    public EarlyStopCollector(long baseline, double thresholdFraction) {
        if (baseline <= 0) {
            throw new InvalidAggregationConfigException("Baseline must be positive, got " + baseline);
        }
        if (!(thresholdFraction > 0.0 && thresholdFraction <= 1.0)) {
            throw new InvalidAggregationConfigException(
                    "Threshold fraction must be in (0, 1], got " + thresholdFraction);
        }
        this.baseline = baseline;
        this.thresholdFraction = thresholdFraction;
    }

    /**
     * Reads rows until the threshold is reached or the source is exhausted.
     * The caller is responsible for cancelling the producers when {@link #isStoppedEarly()}.
     */
    public void collect(ResultSource source) throws InterruptedException {
        if (collected) {
            throw new IllegalStateException("Collector already used");
        }
        collected = true;
        ResultRow row;
        while ((row = source.next()) != null) {
            rows.add(row);
            runningTotal += row.getCount();
            if (thresholdFraction < 1.0 && coverage() >= thresholdFraction) {
                stoppedEarly = true;
                log.info("[COLLECTOR] Coverage {} reached threshold {} after {} rows (total={}, baseline={})",
                        String.format("%.4f", coverage()), thresholdFraction, rows.size(), runningTotal, baseline);
                return;
            }
        }
        log.info("[COLLECTOR] Results exhausted after {} rows; coverage {} (total={}, baseline={})",
                rows.size(), String.format("%.4f", coverage()), runningTotal, baseline);
    }

    public double coverage() {
        return (double) runningTotal / (double) baseline;
    }

    public long getRunningTotal() {
        return runningTotal;
    }

    /**
     * {@code true} when collection stopped because the threshold was reached, even if that
     * happened on the very last row. Always {@code false} for a threshold of {@code 1.0}.
     */
    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    /** Rows in arrival order. */
    public List<ResultRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public long getBaseline() {
        return baseline;
    }

    public double getThresholdFraction() {
        return thresholdFraction;
    }
}
