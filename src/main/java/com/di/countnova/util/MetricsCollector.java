package com.di.countnova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for index store queries and aggregation runs.
 */
@Slf4j
@Component
public class MetricsCollector {

    // Index Store Query Metrics
    private final Counter querySuccessCounter;
    private final Counter queryErrorCounter;
    private final Counter queryTimeoutCounter;
    private final Timer queryTimer;
    private final AtomicInteger queriesInFlight = new AtomicInteger();

    // Aggregation Run Metrics
    private final Counter droppedKeyCounter;
    private final Counter discardedRowCounter;
    private final Counter earlyStopCounter;
    private final Counter exhaustedRunCounter;
    private final Timer runTimer;
    private final DistributionSummary coverageDistribution;

    // Baseline
    private final AtomicLong baseline = new AtomicLong();

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.querySuccessCounter = Counter.builder("indexstore.query.total")
                .description("Total number of index store queries")
                .tag("status", "success")
                .register(meterRegistry);

        this.queryErrorCounter = Counter.builder("indexstore.query.total")
                .description("Total number of index store queries")
                .tag("status", "error")
                .register(meterRegistry);

        this.queryTimeoutCounter = Counter.builder("indexstore.query.total")
                .description("Total number of index store queries")
                .tag("status", "timeout")
                .register(meterRegistry);

        this.queryTimer = Timer.builder("indexstore.query.duration")
                .description("Time taken by a single index store query")
                .register(meterRegistry);

        Gauge.builder("indexstore.query.inflight", queriesInFlight, AtomicInteger::get)
                .description("Index store queries currently outstanding")
                .register(meterRegistry);

        this.droppedKeyCounter = Counter.builder("aggregation.keys.dropped")
                .description("Keys whose count query failed or timed out")
                .register(meterRegistry);

        this.discardedRowCounter = Counter.builder("aggregation.rows.discarded")
                .description("Rows completed after an early stop and discarded")
                .register(meterRegistry);

        this.earlyStopCounter = Counter.builder("aggregation.run.total")
                .description("Total number of aggregation runs")
                .tag("outcome", "early_stop")
                .register(meterRegistry);

        this.exhaustedRunCounter = Counter.builder("aggregation.run.total")
                .description("Total number of aggregation runs")
                .tag("outcome", "exhausted")
                .register(meterRegistry);

        this.runTimer = Timer.builder("aggregation.run.duration")
                .description("Wall time of an aggregation run")
                .register(meterRegistry);

        this.coverageDistribution = DistributionSummary.builder("aggregation.run.coverage")
                .description("Fraction of the baseline covered by collected rows")
                .register(meterRegistry);

        Gauge.builder("aggregation.baseline", baseline, AtomicLong::get)
                .description("Cached baseline record count")
                .baseUnit("records")
                .register(meterRegistry);
    }

    // ============================================================================
    // Index Store Query Metrics
    // ============================================================================

    /**
     * Marks a query as outstanding. Pair with one of the {@code recordQuery*} methods.
     */
    public void queryStarted() {
        queriesInFlight.incrementAndGet();
    }

    public void recordQuerySuccess(long durationNanos) {
        queriesInFlight.decrementAndGet();
        querySuccessCounter.increment();
        queryTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordQueryError(long durationNanos) {
        queriesInFlight.decrementAndGet();
        queryErrorCounter.increment();
        queryTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordQueryTimeout(long durationNanos) {
        queriesInFlight.decrementAndGet();
        queryTimeoutCounter.increment();
        queryTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public int getQueriesInFlight() {
        return queriesInFlight.get();
    }

    // ============================================================================
    // Aggregation Run Metrics
    // ============================================================================

    public void recordDroppedKey() {
        droppedKeyCounter.increment();
    }

    public void recordDiscardedRow() {
        discardedRowCounter.increment();
    }

    /**
     * Records a finished aggregation run.
     *
     * @param durationMs   wall time in milliseconds
     * @param coverage     collected total divided by baseline
     * @param stoppedEarly whether the coverage threshold cut the run short
     */
    public void recordRun(long durationMs, double coverage, boolean stoppedEarly) {
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
        coverageDistribution.record(coverage);
        if (stoppedEarly) {
            earlyStopCounter.increment();
        } else {
            exhaustedRunCounter.increment();
        }
        log.debug("Recorded aggregation run: durationMs={}, coverage={}, stoppedEarly={}",
                durationMs, coverage, stoppedEarly);
    }

    public void recordBaseline(long value) {
        baseline.set(value);
    }
}
