package com.di.countnova.aggregation;

import com.di.countnova.config.AggregationProperties;
import com.di.countnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs a grouped count end to end:
 * <pre>
 *   validate → baseline (cached) → KeySpaceGenerator → CountWorkerPool
 *            → EarlyStopCollector → cancel run → ReportSorter → AggregationReport
 * </pre>
 * Configuration errors are raised before any thread starts. The run is always cancelled once
 * collection ends, so an early stop leaves the pool draining in the background rather than
 * blocked on the result queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final BaselineEstimator baselineEstimator;
    private final CountWorkerPool workerPool;
    private final AggregationProperties properties;
    private final MetricsCollector metrics;

    /**
     * Request pre-filled from {@code countnova.aggregation.*}; callers add dimensions and may
     * override any field.
     */
    public AggregationRequest.AggregationRequestBuilder defaults() {
        return AggregationRequest.builder()
                .poolSize(properties.getPoolSize())
                .thresholdFraction(properties.getThresholdFraction())
                .queueCapacity(properties.getQueueCapacity())
                .baselineDimension(properties.getBaselineDimension().toDimension())
                .sortDimension(properties.getSortDimension());
    }

    /**
     * @throws InvalidAggregationConfigException if the request is invalid or the baseline is 0
     * @throws BaselineUnavailableException      if the baseline cannot be computed
     * @throws AggregationInterruptedException   if the calling thread is interrupted while collecting
     */
    public AggregationReport aggregate(AggregationRequest request) {
        request.validate();
        long startNanos = System.nanoTime();

        long baseline = baselineEstimator.getBaseline(request.getBaselineDimension());
        EarlyStopCollector collector = new EarlyStopCollector(baseline, request.getThresholdFraction());
        KeySpaceGenerator keys = new KeySpaceGenerator(request.getDimensions());
        long keySpaceSize = keys.size();

        log.info("[AGGREGATION] Starting '{}': keys={} poolSize={} threshold={} baseline={}",
                request.getDescription(), keySpaceSize, request.getPoolSize(),
                request.getThresholdFraction(), baseline);

        PipelineRun run = workerPool.start(keys, request.getPoolSize(), request.getQueueCapacity());
        try {
            collector.collect(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AggregationInterruptedException("Aggregation '" + request.getDescription() + "' interrupted", e);
        } finally {
            run.cancel();
        }

        List<ResultRow> sorted = ReportSorter.sort(collector.getRows(), request.getSortDimension());
        long elapsedNanos = System.nanoTime() - startNanos;

        AggregationReport report = AggregationReport.builder()
                .description(request.getDescription())
                .rows(List.copyOf(sorted))
                .baseline(baseline)
                .thresholdFraction(request.getThresholdFraction())
                .seconds(elapsedNanos / 1_000_000_000.0)
                .stoppedEarly(collector.isStoppedEarly())
                .runningTotal(collector.getRunningTotal())
                .coverage(collector.coverage())
                .keySpaceSize(keySpaceSize)
                .keysDispatched(run.getKeysDispatched())
                .droppedKeys(run.getKeysDropped())
                .build();

        metrics.recordRun(elapsedNanos / 1_000_000, report.getCoverage(), report.isStoppedEarly());
        log.info("[AGGREGATION] Completed '{}': rows={} total={} coverage={} stoppedEarly={} dropped={} ({}s)",
                request.getDescription(), sorted.size(), report.getRunningTotal(),
                String.format("%.4f", report.getCoverage()), report.isStoppedEarly(),
                report.getDroppedKeys(), String.format("%.3f", report.getSeconds()));
        return report;
    }

    /** Cached baseline for the configured baseline dimension, computing it if needed. */
    public long currentBaseline() {
        return baselineEstimator.getBaseline(properties.getBaselineDimension().toDimension());
    }

    public void resetBaseline() {
        baselineEstimator.invalidate();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmBaseline() {
        if (!properties.isWarmBaselineOnStartup()) {
            return;
        }
        try {
            log.info("[AGGREGATION] Baseline at startup: {}", currentBaseline());
        } catch (RuntimeException e) {
            log.warn("[AGGREGATION] Baseline warm-up failed; it will be computed on first request: {}",
                    e.getMessage());
        }
    }
}
