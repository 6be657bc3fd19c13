package com.di.countnova.aggregation;

import com.di.countnova.store.IndexStore;
import com.di.countnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Launches bounded-concurrency count runs against the {@link IndexStore}.
 * <p>
 * Each call to {@link #start} creates its own threads and queues; runs never share state, so
 * concurrent HTTP requests each get an independent pool of {@code poolSize} workers.
 */
@Component
@RequiredArgsConstructor
public class CountWorkerPool {

    private final IndexStore indexStore;
    private final MetricsCollector metrics;

    /**
     * Starts the producer, {@code poolSize} workers and the result closer.
     *
     * @param keys          key space to evaluate; consumed by the producer thread
     * @param poolSize      maximum number of workers, i.e. maximum outstanding queries; a smaller
     *                      key space gets one worker per key
     * @param queueCapacity capacity of the intake and result queues
     * @return handle to consume results from and to cancel the run
     */
    public PipelineRun start(KeySpaceGenerator keys, int poolSize, int queueCapacity) {
        if (keys == null) {
            throw new InvalidAggregationConfigException("Key space cannot be null");
        }
        if (poolSize <= 0 || poolSize > AggregationRequest.MAX_POOL_SIZE) {
            throw new InvalidAggregationConfigException(String.format(
                    "Pool size must be in [1, %d], got %d", AggregationRequest.MAX_POOL_SIZE, poolSize));
        }
        if (queueCapacity <= 0 || queueCapacity > AggregationRequest.MAX_QUEUE_CAPACITY) {
            throw new InvalidAggregationConfigException(String.format(
                    "Queue capacity must be in [1, %d], got %d", AggregationRequest.MAX_QUEUE_CAPACITY, queueCapacity));
        }
        // never more workers than keys
        int workers = (int) Math.min(poolSize, keys.size());
        PipelineRun run = new PipelineRun(indexStore, metrics, workers, queueCapacity);
        run.start(keys);
        return run;
    }
}
