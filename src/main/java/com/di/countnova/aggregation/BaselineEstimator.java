package com.di.countnova.aggregation;

import com.di.countnova.store.IndexStore;
import com.di.countnova.store.Predicates;
import com.di.countnova.util.MetricsCollector;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Total record count of the dataset: the sum of {@code Count(Bitmap(d, v))} over every value
 * {@code v} of one low-cardinality dimension {@code d} (e.g. {@code cab_type ∈ [0, 2]}).
 * <p>
 * Computed once per dimension and cached for the lifetime of the process; only
 * {@link #invalidate()} forces a recomputation. A failing sub-query fails the whole estimate
 * and nothing is cached, since a partial sum would be a wrong denominator.
 */
@Slf4j
@Component
public class BaselineEstimator {

    private final IndexStore indexStore;
    private final MetricsCollector metrics;
    private final Cache<Dimension, Long> baselines = Caffeine.newBuilder()
            .maximumSize(16)
            .build();

    public BaselineEstimator(IndexStore indexStore, MetricsCollector metrics) {
        this.indexStore = indexStore;
        this.metrics = metrics;
    }

    /**
     * Cached baseline for {@code dimension}, computing it on first use.
     *
     * @throws BaselineUnavailableException      if any sub-query fails
     * @throws InvalidAggregationConfigException if the dataset is empty (baseline 0)
     */
    public long getBaseline(Dimension dimension) {
        if (dimension == null) {
            throw new InvalidAggregationConfigException("Baseline dimension cannot be null");
        }
        return baselines.get(dimension, this::compute);
    }

    /** Cached baseline, without computing it. */
    public OptionalLong peek(Dimension dimension) {
        Long cached = baselines.getIfPresent(dimension);
        return cached != null ? OptionalLong.of(cached) : OptionalLong.empty();
    }

    /** Forgets every cached baseline; the next run recomputes it. */
    public void invalidate() {
        baselines.invalidateAll();
        log.info("[BASELINE] Cache invalidated");
    }

    private Long compute(Dimension dimension) {
        long start = System.currentTimeMillis();
        long total = 0;
        for (long value : dimension.getValues()) {
            try {
                total += indexStore.count(Predicates.bitmap(dimension.getName(), value));
            } catch (RuntimeException e) {
                log.error("[BASELINE] Count for {}={} failed: {}", dimension.getName(), value, e.getMessage());
                throw new BaselineUnavailableException(String.format(
                        "Baseline count for %s=%d failed: %s", dimension.getName(), value, e.getMessage()), e);
            }
        }
        if (total <= 0) {
            throw new InvalidAggregationConfigException(String.format(
                    "Baseline over dimension '%s' is %d; coverage cannot be computed", dimension.getName(), total));
        }
        metrics.recordBaseline(total);
        log.info("[BASELINE] {} records over {} values of {} ({}ms)",
                total, dimension.size(), dimension.getName(), System.currentTimeMillis() - start);
        return total;
    }
}
