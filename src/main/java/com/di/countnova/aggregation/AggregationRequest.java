package com.di.countnova.aggregation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parameters of one grouped-count run.
 */
@Value
@Builder
public class AggregationRequest {

    /** Most workers, and so most outstanding queries, one run may use. */
    public static final int MAX_POOL_SIZE = 512;
    /** Largest intake and result queue one run may allocate. */
    public static final int MAX_QUEUE_CAPACITY = 65_536;
    /** Largest key space one run may enumerate. */
    public static final long MAX_KEY_SPACE_SIZE = 10_000_000L;

    /** Free-text label copied into the report. */
    String description;
    /** Key space dimensions, outermost first. */
    @Singular
    List<Dimension> dimensions;
    /** Maximum outstanding count queries. */
    int poolSize;
    /** Coverage of the baseline at which collection stops; {@code 1.0} disables early stop. */
    double thresholdFraction;
    /** Capacity of the intake and result queues. */
    int queueCapacity;
    /** Dimension whose per-value counts sum to the baseline. */
    Dimension baselineDimension;
    /** Primary ordering of report rows; must be one of {@link #dimensions}. */
    String sortDimension;

    /**
     * @throws InvalidAggregationConfigException on the first invalid field
     */
    public void validate() {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new InvalidAggregationConfigException("At least one dimension is required");
        }
        if (poolSize <= 0 || poolSize > MAX_POOL_SIZE) {
            throw new InvalidAggregationConfigException(String.format(
                    "Pool size must be in [1, %d], got %d", MAX_POOL_SIZE, poolSize));
        }
        if (queueCapacity <= 0 || queueCapacity > MAX_QUEUE_CAPACITY) {
            throw new InvalidAggregationConfigException(String.format(
                    "Queue capacity must be in [1, %d], got %d", MAX_QUEUE_CAPACITY, queueCapacity));
        }
        if (!(thresholdFraction > 0.0 && thresholdFraction <= 1.0)) {
            throw new InvalidAggregationConfigException(
                    "Threshold fraction must be in (0, 1], got " + thresholdFraction);
        }
        if (baselineDimension == null) {
            throw new InvalidAggregationConfigException("Baseline dimension is required");
        }
        if (sortDimension == null || dimensions.stream().noneMatch(d -> d.getName().equals(sortDimension))) {
            throw new InvalidAggregationConfigException(
                    "Sort dimension '" + sortDimension + "' is not one of the key dimensions");
        }
        long keySpaceSize = KeySpaceGenerator.sizeOf(dimensions);
        if (keySpaceSize > MAX_KEY_SPACE_SIZE) {
            throw new InvalidAggregationConfigException(String.format(
                    "Key space of %d keys exceeds the limit of %d", keySpaceSize, MAX_KEY_SPACE_SIZE));
        }
        if (dimensions.stream().map(Dimension::getName).distinct().count() != dimensions.size()) {
            throw new InvalidAggregationConfigException("Dimension names must be unique");
        }
    }
}
