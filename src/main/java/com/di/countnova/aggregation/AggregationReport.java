package com.di.countnova.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one grouped-count run. Immutable once built.
 */
@Value
@Builder
public class AggregationReport {

    String description;
    /** Rows ordered by (sort dimension, count), ascending. */
    List<ResultRow> rows;
    /** Total record count of the dataset (coverage denominator). */
    @JsonProperty("numProfiles")
    long baseline;
    /** Threshold used, as a fraction in (0, 1]. */
    double thresholdFraction;
    /** Wall time of the run in seconds. */
    double seconds;
    /**
     * Whether collection stopped because coverage reached the threshold. Also {@code true} when the
     * threshold is first reached on the last row of the key space, in which case no row was cut
     * off; compare {@link #keysDispatched} with {@link #keySpaceSize} to tell the two apart.
     * Always {@code false} for a threshold of {@code 1.0}.
     */
    boolean stoppedEarly;
    /** Sum of counts over {@link #rows}. */
    long runningTotal;
    /** {@code runningTotal / baseline}. */
    double coverage;
    /** Size of the full key space. */
    long keySpaceSize;
    /** Keys whose query was issued before the run ended. */
    long keysDispatched;
    /** Keys lost to failed or timed-out queries. */
    long droppedKeys;

    /** Threshold as a percentage, matching the legacy report field. */
    @JsonProperty("percentageThreshold")
    public double getPercentageThreshold() {
        return thresholdFraction * 100.0;
    }
}
