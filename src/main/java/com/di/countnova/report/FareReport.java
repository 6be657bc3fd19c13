package com.di.countnova.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Average total fare per passenger count. Index {@code i} of {@link #avgCostPerPassengerCount}
 * holds the average for {@code i} passengers; index 0 is unused and an entry is {@code null}
 * when its query failed or matched no rides.
 */
@Value
@Builder
public class FareReport {

    String description;
    double seconds;
    List<Double> avgCostPerPassengerCount;
    /** Passenger counts whose query failed. */
    int failedQueries;
}
