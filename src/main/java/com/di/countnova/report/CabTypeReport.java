package com.di.countnova.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ride counts per cab type, highest first.
 */
@Value
@Builder
public class CabTypeReport {

    String description;
    double seconds;
    @JsonProperty("Rows")
    List<Row> rows;

    @Value
    public static class Row {
        @JsonProperty("cab_type")
        long cabType;
        long count;
    }
}
