package com.di.countnova.aggregation;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.Map;

/**
 * Count of records matching one key. Serialized flat: {@code {"count":12,"pickup_year":2013,...}}.
 */
@Value
@JsonPropertyOrder({"count"})
public class ResultRow {

    @JsonIgnore
    CompositeKey key;
    long count;

    @JsonAnyGetter
    public Map<String, Long> getDimensionValues() {
        return key.asMap();
    }
}
