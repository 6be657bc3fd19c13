package com.di.countnova.aggregation;

import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * A named axis of the key space with a finite, ordered set of legal values
 * (e.g. {@code pickup_year ∈ [2009, 2016]}).
 */
@Value
public class Dimension {

    /** Most values a single dimension may hold. */
    public static final int MAX_VALUES = 100_000;

    String name;
    List<Long> values;

    public Dimension(String name, List<Long> values) {
        if (name == null || name.isBlank()) {
            throw new InvalidAggregationConfigException("Dimension name cannot be null or empty");
        }
        if (values == null || values.isEmpty()) {
            throw new InvalidAggregationConfigException("Dimension '" + name + "' has no values");
        }
        if (values.size() > MAX_VALUES) {
            throw new InvalidAggregationConfigException(String.format(
                    "Dimension '%s' has %d values; at most %d are allowed", name, values.size(), MAX_VALUES));
        }
        if (new HashSet<>(values).size() != values.size()) {
            throw new InvalidAggregationConfigException("Dimension '" + name + "' has duplicate values");
        }
        for (Long v : values) {
            if (v == null || v < 0) {
                throw new InvalidAggregationConfigException(
                        "Dimension '" + name + "' has an invalid value: " + v);
            }
        }
        this.name = name;
        this.values = List.copyOf(values);
    }

    /**
     * Inclusive range {@code [from, to]}. The width is checked before any value is materialized.
     */
    public static Dimension range(String name, long from, long to) {
        if (from < 0) {
            throw new InvalidAggregationConfigException(
                    String.format("Dimension '%s' has a negative lower bound %d", name, from));
        }
        if (from > to) {
            throw new InvalidAggregationConfigException(
                    String.format("Dimension '%s' has an empty range [%d, %d]", name, from, to));
        }
        if (to - from >= MAX_VALUES) {
            throw new InvalidAggregationConfigException(String.format(
                    "Dimension '%s' range [%d, %d] is wider than %d values", name, from, to, MAX_VALUES));
        }
        List<Long> values = new ArrayList<>((int) (to - from + 1));
        for (long v = from; v <= to; v++) {
            values.add(v);
        }
        return new Dimension(name, values);
    }

    public static Dimension of(String name, long... values) {
        List<Long> list = new ArrayList<>(values.length);
        for (long v : values) {
            list.add(v);
        }
        return new Dimension(name, list);
    }

    public int size() {
        return values.size();
    }
}
