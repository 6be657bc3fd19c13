package com.di.countnova.aggregation;

import com.di.countnova.store.Predicate;
import com.di.countnova.store.Predicates;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One point of the key space: a value for each active dimension, in dimension order.
 * Dimension names are shared by every key of a run.
 */
@Getter
@EqualsAndHashCode
public final class CompositeKey {

    private final List<String> dimensions;
    private final List<Long> values;

    public CompositeKey(List<String> dimensions, List<Long> values) {
        if (dimensions.size() != values.size()) {
            throw new IllegalArgumentException(String.format(
                    "Key has %d values for %d dimensions", values.size(), dimensions.size()));
        }
        this.dimensions = dimensions;
        this.values = List.copyOf(values);
    }

    /**
     * @throws IllegalArgumentException if the key has no such dimension
     */
    public long valueOf(String dimension) {
        int i = dimensions.indexOf(dimension);
        if (i < 0) {
            throw new IllegalArgumentException("Key has no dimension '" + dimension + "': " + this);
        }
        return values.get(i);
    }

    /** Conjunction of one equality selector per dimension. */
    public Predicate toPredicate() {
        List<Predicate> selectors = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            selectors.add(Predicates.bitmap(dimensions.get(i), values.get(i)));
        }
        return Predicates.intersect(selectors);
    }

    public Map<String, Long> asMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            map.put(dimensions.get(i), values.get(i));
        }
        return map;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
