package com.di.countnova.aggregation;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass enumeration of the Cartesian product of dimension values.
 * <p>
 * Keys come out in nested-loop order: the first dimension varies slowest and the last
 * dimension fastest. Each key is produced exactly once. To enumerate again, create a new
 * generator.
 */
public class KeySpaceGenerator implements Iterator<CompositeKey> {

    private final List<Dimension> dimensions;
    private final List<String> names;
    private final int[] cursor;
    private final long size;
    private long emitted;

    public KeySpaceGenerator(List<Dimension> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new InvalidAggregationConfigException("Key space requires at least one dimension");
        }
        this.dimensions = List.copyOf(dimensions);
        List<String> dimensionNames = new ArrayList<>(dimensions.size());
        for (Dimension d : this.dimensions) {
            if (dimensionNames.contains(d.getName())) {
                throw new InvalidAggregationConfigException("Dimension '" + d.getName() + "' appears twice");
            }
            dimensionNames.add(d.getName());
        }
        this.names = List.copyOf(dimensionNames);
        this.cursor = new int[dimensions.size()];
        this.size = sizeOf(this.dimensions);
    }

    /** Number of keys in the product of the given dimensions. */
    public static long sizeOf(List<Dimension> dimensions) {
        long product = 1;
        try {
            for (Dimension d : dimensions) {
                product = Math.multiplyExact(product, d.size());
            }
        } catch (ArithmeticException e) {
            throw new InvalidAggregationConfigException("Key space size overflows a long");
        }
        return product;
    }

    public long size() {
        return size;
    }

    public List<String> dimensionNames() {
        return names;
    }

    @Override
    public boolean hasNext() {
        return emitted < size;
    }

    @Override
    public CompositeKey next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Key space exhausted after " + size + " keys");
        }
        List<Long> values = new ArrayList<>(cursor.length);
        for (int i = 0; i < cursor.length; i++) {
            values.add(dimensions.get(i).getValues().get(cursor[i]));
        }
        emitted++;
        advance();
        return new CompositeKey(names, values);
    }

    // odometer: bump the innermost position, carry outward
    private void advance() {
        for (int i = cursor.length - 1; i >= 0; i--) {
            if (++cursor[i] < dimensions.get(i).size()) {
                return;
            }
            cursor[i] = 0;
        }
    }
}
