package com.di.countnova.store;

import java.util.Arrays;
import java.util.List;

/**
 * Construction helpers for {@link Predicate}.
 */
public final class Predicates {

    private Predicates() {
    }

    public static Predicate bitmap(String dimension, long value) {
        return new Predicate.Bitmap(dimension, value);
    }

    public static Predicate intersect(Predicate... operands) {
        return new Predicate.Intersect(Arrays.asList(operands));
    }

    public static Predicate intersect(List<Predicate> operands) {
        return new Predicate.Intersect(operands);
    }
}
