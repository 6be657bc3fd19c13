package com.di.countnova.store;

import java.util.List;
import java.util.Objects;

/**
 * Row selector evaluated by the {@link IndexStore}. Only equality selectors over a single
 * dimension ({@link Bitmap}) and conjunctions of selectors ({@link Intersect}) exist.
 * <p>
 * Instances are pure values: building one performs no I/O. Serialization is the concern of the
 * store implementation (see {@link PqlWriter}).
 */
public interface Predicate {

    /** Records whose {@code dimension} equals {@code value}. */
    record Bitmap(String dimension, long value) implements Predicate {
        public Bitmap {
            Objects.requireNonNull(dimension, "dimension");
            if (dimension.isBlank()) {
                throw new IllegalArgumentException("Bitmap dimension cannot be blank");
            }
        }
    }

    /** Records matched by every operand. */
    record Intersect(List<Predicate> operands) implements Predicate {
        public Intersect {
            Objects.requireNonNull(operands, "operands");
            if (operands.isEmpty()) {
                throw new IllegalArgumentException("Intersect requires at least one operand");
            }
            operands = List.copyOf(operands);
        }
    }
}
