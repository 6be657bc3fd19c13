package com.di.countnova.aggregation;

import com.di.countnova.config.DimensionRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dimension Tests")
class DimensionTest {

    @Test
    @DisplayName("Should expand an inclusive range")
    void testRange() {
        Dimension d = Dimension.range("passenger_count", 1, 7);
        assertEquals(7, d.size());
        assertEquals(1L, d.getValues().get(0));
        assertEquals(7L, d.getValues().get(6));
        assertEquals(1, Dimension.range("cab_type", 2, 2).size());
    }

    @Test
    @DisplayName("Should reject empty ranges and bad values")
    void testInvalid() {
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.range("x", 5, 4));
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.of("x"));
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.of("x", 1, 1));
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.of("x", -1));
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.of(" ", 1));
        assertThrows(InvalidAggregationConfigException.class, () -> new Dimension("x", Arrays.asList(1L, null)));
    }

    @Test
    @DisplayName("Should reject an oversized range before allocating its values")
    void testRangeWidthLimit() {
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.range("d", 0, 30_000_000));
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.range("d", 0, Long.MAX_VALUE));
        assertThrows(InvalidAggregationConfigException.class, () -> Dimension.range("d", -5, 5));
        assertEquals(Dimension.MAX_VALUES, Dimension.range("d", 1, Dimension.MAX_VALUES).size());

        DimensionRange wide = new DimensionRange("d", 0, 30_000_000);
        assertFalse(wide.isWithinLimit());
        assertThrows(InvalidAggregationConfigException.class, wide::toDimension);
        assertTrue(new DimensionRange("d", 0, 10).isWithinLimit());
    }

    @Test
    @DisplayName("Should build from a configured range")
    void testFromRange() {
        assertEquals(Dimension.of("cab_type", 0, 1, 2), new DimensionRange("cab_type", 0, 2).toDimension());
        assertFalse(new DimensionRange("cab_type", 3, 2).isOrdered());
    }

    @Test
    @DisplayName("Should not expose a mutable value list")
    void testImmutable() {
        Dimension d = new Dimension("x", new java.util.ArrayList<>(List.of(1L, 2L)));
        assertThrows(UnsupportedOperationException.class, () -> d.getValues().add(3L));
    }
}
