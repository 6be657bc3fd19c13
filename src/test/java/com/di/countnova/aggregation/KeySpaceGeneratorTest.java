package com.di.countnova.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeySpaceGenerator Tests")
class KeySpaceGeneratorTest {

    private static List<CompositeKey> drain(KeySpaceGenerator generator) {
        List<CompositeKey> keys = new ArrayList<>();
        generator.forEachRemaining(keys::add);
        return keys;
    }

    @Test
    @DisplayName("Should enumerate the full Cartesian product exactly once")
    void testProductSizeAndUniqueness() {
        KeySpaceGenerator generator = new KeySpaceGenerator(List.of(
                Dimension.range("pickup_year", 2009, 2016),
                Dimension.range("passenger_count", 1, 7),
                Dimension.range("dist_miles", 0, 50)));

        assertEquals(8L * 7 * 51, generator.size());
        List<CompositeKey> keys = drain(generator);
        assertEquals(2856, keys.size());
        Set<CompositeKey> unique = new HashSet<>(keys);
        assertEquals(keys.size(), unique.size());
        assertFalse(generator.hasNext());
    }

    @Test
    @DisplayName("Should vary the last dimension fastest")
    void testNestedLoopOrder() {
        List<CompositeKey> keys = drain(new KeySpaceGenerator(List.of(
                Dimension.of("pickup_year", 2009, 2010),
                Dimension.of("passenger_count", 1, 2))));

        assertEquals(List.of(
                List.of(2009L, 1L), List.of(2009L, 2L),
                List.of(2010L, 1L), List.of(2010L, 2L)),
                keys.stream().map(CompositeKey::getValues).toList());
        assertEquals(List.of("pickup_year", "passenger_count"), keys.get(0).getDimensions());
    }

    @Test
    @DisplayName("Should yield one key per value for a single dimension")
    void testSingleDimension() {
        List<CompositeKey> keys = drain(new KeySpaceGenerator(List.of(Dimension.of("cab_type", 0, 1, 2))));
        assertEquals(3, keys.size());
        assertEquals(2L, keys.get(2).valueOf("cab_type"));
    }

    @Test
    @DisplayName("Should throw once exhausted; a new generator starts over")
    void testExhaustionAndRestart() {
        List<Dimension> dims = List.of(Dimension.of("cab_type", 0, 1));
        KeySpaceGenerator generator = new KeySpaceGenerator(dims);
        drain(generator);
        assertThrows(NoSuchElementException.class, generator::next);

        KeySpaceGenerator again = new KeySpaceGenerator(dims);
        assertEquals(0L, again.next().valueOf("cab_type"));
    }

    @Test
    @DisplayName("Should reject empty and duplicate dimensions")
    void testInvalidDimensions() {
        assertThrows(InvalidAggregationConfigException.class, () -> new KeySpaceGenerator(List.of()));
        assertThrows(InvalidAggregationConfigException.class, () -> new KeySpaceGenerator(null));
        assertThrows(InvalidAggregationConfigException.class, () -> new KeySpaceGenerator(List.of(
                Dimension.of("cab_type", 0), Dimension.of("cab_type", 1))));
    }

    @Test
    @DisplayName("Should report an overflowing key space as a configuration error")
    void testSizeOverflow() {
        Dimension wide = Dimension.range("x", 0, 65_535);
        assertThrows(InvalidAggregationConfigException.class,
                () -> KeySpaceGenerator.sizeOf(List.of(wide, wide, wide, wide)));
    }

    @Test
    @DisplayName("Should turn a key into an intersection of bitmaps")
    void testKeyPredicate() {
        CompositeKey key = new KeySpaceGenerator(List.of(
                Dimension.of("pickup_year", 2013), Dimension.of("passenger_count", 2))).next();

        assertEquals("{pickup_year=2013, passenger_count=2}", key.toString());
        assertEquals("Intersect(Bitmap(frame=\"pickup_year\", rowID=2013), Bitmap(frame=\"passenger_count\", rowID=2))",
                com.di.countnova.store.PqlWriter.write(key.toPredicate()));
        assertThrows(IllegalArgumentException.class, () -> key.valueOf("dist_miles"));
    }
}
