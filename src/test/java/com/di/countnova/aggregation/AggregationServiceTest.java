package com.di.countnova.aggregation;

import com.di.countnova.config.AggregationProperties;
import com.di.countnova.config.DimensionRange;
import com.di.countnova.store.InMemoryIndexStore;
import com.di.countnova.store.IndexStoreException;
import com.di.countnova.util.MetricsCollector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AggregationService Tests")
@Timeout(30)
class AggregationServiceTest {

    private SimpleMeterRegistry registry;
    private AggregationProperties properties;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new AggregationProperties();
        properties.setPoolSize(4);
        properties.setQueueCapacity(8);
        properties.setBaselineDimension(new DimensionRange("cab_type", 0, 1));
        properties.setSortDimension("pickup_year");
    }

    /**
     * Baseline queries are single bitmaps over cab_type; everything else is a key count.
     */
    private static InMemoryIndexStore store(long baselinePerCabType, ToLongFunction<Map<String, Long>> keyCounts) {
        return new InMemoryIndexStore(sel -> sel.containsKey("cab_type") ? baselinePerCabType : keyCounts.applyAsLong(sel));
    }

    private AggregationService service(InMemoryIndexStore store) {
        MetricsCollector metrics = new MetricsCollector(registry);
        return new AggregationService(new BaselineEstimator(store, metrics),
                new CountWorkerPool(store, metrics), properties, metrics);
    }

    private static AggregationRequest.AggregationRequestBuilder yearByPassengers(AggregationService service) {
        return service.defaults()
                .description("year x passengers")
                .dimension(Dimension.of("pickup_year", 2009, 2010))
                .dimension(Dimension.of("passenger_count", 1, 2));
    }

    @Test
    @DisplayName("Should read the full key space with a threshold of 1.0")
    void testFullExhaustion() {
        AggregationService service = service(store(2, sel -> 1L));

        AggregationReport report = service.aggregate(yearByPassengers(service).thresholdFraction(1.0).build());

        assertEquals(4, report.getRows().size());
        assertEquals(4, report.getRunningTotal());
        assertEquals(4, report.getBaseline());
        assertEquals(1.0, report.getCoverage(), 1e-9);
        assertFalse(report.isStoppedEarly());
        assertEquals(4, report.getKeySpaceSize());
        assertEquals(0, report.getDroppedKeys());
        assertEquals(1.0, registry.get("aggregation.run.total").tag("outcome", "exhausted").counter().count());
    }

    @Test
    @DisplayName("Should stop once coverage reaches the threshold")
    void testEarlyStop() {
        AggregationService service = service(store(50, sel -> 1L));

        AggregationReport report = service.aggregate(service.defaults()
                .description("wide")
                .dimension(Dimension.range("pickup_year", 2009, 2016))
                .dimension(Dimension.range("passenger_count", 1, 7))
                .dimension(Dimension.range("dist_miles", 0, 50))
                .thresholdFraction(0.5)
                .build());

        assertTrue(report.isStoppedEarly());
        assertEquals(50, report.getRows().size());
        assertEquals(50, report.getRunningTotal());
        assertEquals(0.5, report.getCoverage(), 1e-9);
        assertTrue(report.getKeysDispatched() < report.getKeySpaceSize());
        assertEquals(1.0, registry.get("aggregation.run.total").tag("outcome", "early_stop").counter().count());
    }

    @Test
    @DisplayName("Should report dropped keys and continue")
    void testDroppedKey() {
        AggregationService service = service(store(2, sel -> {
            if (sel.equals(Map.of("pickup_year", 2010L, "passenger_count", 2L))) {
                throw new IndexStoreException("boom");
            }
            return 1L;
        }));

        AggregationReport report = service.aggregate(yearByPassengers(service).thresholdFraction(1.0).build());

        assertEquals(3, report.getRows().size());
        assertEquals(3, report.getRunningTotal());
        assertEquals(1, report.getDroppedKeys());
        assertFalse(report.isStoppedEarly());
    }

    @Test
    @DisplayName("Should sort rows by the sort dimension, then by count")
    void testSorted() {
        Map<List<Long>, Long> counts = Map.of(
                List.of(2009L, 1L), 9L, List.of(2009L, 2L), 3L,
                List.of(2010L, 1L), 5L, List.of(2010L, 2L), 2L);
        AggregationService service = service(store(100,
                sel -> counts.get(List.of(sel.get("pickup_year"), sel.get("passenger_count")))));

        AggregationReport report = service.aggregate(yearByPassengers(service).thresholdFraction(1.0).build());

        assertEquals(List.of(3L, 9L, 2L, 5L), report.getRows().stream().map(ResultRow::getCount).toList());
        assertEquals(List.of(2009L, 2009L, 2010L, 2010L),
                report.getRows().stream().map(r -> r.getKey().valueOf("pickup_year")).toList());
    }

    @Test
    @DisplayName("Should fail fast on invalid configuration without querying")
    void testConfigErrors() {
        InMemoryIndexStore store = store(2, sel -> 1L);
        AggregationService service = service(store);

        assertThrows(InvalidAggregationConfigException.class,
                () -> service.aggregate(service.defaults().description("none").build()));
        assertThrows(InvalidAggregationConfigException.class,
                () -> service.aggregate(yearByPassengers(service).poolSize(0).build()));
        assertThrows(InvalidAggregationConfigException.class,
                () -> service.aggregate(yearByPassengers(service).sortDimension("dist_miles").build()));
        assertEquals(0, store.getCalls());
    }

    @Test
    @DisplayName("Should raise AggregationInterruptedException when the caller is interrupted")
    void testInterrupted() {
        AggregationService service = service(store(2, sel -> 1L));
        service.currentBaseline();

        Thread.currentThread().interrupt();
        try {
            AggregationInterruptedException ex = assertThrows(AggregationInterruptedException.class,
                    () -> service.aggregate(yearByPassengers(service).thresholdFraction(1.0).build()));
            assertInstanceOf(InterruptedException.class, ex.getCause());
            assertTrue(Thread.currentThread().isInterrupted(), "interrupt status is restored");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should reject oversized requests before querying")
    void testLimits() {
        InMemoryIndexStore store = store(2, sel -> 1L);
        AggregationService service = service(store);

        assertThrows(InvalidAggregationConfigException.class,
                () -> service.aggregate(yearByPassengers(service).poolSize(Integer.MAX_VALUE).build()));
        assertEquals(0, store.getCalls());
    }

    @Test
    @DisplayName("Should refuse to run over an empty dataset")
    void testZeroBaseline() {
        InMemoryIndexStore store = store(0, sel -> 1L);
        AggregationService service = service(store);

        assertThrows(InvalidAggregationConfigException.class,
                () -> service.aggregate(yearByPassengers(service).build()));
        assertEquals(2, store.getCalls(), "only baseline queries are issued");
    }

    @Test
    @DisplayName("Should surface a failing baseline as BaselineUnavailableException")
    void testBaselineUnavailable() {
        AggregationService service = service(new InMemoryIndexStore(sel -> {
            throw new IndexStoreException("node down");
        }));

        assertThrows(BaselineUnavailableException.class,
                () -> service.aggregate(yearByPassengers(service).build()));
        assertThrows(BaselineUnavailableException.class, service::currentBaseline);
    }

    @Test
    @DisplayName("Should reuse the baseline across runs until reset")
    void testBaselineReuse() {
        InMemoryIndexStore store = store(2, sel -> 1L);
        AggregationService service = service(store);

        assertEquals(4L, service.currentBaseline());
        service.aggregate(yearByPassengers(service).thresholdFraction(1.0).build());
        assertEquals(2 + 4, store.getCalls());

        service.resetBaseline();
        assertEquals(4L, service.currentBaseline());
        assertEquals(2 + 4 + 2, store.getCalls());
    }

    @Test
    @DisplayName("Should warm the baseline only when enabled, tolerating failures")
    void testWarmBaseline() {
        InMemoryIndexStore store = store(2, sel -> 1L);
        AggregationService service = service(store);

        service.warmBaseline();
        assertEquals(0, store.getCalls());

        properties.setWarmBaselineOnStartup(true);
        service.warmBaseline();
        assertEquals(2, store.getCalls());

        AggregationService failing = service(new InMemoryIndexStore(sel -> {
            throw new IndexStoreException("node down");
        }));
        assertDoesNotThrow(failing::warmBaseline);
    }

    @Test
    @DisplayName("Should serialize rows flat with the legacy report fields")
    void testReportJson() throws Exception {
        AggregationService service = service(store(2, sel -> 1L));
        AggregationReport report = service.aggregate(yearByPassengers(service).thresholdFraction(1.0).build());

        JsonNode json = new ObjectMapper().valueToTree(report);

        assertEquals(4, json.get("numProfiles").asLong());
        assertEquals(100.0, json.get("percentageThreshold").asDouble(), 1e-9);
        JsonNode first = json.get("rows").get(0);
        assertEquals(1, first.get("count").asLong());
        assertEquals(2009, first.get("pickup_year").asLong());
        assertTrue(first.has("passenger_count"));
        assertFalse(first.has("key"));
    }
}
