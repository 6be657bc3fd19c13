package com.di.countnova.report;

import com.di.countnova.aggregation.AggregationInterruptedException;
import com.di.countnova.aggregation.AggregationReport;
import com.di.countnova.aggregation.AggregationService;
import com.di.countnova.config.AggregationProperties;
import com.di.countnova.config.ReportProperties;
import com.di.countnova.store.CountItem;
import com.di.countnova.store.IndexStore;
import com.di.countnova.store.Predicates;
import com.di.countnova.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The predefined taxi-ride reports.
 * <ol>
 *   <li>Ride counts per cab type (one TopN query).</li>
 *   <li>Average fare per passenger count (one TopN query per passenger count, in parallel).</li>
 *   <li>Counts by (pickup year, passenger count), full key space.</li>
 *   <li>Counts by (pickup year, passenger count, distance), stopping at the coverage threshold.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RideReportService {

    private final IndexStore indexStore;
    private final AggregationService aggregationService;
    private final AggregationProperties aggregationProperties;
    private final ReportProperties reportProperties;

    public CabTypeReport cabTypeCounts() {
        long start = System.nanoTime();
        List<CountItem> items = indexStore.topN(
                reportProperties.getCabTypeFrame(), reportProperties.getCabTypeTopN(), null);
        List<CabTypeReport.Row> rows = new ArrayList<>(items.size());
        for (CountItem item : items) {
            rows.add(new CabTypeReport.Row(item.id(), item.count()));
        }
        return CabTypeReport.builder()
                .description("Profile count by cab_type (Mark #1)")
                .seconds(secondsSince(start))
                .rows(rows)
                .build();
    }

    /**
     * Fans out one TopN per passenger count on a pool sized to the number of queries and joins
     * them all. A failed query leaves its entry {@code null} and does not fail the report.
     */
    public FareReport averageFarePerPassengerCount() {
        long start = System.nanoTime();
        int max = reportProperties.getMaxPassengerCount();
        Double[] averages = new Double[max + 1];
        ConcurrentLinkedQueue<Integer> failures = new ConcurrentLinkedQueue<>();

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(max, aggregationProperties.getPoolSize()), MdcPropagation.daemonThreads("fare-report"));
        List<CompletableFuture<Void>> futures = new ArrayList<>(max);
        try {
            for (int pcount = 1; pcount <= max; pcount++) {
                final int passengers = pcount;
                futures.add(CompletableFuture
                        .runAsync(MdcPropagation.wrapRunnable(
                                () -> averages[passengers] = averageFare(passengers)), executor)
                        // exceptionally: record and keep going so allOf waits for every query
                        .exceptionally(ex -> {
                            failures.add(passengers);
                            log.warn("[REPORT] Fare query for passenger_count={} failed: {}",
                                    passengers, ex.getMessage());
                            return null;
                        }));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AggregationInterruptedException("Fare report interrupted", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Fare report execution error", e.getCause());
        } finally {
            executor.shutdown();
        }

        return FareReport.builder()
                .description("Average total amount per passenger count (Mark #2)")
                .seconds(secondsSince(start))
                .avgCostPerPassengerCount(Arrays.asList(averages))
                .failedQueries(failures.size())
                .build();
    }

    public AggregationReport yearPassengerCounts() {
        return aggregationService.aggregate(aggregationService.defaults()
                .description("Profile count by (year, passenger_count) (Mark #3)")
                .dimension(aggregationProperties.getYear().toDimension())
                .dimension(aggregationProperties.getPassengerCount().toDimension())
                .thresholdFraction(1.0)
                .build());
    }

    public AggregationReport yearPassengerDistanceCounts() {
        return aggregationService.aggregate(aggregationService.defaults()
                .description("Profile count by (year, passenger_count, trip_distance), ordered by (year, count) (Mark #4)")
                .dimension(aggregationProperties.getYear().toDimension())
                .dimension(aggregationProperties.getPassengerCount().toDimension())
                .dimension(aggregationProperties.getDistance().toDimension())
                .build());
    }

    private Double averageFare(int passengers) {
        long queryStart = System.nanoTime();
        List<CountItem> amounts = indexStore.topN(
                reportProperties.getAmountFrame(),
                reportProperties.getAmountTopN(),
                Predicates.bitmap(reportProperties.getPassengerCountFrame(), passengers));
        log.debug("[REPORT] Fare query for passenger_count={} took {}s", passengers, secondsSince(queryStart));

        long rides = 0;
        long totalAmount = 0;
        for (CountItem item : amounts) {
            rides += item.count();
            totalAmount += item.id() * item.count();
        }
        return rides == 0 ? null : (double) totalAmount / rides;
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
