package com.di.countnova.aggregation;

import com.di.countnova.store.IndexStore;
import com.di.countnova.store.IndexStoreException;
import com.di.countnova.store.Predicate;
import com.di.countnova.store.QueryTimeoutException;
import com.di.countnova.util.MdcPropagation;
import com.di.countnova.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One execution of the worker pool over a key space.
 *
 * <h3>Threads</h3>
 * <pre>
 *   producer  : KeySpaceGenerator → intake queue, then one end marker per worker
 *   worker × N: intake → IndexStore.count(key predicate) → result queue
 *   closer    : waits for all N workers (CountDownLatch), then puts the result end marker
 * </pre>
 * Exactly N workers query the store, so at most N queries are outstanding at any instant.
 *
 * <h3>Cancellation</h3>
 * {@link #cancel()} is soft: the producer stops generating keys and discards the unclaimed ones,
 * workers finish the query they are running and then drain the intake without querying, and a
 * worker blocked on a full result queue abandons its row. No thread waits on the consumer once
 * the run is cancelled, so the pool always terminates after the last in-flight query returns.
 */
@Slf4j
public class PipelineRun implements ResultSource {

    private static final CompositeKey END_OF_KEYS = new CompositeKey(List.of(), List.of());
    private static final ResultRow END_OF_RESULTS = new ResultRow(END_OF_KEYS, -1L);
    /** How often a blocked hand-off re-checks for cancellation. */
    private static final long HANDOFF_POLL_MS = 50;

    private final IndexStore indexStore;
    private final MetricsCollector metrics;
    private final int poolSize;

    private final BlockingQueue<CompositeKey> intake;
    private final BlockingQueue<ResultRow> results;
    private final ExecutorService executor;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch workersDone;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private final AtomicLong keysDispatched = new AtomicLong();
    private final AtomicLong keysDropped = new AtomicLong();
    private final AtomicLong rowsDiscarded = new AtomicLong();

    // consumer-side only
    private boolean resultsExhausted;

    PipelineRun(IndexStore indexStore, MetricsCollector metrics, int poolSize, int queueCapacity) {
        this.indexStore = indexStore;
        this.metrics = metrics;
        this.poolSize = poolSize;
        // room for every end marker once the intake is cleared on cancel
        this.intake = new ArrayBlockingQueue<>(Math.max(queueCapacity, poolSize));
        this.results = new ArrayBlockingQueue<>(queueCapacity);
        this.workersDone = new CountDownLatch(poolSize);
        this.executor = Executors.newFixedThreadPool(poolSize + 2, MdcPropagation.daemonThreads("count-pipeline"));
    }

    void start(KeySpaceGenerator keys) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline run already started");
        }
        log.info("[WORKER-POOL] Starting {} workers over {} keys {}", poolSize, keys.size(), keys.dimensionNames());
        executor.execute(MdcPropagation.wrapRunnable(() -> produce(keys)));
        for (int i = 0; i < poolSize; i++) {
            executor.execute(MdcPropagation.wrapRunnable(this::work));
        }
        executor.execute(MdcPropagation.wrapRunnable(this::closeResults));
        executor.shutdown();
    }

    // ------------------------------------------------------------------ //
    // Consumer side                                                       //
    // ------------------------------------------------------------------ //

    @Override
    public ResultRow next() throws InterruptedException {
        if (resultsExhausted) {
            return null;
        }
        ResultRow row = results.take();
        if (row == END_OF_RESULTS) {
            resultsExhausted = true;
            return null;
        }
        return row;
    }

    /**
     * Stops issuing new queries. Rows of queries already in flight are discarded.
     * Idempotent; safe to call after the run has finished.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true) && terminated.getCount() > 0) {
            log.info("[WORKER-POOL] Cancelled after {} dispatched keys; draining in-flight queries",
                    keysDispatched.get());
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits until every pipeline thread has exited.
     *
     * @return {@code true} if the pool terminated within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        if (!terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        return executor.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    public int getPoolSize() {
        return poolSize;
    }

    /** Keys whose query was issued to the store. */
    public long getKeysDispatched() {
        return keysDispatched.get();
    }

    /** Keys whose query failed or timed out. */
    public long getKeysDropped() {
        return keysDropped.get();
    }

    /** Rows completed after cancellation and never handed to the consumer. */
    public long getRowsDiscarded() {
        return rowsDiscarded.get();
    }

    // ------------------------------------------------------------------ //
    // Producer                                                            //
    // ------------------------------------------------------------------ //

    private void produce(KeySpaceGenerator keys) {
        long produced = 0;
        try {
            produceLoop:
            while (keys.hasNext() && !cancelled.get()) {
                CompositeKey key = keys.next();
                while (!intake.offer(key, HANDOFF_POLL_MS, TimeUnit.MILLISECONDS)) {
                    if (cancelled.get()) {
                        break produceLoop;
                    }
                }
                produced++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[WORKER-POOL] Producer interrupted after {} keys; cancelling run", produced);
            cancelled.set(true);
        } finally {
            closeIntake();
            log.debug("[WORKER-POOL] Producer finished: {} keys enqueued, cancelled={}", produced, cancelled.get());
        }
    }

    private void closeIntake() {
        if (cancelled.get()) {
            intake.clear();
        }
        boolean interrupted = Thread.interrupted();
        try {
            for (int i = 0; i < poolSize; i++) {
                while (true) {
                    try {
                        intake.put(END_OF_KEYS);
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ------------------------------------------------------------------ //
    // Workers                                                             //
    // ------------------------------------------------------------------ //

    private void work() {
        try {
            while (true) {
                CompositeKey key = intake.take();
                if (key == END_OF_KEYS) {
                    return;
                }
                if (cancelled.get()) {
                    continue;
                }
                ResultRow row = query(key);
                if (row != null) {
                    emit(row);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[WORKER-POOL] Worker interrupted; cancelling run");
            cancelled.set(true);
        } finally {
            workersDone.countDown();
        }
    }

    private ResultRow query(CompositeKey key) {
        keysDispatched.incrementAndGet();
        Predicate predicate = key.toPredicate();
        metrics.queryStarted();
        long start = System.nanoTime();
        try {
            long count = indexStore.count(predicate);
            if (count < 0) {
                throw new IndexStoreException("Store returned a negative count: " + count);
            }
            metrics.recordQuerySuccess(System.nanoTime() - start);
            return new ResultRow(key, count);
        } catch (QueryTimeoutException e) {
            metrics.recordQueryTimeout(System.nanoTime() - start);
            drop(key, e);
        } catch (RuntimeException e) {
            metrics.recordQueryError(System.nanoTime() - start);
            drop(key, e);
        }
        return null;
    }

    private void drop(CompositeKey key, RuntimeException e) {
        keysDropped.incrementAndGet();
        metrics.recordDroppedKey();
        log.warn("[WORKER-POOL] Query for key {} failed, dropping key: {}", key, e.getMessage());
    }

    private void emit(ResultRow row) throws InterruptedException {
        while (!cancelled.get()) {
            if (results.offer(row, HANDOFF_POLL_MS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
        rowsDiscarded.incrementAndGet();
        metrics.recordDiscardedRow();
    }

    // ------------------------------------------------------------------ //
    // Closer                                                              //
    // ------------------------------------------------------------------ //

    private void closeResults() {
        try {
            workersDone.await();
            while (!cancelled.get()) {
                if (results.offer(END_OF_RESULTS, HANDOFF_POLL_MS, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[WORKER-POOL] Closer interrupted before all workers finished");
        } finally {
            terminated.countDown();
            log.info("[WORKER-POOL] All {} workers exited: dispatched={} dropped={} discarded={}",
                    poolSize, keysDispatched.get(), keysDropped.get(), rowsDiscarded.get());
        }
    }
}
