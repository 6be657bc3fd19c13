package com.di.countnova.store;

import java.util.List;

/**
 * Remote bitmap index queried by the aggregation pipeline.
 * <p>
 * Implementations must be safe for concurrent invocation: the worker pool calls
 * {@link #count(Predicate)} from up to {@code poolSize} threads at once without locking.
 * Every call is bounded by the implementation's query deadline; a call that exceeds it fails with
 * {@link QueryTimeoutException} instead of blocking the caller.
 */
public interface IndexStore {

    /**
     * Number of records matching {@code predicate}.
     *
     * @throws IndexStoreException    when the query fails
     * @throws QueryTimeoutException  when the query does not complete within the deadline
     */
    long count(Predicate predicate);

    /**
     * Rows of {@code dimension} ranked by number of matching records, highest first.
     *
     * @param filter optional; {@code null} ranks over all records
     */
    List<CountItem> topN(String dimension, int n, Predicate filter);
}
