package com.di.countnova.store;

/**
 * An {@link IndexStore} query did not complete within its deadline.
 */
public class QueryTimeoutException extends IndexStoreException {

    public QueryTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
