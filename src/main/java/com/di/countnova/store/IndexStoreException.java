package com.di.countnova.store;

/**
 * A query against the {@link IndexStore} failed (transport error, HTTP error status, or an
 * undecodable response).
 */
public class IndexStoreException extends RuntimeException {

    public IndexStoreException(String message) {
        super(message);
    }

    public IndexStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
