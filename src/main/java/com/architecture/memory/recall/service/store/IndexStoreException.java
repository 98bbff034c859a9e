package com.architecture.memory.recall.service.store;

/**
 * Transport or protocol failure talking to the index store.
 */
public class IndexStoreException extends RuntimeException {

    public IndexStoreException(String message) {
        super(message);
    }

    public IndexStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
