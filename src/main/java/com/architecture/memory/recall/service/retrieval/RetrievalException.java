package com.architecture.memory.recall.service.retrieval;

/**
 * A search leg failed for a reason other than its timeout.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
