package com.architecture.memory.recall.service.extract;

/**
 * Raised when a repository cannot be resolved or the extraction artifact cannot be read or written.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
