package com.arbiter.core.value;

/**
 * Thrown when persisted value state cannot be read or written.
 */
public class ValueMemoryStoreException extends RuntimeException {
    public ValueMemoryStoreException(String message) {
        super(message);
    }

    public ValueMemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
