package com.arbiter.core.model;

/**
 * Thrown when a specification, its budget or its risk level is malformed.
 * Raised at construction time and never retried.
 */
public class SpecificationValidationException extends RuntimeException {
    public SpecificationValidationException(String message) {
        super(message);
    }

    public SpecificationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
