package com.streamfirst.shush.domain;

/**
 * Rejected input: a bad ttl, an ambiguous selector combination, a malformed
 * filter. Raised before anything touches the registry.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
