package com.streamfirst.shush.ports;

import com.streamfirst.shush.domain.FailureKind;

/**
 * Base type for failures reported by a registry or inventory adapter.
 */
public abstract class RegistryException extends RuntimeException {

    protected RegistryException(String message) {
        super(message);
    }

    protected RegistryException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();

    /** Whether repeating the same call may succeed. */
    public boolean isRetryable() {
        return false;
    }
}
