package com.streamfirst.shush.ports;

import com.streamfirst.shush.domain.FailureKind;

/**
 * The registry could not be reached or answered with a transient error.
 */
public class RegistryUnavailableException extends RegistryException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.UNAVAILABLE;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
