package com.streamfirst.shush.ports;

import com.streamfirst.shush.domain.FailureKind;

/**
 * The addressed resource does not exist (any more).
 */
public class NotFoundException extends RegistryException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.NOT_FOUND;
    }
}
