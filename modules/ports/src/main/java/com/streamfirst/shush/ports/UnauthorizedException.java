package com.streamfirst.shush.ports;

import com.streamfirst.shush.domain.FailureKind;

/**
 * The registry rejected the configured credentials.
 */
public class UnauthorizedException extends RegistryException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.UNAUTHORIZED;
    }
}
