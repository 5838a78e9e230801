package com.streamfirst.shush.ports;

import com.streamfirst.shush.domain.FailureKind;
import com.streamfirst.shush.domain.SilenceRecord;

import java.util.Optional;

/**
 * An unexpired silence with different settings already exists for the target.
 * Never retried; the caller decides whether to overwrite or skip.
 */
public class ConflictException extends RegistryException {

    private final transient SilenceRecord existing;

    public ConflictException(String message, SilenceRecord existing) {
        super(message);
        this.existing = existing;
    }

    public Optional<SilenceRecord> getExisting() {
        return Optional.ofNullable(existing);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CONFLICT;
    }
}
