package com.streamfirst.shush.ports;

import com.streamfirst.shush.domain.SilenceFilter;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;

import java.util.Set;

/**
 * Port for the remote silence registry.
 * Any backend that can list, create and delete silences addressed by target can
 * implement it; the application never assumes a transport.
 *
 * <p>Every operation is idempotent at target granularity. Implementations report
 * failures through {@link RegistryException} subclasses so callers can tell
 * transient unavailability apart from conflicts, missing resources and rejected
 * credentials.
 */
public interface SilenceRegistryPort {

    /**
     * Lists the unexpired silences matching the filter. Entries whose expiry has
     * already passed are never returned, even if the backend still stores them.
     *
     * @param filter subscription/check restriction, {@link SilenceFilter#all()} for everything
     * @return the matching silences
     * @throws RegistryUnavailableException if the registry cannot be reached
     */
    Set<SilenceRecord> list(SilenceFilter filter);

    /**
     * Writes a silence. If an unexpired silence with the same id and the same
     * intent already exists this is a successful no-op.
     *
     * @param record the silence to write
     * @param replaceExisting whether an existing silence with different settings may be overwritten
     * @throws ConflictException if a different silence exists and {@code replaceExisting} is false
     * @throws RegistryUnavailableException if the registry cannot be reached
     */
    void create(SilenceRecord record, boolean replaceExisting);

    /**
     * Removes the silence for a target. Removing a silence that does not exist succeeds.
     *
     * @param target the silenced target
     * @throws RegistryUnavailableException if the registry cannot be reached
     */
    void delete(Target target);
}
