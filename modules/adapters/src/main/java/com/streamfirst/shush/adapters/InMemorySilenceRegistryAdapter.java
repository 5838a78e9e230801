package com.streamfirst.shush.adapters;

import com.streamfirst.shush.domain.SilenceFilter;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.ports.ConflictException;
import com.streamfirst.shush.ports.RegistryException;
import com.streamfirst.shush.ports.SilenceRegistryPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SilenceRegistryPort for testing and development.
 * Records are keyed by silence id, so writing a target twice replaces the first
 * record. Failures can be injected per target, either permanently or for the
 * next few calls only, to stand in for an unreliable registry.
 */
@Slf4j
public class InMemorySilenceRegistryAdapter implements SilenceRegistryPort {

    private final Map<String, SilenceRecord> silences = new ConcurrentHashMap<>();

    // Injected failures
    private final Map<Target, Supplier<? extends RegistryException>> permanentFaults = new ConcurrentHashMap<>();
    private final Map<Target, Deque<RegistryException>> pendingFaults = new ConcurrentHashMap<>();
    private final Deque<RegistryException> pendingListingFaults = new ConcurrentLinkedDeque<>();

    private final AtomicInteger creates = new AtomicInteger();
    private final AtomicInteger deletes = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();

    private final Clock clock;
    private final Duration ttlTolerance;

    public InMemorySilenceRegistryAdapter() {
        this(Clock.systemUTC());
    }

    public InMemorySilenceRegistryAdapter(Clock clock) {
        this(clock, Duration.ofSeconds(1));
    }

    public InMemorySilenceRegistryAdapter(Clock clock, Duration ttlTolerance) {
        this.clock = clock;
        this.ttlTolerance = ttlTolerance;
    }

    @Override
    public Set<SilenceRecord> list(SilenceFilter filter) {
        calls.incrementAndGet();
        throwPending(pendingListingFaults);
        return silences.values().stream()
                .filter(record -> !record.isExpiredAt(clock.instant()))
                .filter(filter::matches)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void create(SilenceRecord record, boolean replaceExisting) {
        calls.incrementAndGet();
        injectFault(record.getTarget());

        Optional<SilenceRecord> existing = live(record.getId());
        if (existing.isPresent()) {
            if (existing.get().sameIntent(record, ttlTolerance)) {
                log.debug("{} already silenced with the same settings", record.getTarget());
                return;
            }
            if (!replaceExisting) {
                throw new ConflictException(
                        "Silence " + record.getId() + " already exists with different settings",
                        existing.get());
            }
        }

        silences.put(record.getId(), record);
        creates.incrementAndGet();
        log.debug("Stored silence {}", record.getId());
    }

    @Override
    public void delete(Target target) {
        calls.incrementAndGet();
        injectFault(target);
        if (silences.remove(target.silenceId()) != null) {
            deletes.incrementAndGet();
            log.debug("Removed silence {}", target.silenceId());
        }
    }

    /** Seeds a record as if it had been written earlier, bypassing conflict checks. */
    public InMemorySilenceRegistryAdapter put(SilenceRecord record) {
        silences.put(record.getId(), record);
        return this;
    }

    public InMemorySilenceRegistryAdapter putAll(Collection<SilenceRecord> records) {
        records.forEach(this::put);
        return this;
    }

    /** Every call for {@code target} fails with a fresh exception from {@code fault}. */
    public InMemorySilenceRegistryAdapter failAlways(Target target, Supplier<? extends RegistryException> fault) {
        permanentFaults.put(target, fault);
        return this;
    }

    /** The next calls for {@code target} fail with the given exceptions, in order. */
    public InMemorySilenceRegistryAdapter failNext(Target target, RegistryException... faults) {
        Deque<RegistryException> queue = pendingFaults.computeIfAbsent(target, k -> new ConcurrentLinkedDeque<>());
        for (RegistryException fault : faults) {
            queue.addLast(fault);
        }
        return this;
    }

    public InMemorySilenceRegistryAdapter failNextListing(RegistryException... faults) {
        for (RegistryException fault : faults) {
            pendingListingFaults.addLast(fault);
        }
        return this;
    }

    /** The stored record for a target, expired or not. */
    public Optional<SilenceRecord> get(Target target) {
        return Optional.ofNullable(silences.get(target.silenceId()));
    }

    public Set<SilenceRecord> all() {
        return Set.copyOf(silences.values());
    }

    /** Number of records actually written. Same-intent creates are not counted. */
    public int createCount() {
        return creates.get();
    }

    /** Number of records actually removed. */
    public int deleteCount() {
        return deletes.get();
    }

    public int writeCount() {
        return creates.get() + deletes.get();
    }

    /** Every call made through the port, including failed ones. */
    public int callCount() {
        return calls.get();
    }

    private Optional<SilenceRecord> live(String id) {
        return Optional.ofNullable(silences.get(id))
                .filter(record -> !record.isExpiredAt(clock.instant()));
    }

    private void injectFault(Target target) {
        Deque<RegistryException> pending = pendingFaults.get(target);
        if (pending != null) {
            throwPending(pending);
        }
        Supplier<? extends RegistryException> fault = permanentFaults.get(target);
        if (fault != null) {
            throw fault.get();
        }
    }

    private static void throwPending(Deque<RegistryException> pending) {
        RegistryException next = pending.pollFirst();
        if (next != null) {
            throw next;
        }
    }
}
