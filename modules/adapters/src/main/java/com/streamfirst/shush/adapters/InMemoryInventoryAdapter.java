package com.streamfirst.shush.adapters;

import com.streamfirst.shush.domain.ClientInfo;
import com.streamfirst.shush.domain.InventorySnapshot;
import com.streamfirst.shush.ports.InventoryPort;
import com.streamfirst.shush.ports.RegistryException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of InventoryPort for testing and development.
 */
@Slf4j
public class InMemoryInventoryAdapter implements InventoryPort {

    private final Map<String, ClientInfo> clients = new ConcurrentHashMap<>();
    private final Set<String> checks = ConcurrentHashMap.newKeySet();
    private final AtomicReference<RegistryException> fault = new AtomicReference<>();
    private final AtomicInteger snapshots = new AtomicInteger();
    private final Clock clock;

    public InMemoryInventoryAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryInventoryAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public InventorySnapshot snapshot() {
        snapshots.incrementAndGet();
        RegistryException failure = fault.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        log.debug("Inventory snapshot with {} clients and {} checks", clients.size(), checks.size());
        return new InventorySnapshot(Map.copyOf(clients), Set.copyOf(checks), clock.instant());
    }

    public InMemoryInventoryAdapter client(String name, String instanceId, String... subscriptions) {
        clients.put(name, new ClientInfo(name, instanceId, List.of(subscriptions)));
        return this;
    }

    public InMemoryInventoryAdapter checks(String... names) {
        checks.addAll(Arrays.asList(names));
        return this;
    }

    /** The next snapshot fails with {@code failure}. */
    public InMemoryInventoryAdapter failNext(RegistryException failure) {
        fault.set(failure);
        return this;
    }

    public int snapshotCount() {
        return snapshots.get();
    }
}
