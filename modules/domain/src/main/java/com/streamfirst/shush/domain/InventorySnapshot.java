package com.streamfirst.shush.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Point-in-time view of the clients and checks the monitoring system knows.
 * Used only to expand and validate selectors; it may already be stale when read.
 */
public record InventorySnapshot(Map<String, ClientInfo> clients, Set<String> checks, Instant capturedAt) {

    public InventorySnapshot {
        clients = Map.copyOf(clients);
        checks = Set.copyOf(checks);
    }

    public static InventorySnapshot of(Collection<ClientInfo> clients, Collection<String> checks, Instant capturedAt) {
        Map<String, ClientInfo> byName = clients.stream()
                .collect(Collectors.toMap(ClientInfo::name, Function.identity(), (first, second) -> second));
        return new InventorySnapshot(byName, Set.copyOf(checks), capturedAt);
    }

    public static InventorySnapshot empty(Instant capturedAt) {
        return new InventorySnapshot(Map.of(), Set.of(), capturedAt);
    }

    public Set<String> clientNames() {
        return new TreeSet<>(clients.keySet());
    }

    public Set<String> subscriptions() {
        return clients.values().stream()
                .flatMap(client -> client.subscriptions().stream())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public Set<String> instanceIds() {
        return clients.values().stream()
                .map(ClientInfo::instance)
                .flatMap(Optional::stream)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public Optional<ClientInfo> clientForInstance(String instanceId) {
        return clients.values().stream()
                .filter(client -> client.instance().filter(instanceId::equals).isPresent())
                .findFirst();
    }

    public boolean hasClient(String name) {
        return clients.containsKey(name);
    }

    public boolean hasSubscription(String name) {
        return clients.values().stream().anyMatch(client -> client.subscriptions().contains(name));
    }
}
