package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.core.type.TypeReference;
import com.streamfirst.shush.domain.ClientInfo;
import com.streamfirst.shush.domain.InventorySnapshot;
import com.streamfirst.shush.ports.InventoryPort;
import com.streamfirst.shush.ports.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * InventoryPort reading clients and check definitions from the Sensu API.
 */
@Slf4j
public class SensuInventoryAdapter implements InventoryPort {

    private static final TypeReference<List<ClientEntry>> CLIENTS = new TypeReference<>() {};
    private static final TypeReference<List<CheckEntry>> CHECKS = new TypeReference<>() {};

    private final SensuApiClient client;
    private final Clock clock;

    public SensuInventoryAdapter(SensuApiClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public InventorySnapshot snapshot() {
        List<ClientInfo> clients = client.get(SensuEndpoint.CLIENTS.path(), CLIENTS).stream()
                .filter(entry -> entry.name() != null)
                .map(entry -> new ClientInfo(entry.name(), entry.instanceId(), entry.subscriptions()))
                .toList();

        List<String> checks;
        try {
            checks = client.get(SensuEndpoint.CHECKS.path(), CHECKS).stream()
                    .map(CheckEntry::name)
                    .filter(Objects::nonNull)
                    .toList();
        } catch (NotFoundException e) {
            log.warn("Sensu API does not expose check definitions, check wildcards will match nothing");
            checks = List.of();
        }

        log.debug("Inventory: {} clients, {} checks", clients.size(), checks.size());
        return InventorySnapshot.of(clients, checks, clock.instant());
    }
}
