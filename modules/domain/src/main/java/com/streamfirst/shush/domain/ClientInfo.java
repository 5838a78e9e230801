package com.streamfirst.shush.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A client known to the monitoring system.
 *
 * @param name the Sensu client name
 * @param instanceId the cloud instance id the client reports, if any
 * @param subscriptions the subscriptions the client is a member of
 */
public record ClientInfo(String name, String instanceId, List<String> subscriptions) {
    public ClientInfo {
        Objects.requireNonNull(name, "Client name cannot be null");
        subscriptions = subscriptions == null ? List.of() : List.copyOf(subscriptions);
    }

    public Optional<String> instance() {
        return Optional.ofNullable(instanceId).filter(id -> !id.isBlank());
    }
}
