package com.streamfirst.shush.adapters.sensu;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Connection settings for a Sensu API endpoint.
 */
@Value
@Builder
public class SensuApiSettings {

    @NonNull URI baseUrl;
    String username;
    String password;
    @NonNull @Builder.Default Duration connectTimeout = Duration.ofSeconds(5);
    @NonNull @Builder.Default Duration requestTimeout = Duration.ofSeconds(10);

    public Optional<String> getUsername() {
        return Optional.ofNullable(username).filter(name -> !name.isBlank());
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    @Override
    public String toString() {
        return "SensuApiSettings(baseUrl=" + baseUrl + ", username=" + getUsername().orElse("<none>")
                + ", connectTimeout=" + connectTimeout + ", requestTimeout=" + requestTimeout + ")";
    }
}
