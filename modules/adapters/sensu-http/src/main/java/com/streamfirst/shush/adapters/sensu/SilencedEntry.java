package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A silence as returned by {@code GET /silenced}. {@code expire} holds the
 * remaining seconds; {@code -1} or absent means the silence never expires.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SilencedEntry(
        @JsonProperty("id") String id,
        @JsonProperty("subscription") String subscription,
        @JsonProperty("check") String check,
        @JsonProperty("reason") String reason,
        @JsonProperty("creator") String creator,
        @JsonProperty("expire") Long expire,
        @JsonProperty("expire_on_resolve") Boolean expireOnResolve,
        @JsonProperty("timestamp") Long timestamp) {

    public boolean isIndefinite() {
        return expire == null || expire < 0;
    }
}
