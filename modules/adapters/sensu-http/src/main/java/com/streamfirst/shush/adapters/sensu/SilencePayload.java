package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /silenced}. Absent subscription means every client, absent
 * check means every check, absent expire means no expiration.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SilencePayload(
        @JsonProperty("subscription") String subscription,
        @JsonProperty("check") String check,
        @JsonProperty("expire") Long expire,
        @JsonProperty("expire_on_resolve") Boolean expireOnResolve,
        @JsonProperty("reason") String reason,
        @JsonProperty("creator") String creator) {
}
