package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientEntry(
        @JsonProperty("name") String name,
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("subscriptions") List<String> subscriptions) {
}
