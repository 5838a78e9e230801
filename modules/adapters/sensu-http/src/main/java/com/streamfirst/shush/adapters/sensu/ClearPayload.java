package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /silenced/clear}. */
public record ClearPayload(@JsonProperty("id") String id) {
}
