package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckEntry(@JsonProperty("name") String name) {
}
