package com.streamfirst.shush.adapters.sensu;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Sensu API endpoints used by shush.
 */
public enum SensuEndpoint {
    /** List or create silences */
    SILENCED("/silenced"),
    /** A single silence, addressed by id */
    SILENCED_ID("/silenced/ids/"),
    /** Remove a silence by id */
    CLEAR("/silenced/clear"),
    CLIENTS("/clients"),
    CHECKS("/checks");

    private final String path;

    SensuEndpoint(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    /** Path of {@link #SILENCED_ID} for the given silence id. */
    public static String silenceById(String id) {
        return SILENCED_ID.path + URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
