package com.streamfirst.shush.boot;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

/**
 * Settings bound from {@code shush.*}: the Sensu API connection, retry and execution
 * limits, and the creator recorded on new silences.
 */
@Data
@ConfigurationProperties(prefix = "shush")
public class ShushProperties {

    private Api api = new Api();
    private Retry retry = new Retry();
    private Execution execution = new Execution();

    /** Recorded as the creator of every silence written. */
    private String creator = "shush";

    /** Largest ttl difference still treated as the same silence. */
    private Duration ttlTolerance = Duration.ofSeconds(1);

    @Data
    public static class Api {
        private URI url;
        private String username;
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 4;
        private Duration baseDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Execution {
        private int maxConcurrency = 4;
        /** Operations not started by then are reported as cancelled. */
        private Duration deadline = Duration.ofSeconds(60);
    }
}
