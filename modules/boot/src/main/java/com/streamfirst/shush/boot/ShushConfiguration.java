package com.streamfirst.shush.boot;

import com.streamfirst.shush.adapters.sensu.SensuApiClient;
import com.streamfirst.shush.adapters.sensu.SensuApiSettings;
import com.streamfirst.shush.adapters.sensu.SensuInventoryAdapter;
import com.streamfirst.shush.adapters.sensu.SensuSilenceRegistryAdapter;
import com.streamfirst.shush.application.PlanExecutor;
import com.streamfirst.shush.application.Retrier;
import com.streamfirst.shush.application.RetryPolicy;
import com.streamfirst.shush.application.RetryingInventory;
import com.streamfirst.shush.application.RetryingSilenceRegistry;
import com.streamfirst.shush.application.SilencePlanner;
import com.streamfirst.shush.application.SilenceService;
import com.streamfirst.shush.application.TargetResolver;
import com.streamfirst.shush.ports.InventoryPort;
import com.streamfirst.shush.ports.SilenceRegistryPort;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the Sensu adapters, wrapped in retries, into the silence service.
 */
@Configuration
@EnableConfigurationProperties(ShushProperties.class)
public class ShushConfiguration {

    // --- Adapter beans ---

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public SensuApiClient sensuApiClient(ShushProperties properties) {
        ShushProperties.Api api = properties.getApi();
        if (api.getUrl() == null) {
            throw new IllegalStateException(
                    "shush.api.url is not configured; set it in a configuration file or pass --shush.api.url");
        }
        return new SensuApiClient(SensuApiSettings.builder()
                .baseUrl(api.getUrl())
                .username(api.getUsername())
                .password(api.getPassword())
                .connectTimeout(api.getConnectTimeout())
                .requestTimeout(api.getRequestTimeout())
                .build());
    }

    @Bean
    public Retrier retrier(ShushProperties properties) {
        ShushProperties.Retry retry = properties.getRetry();
        return new Retrier(new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay()));
    }

    @Bean
    public SilenceRegistryPort silenceRegistry(SensuApiClient client, Clock clock, ShushProperties properties,
                                               Retrier retrier) {
        return new RetryingSilenceRegistry(
                new SensuSilenceRegistryAdapter(client, clock, properties.getTtlTolerance()), retrier);
    }

    @Bean
    public InventoryPort inventory(SensuApiClient client, Clock clock, Retrier retrier) {
        return new RetryingInventory(new SensuInventoryAdapter(client, clock), retrier);
    }

    // --- Application service beans ---

    @Bean
    public SilenceService silenceService(SilenceRegistryPort silenceRegistry, InventoryPort inventory,
                                         ShushProperties properties, Clock clock) {
        return new SilenceService(
                silenceRegistry,
                inventory,
                new TargetResolver(),
                new SilencePlanner(properties.getTtlTolerance()),
                new PlanExecutor(properties.getExecution().getMaxConcurrency()),
                clock);
    }

    @Bean
    public ShushCommandRunner shushCommandRunner(SilenceService silenceService, ShushProperties properties,
                                                 Clock clock) {
        return new ShushCommandRunner(silenceService, properties, clock, new ReportPrinter(clock));
    }
}
