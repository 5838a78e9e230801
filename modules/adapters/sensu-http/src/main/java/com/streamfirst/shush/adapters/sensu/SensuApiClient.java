package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.shush.ports.NotFoundException;
import com.streamfirst.shush.ports.RegistryUnavailableException;
import com.streamfirst.shush.ports.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thin JSON-over-HTTP client for the Sensu API.
 *
 * <p>Responses are classified by status: 401 and 403 become {@link UnauthorizedException},
 * 404 becomes {@link NotFoundException}, 429 and 5xx as well as transport failures and
 * timeouts become {@link RegistryUnavailableException}. Any other 4xx means the request
 * itself was wrong and surfaces as {@link IllegalStateException}.
 *
 * <p>The client owns the executor its {@link HttpClient} runs on; {@link #close()}
 * releases it.
 */
@Slf4j
public class SensuApiClient implements AutoCloseable {

    private static final AtomicInteger THREADS = new AtomicInteger();

    private final SensuApiSettings settings;
    private final ExecutorService executorService;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Optional<String> authorization;

    public SensuApiClient(SensuApiSettings settings) {
        this.settings = settings;
        this.executorService = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "shush-http-" + THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(settings.getConnectTimeout())
                .executor(executorService)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.authorization = settings.getUsername().map(user -> basic(user, settings.getPassword().orElse("")));

        log.debug("Initialized Sensu API client: {}", settings);
    }

    /**
     * GETs a JSON document.
     *
     * @throws NotFoundException if the resource does not exist
     */
    public <T> T get(String path, TypeReference<T> type) {
        HttpResponse<String> response = send(request(path).GET().build());
        return read(path, response.body(), type);
    }

    /** GETs a JSON document, mapping 404 to empty. */
    public <T> Optional<T> find(String path, TypeReference<T> type) {
        try {
            return Optional.of(get(path, type));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    /** POSTs {@code body} as JSON and ignores the response body. */
    public void post(String path, Object body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body for " + path, e);
        }
        log.debug("POST {} {}", path, json);
        send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build());
    }

    public SensuApiSettings getSettings() {
        return settings;
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolve(path))
                .timeout(settings.getRequestTimeout())
                .header("Accept", "application/json");
        authorization.ifPresent(value -> builder.header("Authorization", value));
        return builder;
    }

    private URI resolve(String path) {
        String base = settings.getBaseUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private HttpResponse<String> send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RegistryUnavailableException(
                    request.method() + " " + request.uri().getPath() + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException(request.method() + " " + request.uri().getPath() + " interrupted", e);
        }

        int status = response.statusCode();
        log.debug("{} {} -> {}", request.method(), request.uri().getPath(), status);
        if (status >= 200 && status < 300) {
            return response;
        }

        String message = request.method() + " " + request.uri().getPath() + " returned HTTP " + status;
        if (status == 401 || status == 403) {
            throw new UnauthorizedException(message);
        }
        if (status == 404) {
            throw new NotFoundException(message);
        }
        if (status == 429 || status >= 500) {
            throw new RegistryUnavailableException(message);
        }
        throw new IllegalStateException(message + ": " + response.body());
    }

    private <T> T read(String path, String body, TypeReference<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed response from " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String basic(String username, String password) {
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void close() {
        log.debug("Shutting down Sensu API client executor");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sensu API client executor did not terminate within 5 seconds, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while shutting down Sensu API client executor");
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
