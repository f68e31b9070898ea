package com.daoindexer.ingestion.remote;

import com.daoindexer.ingestion.config.RemoteProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JSON-RPC client for the remote data API using WebClient. Every call passes the shared rate limiter first.
 */
@Slf4j
public class WebClientRemoteDataClient implements RemoteDataClient {

    static final String METHOD_INFO = "getMasterchainInfo";
    static final String METHOD_CONTRACT_DATA = "getContractData";

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final RemoteProperties properties;
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public WebClientRemoteDataClient(WebClient.Builder builder, RateLimiter rateLimiter,
                                     ObjectMapper objectMapper, RemoteProperties properties) {
        this.webClient = builder.build();
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void initIfNeeded() {
        if (initialized.get()) {
            return;
        }
        JsonNode info = call(METHOD_INFO, Map.of());
        initialized.set(true);
        log.info("Remote data API at {} is ready: {}", properties.getUrl(), info);
    }

    boolean isInitialized() {
        return initialized.get();
    }

    @Override
    public JsonNode getContractData(String address) {
        if (address == null || address.isBlank()) {
            throw new RemoteDataException("Contract address is required");
        }
        return call(METHOD_CONTRACT_DATA, Map.of("address", address));
    }

    private JsonNode call(String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RemoteDataException("Local limiter timeout before " + method);
        }
        if (waitedMs > 0) {
            log.debug("Local limiter delayed {} ms before {}", waitedMs, method);
        }

        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params
        );
        String json;
        try {
            json = webClient.post()
                    .uri(properties.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                    .onErrorMap(WebClientResponseException.class, e -> new RemoteDataException(e.getMessage(), e))
                    .onErrorMap(WebClientRequestException.class, e -> new RemoteDataException(e.getMessage(), e))
                    .onErrorMap(TimeoutException.class, e -> new RemoteDataException(method + " timed out", e))
                    .block();
        } catch (RemoteDataException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteDataException(method + " failed: " + e.getMessage(), e);
        }
        return parseResult(method, json);
    }

    private JsonNode parseResult(String method, String json) {
        if (json == null || json.isBlank()) {
            throw new RemoteDataException("Empty response to " + method);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RemoteDataException("Malformed response to " + method, e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new RemoteDataException(method + " returned error: " + error.path("message").asText(error.toString()));
        }
        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new RemoteDataException("No result in response to " + method);
        }
        return result;
    }
}
