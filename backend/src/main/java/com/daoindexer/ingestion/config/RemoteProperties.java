package com.daoindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote data API endpoint and throttling.
 */
@ConfigurationProperties(prefix = "daoindexer.remote")
@NoArgsConstructor
@Getter
@Setter
public class RemoteProperties {

    /** JSON-RPC endpoint. */
    private String url = "http://localhost:8081/jsonRPC";

    /** Request budget per second for this instance. */
    private int maxRequestsPerSecond = 10;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long limiterTimeoutMs = 5_000;

    /** Per-call response timeout. */
    private long timeoutMs = 30_000;
}
