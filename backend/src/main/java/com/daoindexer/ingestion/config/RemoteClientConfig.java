package com.daoindexer.ingestion.config;

import com.daoindexer.ingestion.remote.RemoteDataClient;
import com.daoindexer.ingestion.remote.WebClientRemoteDataClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Remote data client and its rate limiter; binds the ingestion property classes.
 */
@Configuration
@EnableConfigurationProperties({ RemoteProperties.class, SyncProperties.class, ResyncProperties.class })
public class RemoteClientConfig {

    public static final String REMOTE_RATE_LIMITER = "remoteRateLimiter";

    @Bean(name = REMOTE_RATE_LIMITER)
    public RateLimiter remoteRateLimiter(RemoteProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("remote-data", config);
    }

    @Bean
    public RemoteDataClient remoteDataClient(WebClient.Builder webClientBuilder,
                                             @Qualifier(REMOTE_RATE_LIMITER) RateLimiter rateLimiter,
                                             ObjectMapper objectMapper,
                                             RemoteProperties properties) {
        return new WebClientRemoteDataClient(webClientBuilder, rateLimiter, objectMapper, properties);
    }
}
