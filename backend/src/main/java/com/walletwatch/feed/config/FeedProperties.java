package com.walletwatch.feed.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Kaiascan Open API access. Documented in application.yml under walletwatch.feed.
 */
@ConfigurationProperties(prefix = "walletwatch.feed")
@NoArgsConstructor
@Getter
@Setter
public class FeedProperties {

    private String baseUrl = "https://mainnet-oapi.kaiascan.io/api/v1";

    /** Bearer token sent on every request; blank = no Authorization header. */
    private String apiToken = "";

    /** Upper bound for a single request, including connect and body read. */
    private long timeoutMs = 10_000L;

    /** Recent-history window fetched per tracked address per sweep. */
    private int historyPageSize = 20;

    /** Local limiter: requests per second across all callers. */
    private int requestsPerSecond = 10;

    /** How long a caller may wait for a limiter permit before the request counts as unavailable. */
    private long limiterTimeoutMs = 5_000L;

    private Retry retry = new Retry();

    /**
     * Backoff for registration-time baseline fetches and lookups. The poller never retries in-sweep.
     */
    @Getter
    @Setter
    public static class Retry {
        private long baseDelayMs = 500L;
        private double jitterFactor = 0.2;
        private int maxAttempts = 3;
    }
}
