package com.walletwatch.feed.config;

import com.walletwatch.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared beans for Kaiascan access: local rate limiter and retry policy.
 */
@Configuration
@EnableConfigurationProperties(FeedProperties.class)
public class FeedClientConfig {

    public static final String FEED_RATE_LIMITER = "feedRateLimiter";
    public static final String FEED_RETRY_POLICY = "feedRetryPolicy";

    @Bean(name = FEED_RATE_LIMITER)
    public RateLimiter feedRateLimiter(FeedProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("kaiascan", config);
    }

    @Bean(name = FEED_RETRY_POLICY)
    public RetryPolicy feedRetryPolicy(FeedProperties properties) {
        FeedProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), Math.max(1, retry.getMaxAttempts()));
    }
}
