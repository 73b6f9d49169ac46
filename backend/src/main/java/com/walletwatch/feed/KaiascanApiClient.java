package com.walletwatch.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletwatch.feed.config.FeedClientConfig;
import com.walletwatch.feed.config.FeedProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Blocking GET access to the Kaiascan Open API through WebClient. Applies bearer auth, the local rate limiter and a
 * per-request timeout; maps every failure to {@link FeedUnavailableException} or {@link FeedMalformedException}.
 */
@Component
@Slf4j
public class KaiascanApiClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    public KaiascanApiClient(FeedProperties properties,
                             WebClient.Builder webClientBuilder,
                             ObjectMapper objectMapper,
                             @Qualifier(FeedClientConfig.FEED_RATE_LIMITER) RateLimiter rateLimiter) {
        WebClient.Builder builder = webClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "*/*");
        if (properties.getApiToken() != null && !properties.getApiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken());
        }
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.timeout = Duration.ofMillis(Math.max(1L, properties.getTimeoutMs()));
    }

    /**
     * GET the URI template (relative to the base URL) and parse the body as JSON.
     */
    public JsonNode getJson(String uriTemplate, Object... uriVariables) {
        String body = get(uriTemplate, uriVariables);
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FeedMalformedException("Unparseable response for " + uriTemplate + ": " + e.getOriginalMessage(), e);
        }
    }

    String get(String uriTemplate, Object... uriVariables) {
        if (!rateLimiter.acquirePermission()) {
            throw new FeedUnavailableException("Local limiter timeout before GET " + uriTemplate);
        }
        try {
            String body = webClient.get()
                    .uri(uriTemplate, uriVariables)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            if (body == null || body.isBlank()) {
                throw new FeedMalformedException("Empty response for " + uriTemplate);
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new FeedUnavailableException("HTTP " + e.getStatusCode().value() + " for " + uriTemplate, e);
        } catch (FeedException e) {
            throw e;
        } catch (RuntimeException e) {
            // timeouts surface from block() as a RuntimeException wrapping TimeoutException
            throw new FeedUnavailableException("GET " + uriTemplate + " failed: " + messageOf(e), e);
        }
    }

    private static String messageOf(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
