package com.walletwatch.api.dto;

import java.time.Instant;

/**
 * Error response for every non-2xx answer of the tracking and lookup endpoints.
 *
 * @param error     machine-readable code, e.g. INVALID_ADDRESS, STORE_FAILURE, FEED_UNAVAILABLE
 * @param timestamp when the error was produced (UTC)
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String INVALID_LABEL = "INVALID_LABEL";
    public static final String FEED_UNAVAILABLE = "FEED_UNAVAILABLE";

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }

    public static ErrorBody invalidAddress() {
        return of(INVALID_ADDRESS, "Invalid wallet address format");
    }

    public static ErrorBody feedUnavailable() {
        return of(FEED_UNAVAILABLE, "Account data source unavailable");
    }
}
