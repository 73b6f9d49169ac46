package com.walletwatch.feed;

/**
 * Feed could not be reached: HTTP error status, timeout, connection failure or local rate-limit timeout.
 */
public class FeedUnavailableException extends FeedException {

    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
