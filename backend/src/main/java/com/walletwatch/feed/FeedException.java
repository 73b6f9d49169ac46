package com.walletwatch.feed;

/**
 * Base failure of a transaction feed or account data request. Address-level in the poller: logged and retried on
 * the next sweep.
 */
public class FeedException extends RuntimeException {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
