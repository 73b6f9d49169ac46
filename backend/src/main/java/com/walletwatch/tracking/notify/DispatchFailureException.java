package com.walletwatch.tracking.notify;

/**
 * Notification could not be delivered. Transaction-level: the checkpoint is not advanced, so the next sweep retries.
 */
public class DispatchFailureException extends RuntimeException {

    public DispatchFailureException(String message) {
        super(message);
    }

    public DispatchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
