package com.walletwatch.tracking.store;

/**
 * Thrown when the tracked-address store can not complete a read or write.
 */
public class StoreFailureException extends RuntimeException {

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
