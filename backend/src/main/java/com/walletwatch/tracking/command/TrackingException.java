package com.walletwatch.tracking.command;

import lombok.Getter;

/**
 * Thrown by TrackingCommandService when a registration is rejected. The API layer maps INVALID_ADDRESS to 400 and
 * STORE_FAILURE to 503.
 */
@Getter
public class TrackingException extends RuntimeException {

    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String STORE_FAILURE = "STORE_FAILURE";

    private final String errorCode;

    public TrackingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TrackingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
