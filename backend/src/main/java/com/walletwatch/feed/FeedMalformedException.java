package com.walletwatch.feed;

/**
 * Feed answered but the body could not be parsed or lacks required fields.
 */
public class FeedMalformedException extends FeedException {

    public FeedMalformedException(String message) {
        super(message);
    }

    public FeedMalformedException(String message, Throwable cause) {
        super(message, cause);
    }
}
