package com.walletwatch.tracking.notify;

/**
 * Outbound push channel to a subscriber.
 */
public interface NotificationSender {

    /**
     * Deliver the message. Blocks until the channel accepted or rejected it.
     *
     * @throws DispatchFailureException when the channel rejects the message or can not be reached
     */
    void send(String subscriberId, String message);
}
