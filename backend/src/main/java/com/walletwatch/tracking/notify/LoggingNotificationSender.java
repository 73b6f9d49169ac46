package com.walletwatch.tracking.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes notifications to the log. Used when no push channel is configured.
 */
@Slf4j
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void send(String subscriberId, String message) {
        log.info("Notification for {}:\n{}", subscriberId, message);
    }
}
