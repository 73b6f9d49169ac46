package com.walletwatch.tracking.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Push channel and message settings. Documented in application.yml under walletwatch.notification.
 */
@ConfigurationProperties(prefix = "walletwatch.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    /** Deep-link prefix; the transaction hash is appended. */
    private String explorerTxUrl = "https://kaiascan.io/tx/";

    private Telegram telegram = new Telegram();

    @Getter
    @Setter
    public static class Telegram {
        /** When false, notifications are only logged. */
        private boolean enabled = false;
        private String botToken = "";
        private String baseUrl = "https://api.telegram.org";
        private long timeoutMs = 10_000L;
    }
}
