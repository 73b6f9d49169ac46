package com.walletwatch.tracking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletwatch.tracking.detection.ChangeDetector;
import com.walletwatch.tracking.notify.LoggingNotificationSender;
import com.walletwatch.tracking.notify.NotificationFormatter;
import com.walletwatch.tracking.notify.NotificationSender;
import com.walletwatch.tracking.notify.TelegramNotificationSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires detection, formatting and the push channel from walletwatch.tracking / walletwatch.notification.
 */
@Configuration
@EnableConfigurationProperties({ TrackingProperties.class, NotificationProperties.class })
@Slf4j
public class TrackingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChangeDetector changeDetector(TrackingProperties properties) {
        return new ChangeDetector(properties.getDetectionMode());
    }

    @Bean
    public NotificationFormatter notificationFormatter(NotificationProperties properties) {
        return new NotificationFormatter(properties.getExplorerTxUrl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "walletwatch.notification.telegram", name = "enabled", havingValue = "true")
    public NotificationSender telegramNotificationSender(NotificationProperties properties,
                                                         WebClient.Builder webClientBuilder,
                                                         ObjectMapper objectMapper) {
        NotificationProperties.Telegram telegram = properties.getTelegram();
        if (telegram.getBotToken() == null || telegram.getBotToken().isBlank()) {
            throw new IllegalStateException("walletwatch.notification.telegram.bot-token is required when Telegram is enabled");
        }
        return new TelegramNotificationSender(webClientBuilder, objectMapper, telegram.getBaseUrl(),
                telegram.getBotToken(), Duration.ofMillis(Math.max(1L, telegram.getTimeoutMs())));
    }

    @Bean
    @ConditionalOnProperty(prefix = "walletwatch.notification.telegram", name = "enabled", havingValue = "false", matchIfMissing = true)
    public NotificationSender loggingNotificationSender() {
        log.info("Telegram disabled: notifications will be written to the log");
        return new LoggingNotificationSender();
    }
}
