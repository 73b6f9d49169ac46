package com.walletwatch.tracking.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Telegram Bot API {@code sendMessage}; the subscriber id is the chat id.
 */
public class TelegramNotificationSender implements NotificationSender {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String botToken;
    private final Duration timeout;

    public TelegramNotificationSender(WebClient.Builder builder, ObjectMapper objectMapper,
                                      String baseUrl, String botToken, Duration timeout) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
        this.botToken = botToken;
        this.timeout = timeout;
    }

    @Override
    public void send(String subscriberId, String message) {
        Map<String, Object> body = Map.of(
                "chat_id", subscriberId,
                "text", message,
                "disable_web_page_preview", true
        );
        String response;
        try {
            response = webClient.post()
                    .uri("/bot" + botToken + "/sendMessage")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new DispatchFailureException("Telegram sendMessage to " + subscriberId
                    + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new DispatchFailureException("Telegram sendMessage to " + subscriberId + " failed: " + e.getMessage(), e);
        }
        ensureOk(subscriberId, response);
    }

    private void ensureOk(String subscriberId, String response) {
        if (response == null || response.isBlank()) {
            throw new DispatchFailureException("Empty Telegram response for " + subscriberId);
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            if (!root.path("ok").asBoolean(false)) {
                throw new DispatchFailureException("Telegram rejected message for " + subscriberId + ": "
                        + root.path("description").asText("no description"));
            }
        } catch (DispatchFailureException e) {
            throw e;
        } catch (Exception e) {
            throw new DispatchFailureException("Unparseable Telegram response for " + subscriberId, e);
        }
    }
}
