package com.walletwatch.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletwatch.domain.FeedTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link TransactionFeedClient} over Kaiascan {@code /accounts/{address}/transactions}. Pages come back newest first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KaiascanTransactionFeedClient implements TransactionFeedClient {

    static final String HISTORY_PATH = "/accounts/{address}/transactions?page={page}&size={size}";

    private final KaiascanApiClient apiClient;

    @Override
    public Optional<FeedTransaction> latestTransaction(String address) {
        return transactionHistory(address, 1, 1).stream().findFirst();
    }

    @Override
    public List<FeedTransaction> transactionHistory(String address, int page, int pageSize) {
        JsonNode root = apiClient.getJson(HISTORY_PATH, address, Math.max(1, page), Math.max(1, pageSize));
        return parseHistory(root);
    }

    static List<FeedTransaction> parseHistory(JsonNode root) {
        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) {
            throw new FeedMalformedException("Transaction history has no results array");
        }
        List<FeedTransaction> transactions = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            String hash = text(node, "transaction_hash");
            Instant timestamp = parseTimestamp(node.get("datetime"));
            if (hash == null || timestamp == null) {
                log.warn("Skipping history entry without hash or datetime: {}", node);
                continue;
            }
            transactions.add(new FeedTransaction(
                    hash,
                    text(node, "from"),
                    text(node, "to"),
                    timestamp,
                    text(node, "transaction_type"),
                    text(node, "amount"),
                    text(node, "transaction_fee"),
                    methodSignature(node)));
        }
        return transactions;
    }

    /**
     * ISO-8601 instant or offset date-time; numbers are epoch seconds (epoch millis above 10^12).
     */
    static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            long value = node.asLong();
            return value > 1_000_000_000_000L ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException e2) {
                throw new FeedMalformedException("Unparseable datetime '" + raw + "'", e2);
            }
        }
    }

    private static String methodSignature(JsonNode node) {
        String signature = text(node, "method_id");
        if (signature == null) {
            signature = text(node, "signature");
        }
        return signature;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
