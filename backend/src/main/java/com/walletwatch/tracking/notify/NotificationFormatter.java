package com.walletwatch.tracking.notify;

import com.walletwatch.domain.FeedTransaction;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Renders one transaction for a subscriber. Pure: no I/O, no clock.
 */
public class NotificationFormatter {

    static final String HEADER = "🔔 [NEW TRANSACTION] 🔔";
    static final String UNKNOWN = "unknown";

    private static final DateTimeFormatter UTC_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final String explorerTxUrl;

    /**
     * @param explorerTxUrl prefix the hash is appended to for the deep link, e.g. {@code https://kaiascan.io/tx/}
     */
    public NotificationFormatter(String explorerTxUrl) {
        this.explorerTxUrl = explorerTxUrl == null ? "" : explorerTxUrl;
    }

    public String format(FeedTransaction tx, String label) {
        if (tx == null || tx.hash() == null) {
            throw new IllegalArgumentException("transaction with a hash is required");
        }
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append("\n\n");
        if (label != null && !label.isBlank()) {
            sb.append("Label: ").append(label).append('\n');
        }
        sb.append("Time: ").append(tx.timestamp() != null ? UTC_TIME.format(tx.timestamp()) : UNKNOWN).append('\n');
        sb.append("Hash: ").append(tx.hash()).append('\n');
        sb.append("From: ").append(orUnknown(tx.from())).append('\n');
        sb.append("To: ").append(orUnknown(tx.to())).append('\n');
        sb.append("Type: ").append(orUnknown(tx.kind())).append('\n');
        sb.append("Amount: ").append(inKaia(tx.amount())).append('\n');
        sb.append("Fee: ").append(inKaia(tx.fee())).append('\n');
        sb.append("Method: ").append(orUnknown(tx.methodSignature())).append("\n\n");
        sb.append("🔗 ").append(deepLink(tx.hash()));
        return sb.toString();
    }

    public String deepLink(String hash) {
        return explorerTxUrl + hash;
    }

    /** Unit suffix only on a known value. */
    private static String inKaia(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value + " KAIA";
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
