package com.walletwatch.tracking.notify;

import com.walletwatch.domain.FeedTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationFormatterTest {

    private final NotificationFormatter formatter = new NotificationFormatter("https://kaiascan.io/tx/");

    private static final FeedTransaction TX = new FeedTransaction(
            "0x9f1c2e",
            "0x5eda3f9ab84dc831aa3c811af73f54c4ca9ec5aa",
            "0x0000000000000000000000000000000000000001",
            Instant.parse("2024-11-20T08:22:10Z"),
            "smart_contract_execution",
            "12.5",
            "0.00105",
            "0xa9059cbb");

    @Test
    @DisplayName("message carries header, label, UTC time, all transaction fields and deep link")
    void formatsAllFields() {
        String message = formatter.format(TX, "cold wallet");

        assertThat(message).startsWith(NotificationFormatter.HEADER);
        assertThat(message).contains("Label: cold wallet");
        assertThat(message).contains("Time: 2024-11-20 08:22:10 UTC");
        assertThat(message).contains("Hash: 0x9f1c2e");
        assertThat(message).contains("From: 0x5eda3f9ab84dc831aa3c811af73f54c4ca9ec5aa");
        assertThat(message).contains("To: 0x0000000000000000000000000000000000000001");
        assertThat(message).contains("Type: smart_contract_execution");
        assertThat(message).contains("Amount: 12.5 KAIA");
        assertThat(message).contains("Fee: 0.00105 KAIA");
        assertThat(message).contains("Method: 0xa9059cbb");
        assertThat(message).endsWith("https://kaiascan.io/tx/0x9f1c2e");
    }

    @Test
    @DisplayName("missing method signature renders as unknown; no label line without a label")
    void unknownMethodAndNoLabel() {
        FeedTransaction plain = new FeedTransaction("0xabc", "0xa", "0xb",
                Instant.parse("2024-01-01T00:00:00Z"), "value_transfer", "1", "0.0001", null);

        String message = formatter.format(plain, null);

        assertThat(message).contains("Method: unknown");
        assertThat(message).doesNotContain("Label:");
    }

    @Test
    @DisplayName("missing amount and fee render as unknown without a unit")
    void unknownAmountAndFeeHaveNoUnit() {
        FeedTransaction contractCall = new FeedTransaction("0xabc", "0xa", "0xb",
                Instant.parse("2024-01-01T00:00:00Z"), "contract_call", null, " ", "0xa9059cbb");

        String message = formatter.format(contractCall, null);

        assertThat(message).contains("Amount: unknown\n").contains("Fee: unknown\n");
        assertThat(message).doesNotContain("unknown KAIA");
    }

    @Test
    @DisplayName("formatting is deterministic")
    void deterministic() {
        assertThat(formatter.format(TX, "x")).isEqualTo(formatter.format(TX, "x"));
    }

    @Test
    @DisplayName("transaction without hash is rejected")
    void rejectsMissingHash() {
        assertThatThrownBy(() -> formatter.format(null, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
