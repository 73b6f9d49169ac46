package com.walletwatch.domain;

import java.time.Instant;

/**
 * Immutable transaction as returned by the transaction feed. Amount and fee are kept as the feed renders them.
 *
 * @param methodSignature contract method id or signature; null when the feed has none (plain transfer)
 */
public record FeedTransaction(
        String hash,
        String from,
        String to,
        Instant timestamp,
        String kind,
        String amount,
        String fee,
        String methodSignature
) {
}
