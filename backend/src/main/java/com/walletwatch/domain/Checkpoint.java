package com.walletwatch.domain;

import java.time.Instant;

/**
 * Last transaction already delivered for a tracked address: (hash, timestamp).
 */
public record Checkpoint(String hash, Instant time) {

    /** Sentinel hash for an address with no observed history at registration time. */
    public static final String NO_TRANSACTIONS = "NO_TRANSACTIONS";

    public static Checkpoint of(FeedTransaction transaction) {
        return new Checkpoint(transaction.hash(), transaction.timestamp());
    }

    /** Baseline for an address whose latest transaction could not be observed: anything after {@code now} is new. */
    public static Checkpoint noTransactions(Instant now) {
        return new Checkpoint(NO_TRANSACTIONS, now);
    }

    public boolean isNoTransactions() {
        return hash == null || NO_TRANSACTIONS.equals(hash);
    }
}
