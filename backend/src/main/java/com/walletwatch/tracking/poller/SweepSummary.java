package com.walletwatch.tracking.poller;

/**
 * Counters for one sweep over all tracked addresses.
 *
 * @param addresses      rows in the snapshot
 * @param delivered      notifications dispatched and committed
 * @param addressFailures addresses skipped because the feed failed
 * @param transactionFailures render, dispatch or commit failures (the address is resumed next sweep)
 * @param interrupted    true when shutdown stopped the sweep early
 */
public record SweepSummary(int addresses, int delivered, int addressFailures, int transactionFailures, boolean interrupted) {
}
