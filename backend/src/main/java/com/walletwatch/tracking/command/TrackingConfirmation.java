package com.walletwatch.tracking.command;

import com.walletwatch.domain.Checkpoint;

/**
 * Result of a successful track: stored address, effective label and the baseline checkpoint notifications start after.
 */
public record TrackingConfirmation(String subscriberId, String address, String label, Checkpoint baseline) {
}
