package com.walletwatch.tracking.detection;

import com.walletwatch.domain.Checkpoint;
import com.walletwatch.domain.FeedTransaction;

/**
 * A new transaction plus the checkpoint to commit once it has been delivered.
 */
public record DetectedTransaction(FeedTransaction transaction, Checkpoint checkpointAfter) {
}
