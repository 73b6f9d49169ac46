package com.walletwatch.tracking.detection;

/**
 * How {@link ChangeDetector} decides which page entries are new relative to a checkpoint.
 */
public enum DetectionMode {

    /**
     * Entries listed before the checkpoint hash on the newest-first page, not older than the checkpoint time.
     * Falls back to "strictly later than checkpoint time" when the hash is not on the page.
     */
    HASH_POSITION,

    /** Hash differs from the checkpoint hash and timestamp is strictly later than the checkpoint time. */
    HASH_AND_TIME
}
