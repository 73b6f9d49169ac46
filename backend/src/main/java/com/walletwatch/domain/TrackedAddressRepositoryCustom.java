package com.walletwatch.domain;

import java.time.Instant;

/**
 * Single-document atomic writes on tracked_addresses. Each method is one MongoDB operation, which serializes
 * concurrent writers on the same (subscriberId, address) row.
 */
public interface TrackedAddressRepositoryCustom {

    /**
     * Insert or overwrite label and checkpoint for the row. Returns the stored document.
     */
    TrackedAddress upsertTracking(String subscriberId, String address, String label, Checkpoint baseline, Instant now);

    /**
     * Move the checkpoint forward. Matches only an existing row whose checkpointTime is not after {@code checkpoint.time()};
     * never inserts.
     *
     * @return true when a row was modified
     */
    boolean advanceCheckpoint(String subscriberId, String address, Checkpoint checkpoint, Instant now);

    /**
     * Delete rows of the subscriber whose address or label equals the identifier exactly.
     *
     * @return number of deleted rows
     */
    long deleteBySubscriberIdAndAddressOrLabel(String subscriberId, String identifier);
}
