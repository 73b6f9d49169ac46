package com.walletwatch.tracking.store;

import com.walletwatch.domain.Checkpoint;
import com.walletwatch.domain.TrackedAddress;

import java.util.List;

/**
 * Durable table of tracked addresses keyed by (subscriberId, address). All writes to one row are serialized by the
 * backend; reads always reflect committed writes. Failures surface as {@link StoreFailureException}.
 */
public interface TrackedAddressStore {

    /**
     * Insert the row or overwrite its label and checkpoint.
     *
     * @return true when the row was persisted
     */
    boolean upsert(String subscriberId, String address, String label, Checkpoint baseline);

    /** All rows of one subscriber, in no particular order. */
    List<TrackedAddress> list(String subscriberId);

    /**
     * Remove the subscriber's rows whose address or label equals {@code identifier} (exact, case-sensitive).
     *
     * @return true iff at least one row was removed
     */
    boolean remove(String subscriberId, String identifier);

    /** Full snapshot for one sweep. */
    List<TrackedAddress> allTracked();

    /**
     * Overwrite the checkpoint of exactly one row. No-op when the row no longer exists or already holds a later
     * checkpoint.
     *
     * @return true when the row was updated
     */
    boolean advanceCheckpoint(String subscriberId, String address, Checkpoint checkpoint);
}
