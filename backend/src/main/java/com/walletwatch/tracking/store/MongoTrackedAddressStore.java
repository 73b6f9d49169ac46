package com.walletwatch.tracking.store;

import com.walletwatch.domain.Checkpoint;
import com.walletwatch.domain.TrackedAddress;
import com.walletwatch.domain.TrackedAddressRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * MongoDB-backed {@link TrackedAddressStore}. Every write is a single-document atomic operation, so a removal
 * racing with a checkpoint advance leaves the row absent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoTrackedAddressStore implements TrackedAddressStore {

    private final TrackedAddressRepository repository;
    private final Clock clock;

    @Override
    public boolean upsert(String subscriberId, String address, String label, Checkpoint baseline) {
        try {
            return repository.upsertTracking(subscriberId, address, label, baseline, clock.instant()) != null;
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to upsert " + address + " for " + subscriberId, e);
        }
    }

    @Override
    public List<TrackedAddress> list(String subscriberId) {
        try {
            return repository.findBySubscriberId(subscriberId);
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to list tracked addresses for " + subscriberId, e);
        }
    }

    @Override
    public boolean remove(String subscriberId, String identifier) {
        try {
            long deleted = repository.deleteBySubscriberIdAndAddressOrLabel(subscriberId, identifier);
            if (deleted > 1) {
                log.debug("Removed {} rows for {} matching '{}'", deleted, subscriberId, identifier);
            }
            return deleted > 0;
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to remove '" + identifier + "' for " + subscriberId, e);
        }
    }

    @Override
    public List<TrackedAddress> allTracked() {
        try {
            return repository.findAll();
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to load tracked addresses", e);
        }
    }

    @Override
    public boolean advanceCheckpoint(String subscriberId, String address, Checkpoint checkpoint) {
        try {
            return repository.advanceCheckpoint(subscriberId, address, checkpoint, clock.instant());
        } catch (DataAccessException e) {
            throw new StoreFailureException("Failed to advance checkpoint of " + address + " for " + subscriberId, e);
        }
    }
}
