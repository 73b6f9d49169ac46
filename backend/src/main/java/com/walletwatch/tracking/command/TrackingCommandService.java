package com.walletwatch.tracking.command;

import com.walletwatch.common.AddressValidator;
import com.walletwatch.common.RetryPolicy;
import com.walletwatch.domain.Checkpoint;
import com.walletwatch.domain.FeedTransaction;
import com.walletwatch.domain.TrackedAddress;
import com.walletwatch.feed.FeedException;
import com.walletwatch.feed.FeedUnavailableException;
import com.walletwatch.feed.TransactionFeedClient;
import com.walletwatch.feed.config.FeedClientConfig;
import com.walletwatch.tracking.store.StoreFailureException;
import com.walletwatch.tracking.store.TrackedAddressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command-layer operations: track, list, untrack. Registration seeds the checkpoint with the address's current
 * latest transaction so tracking starts from now and re-tracking never replays history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingCommandService {

    private final TrackedAddressStore store;
    private final TransactionFeedClient feedClient;
    private final AddressValidator addressValidator;
    private final Clock clock;
    @Qualifier(FeedClientConfig.FEED_RETRY_POLICY)
    private final RetryPolicy feedRetryPolicy;

    /**
     * Register or re-register (subscriber, address). Label defaults to the normalized address.
     *
     * @throws TrackingException INVALID_ADDRESS for a malformed address, STORE_FAILURE when the row was not persisted
     */
    public TrackingConfirmation track(String subscriberId, String address, String label) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId is required");
        }
        if (!addressValidator.isValidAddress(address)) {
            throw new TrackingException(TrackingException.INVALID_ADDRESS, "Invalid wallet address: " + address);
        }
        String normalized = address.trim().toLowerCase(Locale.ROOT);
        String effectiveLabel = label == null || label.isBlank() ? normalized : label.trim();
        Checkpoint baseline = resolveBaseline(normalized);

        boolean stored;
        try {
            stored = store.upsert(subscriberId, normalized, effectiveLabel, baseline);
        } catch (StoreFailureException e) {
            log.error("Failed to store tracking of {} for {}", normalized, subscriberId, e);
            throw new TrackingException(TrackingException.STORE_FAILURE, "Could not save tracked address", e);
        }
        if (!stored) {
            throw new TrackingException(TrackingException.STORE_FAILURE, "Could not save tracked address");
        }
        log.info("Tracking {} as '{}' for {} from {}", normalized, effectiveLabel, subscriberId, baseline.hash());
        return new TrackingConfirmation(subscriberId, normalized, effectiveLabel, baseline);
    }

    /**
     * Live latest transaction, or the sentinel at the current time when the feed can not tell.
     */
    Checkpoint resolveBaseline(String address) {
        try {
            Optional<FeedTransaction> latest = feedRetryPolicy.execute(
                    () -> feedClient.latestTransaction(address), FeedUnavailableException.class::isInstance);
            return latest.map(Checkpoint::of).orElseGet(() -> Checkpoint.noTransactions(clock.instant()));
        } catch (FeedException e) {
            log.warn("Latest transaction of {} unavailable, seeding with no-transactions baseline: {}", address, e.getMessage());
            return Checkpoint.noTransactions(clock.instant());
        }
    }

    /**
     * @throws StoreFailureException when the store can not be read
     */
    public List<TrackedAddress> list(String subscriberId) {
        return store.list(subscriberId);
    }

    /**
     * Remove by exact address or label match.
     *
     * @return true iff at least one row was removed
     * @throws StoreFailureException when the store can not be written
     */
    public boolean untrack(String subscriberId, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return false;
        }
        boolean removed = store.remove(subscriberId, identifier);
        if (removed) {
            log.info("Untracked '{}' for {}", identifier, subscriberId);
        }
        return removed;
    }
}
