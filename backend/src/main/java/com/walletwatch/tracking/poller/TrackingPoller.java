package com.walletwatch.tracking.poller;

import com.walletwatch.domain.FeedTransaction;
import com.walletwatch.domain.TrackedAddress;
import com.walletwatch.feed.FeedException;
import com.walletwatch.feed.TransactionFeedClient;
import com.walletwatch.feed.config.FeedProperties;
import com.walletwatch.tracking.detection.ChangeDetector;
import com.walletwatch.tracking.detection.DetectedTransaction;
import com.walletwatch.tracking.notify.NotificationFormatter;
import com.walletwatch.tracking.notify.NotificationSender;
import com.walletwatch.tracking.store.TrackedAddressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One sweep over every tracked address: fetch recent history, detect new transactions, then for each one in
 * chronological order format, dispatch and commit its checkpoint before moving on.
 *
 * <p>Failures are isolated per level. A feed failure skips the address. A render, dispatch or commit failure stops
 * that address for this sweep without advancing past the failed transaction, so the next sweep retries it first.
 * Neither aborts the sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingPoller {

    private final TrackedAddressStore store;
    private final TransactionFeedClient feedClient;
    private final ChangeDetector changeDetector;
    private final NotificationFormatter formatter;
    private final NotificationSender sender;
    private final FeedProperties feedProperties;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    /**
     * Runs one sweep. Store failures while loading the snapshot propagate to the caller.
     */
    public SweepSummary sweep() {
        List<TrackedAddress> tracked = store.allTracked();
        int delivered = 0;
        int addressFailures = 0;
        int transactionFailures = 0;
        for (TrackedAddress row : tracked) {
            if (stopRequested.get()) {
                log.info("Sweep stopped early for shutdown");
                return new SweepSummary(tracked.size(), delivered, addressFailures, transactionFailures, true);
            }
            AddressOutcome outcome = processAddress(row);
            delivered += outcome.delivered();
            if (outcome.feedFailed()) addressFailures++;
            if (outcome.transactionFailed()) transactionFailures++;
        }
        return new SweepSummary(tracked.size(), delivered, addressFailures, transactionFailures, false);
    }

    private AddressOutcome processAddress(TrackedAddress row) {
        List<DetectedTransaction> detected;
        try {
            List<FeedTransaction> page = feedClient.transactionHistory(row.getAddress(), 1, feedProperties.getHistoryPageSize());
            detected = changeDetector.detect(page, row.checkpoint());
        } catch (FeedException e) {
            log.warn("Feed failed for {} ({}): {}", row.getAddress(), row.getSubscriberId(), e.getMessage());
            return AddressOutcome.FEED_FAILED;
        } catch (RuntimeException e) {
            log.warn("Detection failed for {} ({})", row.getAddress(), row.getSubscriberId(), e);
            return AddressOutcome.FEED_FAILED;
        }
        if (detected.isEmpty()) {
            return AddressOutcome.NOTHING_NEW;
        }
        log.debug("{} new transaction(s) for {} ({})", detected.size(), row.getAddress(), row.getSubscriberId());

        int delivered = 0;
        for (DetectedTransaction item : detected) {
            if (stopRequested.get()) {
                break;
            }
            boolean advanced;
            try {
                advanced = deliver(row, item);
            } catch (RuntimeException e) {
                log.warn("Delivery of {} to {} failed, will retry next sweep: {}",
                        item.transaction().hash(), row.getSubscriberId(), e.getMessage());
                return new AddressOutcome(delivered, false, true);
            }
            delivered++;
            if (!advanced) {
                break;
            }
        }
        return new AddressOutcome(delivered, false, false);
    }

    /**
     * @return false when the row was removed or re-registered meanwhile; the rest of its batch is dropped
     */
    private boolean deliver(TrackedAddress row, DetectedTransaction item) {
        String message = formatter.format(item.transaction(), row.getLabel());
        sender.send(row.getSubscriberId(), message);
        boolean advanced = store.advanceCheckpoint(row.getSubscriberId(), row.getAddress(), item.checkpointAfter());
        if (!advanced) {
            log.debug("Checkpoint for {} ({}) not advanced: row removed or already ahead",
                    row.getAddress(), row.getSubscriberId());
        }
        return advanced;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    private record AddressOutcome(int delivered, boolean feedFailed, boolean transactionFailed) {
        static final AddressOutcome FEED_FAILED = new AddressOutcome(0, true, false);
        static final AddressOutcome NOTHING_NEW = new AddressOutcome(0, false, false);
    }
}
