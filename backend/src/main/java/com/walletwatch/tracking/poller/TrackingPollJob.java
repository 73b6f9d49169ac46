package com.walletwatch.tracking.poller;

import com.walletwatch.tracking.config.TrackingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-rate trigger for {@link TrackingPoller#sweep()}. Any sweep-level failure is logged and opens a backoff
 * window during which ticks are skipped; the schedule itself never stops.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackingPollJob {

    private final TrackingPoller trackingPoller;
    private final TrackingProperties trackingProperties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant backoffUntil = Instant.EPOCH;

    @Scheduled(
            fixedRateString = "${walletwatch.tracking.poll-interval-ms:60000}",
            initialDelayString = "${walletwatch.tracking.initial-delay-ms:15000}")
    public void runScheduled() {
        Instant now = clock.instant();
        if (now.isBefore(backoffUntil)) {
            log.debug("Sweep skipped: backing off until {}", backoffUntil);
            return;
        }
        if (trackingPoller.isStopRequested()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Sweep skipped: previous sweep still running");
            return;
        }
        try {
            SweepSummary summary = trackingPoller.sweep();
            log.info("Sweep done: {} address(es), {} delivered, {} feed failure(s), {} delivery failure(s)",
                    summary.addresses(), summary.delivered(), summary.addressFailures(), summary.transactionFailures());
        } catch (Exception e) {
            backoffUntil = clock.instant().plusMillis(Math.max(0L, trackingProperties.getSweepFailureBackoffMs()));
            log.error("Sweep failed, backing off until {}", backoffUntil, e);
        } finally {
            running.set(false);
        }
    }

    Instant getBackoffUntil() {
        return backoffUntil;
    }
}
