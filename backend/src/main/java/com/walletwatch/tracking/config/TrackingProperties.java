package com.walletwatch.tracking.config;

import com.walletwatch.tracking.detection.DetectionMode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tracking poller settings. Documented in application.yml under walletwatch.tracking. The sweep schedule keys
 * (poll-interval-ms, initial-delay-ms) are read directly by {@code TrackingPollJob}'s {@code @Scheduled}.
 */
@ConfigurationProperties(prefix = "walletwatch.tracking")
@NoArgsConstructor
@Getter
@Setter
public class TrackingProperties {

    /** After a sweep-level failure, ticks are skipped until this much time has passed. */
    private long sweepFailureBackoffMs = 30_000L;

    private DetectionMode detectionMode = DetectionMode.HASH_POSITION;

    /** How long shutdown waits for an in-flight sweep to finish its current commit. */
    private int shutdownAwaitSeconds = 30;
}
