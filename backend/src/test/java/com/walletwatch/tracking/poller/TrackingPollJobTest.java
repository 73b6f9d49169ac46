package com.walletwatch.tracking.poller;

import com.walletwatch.tracking.config.TrackingProperties;
import com.walletwatch.tracking.store.StoreFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrackingPollJobTest {

    private static final Instant NOW = Instant.parse("2024-11-20T08:00:00Z");

    @Mock
    private TrackingPoller trackingPoller;

    private TrackingProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TrackingProperties();
        properties.setSweepFailureBackoffMs(30_000L);
    }

    @Test
    void runScheduled_delegatesToPoller() {
        when(trackingPoller.sweep()).thenReturn(new SweepSummary(2, 1, 0, 0, false));
        TrackingPollJob job = new TrackingPollJob(trackingPoller, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        job.runScheduled();

        verify(trackingPoller).sweep();
        assertThat(job.getBackoffUntil()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void sweepFailure_opensBackoffWindowAndSkipsTicks() {
        when(trackingPoller.sweep()).thenThrow(new StoreFailureException("down", null));
        TrackingPollJob job = new TrackingPollJob(trackingPoller, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        job.runScheduled();
        job.runScheduled();

        assertThat(job.getBackoffUntil()).isEqualTo(NOW.plusMillis(30_000L));
        verify(trackingPoller, times(1)).sweep();
    }

    @Test
    void stopRequested_skipsSweep() {
        when(trackingPoller.isStopRequested()).thenReturn(true);
        TrackingPollJob job = new TrackingPollJob(trackingPoller, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        job.runScheduled();

        verify(trackingPoller, never()).sweep();
    }

    @Test
    void schedule_readsPollIntervalAndInitialDelayKeys() throws NoSuchMethodException {
        Scheduled scheduled = TrackingPollJob.class.getMethod("runScheduled").getAnnotation(Scheduled.class);

        assertThat(scheduled.fixedRateString()).isEqualTo("${walletwatch.tracking.poll-interval-ms:60000}");
        assertThat(scheduled.initialDelayString()).isEqualTo("${walletwatch.tracking.initial-delay-ms:15000}");
    }
}
