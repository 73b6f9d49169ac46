package com.walletwatch.tracking.poller;

import com.walletwatch.domain.Checkpoint;
import com.walletwatch.domain.FeedTransaction;
import com.walletwatch.domain.TrackedAddress;
import com.walletwatch.feed.FeedUnavailableException;
import com.walletwatch.feed.TransactionFeedClient;
import com.walletwatch.feed.config.FeedProperties;
import com.walletwatch.tracking.detection.ChangeDetector;
import com.walletwatch.tracking.detection.DetectionMode;
import com.walletwatch.tracking.notify.DispatchFailureException;
import com.walletwatch.tracking.notify.NotificationFormatter;
import com.walletwatch.tracking.notify.NotificationSender;
import com.walletwatch.tracking.store.InMemoryTrackedAddressStore;
import com.walletwatch.tracking.store.StoreFailureException;
import com.walletwatch.tracking.store.TrackedAddressStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrackingPollerTest {

    private static final String SUBSCRIBER = "1001";
    private static final String ADDRESS_A = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String ADDRESS_B = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";
    private static final Instant T0 = Instant.parse("2024-11-20T08:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);

    @Mock
    private TransactionFeedClient feedClient;
    @Mock
    private NotificationSender sender;

    private InMemoryTrackedAddressStore store;
    private TrackingPoller poller;

    @BeforeEach
    void setUp() {
        store = new InMemoryTrackedAddressStore();
        poller = newPoller(store);
    }

    private TrackingPoller newPoller(TrackedAddressStore backing) {
        return new TrackingPoller(backing, feedClient, new ChangeDetector(DetectionMode.HASH_POSITION),
                new NotificationFormatter("https://kaiascan.io/tx/"), sender, new FeedProperties());
    }

    private static FeedTransaction tx(String hash, Instant at) {
        return new FeedTransaction(hash, "0xfrom", "0xto", at, "value_transfer", "1", "0.0001", null);
    }

    private void feed(String address, FeedTransaction... newestFirst) {
        when(feedClient.transactionHistory(eq(address), eq(1), anyInt())).thenReturn(List.of(newestFirst));
    }

    @Test
    @DisplayName("first sweep after registration is silent; a new transaction is delivered once and checkpointed")
    void trackThenNewTransaction() {
        store.upsert(SUBSCRIBER, ADDRESS_A, "cold wallet", new Checkpoint("0xh0", T0));
        feed(ADDRESS_A, tx("0xh0", T0));

        SweepSummary first = poller.sweep();

        assertThat(first.delivered()).isZero();
        verify(sender, never()).send(anyString(), anyString());

        feed(ADDRESS_A, tx("0xh1", T1), tx("0xh0", T0));
        SweepSummary second = poller.sweep();

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(sender).send(eq(SUBSCRIBER), message.capture());
        assertThat(message.getValue()).contains("0xh1").contains("cold wallet");
        assertThat(second.delivered()).isEqualTo(1);
        assertThat(store.checkpointOf(SUBSCRIBER, ADDRESS_A)).isEqualTo(new Checkpoint("0xh1", T1));

        poller.sweep();
        verify(sender, times(1)).send(anyString(), anyString());
    }

    @Test
    @DisplayName("dispatch failure keeps the checkpoint and the next sweep retries the same transaction")
    void dispatchFailure_retriedNextSweep() {
        store.upsert(SUBSCRIBER, ADDRESS_A, "cold wallet", new Checkpoint("0xh0", T0));
        feed(ADDRESS_A, tx("0xh1", T1), tx("0xh0", T0));
        doThrow(new DispatchFailureException("down")).doNothing().when(sender).send(eq(SUBSCRIBER), anyString());

        SweepSummary failed = poller.sweep();

        assertThat(failed.transactionFailures()).isEqualTo(1);
        assertThat(store.checkpointOf(SUBSCRIBER, ADDRESS_A)).isEqualTo(new Checkpoint("0xh0", T0));

        SweepSummary retried = poller.sweep();

        assertThat(retried.delivered()).isEqualTo(1);
        verify(sender, times(2)).send(eq(SUBSCRIBER), contains("0xh1"));
        assertThat(store.checkpointOf(SUBSCRIBER, ADDRESS_A)).isEqualTo(new Checkpoint("0xh1", T1));
    }

    @Test
    @DisplayName("later transactions of an address wait behind a failed one")
    void failureStopsAddressBatch() {
        store.upsert(SUBSCRIBER, ADDRESS_A, null, new Checkpoint("0xh0", T0));
        feed(ADDRESS_A, tx("0xh2", T1.plusSeconds(1)), tx("0xh1", T1), tx("0xh0", T0));
        doThrow(new DispatchFailureException("down")).when(sender).send(eq(SUBSCRIBER), contains("0xh1"));

        poller.sweep();

        verify(sender, never()).send(anyString(), contains("0xh2"));
        assertThat(store.checkpointOf(SUBSCRIBER, ADDRESS_A)).isEqualTo(new Checkpoint("0xh0", T0));
    }

    @Test
    @DisplayName("several new transactions are dispatched oldest first, checkpoints committed one by one")
    void chronologicalDelivery_monotonicCheckpoints() {
        store.upsert(SUBSCRIBER, ADDRESS_A, null, new Checkpoint("0xh0", T0));
        feed(ADDRESS_A, tx("0xh3", T0.plusSeconds(3)), tx("0xh2", T0.plusSeconds(2)), tx("0xh1", T0.plusSeconds(1)), tx("0xh0", T0));

        poller.sweep();

        ArgumentCaptor<String> messages = ArgumentCaptor.forClass(String.class);
        verify(sender, times(3)).send(eq(SUBSCRIBER), messages.capture());
        assertThat(messages.getAllValues().get(0)).contains("0xh1");
        assertThat(messages.getAllValues().get(1)).contains("0xh2");
        assertThat(messages.getAllValues().get(2)).contains("0xh3");
        assertThat(store.advances()).extracting(Checkpoint::time)
                .containsExactly(T0.plusSeconds(1), T0.plusSeconds(2), T0.plusSeconds(3));
    }

    @Test
    @DisplayName("feed failure for one address does not prevent delivery for another")
    void feedFailureIsolatedPerAddress() {
        store.upsert(SUBSCRIBER, ADDRESS_A, "a", new Checkpoint("0xa0", T0));
        store.upsert(SUBSCRIBER, ADDRESS_B, "b", new Checkpoint("0xb0", T0));
        when(feedClient.transactionHistory(eq(ADDRESS_A), eq(1), anyInt()))
                .thenThrow(new FeedUnavailableException("HTTP 503"));
        feed(ADDRESS_B, tx("0xb1", T1), tx("0xb0", T0));

        SweepSummary summary = poller.sweep();

        assertThat(summary.addressFailures()).isEqualTo(1);
        assertThat(summary.delivered()).isEqualTo(1);
        verify(sender).send(eq(SUBSCRIBER), contains("0xb1"));
        assertThat(store.checkpointOf(SUBSCRIBER, ADDRESS_A)).isEqualTo(new Checkpoint("0xa0", T0));
    }

    @Test
    @DisplayName("row removed mid-sweep is not resurrected and gets no further notifications")
    void removedDuringSweep_notResurrected() {
        store.upsert(SUBSCRIBER, ADDRESS_A, "myLabel", new Checkpoint("0xh0", T0));
        feed(ADDRESS_A, tx("0xh2", T1.plusSeconds(1)), tx("0xh1", T1), tx("0xh0", T0));
        doAnswer(inv -> {
            store.remove(SUBSCRIBER, "myLabel");
            return null;
        }).when(sender).send(eq(SUBSCRIBER), contains("0xh1"));

        poller.sweep();

        assertThat(store.list(SUBSCRIBER)).isEmpty();
        assertThat(store.checkpointOf(SUBSCRIBER, ADDRESS_A)).isNull();
        verify(sender, never()).send(anyString(), contains("0xh2"));
    }

    @Test
    @DisplayName("store failure on checkpoint commit is a transaction-level failure")
    void commitFailure_transactionLevel() {
        TrackedAddressStore failing = mock(TrackedAddressStore.class);
        TrackedAddress row = new TrackedAddress();
        row.setSubscriberId(SUBSCRIBER);
        row.setAddress(ADDRESS_A);
        row.setCheckpointHash("0xh0");
        row.setCheckpointTime(T0);
        when(failing.allTracked()).thenReturn(List.of(row));
        when(failing.advanceCheckpoint(anyString(), anyString(), any()))
                .thenThrow(new StoreFailureException("down", null));
        feed(ADDRESS_A, tx("0xh1", T1), tx("0xh0", T0));

        SweepSummary summary = newPoller(failing).sweep();

        assertThat(summary.transactionFailures()).isEqualTo(1);
        assertThat(summary.delivered()).isZero();
    }

    @Test
    @DisplayName("snapshot load failure propagates to the job")
    void snapshotFailure_propagates() {
        TrackedAddressStore failing = mock(TrackedAddressStore.class);
        when(failing.allTracked()).thenThrow(new StoreFailureException("down", null));

        assertThatThrownBy(() -> newPoller(failing).sweep()).isInstanceOf(StoreFailureException.class);
    }

    @Test
    @DisplayName("after shutdown is requested no further address is processed")
    void stopRequested_sweepInterrupted() {
        store.upsert(SUBSCRIBER, ADDRESS_A, null, new Checkpoint("0xh0", T0));
        poller.onContextClosed();

        SweepSummary summary = poller.sweep();

        assertThat(summary.interrupted()).isTrue();
        verify(feedClient, never()).transactionHistory(anyString(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("shutdown during a batch lets the current transaction commit and stops before the next")
    void stopDuringBatch_currentCommitted() {
        store.upsert(SUBSCRIBER, ADDRESS_A, null, new Checkpoint("0xh0", T0));
        feed(ADDRESS_A, tx("0xh2", T1.plusSeconds(1)), tx("0xh1", T1), tx("0xh0", T0));
        doAnswer(inv -> {
            poller.onContextClosed();
            return null;
        }).when(sender).send(eq(SUBSCRIBER), contains("0xh1"));

        poller.sweep();

        assertThat(store.checkpointOf(SUBSCRIBER, ADDRESS_A)).isEqualTo(new Checkpoint("0xh1", T1));
        verify(sender, never()).send(anyString(), contains("0xh2"));
    }
}
