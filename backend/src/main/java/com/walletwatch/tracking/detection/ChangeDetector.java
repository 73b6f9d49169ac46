package com.walletwatch.tracking.detection;

import com.walletwatch.domain.Checkpoint;
import com.walletwatch.domain.FeedTransaction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pure diff of a newest-first feed page against a stored checkpoint. Output is in chronological order (oldest new
 * transaction first) and each entry carries the checkpoint that applies after it, so the caller can commit one
 * transaction at a time. Checkpoint times in the output never decrease and are never before the input checkpoint.
 */
public class ChangeDetector {

    private final DetectionMode mode;

    public ChangeDetector(DetectionMode mode) {
        this.mode = mode == null ? DetectionMode.HASH_POSITION : mode;
    }

    public DetectionMode getMode() {
        return mode;
    }

    public List<DetectedTransaction> detect(List<FeedTransaction> page, Checkpoint checkpoint) {
        if (page == null || page.isEmpty()) {
            return List.of();
        }
        List<FeedTransaction> wellFormed = page.stream()
                .filter(tx -> tx != null && tx.hash() != null && tx.timestamp() != null)
                .toList();
        List<FeedTransaction> candidates = switch (mode) {
            case HASH_POSITION -> byPosition(wellFormed, checkpoint);
            case HASH_AND_TIME -> byHashAndTime(wellFormed, checkpoint);
        };
        return toChronological(candidates);
    }

    private static List<FeedTransaction> byHashAndTime(List<FeedTransaction> page, Checkpoint checkpoint) {
        return page.stream()
                .filter(tx -> !sameHash(tx.hash(), checkpoint.hash()))
                .filter(tx -> checkpoint.time() == null || tx.timestamp().isAfter(checkpoint.time()))
                .toList();
    }

    private static List<FeedTransaction> byPosition(List<FeedTransaction> page, Checkpoint checkpoint) {
        int checkpointIndex = checkpoint.isNoTransactions() ? -1 : indexOfHash(page, checkpoint.hash());
        if (checkpointIndex < 0) {
            return page.stream()
                    .filter(tx -> checkpoint.time() == null || tx.timestamp().isAfter(checkpoint.time()))
                    .toList();
        }
        return page.subList(0, checkpointIndex).stream()
                .filter(tx -> !sameHash(tx.hash(), checkpoint.hash()))
                .filter(tx -> checkpoint.time() == null || !tx.timestamp().isBefore(checkpoint.time()))
                .toList();
    }

    /**
     * Reverse the newest-first candidates so equal timestamps keep their true order, drop repeated hashes,
     * then stable-sort ascending by timestamp.
     */
    private static List<DetectedTransaction> toChronological(List<FeedTransaction> newestFirst) {
        List<FeedTransaction> oldestFirst = new ArrayList<>(newestFirst.size());
        Set<String> seen = new HashSet<>();
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            FeedTransaction tx = newestFirst.get(i);
            if (seen.add(tx.hash().toLowerCase(Locale.ROOT))) {
                oldestFirst.add(tx);
            }
        }
        oldestFirst.sort(Comparator.comparing(FeedTransaction::timestamp));
        List<DetectedTransaction> detected = new ArrayList<>(oldestFirst.size());
        for (FeedTransaction tx : oldestFirst) {
            detected.add(new DetectedTransaction(tx, Checkpoint.of(tx)));
        }
        return detected;
    }

    private static int indexOfHash(List<FeedTransaction> page, String hash) {
        for (int i = 0; i < page.size(); i++) {
            if (sameHash(page.get(i).hash(), hash)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean sameHash(String a, String b) {
        return a != null && a.equalsIgnoreCase(b);
    }
}
