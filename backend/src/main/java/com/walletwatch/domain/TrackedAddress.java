package com.walletwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One tracked wallet per (subscriberId, address). Checkpoint fields are written only by the tracking poller
 * (advance) or by a re-registration (reset to the live latest transaction).
 */
@Document(collection = "tracked_addresses")
@CompoundIndex(name = "subscriber_address", def = "{'subscriberId': 1, 'address': 1}", unique = true)
@CompoundIndex(name = "subscriber_label", def = "{'subscriberId': 1, 'label': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TrackedAddress {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String subscriberId;
    /** Lowercase 0x + 40 hex. */
    private String address;
    /** Defaults to the address when the subscriber gave none. */
    private String label;
    /** Hash of the last delivered transaction, or {@link Checkpoint#NO_TRANSACTIONS}. */
    private String checkpointHash;
    private Instant checkpointTime;
    private Instant createdAt;
    private Instant updatedAt;

    public Checkpoint checkpoint() {
        return new Checkpoint(checkpointHash, checkpointTime);
    }
}
