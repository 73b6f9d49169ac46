package com.walletwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for tracked_addresses. Atomic writes live in {@link TrackedAddressRepositoryCustom}.
 */
public interface TrackedAddressRepository extends MongoRepository<TrackedAddress, String>, TrackedAddressRepositoryCustom {

    List<TrackedAddress> findBySubscriberId(String subscriberId);

    Optional<TrackedAddress> findBySubscriberIdAndAddress(String subscriberId, String address);
}
