package com.walletwatch.feed;

import com.walletwatch.domain.FeedTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Read-only transaction history of one address. Every call is bounded by a timeout.
 *
 * @throws FeedUnavailableException when the source can not be reached
 * @throws FeedMalformedException when the response can not be parsed
 */
public interface TransactionFeedClient {

    /** Most recent transaction of the address, or empty when it has none. */
    Optional<FeedTransaction> latestTransaction(String address);

    /** One page of history, newest first. {@code page} is 1-based. */
    List<FeedTransaction> transactionHistory(String address, int page, int pageSize);
}
