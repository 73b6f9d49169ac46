package com.walletwatch.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed atomic writes for tracked_addresses.
 */
@Repository
@RequiredArgsConstructor
public class TrackedAddressRepositoryImpl implements TrackedAddressRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public TrackedAddress upsertTracking(String subscriberId, String address, String label, Checkpoint baseline, Instant now) {
        Query query = rowQuery(subscriberId, address);
        Update update = new Update()
                .set("label", label)
                .set("checkpointHash", baseline.hash())
                .set("checkpointTime", baseline.time())
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), TrackedAddress.class);
    }

    @Override
    public boolean advanceCheckpoint(String subscriberId, String address, Checkpoint checkpoint, Instant now) {
        Query query = new Query(where("subscriberId").is(subscriberId)
                .and("address").is(address)
                .and("checkpointTime").lte(checkpoint.time()));
        Update update = new Update()
                .set("checkpointHash", checkpoint.hash())
                .set("checkpointTime", checkpoint.time())
                .set("updatedAt", now);
        return mongoTemplate.updateFirst(query, update, TrackedAddress.class).getMatchedCount() > 0;
    }

    @Override
    public long deleteBySubscriberIdAndAddressOrLabel(String subscriberId, String identifier) {
        Query query = new Query(where("subscriberId").is(subscriberId)
                .orOperator(where("address").is(identifier), where("label").is(identifier)));
        return mongoTemplate.remove(query, TrackedAddress.class).getDeletedCount();
    }

    private static Query rowQuery(String subscriberId, String address) {
        return new Query(Criteria.where("subscriberId").is(subscriberId).and("address").is(address));
    }
}
