package com.navtracker.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed upsert and distinct queries for daily_snapshots.
 */
@Repository
@RequiredArgsConstructor
public class DailySnapshotRepositoryImpl implements DailySnapshotRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public DailySnapshot upsertDaily(DailySnapshot snapshot) {
        Query query = new Query(where("userId").is(snapshot.getUserId())
                .and("walletAddress").is(snapshot.getWalletAddress())
                .and("day").is(snapshot.getDay()));
        Update update = MongoUpserts.replaceFieldsOf(mongoTemplate, snapshot, "createdAt");
        update.setOnInsert("createdAt", snapshot.getCreatedAt());
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), DailySnapshot.class);
    }

    @Override
    public List<String> findDistinctWalletAddressesByUserId(String userId) {
        Query query = new Query(where("userId").is(userId));
        return mongoTemplate.findDistinct(query, "walletAddress", DailySnapshot.class, String.class);
    }
}
