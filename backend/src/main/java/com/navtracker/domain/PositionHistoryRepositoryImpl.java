package com.navtracker.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed reads and writes for position_history.
 */
@Repository
@RequiredArgsConstructor
public class PositionHistoryRepositoryImpl implements PositionHistoryRepositoryCustom {

    private static final Sort LATEST_FIRST = Sort.by(Sort.Direction.DESC, "date");

    private final MongoTemplate mongoTemplate;

    @Override
    public PositionHistory upsertDaily(PositionHistory entry) {
        Query query = new Query(where("userId").is(entry.getUserId())
                .and("walletAddress").is(entry.getWalletAddress())
                .and("protocolName").is(entry.getProtocolName())
                .and("debankPositionId").is(entry.getDebankPositionId())
                .and("day").is(entry.getDay()));
        Update update = MongoUpserts.replaceFieldsOf(mongoTemplate, entry, "createdAt");
        update.setOnInsert("createdAt", entry.getCreatedAt());
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), PositionHistory.class);
    }

    @Override
    public long markInactiveExcept(String userId, String walletAddress, Collection<String> activeIds,
                                   String day, Instant now) {
        long marked = 0;
        for (String positionId : distinctPositionIds(userId, walletAddress, now)) {
            if (activeIds.contains(positionId)) {
                continue;
            }
            PositionHistory latest = latest(userId, walletAddress, positionId, now);
            if (latest == null || !latest.isActive()) {
                continue;
            }
            upsertDaily(inactiveMarker(latest, day, now));
            marked++;
        }
        return marked;
    }

    @Override
    public List<PositionHistory> findLatestPerPosition(String userId, Instant atOrBefore) {
        List<String> wallets = mongoTemplate.findDistinct(
                new Query(where("userId").is(userId).and("date").lte(atOrBefore)),
                "walletAddress", PositionHistory.class, String.class);
        List<PositionHistory> result = new ArrayList<>();
        for (String wallet : wallets) {
            for (String positionId : distinctPositionIds(userId, wallet, atOrBefore)) {
                PositionHistory latest = latest(userId, wallet, positionId, atOrBefore);
                if (latest != null) {
                    result.add(latest);
                }
            }
        }
        return result;
    }

    private List<String> distinctPositionIds(String userId, String walletAddress, Instant atOrBefore) {
        Query query = new Query(where("userId").is(userId)
                .and("walletAddress").is(walletAddress)
                .and("date").lte(atOrBefore));
        return mongoTemplate.findDistinct(query, "debankPositionId", PositionHistory.class, String.class);
    }

    private PositionHistory latest(String userId, String walletAddress, String positionId, Instant atOrBefore) {
        Query query = new Query(where("userId").is(userId)
                .and("walletAddress").is(walletAddress)
                .and("debankPositionId").is(positionId)
                .and("date").lte(atOrBefore))
                .with(LATEST_FIRST)
                .limit(1);
        return mongoTemplate.findOne(query, PositionHistory.class);
    }

    private static PositionHistory inactiveMarker(PositionHistory latest, String day, Instant now) {
        PositionHistory marker = new PositionHistory();
        marker.setUserId(latest.getUserId());
        marker.setWalletAddress(latest.getWalletAddress());
        marker.setProtocolName(latest.getProtocolName());
        marker.setPositionName(latest.getPositionName());
        marker.setDebankPositionId(latest.getDebankPositionId());
        marker.setDay(day);
        marker.setDate(now);
        marker.setActive(false);
        marker.setCreatedAt(now);
        marker.setUpdatedAt(now);
        return marker;
    }
}
