package com.navtracker.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Range;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for position_history.
 */
public interface PositionHistoryRepository extends MongoRepository<PositionHistory, String>, PositionHistoryRepositoryCustom {

    List<PositionHistory> findByUserIdAndDateBetweenOrderByDateAsc(String userId, Range<Instant> date);

    List<PositionHistory> findByUserIdAndDebankPositionIdOrderByDateDesc(String userId, String debankPositionId, Pageable pageable);

    List<PositionHistory> findByUserIdAndDebankPositionIdAndActiveTrueOrderByDateDesc(
            String userId, String debankPositionId, Pageable pageable);
}
