package com.navtracker.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Range;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for daily_snapshots keyed by (userId, walletAddress, day).
 */
public interface DailySnapshotRepository extends MongoRepository<DailySnapshot, String>, DailySnapshotRepositoryCustom {

    Optional<DailySnapshot> findByUserIdAndWalletAddressAndDay(String userId, String walletAddress, String day);

    Optional<DailySnapshot> findFirstByUserIdAndWalletAddressOrderByDateDesc(String userId, String walletAddress);

    Optional<DailySnapshot> findFirstByUserIdAndWalletAddressAndDateLessThanEqualOrderByDateDesc(
            String userId, String walletAddress, Instant date);

    /** Range bounds are honoured as given (Range.closed = inclusive on both ends). */
    List<DailySnapshot> findByUserIdAndDateBetweenOrderByDateAsc(String userId, Range<Instant> range);

    List<DailySnapshot> findByUserIdAndWalletAddressAndDateBetweenOrderByDateAsc(
            String userId, String walletAddress, Range<Instant> range);

    List<DailySnapshot> findByUserIdAndDateLessThanEqualOrderByDateDesc(String userId, Instant date, Pageable pageable);
}
