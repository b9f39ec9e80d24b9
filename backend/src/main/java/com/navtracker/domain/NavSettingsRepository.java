package com.navtracker.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for nav_settings keyed by (userId, year, month).
 */
public interface NavSettingsRepository extends MongoRepository<NavSettings, String> {

    Optional<NavSettings> findByUserIdAndYearAndMonth(String userId, int year, int month);

    List<NavSettings> findByUserIdOrderByYearDescMonthDesc(String userId);

    List<NavSettings> findByUserIdOrderByYearDescMonthDesc(String userId, Pageable pageable);

    long deleteByUserId(String userId);

    long deleteByUserIdAndYearAndMonth(String userId, int year, int month);
}
