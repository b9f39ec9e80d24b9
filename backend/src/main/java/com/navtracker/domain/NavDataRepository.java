package com.navtracker.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for nav_data, one document per user.
 */
public interface NavDataRepository extends MongoRepository<NavData, String> {

    Optional<NavData> findByUserId(String userId);

    long deleteByUserId(String userId);
}
