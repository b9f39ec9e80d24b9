package com.navtracker.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Custom reads and writes for position_history.
 */
public interface PositionHistoryRepositoryCustom {

    /**
     * Atomic upsert on (userId, walletAddress, protocolName, debankPositionId, day).
     */
    PositionHistory upsertDaily(PositionHistory entry);

    /**
     * For every position of the wallet whose debankPositionId is not in activeIds and whose latest row is still
     * active, upserts an inactive zero-value row for day. Earlier rows keep their flag, so windows ending before
     * day still see the position as it was.
     *
     * @return number of positions newly flagged inactive
     */
    long markInactiveExcept(String userId, String walletAddress, Collection<String> activeIds, String day, Instant now);

    /**
     * Latest row at or before atOrBefore of each (walletAddress, debankPositionId) of the user.
     */
    List<PositionHistory> findLatestPerPosition(String userId, Instant atOrBefore);
}
