package com.navtracker.apy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class PositionPerformanceService {

    private static final Comparator<ApyResult> LARGEST_FIRST = Comparator
            .comparing((ApyResult r) -> r.currentValue() == null ? BigDecimal.ZERO : r.currentValue())
            .reversed()
            .thenComparing(ApyResult::positionId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ApyEngine apyEngine;

    /**
     * @throws IllegalArgumentException if limit or periodDays is below 1
     */
    public PositionPerformanceSummary summary(String userId, LocalDate targetDate, int periodDays, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        Map<String, ApyResult> all = apyEngine.calculateAllPositionAPYs(userId, targetDate, periodDays);
        List<ApyResult> top = all.values().stream()
                .sorted(LARGEST_FIRST)
                .limit(limit)
                .toList();
        log.debug("Performance summary for user {} on {}: {} of {} positions", userId, targetDate, top.size(), all.size());
        return new PositionPerformanceSummary(userId, targetDate, periodDays, top, all.size(), top.size());
    }
}
