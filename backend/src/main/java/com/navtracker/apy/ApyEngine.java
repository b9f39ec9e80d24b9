package com.navtracker.apy;

import com.navtracker.common.CalendarDays;
import com.navtracker.domain.PositionHistory;
import com.navtracker.domain.PositionHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-position annualized yield from position history. Read-only.
 * <p>
 * For each position the current point is its latest record at or before the end of targetDate and the earlier point
 * its latest record at or before the end of (targetDate - periodDays). The window return is the reward accrual
 * between them over the earlier position value, compounded to a year:
 * {@code APY = ((1 + r) ^ (365 / elapsedDays) - 1) * 100}. Positions without an earlier point are estimated from
 * their current unclaimed rewards over the days since first seen (at least one).
 * <p>
 * Every active position gets a finite result with a confidence label; nothing is dropped for being implausible.
 * Only the rows inside the window plus the latest row before it are read per position.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApyEngine {

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double DAYS_PER_YEAR = 365.0;

    private final PositionHistoryRepository positionHistoryRepository;
    private final ApyProperties properties;
    private final Clock clock;

    /**
     * APY of every position whose latest record at or before targetDate is active, keyed by position id. If the same
     * position id occurs in several wallets of the user, its keys are prefixed with "walletAddress/".
     *
     * @throws IllegalArgumentException if periodDays is below 1
     */
    public Map<String, ApyResult> calculateAllPositionAPYs(String userId, LocalDate targetDate, int periodDays) {
        if (periodDays < 1) {
            throw new IllegalArgumentException("periodDays must be at least 1, got " + periodDays);
        }
        ZoneId zone = clock.getZone();
        Instant targetEnd = CalendarDays.endOfDay(targetDate, zone);
        Instant windowEnd = CalendarDays.endOfDay(targetDate.minusDays(periodDays), zone);

        Map<String, List<PositionHistory>> byPosition = new LinkedHashMap<>();
        Map<String, Integer> walletsPerId = new HashMap<>();
        List<PositionHistory> earlierPoints = positionHistoryRepository.findLatestPerPosition(userId, windowEnd).stream()
                .sorted(Comparator.comparing(PositionHistory::getDate, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        for (PositionHistory row : earlierPoints) {
            group(byPosition, walletsPerId, row);
        }
        for (PositionHistory row : positionHistoryRepository.findByUserIdAndDateBetweenOrderByDateAsc(userId,
                Range.leftOpen(windowEnd, targetEnd))) {
            group(byPosition, walletsPerId, row);
        }

        List<Draft> drafts = new ArrayList<>();
        for (List<PositionHistory> history : byPosition.values()) {
            PositionHistory current = history.get(history.size() - 1);
            if (!current.isActive()) {
                continue;
            }
            drafts.add(evaluate(history, current, windowEnd, zone));
        }
        flagOutliers(drafts);

        Map<String, ApyResult> results = new LinkedHashMap<>();
        for (Draft draft : drafts) {
            String id = draft.current.getDebankPositionId();
            String key = walletsPerId.getOrDefault(id, 1) > 1 ? draft.current.getWalletAddress() + "/" + id : id;
            results.put(key, draft.toResult());
        }
        log.info("APY for user {} on {} over {} day(s): {} positions ({} low confidence)", userId, targetDate, periodDays,
                results.size(), results.values().stream().filter(r -> r.confidence() == ApyConfidence.LOW).count());
        return results;
    }

    /**
     * Window rows arrive after all earlier points, so each position's list stays in date order.
     */
    private static void group(Map<String, List<PositionHistory>> byPosition, Map<String, Integer> walletsPerId,
                              PositionHistory row) {
        if (row.getDebankPositionId() == null || row.getDate() == null) {
            return;
        }
        String key = row.getWalletAddress() + "/" + row.getDebankPositionId();
        byPosition.computeIfAbsent(key, k -> {
            walletsPerId.merge(row.getDebankPositionId(), 1, Integer::sum);
            return new ArrayList<>();
        }).add(row);
    }

    private Draft evaluate(List<PositionHistory> history, PositionHistory current, Instant windowEnd, ZoneId zone) {
        Draft draft = new Draft(current);
        PositionHistory earlierPoint = null;
        for (PositionHistory row : history) {
            if (!row.getDate().isAfter(windowEnd)) {
                earlierPoint = row;
            }
        }
        if (earlierPoint == null) {
            return estimateNewPosition(draft, history.get(0), current, windowEnd, zone);
        }
        final PositionHistory earlier = earlierPoint;

        double elapsedDays = elapsedDays(earlier.getDate(), current.getDate());
        if (elapsedDays <= 0) {
            draft.insufficient("No elapsed time between reference points: latest record " + dayOf(current, zone)
                    + " is not newer than the window start");
            return draft;
        }
        BigDecimal rewards = current.getUnclaimedRewardsValue().subtract(earlier.getUnclaimedRewardsValue());
        if (rewards.signum() < 0) {
            rewards = current.getUnclaimedRewardsValue();
            draft.downgrade(ApyConfidence.MEDIUM,
                    "Unclaimed rewards decreased inside the window (claimed?); current unclaimed rewards used as accrual");
        }
        BigDecimal base = earlier.getTotalValue().signum() > 0 ? earlier.getTotalValue() : current.getTotalValue();
        if (base.signum() <= 0) {
            draft.insufficient("Position value is zero");
            return draft;
        }
        draft.measure(rewards.divide(base, MathContext.DECIMAL64).doubleValue(), elapsedDays,
                ApyCalculationMethod.REWARDS_ACCRUAL);

        List<PositionHistory> window = history.stream()
                .filter(r -> !r.getDate().isBefore(earlier.getDate()))
                .toList();
        if (window.stream().anyMatch(r -> !r.isActive())) {
            draft.downgrade(ApyConfidence.LOW, "Position was inactive inside the window and has been reactivated");
        } else if (hasGap(window, zone)) {
            draft.downgrade(ApyConfidence.MEDIUM,
                    "History has gaps longer than " + properties.getMaxGapDays() + " day(s) inside the window");
        }
        return draft;
    }

    private Draft estimateNewPosition(Draft draft, PositionHistory firstSeen, PositionHistory current,
                                      Instant windowEnd, ZoneId zone) {
        draft.newPosition = true;
        if (current.getTotalValue().signum() <= 0) {
            draft.insufficient("Position value is zero");
            return draft;
        }
        double days = Math.max(1.0, elapsedDays(firstSeen.getDate(), current.getDate()));
        double rate = current.getUnclaimedRewardsValue().divide(current.getTotalValue(), MathContext.DECIMAL64).doubleValue();
        draft.measure(rate, days, ApyCalculationMethod.NEW_POSITION_REWARDS_RATE);
        draft.downgrade(ApyConfidence.LOW, String.format(Locale.ROOT,
                "New position: no history at or before %s; estimated from current unclaimed rewards over %.2f day(s)",
                windowEnd.atZone(zone).toLocalDate(), days));
        return draft;
    }

    private void flagOutliers(List<Draft> drafts) {
        OutlierDetector detector = new OutlierDetector(properties.getOutlierMadMultiplier(),
                properties.getOutlierMinDeviation(), properties.getOutlierMinSample());
        List<Draft> measured = drafts.stream().filter(d -> d.method != ApyCalculationMethod.INSUFFICIENT_DATA).toList();
        for (Draft draft : measured) {
            if (Math.abs(draft.apy) > properties.getSanityCeilingPercent()) {
                draft.downgrade(ApyConfidence.LOW, String.format(Locale.ROOT,
                        "APY of %.2f%% exceeds the sanity ceiling of %.0f%%", draft.apy, properties.getSanityCeilingPercent()));
                continue;
            }
            List<Double> peers = measured.stream().filter(d -> d != draft).map(d -> d.apy).toList();
            if (detector.isOutlier(draft.apy, peers)) {
                draft.downgrade(ApyConfidence.LOW, String.format(Locale.ROOT,
                        "APY of %.2f%% is a statistical outlier against %d other positions (median %.2f%%)",
                        draft.apy, peers.size(), OutlierDetector.median(peers)));
            }
        }
    }

    private boolean hasGap(List<PositionHistory> window, ZoneId zone) {
        for (int i = 1; i < window.size(); i++) {
            LocalDate previous = window.get(i - 1).getDate().atZone(zone).toLocalDate();
            LocalDate next = window.get(i).getDate().atZone(zone).toLocalDate();
            if (ChronoUnit.DAYS.between(previous, next) > properties.getMaxGapDays()) {
                return true;
            }
        }
        return false;
    }

    private static double elapsedDays(Instant from, Instant to) {
        return Duration.between(from, to).getSeconds() / SECONDS_PER_DAY;
    }

    private static LocalDate dayOf(PositionHistory row, ZoneId zone) {
        return row.getDate().atZone(zone).toLocalDate();
    }

    private final class Draft {

        private final PositionHistory current;
        private final List<String> warnings = new ArrayList<>();
        private ApyConfidence confidence = ApyConfidence.HIGH;
        private ApyCalculationMethod method = ApyCalculationMethod.INSUFFICIENT_DATA;
        private boolean newPosition;
        private double apy;
        private double periodReturn;
        private double days;

        Draft(PositionHistory current) {
            this.current = current;
        }

        void measure(double windowReturn, double elapsedDays, ApyCalculationMethod calculationMethod) {
            method = calculationMethod;
            days = elapsedDays;
            periodReturn = windowReturn * 100;
            double annualized = (Math.pow(1 + windowReturn, DAYS_PER_YEAR / elapsedDays) - 1) * 100;
            double cap = properties.getMaxReportedApyPercent();
            if (!Double.isFinite(annualized) || annualized > cap) {
                warnings.add(String.format(Locale.ROOT, "APY capped at %.0f%%", cap));
                annualized = cap;
            }
            apy = annualized;
        }

        void insufficient(String reason) {
            method = ApyCalculationMethod.INSUFFICIENT_DATA;
            apy = 0;
            periodReturn = 0;
            downgrade(ApyConfidence.LOW, reason);
        }

        void downgrade(ApyConfidence cap, String warning) {
            confidence = confidence.atMost(cap);
            warnings.add(warning);
        }

        ApyResult toResult() {
            return new ApyResult(
                    current.getDebankPositionId(),
                    current.getProtocolName(),
                    current.getPositionName(),
                    current.getWalletAddress(),
                    BigDecimal.valueOf(apy).setScale(2, RoundingMode.HALF_UP),
                    BigDecimal.valueOf(periodReturn).setScale(4, RoundingMode.HALF_UP),
                    BigDecimal.valueOf(days).setScale(2, RoundingMode.HALF_UP),
                    newPosition,
                    confidence,
                    method,
                    current.getTotalValue(),
                    current.getUnclaimedRewardsValue(),
                    warnings);
        }
    }
}
