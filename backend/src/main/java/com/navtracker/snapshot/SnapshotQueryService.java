package com.navtracker.snapshot;

import com.navtracker.common.CalendarDays;
import com.navtracker.config.SnapshotProperties;
import com.navtracker.domain.DailySnapshot;
import com.navtracker.domain.DailySnapshotRepository;
import com.navtracker.domain.PortfolioTotals;
import com.navtracker.domain.PositionHistory;
import com.navtracker.domain.PositionHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Range;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of daily snapshots: history ranges, portfolio as of a date, current totals and PnL since last report.
 * Dates are calendar days in the reference clock's zone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotQueryService {

    private static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final DailySnapshotRepository dailySnapshotRepository;
    private final PositionHistoryRepository positionHistoryRepository;
    private final SnapshotProperties snapshotProperties;
    private final Clock clock;

    /**
     * Snapshots with day in [from, to], ascending by date. walletAddress null = all wallets of the user.
     */
    public List<DailySnapshot> getHistory(String userId, String walletAddress, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        }
        ZoneId zone = clock.getZone();
        Range<Instant> range = Range.closed(CalendarDays.startOfDay(from, zone), CalendarDays.endOfDay(to, zone));
        if (walletAddress == null || walletAddress.isBlank()) {
            return dailySnapshotRepository.findByUserIdAndDateBetweenOrderByDateAsc(userId, range);
        }
        return dailySnapshotRepository.findByUserIdAndWalletAddressAndDateBetweenOrderByDateAsc(
                userId, walletAddress.trim(), range);
    }

    /**
     * Last {@code days} calendar days up to and including today.
     */
    public List<DailySnapshot> getHistory(String userId, String walletAddress, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        LocalDate today = today();
        return getHistory(userId, walletAddress, today.minusDays(days - 1L), today);
    }

    /**
     * Aggregates, per wallet, the latest snapshot at or before the end of {@code date}.
     *
     * @throws SnapshotNotFoundException if no wallet has a snapshot at or before the date
     */
    public PortfolioAtDate portfolioAtDate(String userId, LocalDate date, String walletAddress) {
        Instant end = CalendarDays.endOfDay(date, clock.getZone());
        PortfolioTotals totals = PortfolioTotals.ZERO;
        Map<String, String> snapshotDays = new LinkedHashMap<>();
        int tokenCount = 0;
        int positionCount = 0;
        boolean exact = true;
        for (String wallet : wallets(userId, walletAddress)) {
            Optional<DailySnapshot> found = dailySnapshotRepository
                    .findFirstByUserIdAndWalletAddressAndDateLessThanEqualOrderByDateDesc(userId, wallet, end);
            if (found.isEmpty()) {
                continue;
            }
            DailySnapshot snapshot = found.get();
            totals = totals.plus(PortfolioTotals.of(snapshot));
            tokenCount += snapshot.getTokens().size();
            positionCount += snapshot.getPositions().size();
            snapshotDays.put(wallet, snapshot.getDay());
            exact &= date.toString().equals(snapshot.getDay());
        }
        if (snapshotDays.isEmpty()) {
            throw new SnapshotNotFoundException("No snapshot at or before " + date + " for user " + userId);
        }
        return new PortfolioAtDate(date, totals, tokenCount, positionCount, snapshotDays, exact);
    }

    /**
     * Sum of every wallet's latest snapshot; zero totals when the user has none.
     */
    public PortfolioTotals currentTotals(String userId) {
        PortfolioTotals totals = PortfolioTotals.ZERO;
        for (String wallet : wallets(userId, null)) {
            Optional<DailySnapshot> latest = dailySnapshotRepository.findFirstByUserIdAndWalletAddressOrderByDateDesc(userId, wallet);
            if (latest.isPresent()) {
                totals = totals.plus(PortfolioTotals.of(latest.get()));
            }
        }
        return totals;
    }

    /**
     * Compares the summed latest snapshots with the summed snapshots at or before the lookback date. When nothing is
     * that old, the previous value equals the current one.
     */
    public PnlReport pnlSinceLastReport(String userId, ReportType reportType) {
        Instant lookbackEnd = reportType.lookbackFrom(clock.instant().atZone(clock.getZone())).toInstant();
        BigDecimal current = BigDecimal.ZERO;
        BigDecimal previous = BigDecimal.ZERO;
        Instant currentDate = null;
        Instant previousDate = null;
        boolean hasData = false;
        for (String wallet : wallets(userId, null)) {
            Optional<DailySnapshot> latest = dailySnapshotRepository.findFirstByUserIdAndWalletAddressOrderByDateDesc(userId, wallet);
            if (latest.isEmpty()) {
                continue;
            }
            hasData = true;
            current = current.add(latest.get().getTotalNavUsd());
            currentDate = max(currentDate, latest.get().getDate());
            Optional<DailySnapshot> before = dailySnapshotRepository
                    .findFirstByUserIdAndWalletAddressAndDateLessThanEqualOrderByDateDesc(userId, wallet, lookbackEnd);
            if (before.isPresent()) {
                previous = previous.add(before.get().getTotalNavUsd());
                previousDate = max(previousDate, before.get().getDate());
            } else {
                previous = previous.add(latest.get().getTotalNavUsd());
            }
        }
        if (!hasData) {
            return new PnlReport(reportType, false, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, null);
        }
        BigDecimal pnl = current.subtract(previous);
        BigDecimal pct;
        if (previous.signum() > 0) {
            pct = pnl.multiply(HUNDRED).divide(previous, PERCENT_SCALE, RoundingMode.HALF_UP);
        } else {
            pct = current.signum() > 0 ? HUNDRED : BigDecimal.ZERO;
        }
        log.debug("PnL for user {} ({}): current ${} previous ${} pnl ${} ({}%)", userId, reportType, current, previous, pnl, pct);
        return new PnlReport(reportType, true, current, previous, pnl, pct, currentDate, previousDate);
    }

    /**
     * Return and risk of the daily portfolio value over the last periodDays days up to today. A wallet without a
     * snapshot on some day contributes its latest earlier value to that day.
     */
    public PortfolioPerformance performance(String userId, int periodDays, String walletAddress) {
        if (periodDays < 1) {
            throw new IllegalArgumentException("period must be at least 1, got " + periodDays);
        }
        LocalDate today = today();
        List<DailySnapshot> snapshots = getHistory(userId, walletAddress, today.minusDays(periodDays), today);
        List<BigDecimal> dailyValues = new ArrayList<>();
        Map<String, BigDecimal> latestByWallet = new HashMap<>();
        String currentDay = null;
        for (DailySnapshot snapshot : snapshots) {
            if (currentDay != null && !currentDay.equals(snapshot.getDay())) {
                dailyValues.add(sum(latestByWallet));
            }
            currentDay = snapshot.getDay();
            latestByWallet.put(snapshot.getWalletAddress(), snapshot.getTotalNavUsd());
        }
        if (currentDay != null) {
            dailyValues.add(sum(latestByWallet));
        }
        PortfolioPerformance performance = PerformanceCalculator.measure(periodDays,
                walletAddress == null || walletAddress.isBlank() ? null : walletAddress.trim(),
                dailyValues, snapshotProperties.getRiskFreeRate());
        log.debug("Performance for user {} over {} day(s): {} daily values, total return {}",
                userId, periodDays, dailyValues.size(), performance.totalReturn());
        return performance;
    }

    /**
     * Newest-first history of one position, optionally excluding inactive rows.
     */
    public List<PositionHistory> positionHistory(String userId, String positionId, int limit, boolean includeInactive) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        if (includeInactive) {
            return positionHistoryRepository.findByUserIdAndDebankPositionIdOrderByDateDesc(userId, positionId, page);
        }
        return positionHistoryRepository.findByUserIdAndDebankPositionIdAndActiveTrueOrderByDateDesc(userId, positionId, page);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private List<String> wallets(String userId, String walletAddress) {
        if (walletAddress != null && !walletAddress.isBlank()) {
            return List.of(walletAddress.trim());
        }
        return new ArrayList<>(dailySnapshotRepository.findDistinctWalletAddressesByUserId(userId));
    }

    private static BigDecimal sum(Map<String, BigDecimal> values) {
        return values.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static Instant max(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b != null && b.isAfter(a) ? b : a;
    }
}
