package com.navtracker.nav;

import com.navtracker.domain.MonthlyNav;
import com.navtracker.domain.NavData;
import com.navtracker.domain.NavDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Consumer;

/**
 * Per-user NAV data kept next to the monthly fee reports: net flows (user-level and per wallet), the latest NAV
 * values, and a monthly NAV series whose volatility is recomputed on every change. Updates are read-modify-write
 * guarded by the document version and retried on a concurrent change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NavDataService {

    static final int MAX_UPDATE_ATTEMPTS = 3;

    private final NavDataRepository navDataRepository;
    private final NavProperties navProperties;
    private final Clock clock;

    /**
     * NAV data of the user, created empty on first access.
     */
    public NavDataView get(String userId) {
        requireUser(userId);
        return toView(getOrCreate(userId));
    }

    public NetFlowsUpdate updateNetFlows(String userId, BigDecimal netFlows) {
        requireUser(userId);
        requireAmount("netFlows", netFlows);
        BigDecimal[] previous = new BigDecimal[1];
        NavData saved = update(userId, data -> {
            previous[0] = nz(data.getNetFlows());
            data.setNetFlows(netFlows);
        });
        log.info("Net flows for user {} changed from {} to {}", userId, previous[0], netFlows);
        return new NetFlowsUpdate(null, saved.getNetFlows(), previous[0], saved.totalNetFlows(),
                version(saved), saved.getLastUpdated());
    }

    public NetFlowsUpdate updateWalletNetFlows(String userId, String walletAddress, BigDecimal netFlows) {
        requireUser(userId);
        if (walletAddress == null || walletAddress.isBlank()) {
            throw new NavSettingsException(NavSettingsException.INVALID_REQUEST, "walletAddress is required");
        }
        requireAmount("netFlows", netFlows);
        String wallet = walletAddress.trim();
        BigDecimal[] previous = new BigDecimal[1];
        NavData saved = update(userId, data -> {
            previous[0] = data.walletNetFlows(wallet);
            if (data.getWalletNetFlows() == null) {
                data.setWalletNetFlows(new LinkedHashMap<>());
            }
            data.getWalletNetFlows().put(wallet, netFlows);
        });
        log.info("Net flows for user {} wallet {} changed from {} to {}", userId, wallet, previous[0], netFlows);
        return new NetFlowsUpdate(wallet, saved.walletNetFlows(wallet), previous[0], saved.totalNetFlows(),
                version(saved), saved.getLastUpdated());
    }

    /**
     * Replaces the given values; null leaves a value unchanged. A positive currentPreFeeNav is also recorded as this
     * month's entry of the monthly NAV series.
     */
    public NavDataView updateNavValues(String userId, BigDecimal priorPreFeeNav, BigDecimal currentPreFeeNav,
                                       BigDecimal performance) {
        requireUser(userId);
        NavData saved = update(userId, data -> {
            if (priorPreFeeNav != null) {
                data.setPriorPreFeeNav(priorPreFeeNav);
            }
            if (currentPreFeeNav != null) {
                data.setCurrentPreFeeNav(currentPreFeeNav);
            }
            if (performance != null) {
                data.setPerformance(performance);
            }
            if (currentPreFeeNav != null && currentPreFeeNav.signum() > 0) {
                putMonthlyNav(data, LocalDate.now(clock), currentPreFeeNav);
            }
        });
        log.info("NAV values for user {} updated (annualized volatility {}%)",
                userId, saved.getVolatilityMetrics().getAnnualizedVolatility());
        return toView(saved);
    }

    /**
     * Sets the NAV of the month containing date, replacing an existing entry of that month.
     */
    public NavDataView addMonthlyNav(String userId, LocalDate date, BigDecimal nav) {
        requireUser(userId);
        if (date == null) {
            throw new NavSettingsException(NavSettingsException.INVALID_REQUEST, "date is required");
        }
        requireAmount("nav", nav);
        NavData saved = update(userId, data -> putMonthlyNav(data, date, nav));
        log.info("Monthly NAV {} for user {} set to {}", YearMonth.from(date), userId, nav);
        return toView(saved);
    }

    /**
     * Volatility recomputed from the stored monthly series.
     */
    public NavDataView volatility(String userId) {
        requireUser(userId);
        NavData data = getOrCreate(userId);
        data.setVolatilityMetrics(NavVolatility.measure(data.getMonthlyNavHistory(), clock.instant()));
        return toView(data);
    }

    /**
     * Deletes the user's NAV data. Returns whether a document existed.
     */
    public boolean reset(String userId) {
        requireUser(userId);
        try {
            long deleted = navDataRepository.deleteByUserId(userId);
            log.warn("NAV data reset for user {} ({} document(s) deleted)", userId, deleted);
            return deleted > 0;
        } catch (DataAccessException e) {
            throw persistenceFailure(userId, e);
        }
    }

    private void putMonthlyNav(NavData data, LocalDate date, BigDecimal nav) {
        String month = YearMonth.from(date).toString();
        Instant at = date.atStartOfDay(clock.getZone()).toInstant();
        List<MonthlyNav> history = new ArrayList<>(data.getMonthlyNavHistory());
        history.removeIf(entry -> month.equals(entry.getMonth()));
        history.add(new MonthlyNav().setMonth(month).setDate(at).setNav(nav));
        history.sort(Comparator.comparing(MonthlyNav::getMonth).reversed());
        int limit = Math.max(2, navProperties.getMonthlyHistoryLimit());
        if (history.size() > limit) {
            history = new ArrayList<>(history.subList(0, limit));
        }
        data.setMonthlyNavHistory(history);
        data.setVolatilityMetrics(NavVolatility.measure(history, clock.instant()));
    }

    private NavData update(String userId, Consumer<NavData> change) {
        for (int attempt = 1; ; attempt++) {
            NavData data = getOrCreate(userId);
            change.accept(data);
            if (data.getVolatilityMetrics() == null) {
                data.setVolatilityMetrics(NavVolatility.measure(data.getMonthlyNavHistory(), clock.instant()));
            }
            data.setLastUpdated(clock.instant());
            try {
                return navDataRepository.save(data);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= MAX_UPDATE_ATTEMPTS) {
                    throw persistenceFailure(userId, e);
                }
                log.debug("NAV data of user {} changed concurrently; retrying (attempt {})", userId, attempt + 1);
            } catch (DataAccessException e) {
                throw persistenceFailure(userId, e);
            }
        }
    }

    private NavData getOrCreate(String userId) {
        try {
            return navDataRepository.findByUserId(userId).orElseGet(() -> create(userId));
        } catch (DataAccessException e) {
            throw persistenceFailure(userId, e);
        }
    }

    private NavData create(String userId) {
        Instant now = clock.instant();
        NavData data = new NavData();
        data.setUserId(userId);
        data.setCreatedAt(now);
        data.setLastUpdated(now);
        data.getVolatilityMetrics().setLastCalculated(now);
        try {
            NavData saved = navDataRepository.save(data);
            log.info("Created NAV data for user {}", userId);
            return saved;
        } catch (DuplicateKeyException e) {
            log.debug("NAV data for user {} created concurrently; reloading", userId);
            return navDataRepository.findByUserId(userId).orElseThrow(() -> persistenceFailure(userId, e));
        }
    }

    private static NavDataView toView(NavData data) {
        List<MonthlyNav> history = List.copyOf(data.getMonthlyNavHistory());
        return new NavDataView(data.getUserId(), nz(data.getNetFlows()),
                data.getWalletNetFlows() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data.getWalletNetFlows()),
                data.totalNetFlows(), nz(data.getPriorPreFeeNav()), nz(data.getCurrentPreFeeNav()),
                nz(data.getPerformance()), version(data), data.getLastUpdated(), data.getVolatilityMetrics(),
                history.size(), history);
    }

    private static long version(NavData data) {
        return data.getVersion() == null ? 0L : data.getVersion();
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new NavSettingsException(NavSettingsException.INVALID_REQUEST, "userId is required");
        }
    }

    private static void requireAmount(String field, BigDecimal value) {
        if (value == null) {
            throw new NavSettingsException(NavSettingsException.INVALID_REQUEST, field + " must be a number");
        }
    }

    private static NavSettingsException persistenceFailure(String userId, Exception cause) {
        return new NavSettingsException(NavSettingsException.PERSISTENCE_FAILURE,
                "Failed to persist NAV data for user " + userId + ": " + cause.getMessage(), cause);
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
