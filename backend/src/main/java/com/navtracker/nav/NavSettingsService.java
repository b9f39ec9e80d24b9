package com.navtracker.nav;

import com.navtracker.common.ReportingPeriod;
import com.navtracker.domain.FeeSettings;
import com.navtracker.domain.NavCalculations;
import com.navtracker.domain.NavSettings;
import com.navtracker.domain.NavSettingsRepository;
import com.navtracker.domain.PortfolioTotals;
import com.navtracker.domain.PriorNavSource;
import com.navtracker.snapshot.SnapshotQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Monthly NAV settings per user: lazy defaults seeded from the previous month, validated saves, previews against the
 * current portfolio, and history. One document per (userId, year, month).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NavSettingsService {

    private final NavSettingsRepository navSettingsRepository;
    private final NavFeeEngine navFeeEngine;
    private final NavValidator navValidator;
    private final SnapshotQueryService snapshotQueryService;
    private final NavProperties navProperties;
    private final Clock clock;

    /**
     * Settings of the month; created with defaults when missing. priorPreFeeNav is seeded from the previous month's
     * preFeeNav (AUTO_LOADED) or left at 0 (FALLBACK_NEEDED).
     *
     * @throws NavSettingsException INVALID_PERIOD, PERSISTENCE_FAILURE
     */
    public NavSettings getNav(String userId, int year, int month) {
        ReportingPeriod period = period(year, month);
        requireUser(userId);
        Optional<NavSettings> existing = find(userId, period);
        if (existing.isPresent()) {
            return existing.get();
        }
        NavSettings created = defaults(userId, period);
        try {
            NavSettings saved = navSettingsRepository.save(created);
            log.info("Created default NAV settings for user {} {} (prior source {})",
                    userId, period, created.getFeeSettings().getPriorPreFeeNavSource());
            return saved;
        } catch (DuplicateKeyException e) {
            log.debug("NAV settings for user {} {} created concurrently; reloading", userId, period);
            return find(userId, period).orElseThrow(() -> persistenceFailure(userId, period, e));
        } catch (DataAccessException e) {
            throw persistenceFailure(userId, period, e);
        }
    }

    /**
     * Stores caller-supplied settings and calculations. Warnings are recomputed from the supplied numbers and
     * calculationDate is stamped; the rest is stored as given.
     *
     * @throws NavSettingsException INVALID_PERIOD, INVALID_FEE_SETTINGS, PERSISTENCE_FAILURE
     */
    public NavSettings saveNav(String userId, int year, int month, FeeSettings feeSettings, NavCalculations navCalculations) {
        ReportingPeriod period = period(year, month);
        requireUser(userId);
        FeeSettings fees = feeSettings != null ? feeSettings.copy() : new FeeSettings();
        validateFeeSettings(fees);
        if (fees.getPriorPreFeeNavSource() == null) {
            fees.setPriorPreFeeNavSource(PriorNavSource.MANUAL);
        }
        NavCalculations calculations = navCalculations != null ? navCalculations : new NavCalculations();
        calculations.setNetFlows(nz(fees.getNetFlows()));
        calculations.setPriorPreFeeNav(nz(fees.getPriorPreFeeNav()));
        calculations.setPriorPreFeeNavSource(fees.getPriorPreFeeNavSource());
        calculations.setValidationWarnings(navValidator.validate(
                calculations.getPerformance(), calculations.getPreFeeNav(), fees.getPriorPreFeeNav(), fees.getNetFlows()));
        return store(userId, period, fees, calculations, null);
    }

    /**
     * Preview: current portfolio totals run through the waterfall. Uses the stored (or default) settings when
     * {@code feeSettings} is null. Nothing is persisted.
     */
    public NavCalculations calculateNav(String userId, int year, int month, FeeSettings feeSettings) {
        period(year, month);
        requireUser(userId);
        FeeSettings fees = effectiveSettings(userId, year, month, feeSettings);
        return navFeeEngine.computeNav(snapshotQueryService.currentTotals(userId), fees);
    }

    /**
     * Computes against the current portfolio and saves the result together with the portfolio split it used.
     */
    public NavSettings calculateAndSave(String userId, int year, int month, FeeSettings feeSettings) {
        requireUser(userId);
        ReportingPeriod period = period(year, month);
        FeeSettings fees = effectiveSettings(userId, year, month, feeSettings);
        PortfolioTotals totals = snapshotQueryService.currentTotals(userId);
        NavCalculations calculations = navFeeEngine.computeNav(totals, fees);
        NavSettings saved = store(userId, period, fees, calculations, totals);
        log.info("NAV calculated for user {} {}: preFeeNav ${} netAssets ${} ({} warnings)", userId, period,
                calculations.getPreFeeNav(), calculations.getNetAssets(), calculations.getValidationWarnings().size());
        return saved;
    }

    /**
     * Looks up the month before (year, month). Without a stored prior month the source is FALLBACK_NEEDED when the
     * user has portfolio data to estimate from, MANUAL otherwise.
     */
    public PriorNavLookup getPriorNav(String userId, int year, int month) {
        ReportingPeriod prior = period(year, month).prior();
        requireUser(userId);
        Optional<NavSettings> priorSettings = find(userId, prior);
        if (priorSettings.isPresent()) {
            NavCalculations calc = priorSettings.get().getNavCalculations();
            return new PriorNavLookup(true, nz(calc.getPreFeeNav()), PriorNavSource.AUTO_LOADED,
                    prior.year(), prior.month(), prior.monthName(),
                    "Loaded from " + prior.monthName() + " " + prior.year() + " NAV report",
                    nz(calc.getTotalAssets()), nz(calc.getNetAssets()), nz(calc.getPerformance()),
                    priorSettings.get().getCreatedAt());
        }
        boolean hasPortfolio = snapshotQueryService.currentTotals(userId).totalValue().signum() > 0;
        if (hasPortfolio) {
            return new PriorNavLookup(false, BigDecimal.ZERO, PriorNavSource.FALLBACK_NEEDED,
                    prior.year(), prior.month(), prior.monthName(),
                    "No prior month data found. Consider using current portfolio value as baseline for first month.",
                    null, null, null, null);
        }
        return new PriorNavLookup(false, BigDecimal.ZERO, PriorNavSource.MANUAL,
                prior.year(), prior.month(), prior.monthName(), "No prior month data found",
                null, null, null, null);
    }

    /**
     * First-month setup: uses the current portfolio value as priorPreFeeNav (source PORTFOLIO_ESTIMATE).
     */
    public NavSettings usePortfolioEstimate(String userId, int year, int month) {
        NavSettings settings = getNav(userId, year, month);
        ReportingPeriod period = period(year, month);
        BigDecimal estimate = snapshotQueryService.currentTotals(userId).totalValue();
        FeeSettings fees = settings.getFeeSettings() != null ? settings.getFeeSettings().copy() : new FeeSettings();
        fees.setPriorPreFeeNav(estimate);
        fees.setPriorPreFeeNavSource(PriorNavSource.PORTFOLIO_ESTIMATE);
        log.info("Prior NAV for user {} {} set from portfolio estimate ${}", userId, period, estimate);
        return store(userId, period, fees, settings.getNavCalculations(), settings.getPortfolioData());
    }

    /** Months with stored settings, newest first. */
    public List<NavMonth> availableMonths(String userId) {
        requireUser(userId);
        return navSettingsRepository.findByUserIdOrderByYearDescMonthDesc(userId).stream()
                .map(s -> new NavMonth(s.getYear(), s.getMonth(), ReportingPeriod.monthName(s.getMonth()), s.getCreatedAt()))
                .toList();
    }

    /**
     * Newest-first headline figures. A limit below 1 falls back to navtracker.nav.history-limit.
     */
    public List<NavHistoryEntry> history(String userId, int limit) {
        requireUser(userId);
        int size = limit >= 1 ? limit : navProperties.getHistoryLimit();
        return navSettingsRepository.findByUserIdOrderByYearDescMonthDesc(userId, PageRequest.of(0, size)).stream()
                .map(NavSettingsService::toHistoryEntry)
                .toList();
    }

    /**
     * Deletes every NAV month of the user. Returns the number of deleted documents.
     */
    public long reset(String userId) {
        requireUser(userId);
        long deleted = navSettingsRepository.deleteByUserId(userId);
        log.info("Deleted {} NAV settings for user {}", deleted, userId);
        return deleted;
    }

    /**
     * Deletes one month.
     *
     * @throws NavSettingsException NAV_NOT_FOUND when the month has no settings
     */
    public void deleteNav(String userId, int year, int month) {
        ReportingPeriod period = period(year, month);
        requireUser(userId);
        long deleted = navSettingsRepository.deleteByUserIdAndYearAndMonth(userId, period.year(), period.month());
        if (deleted == 0) {
            throw new NavSettingsException(NavSettingsException.NAV_NOT_FOUND,
                    "No NAV settings for user " + userId + " " + period);
        }
        log.info("Deleted NAV settings for user {} {}", userId, period);
    }

    /**
     * Rejects negative amounts, fee rates outside [0, 1] and a negative hurdle rate.
     *
     * @throws NavSettingsException INVALID_FEE_SETTINGS
     */
    void validateFeeSettings(FeeSettings fees) {
        requireNonNegative("annualExpense", fees.getAnnualExpense());
        requireNonNegative("monthlyExpense", fees.getMonthlyExpense());
        requireNonNegative("partialPaymentAmount", fees.getPartialPaymentAmount());
        requireNonNegative("hurdleRate", fees.getHurdleRate());
        requireNonNegative("highWaterMark", fees.getHighWaterMark());
        requireFraction("performanceFeeRate", fees.getPerformanceFeeRate());
        requireFraction("accruedPerformanceFeeRate", fees.getAccruedPerformanceFeeRate());
    }

    private FeeSettings effectiveSettings(String userId, int year, int month, FeeSettings supplied) {
        FeeSettings fees = supplied != null ? supplied.copy() : getNav(userId, year, month).getFeeSettings().copy();
        validateFeeSettings(fees);
        return fees;
    }

    private NavSettings store(String userId, ReportingPeriod period, FeeSettings fees, NavCalculations calculations,
                              PortfolioTotals portfolioData) {
        Instant now = clock.instant();
        try {
            NavSettings settings = find(userId, period).orElseGet(() -> newSettings(userId, period, now));
            settings.setFeeSettings(fees);
            settings.setNavCalculations(calculations);
            if (portfolioData != null) {
                settings.setPortfolioData(portfolioData);
            }
            settings.setCalculationDate(now);
            settings.setUpdatedAt(now);
            NavSettings saved = navSettingsRepository.save(settings);
            log.info("Saved NAV settings for user {} {}", userId, period);
            return saved;
        } catch (DataAccessException e) {
            throw persistenceFailure(userId, period, e);
        }
    }

    private NavSettings defaults(String userId, ReportingPeriod period) {
        FeeSettings fees = new FeeSettings();
        fees.setAnnualExpense(navProperties.getAnnualExpense());
        fees.setMonthlyExpense(navProperties.getMonthlyExpense());
        fees.setPerformanceFeeRate(navProperties.getPerformanceFeeRate());
        fees.setAccruedPerformanceFeeRate(navProperties.getAccruedPerformanceFeeRate());
        fees.setHurdleRate(navProperties.getHurdleRate());

        BigDecimal priorNav = find(userId, period.prior())
                .map(NavSettings::getNavCalculations)
                .map(NavCalculations::getPreFeeNav)
                .orElse(BigDecimal.ZERO);
        if (priorNav.signum() > 0) {
            fees.setPriorPreFeeNav(priorNav);
            fees.setPriorPreFeeNavSource(PriorNavSource.AUTO_LOADED);
        } else {
            fees.setPriorPreFeeNavSource(PriorNavSource.FALLBACK_NEEDED);
        }

        NavSettings settings = newSettings(userId, period, clock.instant());
        settings.setFeeSettings(fees);
        NavCalculations calculations = new NavCalculations();
        calculations.setPriorPreFeeNav(fees.getPriorPreFeeNav());
        calculations.setPriorPreFeeNavSource(fees.getPriorPreFeeNavSource());
        settings.setNavCalculations(calculations);
        return settings;
    }

    private static NavSettings newSettings(String userId, ReportingPeriod period, Instant now) {
        NavSettings settings = new NavSettings();
        settings.setUserId(userId);
        settings.setYear(period.year());
        settings.setMonth(period.month());
        settings.setCreatedAt(now);
        settings.setUpdatedAt(now);
        return settings;
    }

    private Optional<NavSettings> find(String userId, ReportingPeriod period) {
        try {
            return navSettingsRepository.findByUserIdAndYearAndMonth(userId, period.year(), period.month());
        } catch (DataAccessException e) {
            throw persistenceFailure(userId, period, e);
        }
    }

    private static NavHistoryEntry toHistoryEntry(NavSettings settings) {
        NavCalculations calc = settings.getNavCalculations() != null ? settings.getNavCalculations() : new NavCalculations();
        return new NavHistoryEntry(settings.getYear(), settings.getMonth(), ReportingPeriod.monthName(settings.getMonth()),
                nz(calc.getTotalAssets()), nz(calc.getPreFeeNav()), nz(calc.getPerformance()), nz(calc.getPerformanceFee()),
                nz(calc.getAccruedPerformanceFees()), nz(calc.getNetAssets()), calc.getValidationWarnings(),
                settings.getCalculationDate());
    }

    private static ReportingPeriod period(int year, int month) {
        try {
            return new ReportingPeriod(year, month);
        } catch (IllegalArgumentException e) {
            throw new NavSettingsException(NavSettingsException.INVALID_PERIOD, e.getMessage(), e);
        }
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new NavSettingsException(NavSettingsException.INVALID_REQUEST, "userId is required");
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new NavSettingsException(NavSettingsException.INVALID_FEE_SETTINGS, field + " must not be negative");
        }
    }

    private static void requireFraction(String field, BigDecimal value) {
        if (value != null && (value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0)) {
            throw new NavSettingsException(NavSettingsException.INVALID_FEE_SETTINGS, field + " must be between 0 and 1");
        }
    }

    private static NavSettingsException persistenceFailure(String userId, ReportingPeriod period, Exception cause) {
        return new NavSettingsException(NavSettingsException.PERSISTENCE_FAILURE,
                "Failed to persist NAV settings for user " + userId + " " + period + ": " + cause.getMessage(), cause);
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
