package com.navtracker.nav;

import com.navtracker.domain.FeeSettings;
import com.navtracker.domain.NavCalculations;
import com.navtracker.domain.NavSettings;
import com.navtracker.domain.NavSettingsRepository;
import com.navtracker.domain.PortfolioTotals;
import com.navtracker.domain.PriorNavSource;
import com.navtracker.snapshot.SnapshotQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NavSettingsServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-15T10:00:00Z");

    @Mock
    NavSettingsRepository navSettingsRepository;
    @Mock
    SnapshotQueryService snapshotQueryService;

    NavSettingsService service;

    @BeforeEach
    void setUp() {
        NavValidator validator = new NavValidator();
        service = new NavSettingsService(navSettingsRepository, new NavFeeEngine(validator), validator,
                snapshotQueryService, new NavProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("missing month is created with defaults and prior NAV auto-loaded from the previous month")
    void lazyCreateAutoLoaded() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 1)).thenReturn(Optional.empty());
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2024, 12))
                .thenReturn(Optional.of(stored(2024, 12, "12345.67")));
        when(navSettingsRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NavSettings settings = service.getNav("u1", 2025, 1);

        FeeSettings fees = settings.getFeeSettings();
        assertThat(fees.getPriorPreFeeNav()).isEqualByComparingTo("12345.67");
        assertThat(fees.getPriorPreFeeNavSource()).isEqualTo(PriorNavSource.AUTO_LOADED);
        assertThat(fees.getAnnualExpense()).isEqualByComparingTo("600");
        assertThat(fees.getMonthlyExpense()).isEqualByComparingTo("50");
        assertThat(fees.getPerformanceFeeRate()).isEqualByComparingTo("0.25");
        assertThat(fees.getAccruedPerformanceFeeRate()).isEqualByComparingTo("0.25");
        assertThat(settings.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("first month without a predecessor is seeded with 0 and needs a fallback")
    void lazyCreateFallbackNeeded() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth(eq("u1"), anyInt(), anyInt())).thenReturn(Optional.empty());
        when(navSettingsRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NavSettings settings = service.getNav("u1", 2025, 3);

        assertThat(settings.getFeeSettings().getPriorPreFeeNav()).isEqualByComparingTo("0");
        assertThat(settings.getFeeSettings().getPriorPreFeeNavSource()).isEqualTo(PriorNavSource.FALLBACK_NEEDED);
    }

    @Test
    @DisplayName("existing month is returned as stored")
    void existingReturned() {
        NavSettings existing = stored(2025, 3, "100");
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 3)).thenReturn(Optional.of(existing));

        assertThat(service.getNav("u1", 2025, 3)).isSameAs(existing);
        verify(navSettingsRepository, never()).save(any());
    }

    @Test
    @DisplayName("concurrent creation reloads the winner instead of failing")
    void concurrentCreate() {
        NavSettings winner = stored(2025, 3, "0");
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 3))
                .thenReturn(Optional.empty(), Optional.of(winner));
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 2)).thenReturn(Optional.empty());
        when(navSettingsRepository.save(any())).thenThrow(new DuplicateKeyException("dup"));

        assertThat(service.getNav("u1", 2025, 3)).isSameAs(winner);
    }

    @Test
    @DisplayName("invalid month is rejected with INVALID_PERIOD")
    void invalidPeriod() {
        assertThatThrownBy(() -> service.getNav("u1", 2025, 13))
                .isInstanceOf(NavSettingsException.class)
                .extracting("errorCode").isEqualTo(NavSettingsException.INVALID_PERIOD);
    }

    @Test
    @DisplayName("save recomputes warnings from the supplied numbers and stamps the calculation date")
    void saveRecomputesWarnings() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 3)).thenReturn(Optional.empty());
        when(navSettingsRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        FeeSettings fees = new FeeSettings();
        fees.setPriorPreFeeNav(new BigDecimal("100"));
        fees.setPriorPreFeeNavSource(null);
        NavCalculations calc = new NavCalculations();
        calc.setPerformance(new BigDecimal("500"));
        calc.setPreFeeNav(new BigDecimal("600"));
        calc.setValidationWarnings(List.of("stale warning"));

        NavSettings saved = service.saveNav("u1", 2025, 3, fees, calc);

        assertThat(saved.getNavCalculations().getValidationWarnings())
                .containsExactly("Performance of 500.0% seems unrealistically high");
        assertThat(saved.getFeeSettings().getPriorPreFeeNavSource()).isEqualTo(PriorNavSource.MANUAL);
        assertThat(saved.getCalculationDate()).isEqualTo(NOW);
        assertThat(saved.getYear()).isEqualTo(2025);
        assertThat(saved.getMonth()).isEqualTo(3);
    }

    @Test
    @DisplayName("fee rate above 1 is rejected with INVALID_FEE_SETTINGS")
    void invalidFeeRate() {
        FeeSettings fees = new FeeSettings();
        fees.setPerformanceFeeRate(new BigDecimal("25"));

        assertThatThrownBy(() -> service.saveNav("u1", 2025, 3, fees, new NavCalculations()))
                .isInstanceOf(NavSettingsException.class)
                .extracting("errorCode").isEqualTo(NavSettingsException.INVALID_FEE_SETTINGS);
        verify(navSettingsRepository, never()).save(any());
    }

    @Test
    @DisplayName("negative monthly expense is rejected")
    void negativeExpense() {
        FeeSettings fees = new FeeSettings();
        fees.setMonthlyExpense(new BigDecimal("-1"));

        assertThatThrownBy(() -> service.calculateNav("u1", 2025, 3, fees))
                .isInstanceOf(NavSettingsException.class)
                .hasMessageContaining("monthlyExpense");
    }

    @Test
    @DisplayName("calculate previews against current portfolio totals without saving")
    void calculatePreview() {
        when(snapshotQueryService.currentTotals("u1")).thenReturn(
                new PortfolioTotals(new BigDecimal("1000"), new BigDecimal("500"), new BigDecimal("50")));
        FeeSettings fees = new FeeSettings();
        fees.setMonthlyExpense(new BigDecimal("50"));

        NavCalculations nav = service.calculateNav("u1", 2025, 3, fees);

        assertThat(nav.getPreFeeNav()).isEqualByComparingTo("1450");
        verify(navSettingsRepository, never()).save(any());
    }

    @Test
    @DisplayName("calculate and save stores the result with the portfolio split")
    void calculateAndSave() {
        PortfolioTotals totals = new PortfolioTotals(new BigDecimal("1000"), new BigDecimal("500"), new BigDecimal("50"));
        when(snapshotQueryService.currentTotals("u1")).thenReturn(totals);
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 3)).thenReturn(Optional.of(stored(2025, 3, "0")));
        when(navSettingsRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NavSettings saved = service.calculateAndSave("u1", 2025, 3, new FeeSettings());

        assertThat(saved.getNavCalculations().getPreFeeNav()).isEqualByComparingTo("1500");
        assertThat(saved.getPortfolioData()).isEqualTo(totals);
    }

    @Test
    @DisplayName("calculate and save rejects a blank user before touching any store")
    void calculateAndSaveRequiresUser() {
        assertThatThrownBy(() -> service.calculateAndSave(" ", 2025, 3, new FeeSettings()))
                .isInstanceOf(NavSettingsException.class)
                .extracting("errorCode").isEqualTo(NavSettingsException.INVALID_REQUEST);
        verify(snapshotQueryService, never()).currentTotals(anyString());
        verify(navSettingsRepository, never()).save(any());
    }

    @Test
    @DisplayName("prior lookup returns the previous month's line items when stored")
    void priorFound() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2024, 12))
                .thenReturn(Optional.of(stored(2024, 12, "900")));

        PriorNavLookup prior = service.getPriorNav("u1", 2025, 1);

        assertThat(prior.found()).isTrue();
        assertThat(prior.source()).isEqualTo(PriorNavSource.AUTO_LOADED);
        assertThat(prior.priorPreFeeNav()).isEqualByComparingTo("900");
        assertThat(prior.priorYear()).isEqualTo(2024);
        assertThat(prior.priorMonthName()).isEqualTo("December");
        assertThat(prior.message()).isEqualTo("Loaded from December 2024 NAV report");
    }

    @Test
    @DisplayName("prior lookup suggests a portfolio estimate when the user has portfolio data")
    void priorFallbackNeeded() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 2)).thenReturn(Optional.empty());
        when(snapshotQueryService.currentTotals("u1")).thenReturn(
                new PortfolioTotals(new BigDecimal("10"), BigDecimal.ZERO, BigDecimal.ZERO));

        PriorNavLookup prior = service.getPriorNav("u1", 2025, 3);

        assertThat(prior.found()).isFalse();
        assertThat(prior.source()).isEqualTo(PriorNavSource.FALLBACK_NEEDED);
    }

    @Test
    @DisplayName("prior lookup stays manual when there is nothing to estimate from")
    void priorManual() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 2)).thenReturn(Optional.empty());
        when(snapshotQueryService.currentTotals("u1")).thenReturn(PortfolioTotals.ZERO);

        assertThat(service.getPriorNav("u1", 2025, 3).source()).isEqualTo(PriorNavSource.MANUAL);
    }

    @Test
    @DisplayName("portfolio estimate seeds prior NAV with the current total")
    void portfolioEstimate() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth("u1", 2025, 3)).thenReturn(Optional.of(stored(2025, 3, "0")));
        when(snapshotQueryService.currentTotals("u1")).thenReturn(
                new PortfolioTotals(new BigDecimal("700"), new BigDecimal("300"), new BigDecimal("20")));
        when(navSettingsRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NavSettings settings = service.usePortfolioEstimate("u1", 2025, 3);

        assertThat(settings.getFeeSettings().getPriorPreFeeNav()).isEqualByComparingTo("1000");
        assertThat(settings.getFeeSettings().getPriorPreFeeNavSource()).isEqualTo(PriorNavSource.PORTFOLIO_ESTIMATE);
    }

    @Test
    @DisplayName("history falls back to the configured limit and maps month names")
    void history() {
        when(navSettingsRepository.findByUserIdOrderByYearDescMonthDesc(eq("u1"), any(Pageable.class)))
                .thenReturn(List.of(stored(2025, 2, "1100"), stored(2025, 1, "1000")));

        List<NavHistoryEntry> history = service.history("u1", 0);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(navSettingsRepository).findByUserIdOrderByYearDescMonthDesc(eq("u1"), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(12);
        assertThat(history).extracting(NavHistoryEntry::monthName).containsExactly("February", "January");
        assertThat(history.get(0).preFeeNav()).isEqualByComparingTo("1100");
    }

    @Test
    @DisplayName("deleting a missing month is NAV_NOT_FOUND")
    void deleteMissing() {
        when(navSettingsRepository.deleteByUserIdAndYearAndMonth("u1", 2025, 3)).thenReturn(0L);

        assertThatThrownBy(() -> service.deleteNav("u1", 2025, 3))
                .isInstanceOf(NavSettingsException.class)
                .extracting("errorCode").isEqualTo(NavSettingsException.NAV_NOT_FOUND);
    }

    @Test
    @DisplayName("store failure is wrapped as PERSISTENCE_FAILURE")
    void persistenceFailure() {
        when(navSettingsRepository.findByUserIdAndYearAndMonth(anyString(), anyInt(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.getNav("u1", 2025, 3))
                .isInstanceOf(NavSettingsException.class)
                .extracting("errorCode").isEqualTo(NavSettingsException.PERSISTENCE_FAILURE);
    }

    @Test
    @DisplayName("reset returns the number of deleted months")
    void reset() {
        when(navSettingsRepository.deleteByUserId("u1")).thenReturn(4L);

        assertThat(service.reset("u1")).isEqualTo(4L);
    }

    private static NavSettings stored(int year, int month, String preFeeNav) {
        NavSettings settings = new NavSettings();
        settings.setId("id-" + year + "-" + month);
        settings.setUserId("u1");
        settings.setYear(year);
        settings.setMonth(month);
        NavCalculations calc = new NavCalculations();
        calc.setPreFeeNav(new BigDecimal(preFeeNav));
        calc.setTotalAssets(new BigDecimal(preFeeNav));
        calc.setNetAssets(new BigDecimal(preFeeNav));
        settings.setNavCalculations(calc);
        settings.setCreatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        return settings;
    }
}
