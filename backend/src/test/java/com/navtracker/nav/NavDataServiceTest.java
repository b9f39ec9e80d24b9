package com.navtracker.nav;

import com.navtracker.domain.MonthlyNav;
import com.navtracker.domain.NavData;
import com.navtracker.domain.NavDataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NavDataServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-15T10:00:00Z");

    @Mock
    NavDataRepository navDataRepository;

    NavProperties properties;
    NavDataService service;

    @BeforeEach
    void setUp() {
        properties = new NavProperties();
        service = new NavDataService(navDataRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("first access creates empty NAV data")
    void getCreates() {
        when(navDataRepository.findByUserId("u1")).thenReturn(Optional.empty());
        when(navDataRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NavDataView view = service.get("u1");

        assertThat(view.userId()).isEqualTo("u1");
        assertThat(view.totalNetFlows()).isEqualByComparingTo("0");
        assertThat(view.monthsOfData()).isZero();
        assertThat(view.lastUpdated()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("wallet net flows add to the user-level net flows in the total")
    void walletNetFlows() {
        NavData data = stored();
        data.setNetFlows(new BigDecimal("100"));
        data.getWalletNetFlows().put("0xa", new BigDecimal("50"));
        when(navDataRepository.findByUserId("u1")).thenReturn(Optional.of(data));
        when(navDataRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NetFlowsUpdate update = service.updateWalletNetFlows("u1", " 0xb ", new BigDecimal("25"));

        assertThat(update.walletAddress()).isEqualTo("0xb");
        assertThat(update.previousNetFlows()).isEqualByComparingTo("0");
        assertThat(update.netFlows()).isEqualByComparingTo("25");
        assertThat(update.totalNetFlows()).isEqualByComparingTo("175");

        NetFlowsUpdate userLevel = service.updateNetFlows("u1", new BigDecimal("-40"));
        assertThat(userLevel.previousNetFlows()).isEqualByComparingTo("100");
        assertThat(userLevel.totalNetFlows()).isEqualByComparingTo("35");
    }

    @Test
    @DisplayName("a monthly NAV replaces the same month and the series keeps the newest months")
    void monthlyReplaceAndTrim() {
        properties.setMonthlyHistoryLimit(3);
        NavData data = stored();
        data.setMonthlyNavHistory(new ArrayList<>(List.of(month("2025-03", "99"), month("2025-02", "110"), month("2025-01", "100"))));
        when(navDataRepository.findByUserId("u1")).thenReturn(Optional.of(data));
        when(navDataRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NavDataView replaced = service.addMonthlyNav("u1", LocalDate.of(2025, 3, 31), new BigDecimal("121"));

        assertThat(replaced.monthlyHistory()).extracting(MonthlyNav::getMonth).containsExactly("2025-03", "2025-02", "2025-01");
        assertThat(replaced.monthlyHistory().get(0).getNav()).isEqualByComparingTo("121");
        assertThat(replaced.volatilityMetrics().getStandardDeviation()).isEqualByComparingTo("0");

        NavDataView trimmed = service.addMonthlyNav("u1", LocalDate.of(2025, 4, 30), new BigDecimal("130"));

        assertThat(trimmed.monthlyHistory()).extracting(MonthlyNav::getMonth).containsExactly("2025-04", "2025-03", "2025-02");
        assertThat(trimmed.monthsOfData()).isEqualTo(3);
    }

    @Test
    @DisplayName("a positive current NAV is recorded as this month's entry")
    void navValuesRecordMonth() {
        NavData data = stored();
        data.setPriorPreFeeNav(new BigDecimal("9000"));
        when(navDataRepository.findByUserId("u1")).thenReturn(Optional.of(data));
        when(navDataRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        NavDataView view = service.updateNavValues("u1", null, new BigDecimal("10000"), new BigDecimal("1000"));

        assertThat(view.priorPreFeeNav()).isEqualByComparingTo("9000");
        assertThat(view.currentPreFeeNav()).isEqualByComparingTo("10000");
        assertThat(view.monthlyHistory()).extracting(MonthlyNav::getMonth).containsExactly("2025-03");
    }

    @Test
    @DisplayName("a concurrent change is retried on fresh data")
    void retriesConcurrentChange() {
        when(navDataRepository.findByUserId("u1")).thenReturn(Optional.of(stored()));
        when(navDataRepository.save(any()))
                .thenThrow(new OptimisticLockingFailureException("stale version"))
                .thenAnswer(inv -> inv.getArgument(0));

        NetFlowsUpdate update = service.updateNetFlows("u1", new BigDecimal("500"));

        assertThat(update.netFlows()).isEqualByComparingTo("500");
        verify(navDataRepository, times(2)).findByUserId("u1");
    }

    @Test
    @DisplayName("repeated concurrent changes give up with a persistence failure")
    void givesUpAfterRetries() {
        when(navDataRepository.findByUserId("u1")).thenReturn(Optional.of(stored()));
        when(navDataRepository.save(any())).thenThrow(new OptimisticLockingFailureException("stale version"));

        assertThatThrownBy(() -> service.updateNetFlows("u1", BigDecimal.ONE))
                .isInstanceOf(NavSettingsException.class)
                .extracting("errorCode").isEqualTo(NavSettingsException.PERSISTENCE_FAILURE);
        verify(navDataRepository, times(NavDataService.MAX_UPDATE_ATTEMPTS)).save(any());
    }

    @Test
    @DisplayName("missing user, wallet or amount is rejected before any write")
    void validation() {
        assertThatThrownBy(() -> service.get(" "))
                .extracting("errorCode").isEqualTo(NavSettingsException.INVALID_REQUEST);
        assertThatThrownBy(() -> service.updateWalletNetFlows("u1", "", BigDecimal.ONE))
                .extracting("errorCode").isEqualTo(NavSettingsException.INVALID_REQUEST);
        assertThatThrownBy(() -> service.updateNetFlows("u1", null))
                .hasMessage("netFlows must be a number");
        assertThatThrownBy(() -> service.addMonthlyNav("u1", null, BigDecimal.TEN))
                .hasMessage("date is required");
        verify(navDataRepository, never()).save(any());
    }

    @Test
    @DisplayName("reset reports whether NAV data existed")
    void reset() {
        when(navDataRepository.deleteByUserId("u1")).thenReturn(1L);
        when(navDataRepository.deleteByUserId("u2")).thenReturn(0L);

        assertThat(service.reset("u1")).isTrue();
        assertThat(service.reset("u2")).isFalse();
    }

    private static NavData stored() {
        NavData data = new NavData();
        data.setId("n1");
        data.setUserId("u1");
        data.setVersion(3L);
        data.setWalletNetFlows(new LinkedHashMap<>());
        return data;
    }

    private static MonthlyNav month(String month, String nav) {
        return new MonthlyNav().setMonth(month).setNav(new BigDecimal(nav));
    }
}
