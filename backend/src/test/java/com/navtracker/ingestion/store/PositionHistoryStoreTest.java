package com.navtracker.ingestion.store;

import com.navtracker.domain.PositionHistory;
import com.navtracker.domain.PositionHistoryRepository;
import com.navtracker.domain.PositionRecord;
import com.navtracker.domain.TokenHolding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PositionHistoryStoreTest {

    @Mock
    PositionHistoryRepository positionHistoryRepository;

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    PositionHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new PositionHistoryStore(positionHistoryRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("upserts one active row per position and deactivates the rest of the wallet")
    void recordsAndDeactivates() {
        when(positionHistoryRepository.markInactiveExcept(eq("u1"), eq("0xw"), any(), eq("2025-03-10"), eq(NOW)))
                .thenReturn(2L);

        long deactivated = store.record("u1", "0xw", List.of(position("p1", "100", "5"), position("p2", "50", "0")));

        assertThat(deactivated).isEqualTo(2L);
        ArgumentCaptor<PositionHistory> captor = ArgumentCaptor.forClass(PositionHistory.class);
        verify(positionHistoryRepository, times(2)).upsertDaily(captor.capture());
        PositionHistory first = captor.getAllValues().get(0);
        assertThat(first.getDebankPositionId()).isEqualTo("p1");
        assertThat(first.getDay()).isEqualTo("2025-03-10");
        assertThat(first.isActive()).isTrue();
        assertThat(first.getTotalValue()).isEqualByComparingTo("100");
        assertThat(first.getUnclaimedRewardsValue()).isEqualByComparingTo("5");
        verify(positionHistoryRepository).markInactiveExcept("u1", "0xw", Set.of("p1", "p2"), "2025-03-10", NOW);
    }

    @Test
    @DisplayName("positions sharing an id in one refresh are summed into a single row")
    void sharedIdIsCombined() {
        when(positionHistoryRepository.markInactiveExcept(eq("u1"), eq("0xw"), any(), any(), any())).thenReturn(0L);

        store.record("u1", "0xw", List.of(
                position("eth:uniswap3:0xpool", "2000", "1"),
                position("eth:uniswap3:0xpool", "4000", "2"),
                position("p2", "50", "0")));

        ArgumentCaptor<PositionHistory> captor = ArgumentCaptor.forClass(PositionHistory.class);
        verify(positionHistoryRepository, times(2)).upsertDaily(captor.capture());
        PositionHistory pool = captor.getAllValues().get(0);
        assertThat(pool.getDebankPositionId()).isEqualTo("eth:uniswap3:0xpool");
        assertThat(pool.getTotalValue()).isEqualByComparingTo("6000");
        assertThat(pool.getUnclaimedRewardsValue()).isEqualByComparingTo("3");
        assertThat(pool.getTokens()).hasSize(2);
        assertThat(captor.getAllValues().get(1).getDebankPositionId()).isEqualTo("p2");
        verify(positionHistoryRepository).markInactiveExcept("u1", "0xw",
                Set.of("eth:uniswap3:0xpool", "p2"), "2025-03-10", NOW);
    }

    @Test
    @DisplayName("an empty refresh deactivates every position of the wallet")
    void emptyRefresh() {
        when(positionHistoryRepository.markInactiveExcept("u1", "0xw", Set.of(), "2025-03-10", NOW)).thenReturn(3L);

        assertThat(store.record("u1", "0xw", List.of())).isEqualTo(3L);
    }

    @Test
    @DisplayName("write failure surfaces as SnapshotPersistenceException")
    void wrapsFailure() {
        when(positionHistoryRepository.upsertDaily(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> store.record("u1", "0xw", List.of(position("p1", "1", "0"))))
                .isInstanceOf(SnapshotPersistenceException.class);
    }

    private static PositionRecord position(String id, String value, String rewards) {
        return new PositionRecord()
                .setPositionId(id)
                .setProtocolName("Aave")
                .setPositionName("Lending")
                .setSupplyTokens(List.of(new TokenHolding().setSymbol("ETH")))
                .setTotalUsdValue(new BigDecimal(value))
                .setUnclaimedRewardsUsd(new BigDecimal(rewards));
    }
}
