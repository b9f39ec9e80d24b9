package com.navtracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running NAV figures of one user outside the monthly fee reports: user-level and per-wallet net flows, the latest
 * NAV values and a monthly NAV series with its volatility. One document per user; version counts updates.
 */
@Document(collection = "nav_data")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NavData {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String userId;
    /** Signed: deposits positive, withdrawals negative. */
    private BigDecimal netFlows = BigDecimal.ZERO;
    private Map<String, BigDecimal> walletNetFlows = new LinkedHashMap<>();
    private BigDecimal priorPreFeeNav = BigDecimal.ZERO;
    private BigDecimal currentPreFeeNav = BigDecimal.ZERO;
    private BigDecimal performance = BigDecimal.ZERO;
    /** Newest first. */
    private List<MonthlyNav> monthlyNavHistory = new ArrayList<>();
    private VolatilityMetrics volatilityMetrics = new VolatilityMetrics();
    @Version
    private Long version;
    private Instant lastUpdated;
    private Instant createdAt;

    public List<MonthlyNav> getMonthlyNavHistory() {
        return monthlyNavHistory == null ? List.of() : monthlyNavHistory;
    }

    public BigDecimal walletNetFlows(String walletAddress) {
        BigDecimal value = walletNetFlows == null ? null : walletNetFlows.get(walletAddress);
        return value == null ? BigDecimal.ZERO : value;
    }

    /**
     * User-level net flows plus every wallet's net flows.
     */
    public BigDecimal totalNetFlows() {
        BigDecimal total = netFlows == null ? BigDecimal.ZERO : netFlows;
        if (walletNetFlows != null) {
            for (BigDecimal value : walletNetFlows.values()) {
                if (value != null) {
                    total = total.add(value);
                }
            }
        }
        return total;
    }
}
