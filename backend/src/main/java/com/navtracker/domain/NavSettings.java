package com.navtracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Fee inputs and computed NAV for one (userId, year, month). Created lazily on first read, replaced by explicit save.
 */
@Document(collection = "nav_settings")
@CompoundIndex(name = "user_year_month", def = "{'userId': 1, 'year': 1, 'month': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NavSettings {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private int year;
    private int month;
    private FeeSettings feeSettings = new FeeSettings();
    private NavCalculations navCalculations = new NavCalculations();
    /** Portfolio split the calculation was based on; null until a calculation has been saved. */
    private PortfolioTotals portfolioData;
    private Instant calculationDate;
    private Instant createdAt;
    private Instant updatedAt;
}
