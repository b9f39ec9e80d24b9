package com.navtracker.apy;

import com.navtracker.common.CalendarDays;
import com.navtracker.domain.DailySnapshot;
import com.navtracker.domain.DailySnapshotRepository;
import com.navtracker.domain.TokenHolding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Price-based APY of each token held on the latest snapshot day, from the user's recent daily snapshots.
 * <p>
 * Snapshots of all wallets are merged per day: a token's price is the first positive price seen that day, its amount
 * and value are summed. For the daily, weekly and monthly periods the reference day is the older day closest to
 * (current - N days) on which the token had a price; allTime uses the oldest such day.
 * {@code APY = ((current / historical) ^ (365 / days) - 1) * 100}. Read-only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenApyEngine {

    private static final double DAYS_PER_YEAR = 365.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final double MAX_REASONABLE_APY = 50_000;
    private static final double MIN_REASONABLE_APY = -99;
    private static final double EXTREME_PRICE_RETURN = 500;
    private static final double SHORT_PERIOD_APY = 1000;
    private static final int SHORT_PERIOD_DAYS = 7;

    private final DailySnapshotRepository dailySnapshotRepository;
    private final ApyProperties properties;
    private final Clock clock;

    /**
     * Keyed by token symbol in the order the tokens appear on the latest day. Empty when the user has no snapshot
     * at or before targetDate.
     */
    public Map<String, TokenApy> calculateAllTokenAPYs(String userId, LocalDate targetDate) {
        Instant end = CalendarDays.endOfDay(targetDate, clock.getZone());
        List<DailySnapshot> snapshots = dailySnapshotRepository.findByUserIdAndDateLessThanEqualOrderByDateDesc(
                userId, end, PageRequest.of(0, Math.max(1, properties.getTokenSnapshotLimit())));
        List<Day> days = mergeByDay(snapshots);
        Map<String, TokenApy> result = new LinkedHashMap<>();
        if (days.isEmpty()) {
            log.debug("No snapshots for token APY of user {} at or before {}", userId, targetDate);
            return result;
        }
        Day current = days.get(0);
        List<Day> older = days.subList(1, days.size());
        for (TokenHolding token : current.tokens().values()) {
            result.put(token.getSymbol(), tokenApy(token, current.date(), older));
        }
        log.debug("Token APY for user {} on {}: {} token(s) over {} day(s)", userId, targetDate, result.size(), days.size());
        return result;
    }

    private TokenApy tokenApy(TokenHolding token, Instant currentDate, List<Day> older) {
        TokenApyPeriod daily = null;
        TokenApyPeriod weekly = null;
        TokenApyPeriod monthly = null;
        TokenApyPeriod allTime = null;
        BigDecimal price = token.getPrice();
        if (price.signum() > 0) {
            daily = period(token, currentDate, closest(older, token.getSymbol(), currentDate.minus(Duration.ofDays(1))));
            weekly = period(token, currentDate, closest(older, token.getSymbol(), currentDate.minus(Duration.ofDays(7))));
            monthly = period(token, currentDate, closest(older, token.getSymbol(), currentDate.minus(Duration.ofDays(30))));
            allTime = period(token, currentDate, oldest(older, token.getSymbol()));
        }
        return new TokenApy(token.getSymbol(), token.getName(), token.getAmount(), price, token.getUsdValue(),
                daily, weekly, monthly, allTime, bestPeriod(daily, weekly, monthly), riskLevel(daily, weekly, monthly));
    }

    private static TokenApyPeriod period(TokenHolding token, Instant currentDate, Day reference) {
        if (reference == null) {
            return null;
        }
        BigDecimal currentPrice = token.getPrice();
        BigDecimal historicalPrice = reference.tokens().get(token.getSymbol()).getPrice();
        long elapsedMillis = Duration.between(reference.date(), currentDate).toMillis();
        int days = (int) Math.max(1, Math.ceil(elapsedMillis / MILLIS_PER_DAY));
        double priceReturn = currentPrice.divide(historicalPrice, MathContext.DECIMAL64).doubleValue() - 1;
        double apy = (Math.pow(1 + priceReturn, DAYS_PER_YEAR / days) - 1) * 100;
        double priceReturnPercent = priceReturn * 100;

        List<String> warnings = new ArrayList<>();
        ApyConfidence confidence = ApyConfidence.HIGH;
        BigDecimal reportedApy = null;
        if (!Double.isFinite(apy)) {
            confidence = ApyConfidence.LOW;
            warnings.add("Token APY overflows over " + days + " day(s)");
        } else {
            reportedApy = percent(apy);
            if (apy > MAX_REASONABLE_APY) {
                confidence = ApyConfidence.LOW;
                warnings.add("Extreme token APY of " + format(apy) + "%");
            } else if (apy < MIN_REASONABLE_APY) {
                confidence = ApyConfidence.MEDIUM;
                warnings.add("Large token loss of " + format(apy) + "%");
            }
            if (days < SHORT_PERIOD_DAYS && Math.abs(apy) > SHORT_PERIOD_APY) {
                confidence = ApyConfidence.LOW;
                warnings.add("High APY over a short period of " + days + " day(s)");
            }
        }
        if (Math.abs(priceReturnPercent) > EXTREME_PRICE_RETURN) {
            confidence = ApyConfidence.LOW;
            warnings.add("Extreme price movement of " + format(priceReturnPercent) + "%");
        }
        return new TokenApyPeriod(reportedApy, percent(priceReturnPercent), days, confidence, warnings,
                currentPrice, historicalPrice, currentPrice.subtract(historicalPrice), reference.date());
    }

    private static Day closest(List<Day> older, String symbol, Instant target) {
        Day closest = null;
        long closestDiff = Long.MAX_VALUE;
        for (Day day : older) {
            if (!day.hasPrice(symbol)) {
                continue;
            }
            long diff = Math.abs(Duration.between(day.date(), target).toMillis());
            if (diff < closestDiff) {
                closestDiff = diff;
                closest = day;
            }
        }
        return closest;
    }

    private static Day oldest(List<Day> older, String symbol) {
        for (int i = older.size() - 1; i >= 0; i--) {
            if (older.get(i).hasPrice(symbol)) {
                return older.get(i);
            }
        }
        return null;
    }

    static TokenApy.BestPeriod bestPeriod(TokenApyPeriod daily, TokenApyPeriod weekly, TokenApyPeriod monthly) {
        Map<String, TokenApyPeriod> longestFirst = new LinkedHashMap<>();
        longestFirst.put("monthly", monthly);
        longestFirst.put("weekly", weekly);
        longestFirst.put("daily", daily);
        for (Map.Entry<String, TokenApyPeriod> entry : longestFirst.entrySet()) {
            TokenApyPeriod period = entry.getValue();
            if (period != null && period.apy() != null && period.confidence() != ApyConfidence.LOW) {
                return new TokenApy.BestPeriod(entry.getKey(), period.apy(), period.confidence());
            }
        }
        return null;
    }

    static TokenRiskLevel riskLevel(TokenApyPeriod... periods) {
        double max = 0;
        double sum = 0;
        int count = 0;
        for (TokenApyPeriod period : periods) {
            if (period == null || period.apy() == null) {
                continue;
            }
            double value = Math.abs(period.apy().doubleValue());
            max = Math.max(max, value);
            sum += value;
            count++;
        }
        if (count == 0) {
            return TokenRiskLevel.UNKNOWN;
        }
        double average = sum / count;
        if (max > 1000 || average > 500) {
            return TokenRiskLevel.HIGH;
        }
        if (max > 100 || average > 50) {
            return TokenRiskLevel.MEDIUM;
        }
        return TokenRiskLevel.LOW;
    }

    private static List<Day> mergeByDay(List<DailySnapshot> newestFirst) {
        Map<String, Day> byDay = new LinkedHashMap<>();
        for (DailySnapshot snapshot : newestFirst) {
            if (snapshot.getDate() == null) {
                continue;
            }
            Day day = byDay.computeIfAbsent(snapshot.getDay(), d -> new Day(snapshot.getDate(), new LinkedHashMap<>()));
            for (TokenHolding holding : snapshot.getTokens()) {
                day.tokens().merge(holding.getSymbol(), copy(holding), TokenApyEngine::combine);
            }
        }
        return new ArrayList<>(byDay.values());
    }

    private static TokenHolding copy(TokenHolding holding) {
        return new TokenHolding()
                .setSymbol(holding.getSymbol())
                .setName(holding.getName())
                .setAmount(holding.getAmount())
                .setPrice(holding.getPrice())
                .setUsdValue(holding.getUsdValue());
    }

    private static TokenHolding combine(TokenHolding a, TokenHolding b) {
        return a.setAmount(a.getAmount().add(b.getAmount()))
                .setUsdValue(a.getUsdValue().add(b.getUsdValue()))
                .setPrice(a.getPrice().signum() > 0 ? a.getPrice() : b.getPrice());
    }

    private static BigDecimal percent(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /** Date is the newest snapshot time of the day. */
    private record Day(Instant date, Map<String, TokenHolding> tokens) {

        boolean hasPrice(String symbol) {
            TokenHolding holding = tokens.get(symbol);
            return holding != null && holding.getPrice().signum() > 0;
        }
    }
}
