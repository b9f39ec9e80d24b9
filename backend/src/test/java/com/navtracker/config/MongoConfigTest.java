package com.navtracker.config;

import org.bson.types.Decimal128;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MongoConfigTest {

    private final MongoConfig.AmountWriter writer = new MongoConfig.AmountWriter();
    private final MongoConfig.AmountReader reader = new MongoConfig.AmountReader();

    @Test
    @DisplayName("amounts with more than 34 significant digits are rounded on write")
    void writeRoundsLongExpansions() {
        BigDecimal apy = new BigDecimal("44.0327868852459016393442622950819672131147540983606557");

        Decimal128 stored = writer.convert(apy);

        assertThat(stored.bigDecimalValue().precision()).isEqualTo(34);
        assertThat(stored.bigDecimalValue()).isEqualByComparingTo("44.03278688524590163934426229508197");
    }

    @Test
    @DisplayName("ordinary amounts round-trip exactly, scale included")
    void exactRoundTrip() {
        BigDecimal amount = new BigDecimal("3012.450000000000000000");

        assertThat(reader.convert(writer.convert(amount))).isEqualTo(amount);
    }

    @Test
    @DisplayName("NaN, infinity and negative zero read back as zero")
    void nonFiniteReadAsZero() {
        assertThat(reader.convert(Decimal128.NaN)).isEqualByComparingTo("0");
        assertThat(reader.convert(Decimal128.POSITIVE_INFINITY)).isEqualByComparingTo("0");
        assertThat(reader.convert(Decimal128.NEGATIVE_ZERO)).isEqualByComparingTo("0");
        assertThat(reader.convert(Decimal128.parse("-12.5"))).isEqualByComparingTo("-12.5");
    }
}
