package com.navtracker.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Stores every USD amount, token quantity and NAV figure as Decimal128.
 * Unique keys come from @CompoundIndex on the documents; enable spring.data.mongodb.auto-index-creation.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(new AmountWriter(), new AmountReader()));
    }

    /**
     * Values beyond 34 significant digits (long APY or fee-rate expansions) are rounded to fit.
     */
    @WritingConverter
    static class AmountWriter implements Converter<BigDecimal, Decimal128> {

        @Override
        public Decimal128 convert(BigDecimal source) {
            BigDecimal fitted = source.precision() > 34 ? source.round(MathContext.DECIMAL128) : source;
            return new Decimal128(fitted);
        }
    }

    /**
     * NaN, infinities and negative zero have no BigDecimal form; they read back as 0.
     */
    @ReadingConverter
    static class AmountReader implements Converter<Decimal128, BigDecimal> {

        @Override
        public BigDecimal convert(Decimal128 source) {
            if (source.isNaN() || source.isInfinite()) {
                return BigDecimal.ZERO;
            }
            // bigDecimalValue() rejects negative zero at any exponent
            return source.isNegative() ? new BigDecimal(source.toString()) : source.bigDecimalValue();
        }
    }
}
