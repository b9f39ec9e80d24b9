package com.navtracker.nav;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Advisory plausibility checks on a NAV calculation. Never throws; an empty list means nothing looked wrong.
 */
@Component
public class NavValidator {

    static final BigDecimal HIGH_PERFORMANCE_PERCENT = BigDecimal.valueOf(100);
    static final BigDecimal LOW_PERFORMANCE_PERCENT = BigDecimal.valueOf(-90);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 10;

    public List<String> validate(BigDecimal performance, BigDecimal preFeeNav, BigDecimal priorPreFeeNav, BigDecimal netFlows) {
        BigDecimal perf = nz(performance);
        BigDecimal nav = nz(preFeeNav);
        BigDecimal prior = nz(priorPreFeeNav);
        BigDecimal flows = nz(netFlows);
        List<String> warnings = new ArrayList<>();

        if (prior.signum() > 0) {
            BigDecimal percent = perf.multiply(HUNDRED).divide(prior, PERCENT_SCALE, RoundingMode.HALF_UP);
            if (percent.compareTo(HIGH_PERFORMANCE_PERCENT) > 0) {
                warnings.add("Performance of " + oneDecimal(percent) + "% seems unrealistically high");
            }
            if (percent.compareTo(LOW_PERFORMANCE_PERCENT) < 0) {
                warnings.add("Performance of " + oneDecimal(percent) + "% seems unrealistically low");
            }
            if (flows.abs().compareTo(prior) > 0) {
                warnings.add("Net flows (" + grouped(flows) + ") are larger than prior NAV - please verify");
            }
        }
        if (nav.signum() < 0) {
            warnings.add("Current NAV is negative - please review calculations");
        }
        return warnings;
    }

    private static String oneDecimal(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    private static String grouped(BigDecimal value) {
        DecimalFormat format = new DecimalFormat("#,##0.###", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(value);
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
