package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.core.util.MoneyUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Splits a gross payout into the platform fee and the creator's net share.
 * The fee is rounded down, so {@code fee + net} always equals the gross amount.
 */
@Component
public class FeeCalculator {

    public static final int BASIS_POINTS_DENOMINATOR = 10_000;

    private static final BigDecimal DENOMINATOR = BigDecimal.valueOf(BASIS_POINTS_DENOMINATOR);

    public FeeSplit split(BigDecimal gross, int basisPoints) {
        if (gross == null || gross.signum() < 0) {
            throw new IllegalArgumentException("Gross amount must be zero or positive");
        }
        if (basisPoints < 0 || basisPoints > BASIS_POINTS_DENOMINATOR) {
            throw new IllegalArgumentException("Basis points out of range: " + basisPoints);
        }

        BigDecimal amount = MoneyUtil.format(gross);
        BigDecimal fee = amount.multiply(BigDecimal.valueOf(basisPoints))
                .divide(DENOMINATOR, MoneyUtil.SCALE, RoundingMode.DOWN);

        return new FeeSplit(fee, amount.subtract(fee));
    }
}
