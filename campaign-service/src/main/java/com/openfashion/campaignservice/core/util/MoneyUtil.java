package com.openfashion.campaignservice.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class MoneyUtil {

    private MoneyUtil(){}

    public static final int SCALE = 4;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public static BigDecimal format(BigDecimal amount) {
        if (amount == null) return BigDecimal.ZERO.setScale(SCALE, ROUNDING);
        return amount.setScale(SCALE, ROUNDING);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    // Positive amounts that fit the ledger precision without rounding
    public static boolean isValidAmount(BigDecimal amount) {
        return isPositive(amount) && amount.stripTrailingZeros().scale() <= SCALE;
    }

}
