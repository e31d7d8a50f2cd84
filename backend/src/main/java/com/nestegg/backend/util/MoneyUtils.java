package com.nestegg.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final int QUANTITY_SCALE = 6;
    public static final int COST_SCALE = 6;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal quantity(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(QUANTITY_SCALE, RoundingMode.DOWN);
        }
        return value.setScale(QUANTITY_SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    /**
     * Cash value of {@code quantity} units at {@code price}, rounded once to money scale.
     * Trade execution and ledger replay both go through here so their cash agrees exactly.
     */
    public static BigDecimal notional(BigDecimal price, BigDecimal quantity) {
        return scale(price.multiply(quantity));
    }

    /**
     * Quantity-weighted average of an existing holding and a new fill.
     */
    public static BigDecimal weightedAverage(BigDecimal oldQty, BigDecimal oldAvg, BigDecimal addQty, BigDecimal addPrice) {
        BigDecimal totalQty = oldQty.add(addQty);
        return oldQty.multiply(oldAvg)
                .add(addQty.multiply(addPrice))
                .divide(totalQty, COST_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentChange(BigDecimal from, BigDecimal to) {
        if (from == null || from.signum() <= 0) {
            return ZERO;
        }
        return scale(to.subtract(from).multiply(HUNDRED).divide(from, SCALE, RoundingMode.HALF_UP));
    }
}
