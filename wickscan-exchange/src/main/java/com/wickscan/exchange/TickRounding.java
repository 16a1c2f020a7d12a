package com.wickscan.exchange;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal-exact rounding of prices onto a tick grid.
 */
public final class TickRounding {

    private TickRounding() {}

    /**
     * Round {@code price} to the nearest multiple of {@code tickSize} (half up).
     * A non-positive tick size leaves the price untouched.
     */
    public static double round(double price, double tickSize) {
        if (tickSize <= 0 || !Double.isFinite(price)) {
            return price;
        }
        BigDecimal tick = BigDecimal.valueOf(tickSize);
        BigDecimal steps = BigDecimal.valueOf(price).divide(tick, 0, RoundingMode.HALF_UP);
        return steps.multiply(tick).stripTrailingZeros().doubleValue();
    }
}
