package com.wickscan.execution.dca;

import com.wickscan.core.model.Side;

/**
 * Isolated-margin liquidation estimate. Informational only, never used to trigger exits.
 */
public final class LiquidationEstimator {

    private LiquidationEstimator() {}

    /**
     * @param avgPrice volume-weighted entry
     * @param quantity position size in base units
     * @param equity margin backing the position
     * @param maintenanceMarginRatio e.g. 0.005
     * @return estimated liquidation price, never negative; NaN when quantity is not positive
     */
    public static double estimate(Side side, double avgPrice, double quantity, double equity,
                                  double maintenanceMarginRatio) {
        if (!(quantity > 0) || !Double.isFinite(avgPrice)) {
            return Double.NaN;
        }
        double price;
        if (side == Side.LONG) {
            price = (avgPrice * quantity - equity) / (quantity * (1 - maintenanceMarginRatio));
        } else {
            price = (avgPrice * quantity + equity) / (quantity * (1 + maintenanceMarginRatio));
        }
        return Math.max(0.0, price);
    }

    /**
     * Percent distance from {@code price} to the liquidation price, positive while solvent.
     */
    public static double distancePct(Side side, double price, double liquidationPrice) {
        if (!Double.isFinite(liquidationPrice) || price <= 0) {
            return Double.NaN;
        }
        return side.sign() * (price - liquidationPrice) / price * 100.0;
    }
}
