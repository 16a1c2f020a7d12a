package com.wickscan.execution.open;

import com.wickscan.core.model.Side;

/**
 * Prices of a planned open.
 *
 * @param tailFraction retracement into the signal bar's tail used for the entry
 * @param tpPct target distance in price percent
 */
public record EntryPlan(String symbol, Side side, double entry, double stopLoss, double takeProfit,
                        double tailFraction, double tpPct) {

    public EntryPlan withPrices(double entry, double stopLoss, double takeProfit) {
        return new EntryPlan(symbol, side, entry, stopLoss, takeProfit, tailFraction, tpPct);
    }

    public double stopDistancePct() {
        return Math.abs(entry - stopLoss) / entry * 100.0;
    }

    public double riskReward() {
        double risk = Math.abs(entry - stopLoss);
        return risk > 0 ? Math.abs(takeProfit - entry) / risk : Double.NaN;
    }
}
