package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Sizing, bracket and touch-check parameters of the wick-spike opener.
 * Percentages are price percent (not leveraged).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntrySettings {

    private double positionSizeUsdt = 10.0;
    private int leverage = 20;
    private int maxConcurrentPositions = 10;
    private double slPct = 0.20;
    private double slAtrMult = 0.50;
    private double tpPct = 0.30;
    private double tailFraction = 0.25;
    private List<MarginTier> marginTiers = List.of(
        new MarginTier(0.15, 1.25, 0.33),
        new MarginTier(0.30, 1.50, 0.40));
    private int touchTicks = 3;
    private double touchWickFraction = 0.15;
    private double touchAtrFraction = 0.10;
    private double lowPriceCutoff = 0.01;
    private double lowPriceTolerancePct = 0.20;
    private double minTolerancePct = 0.05;
    private long entrySettleMs = 2000;
    private int cooldownMinutes = 30;
    private int openerThreads = 4;

    public double getPositionSizeUsdt() { return positionSizeUsdt; }
    public void setPositionSizeUsdt(double v) { this.positionSizeUsdt = v; }

    public int getLeverage() { return leverage; }
    public void setLeverage(int leverage) { this.leverage = leverage; }

    public int getMaxConcurrentPositions() { return maxConcurrentPositions; }
    public void setMaxConcurrentPositions(int v) { this.maxConcurrentPositions = v; }

    public double getSlPct() { return slPct; }
    public void setSlPct(double slPct) { this.slPct = slPct; }

    public double getSlAtrMult() { return slAtrMult; }
    public void setSlAtrMult(double slAtrMult) { this.slAtrMult = slAtrMult; }

    public double getTpPct() { return tpPct; }
    public void setTpPct(double tpPct) { this.tpPct = tpPct; }

    public double getTailFraction() { return tailFraction; }
    public void setTailFraction(double tailFraction) { this.tailFraction = tailFraction; }

    public List<MarginTier> getMarginTiers() { return marginTiers; }
    public void setMarginTiers(List<MarginTier> marginTiers) { this.marginTiers = marginTiers; }

    public int getTouchTicks() { return touchTicks; }
    public void setTouchTicks(int touchTicks) { this.touchTicks = touchTicks; }

    public double getTouchWickFraction() { return touchWickFraction; }
    public void setTouchWickFraction(double v) { this.touchWickFraction = v; }

    public double getTouchAtrFraction() { return touchAtrFraction; }
    public void setTouchAtrFraction(double v) { this.touchAtrFraction = v; }

    public double getLowPriceCutoff() { return lowPriceCutoff; }
    public void setLowPriceCutoff(double v) { this.lowPriceCutoff = v; }

    public double getLowPriceTolerancePct() { return lowPriceTolerancePct; }
    public void setLowPriceTolerancePct(double v) { this.lowPriceTolerancePct = v; }

    public double getMinTolerancePct() { return minTolerancePct; }
    public void setMinTolerancePct(double v) { this.minTolerancePct = v; }

    public long getEntrySettleMs() { return entrySettleMs; }
    public void setEntrySettleMs(long entrySettleMs) { this.entrySettleMs = entrySettleMs; }

    public int getCooldownMinutes() { return cooldownMinutes; }
    public void setCooldownMinutes(int cooldownMinutes) { this.cooldownMinutes = cooldownMinutes; }

    public int getOpenerThreads() { return openerThreads; }
    public void setOpenerThreads(int openerThreads) { this.openerThreads = openerThreads; }

    public double riskReward() {
        return slPct > 0 ? tpPct / slPct : Double.NaN;
    }

    /**
     * Best tier whose margin requirement {@code scoreMargin} meets, or null for the base parameters.
     */
    public MarginTier tierFor(double scoreMargin) {
        MarginTier best = null;
        for (MarginTier tier : marginTiers) {
            if (scoreMargin >= tier.getMinMargin() && (best == null || tier.getMinMargin() > best.getMinMargin())) {
                best = tier;
            }
        }
        return best;
    }

    /**
     * Score-above-threshold tier: larger targets and deeper tail entries for stronger signals.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarginTier {
        private double minMargin;
        private double tpMultiplier = 1.0;
        private double tailFraction = 0.25;

        public MarginTier() {
        }

        public MarginTier(double minMargin, double tpMultiplier, double tailFraction) {
            this.minMargin = minMargin;
            this.tpMultiplier = tpMultiplier;
            this.tailFraction = tailFraction;
        }

        public double getMinMargin() { return minMargin; }
        public void setMinMargin(double minMargin) { this.minMargin = minMargin; }

        public double getTpMultiplier() { return tpMultiplier; }
        public void setTpMultiplier(double tpMultiplier) { this.tpMultiplier = tpMultiplier; }

        public double getTailFraction() { return tailFraction; }
        public void setTailFraction(double tailFraction) { this.tailFraction = tailFraction; }
    }
}
