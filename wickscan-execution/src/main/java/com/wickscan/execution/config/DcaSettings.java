package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wickscan.core.model.Timeframe;

import java.util.List;

/**
 * Range-bound averaging strategy on a single symbol.
 * Percent fields are price percent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DcaSettings {

    private String symbol = "EURCUSDT";
    private Timeframe entryTimeframe = Timeframe.M5;
    private Timeframe rangeTimeframe = Timeframe.H1;
    private int entryBars = 120;

    // Ranges
    private int strategicLookbackHours = 2160;
    private int maxRangeBars = 1500;
    private int tacticalLookbackHours = 48;
    private double quantileLower = 0.025;
    private double quantileUpper = 0.975;
    private double rangeMinAtrMult = 1.5;
    private int rangeEmaPeriod = 50;
    private int rangeAtrPeriod = 14;
    private int rangeRebuildMinutes = 15;

    // Entry score
    private double borderBandPct = 0.15;
    private double entryScoreThreshold = 0.55;
    private double weightBorder = 0.45;
    private double weightRsi = 0.15;
    private double weightEmaDev = 0.20;
    private double weightSupertrend = 0.10;
    private double weightVolume = 0.10;
    private int rsiPeriod = 14;
    private int emaPeriod = 20;
    private int atrPeriod = 14;
    private int supertrendPeriod = 10;
    private double supertrendMultiplier = 3.0;
    private int volWindow = 50;

    // Margin plan
    private double bank = 1500;
    private int levels = 7;
    private double cumDepositFracAtFull = 2.0 / 3.0;
    private double thinRangeAtr = 8;
    private double wideRangeAtr = 20;
    private double growthThin = 1.5;
    private double growthNormal = 2.0;
    private double growthWide = 2.5;
    private int leverage = 20;
    private double tpPct = 1.0;

    // Ladder, breakout and retest
    private List<Double> ladderFractions = List.of(0.15, 0.30, 0.45, 0.60, 0.80, 1.00);
    private double ladderMinGapPct = 0.05;
    private List<Double> fallbackAtrMultiples = List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0);
    private double reentryBandPct = 0.10;

    // Trailing stop
    private List<TrailStage> trailStages = List.of(
        new TrailStage(0.50, 0.20),
        new TrailStage(0.70, 0.40),
        new TrailStage(0.85, 0.60));
    private double chandelierAtrMult = 3.0;
    private int minTrailTicks = 5;
    private double maintenanceMarginRatio = 0.005;

    public String getSymbol() { return symbol; }
    public void setSymbol(String symbol) { this.symbol = symbol; }

    public Timeframe getEntryTimeframe() { return entryTimeframe; }
    public void setEntryTimeframe(Timeframe v) { this.entryTimeframe = v; }

    public Timeframe getRangeTimeframe() { return rangeTimeframe; }
    public void setRangeTimeframe(Timeframe v) { this.rangeTimeframe = v; }

    public int getEntryBars() { return entryBars; }
    public void setEntryBars(int entryBars) { this.entryBars = entryBars; }

    public int getStrategicLookbackHours() { return strategicLookbackHours; }
    public void setStrategicLookbackHours(int v) { this.strategicLookbackHours = v; }

    public int getMaxRangeBars() { return maxRangeBars; }
    public void setMaxRangeBars(int v) { this.maxRangeBars = v; }

    public int getTacticalLookbackHours() { return tacticalLookbackHours; }
    public void setTacticalLookbackHours(int v) { this.tacticalLookbackHours = v; }

    public double getQuantileLower() { return quantileLower; }
    public void setQuantileLower(double v) { this.quantileLower = v; }

    public double getQuantileUpper() { return quantileUpper; }
    public void setQuantileUpper(double v) { this.quantileUpper = v; }

    public double getRangeMinAtrMult() { return rangeMinAtrMult; }
    public void setRangeMinAtrMult(double v) { this.rangeMinAtrMult = v; }

    public int getRangeEmaPeriod() { return rangeEmaPeriod; }
    public void setRangeEmaPeriod(int v) { this.rangeEmaPeriod = v; }

    public int getRangeAtrPeriod() { return rangeAtrPeriod; }
    public void setRangeAtrPeriod(int v) { this.rangeAtrPeriod = v; }

    public int getRangeRebuildMinutes() { return rangeRebuildMinutes; }
    public void setRangeRebuildMinutes(int v) { this.rangeRebuildMinutes = v; }

    public double getBorderBandPct() { return borderBandPct; }
    public void setBorderBandPct(double v) { this.borderBandPct = v; }

    public double getEntryScoreThreshold() { return entryScoreThreshold; }
    public void setEntryScoreThreshold(double v) { this.entryScoreThreshold = v; }

    public double getWeightBorder() { return weightBorder; }
    public void setWeightBorder(double v) { this.weightBorder = v; }

    public double getWeightRsi() { return weightRsi; }
    public void setWeightRsi(double v) { this.weightRsi = v; }

    public double getWeightEmaDev() { return weightEmaDev; }
    public void setWeightEmaDev(double v) { this.weightEmaDev = v; }

    public double getWeightSupertrend() { return weightSupertrend; }
    public void setWeightSupertrend(double v) { this.weightSupertrend = v; }

    public double getWeightVolume() { return weightVolume; }
    public void setWeightVolume(double v) { this.weightVolume = v; }

    public int getRsiPeriod() { return rsiPeriod; }
    public void setRsiPeriod(int v) { this.rsiPeriod = v; }

    public int getEmaPeriod() { return emaPeriod; }
    public void setEmaPeriod(int v) { this.emaPeriod = v; }

    public int getAtrPeriod() { return atrPeriod; }
    public void setAtrPeriod(int v) { this.atrPeriod = v; }

    public int getSupertrendPeriod() { return supertrendPeriod; }
    public void setSupertrendPeriod(int v) { this.supertrendPeriod = v; }

    public double getSupertrendMultiplier() { return supertrendMultiplier; }
    public void setSupertrendMultiplier(double v) { this.supertrendMultiplier = v; }

    public int getVolWindow() { return volWindow; }
    public void setVolWindow(int v) { this.volWindow = v; }

    public double getBank() { return bank; }
    public void setBank(double bank) { this.bank = bank; }

    public int getLevels() { return levels; }
    public void setLevels(int levels) { this.levels = levels; }

    public double getCumDepositFracAtFull() { return cumDepositFracAtFull; }
    public void setCumDepositFracAtFull(double v) { this.cumDepositFracAtFull = v; }

    public double getThinRangeAtr() { return thinRangeAtr; }
    public void setThinRangeAtr(double v) { this.thinRangeAtr = v; }

    public double getWideRangeAtr() { return wideRangeAtr; }
    public void setWideRangeAtr(double v) { this.wideRangeAtr = v; }

    public double getGrowthThin() { return growthThin; }
    public void setGrowthThin(double v) { this.growthThin = v; }

    public double getGrowthNormal() { return growthNormal; }
    public void setGrowthNormal(double v) { this.growthNormal = v; }

    public double getGrowthWide() { return growthWide; }
    public void setGrowthWide(double v) { this.growthWide = v; }

    public int getLeverage() { return leverage; }
    public void setLeverage(int leverage) { this.leverage = leverage; }

    public double getTpPct() { return tpPct; }
    public void setTpPct(double tpPct) { this.tpPct = tpPct; }

    public List<Double> getLadderFractions() { return ladderFractions; }
    public void setLadderFractions(List<Double> v) { this.ladderFractions = v; }

    public double getLadderMinGapPct() { return ladderMinGapPct; }
    public void setLadderMinGapPct(double v) { this.ladderMinGapPct = v; }

    public List<Double> getFallbackAtrMultiples() { return fallbackAtrMultiples; }
    public void setFallbackAtrMultiples(List<Double> v) { this.fallbackAtrMultiples = v; }

    public double getReentryBandPct() { return reentryBandPct; }
    public void setReentryBandPct(double v) { this.reentryBandPct = v; }

    public List<TrailStage> getTrailStages() { return trailStages; }
    public void setTrailStages(List<TrailStage> v) { this.trailStages = v; }

    public double getChandelierAtrMult() { return chandelierAtrMult; }
    public void setChandelierAtrMult(double v) { this.chandelierAtrMult = v; }

    public int getMinTrailTicks() { return minTrailTicks; }
    public void setMinTrailTicks(int v) { this.minTrailTicks = v; }

    public double getMaintenanceMarginRatio() { return maintenanceMarginRatio; }
    public void setMaintenanceMarginRatio(double v) { this.maintenanceMarginRatio = v; }

    /**
     * Growth factor of the margin plan for a strategic range {@code widthAtr} ATRs wide.
     * Thin ranges break more easily, so later steps grow less.
     */
    public double growthFor(double widthAtr) {
        if (!Double.isFinite(widthAtr)) {
            return growthNormal;
        }
        if (widthAtr < thinRangeAtr) {
            return growthThin;
        }
        if (widthAtr > wideRangeAtr) {
            return growthWide;
        }
        return growthNormal;
    }

    /**
     * Trail stage: armed once {@code arm} of the distance to target is covered, then locks
     * {@code lock} of that distance.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrailStage {
        private double arm;
        private double lock;

        public TrailStage() {
        }

        public TrailStage(double arm, double lock) {
            this.arm = arm;
            this.lock = lock;
        }

        public double getArm() { return arm; }
        public void setArm(double arm) { this.arm = arm; }

        public double getLock() { return lock; }
        public void setLock(double lock) { this.lock = lock; }
    }
}
