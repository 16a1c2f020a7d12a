package com.wickscan.engine.gate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wickscan.core.model.Side;

/**
 * Thresholds of the wick-spike gate. Longs use the stricter wick ratio and the lower spike ceiling.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GateSettings {

    private int atrPeriod = 14;
    private int volWindow = 50;
    private int smaPeriod = 20;
    private double minBodyAtrFraction = 0.05;
    private double wickRatioShort = 2.0;
    private double wickRatioLong = 2.5;
    private double minSpikeAtr = 1.8;
    private double maxSpikeAtrShort = 6.0;
    private double maxSpikeAtrLong = 4.5;
    private double volZThreshold = 2.0;
    private double minPrice = 0.001;
    private int maxPositionsPerSymbol = 1;
    private int maxBarAgeBars = 2;

    public int getAtrPeriod() { return atrPeriod; }
    public void setAtrPeriod(int atrPeriod) { this.atrPeriod = atrPeriod; }

    public int getVolWindow() { return volWindow; }
    public void setVolWindow(int volWindow) { this.volWindow = volWindow; }

    public int getSmaPeriod() { return smaPeriod; }
    public void setSmaPeriod(int smaPeriod) { this.smaPeriod = smaPeriod; }

    public double getMinBodyAtrFraction() { return minBodyAtrFraction; }
    public void setMinBodyAtrFraction(double v) { this.minBodyAtrFraction = v; }

    public double getWickRatioShort() { return wickRatioShort; }
    public void setWickRatioShort(double v) { this.wickRatioShort = v; }

    public double getWickRatioLong() { return wickRatioLong; }
    public void setWickRatioLong(double v) { this.wickRatioLong = v; }

    public double getMinSpikeAtr() { return minSpikeAtr; }
    public void setMinSpikeAtr(double v) { this.minSpikeAtr = v; }

    public double getMaxSpikeAtrShort() { return maxSpikeAtrShort; }
    public void setMaxSpikeAtrShort(double v) { this.maxSpikeAtrShort = v; }

    public double getMaxSpikeAtrLong() { return maxSpikeAtrLong; }
    public void setMaxSpikeAtrLong(double v) { this.maxSpikeAtrLong = v; }

    public double getVolZThreshold() { return volZThreshold; }
    public void setVolZThreshold(double v) { this.volZThreshold = v; }

    public double getMinPrice() { return minPrice; }
    public void setMinPrice(double minPrice) { this.minPrice = minPrice; }

    public int getMaxPositionsPerSymbol() { return maxPositionsPerSymbol; }
    public void setMaxPositionsPerSymbol(int v) { this.maxPositionsPerSymbol = v; }

    public int getMaxBarAgeBars() { return maxBarAgeBars; }
    public void setMaxBarAgeBars(int v) { this.maxBarAgeBars = v; }

    public double minWickRatio(Side side) {
        return side == Side.LONG ? wickRatioLong : wickRatioShort;
    }

    public double maxSpikeAtr(Side side) {
        return side == Side.LONG ? maxSpikeAtrLong : maxSpikeAtrShort;
    }

    /**
     * Bars needed before the signal bar can be evaluated.
     */
    public int requiredBars() {
        return atrPeriod + volWindow + 1;
    }
}
