package com.wickscan.engine.score;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wickscan.core.model.Timeframe;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoreSettings {

    // Higher timeframe trend
    private Timeframe htfTimeframe = Timeframe.M15;
    private int htfBars = 80;
    private int trendSmaPeriod = 50;
    private int trendAtrPeriod = 14;
    private int trendLookback = 5;
    private double strongCounterTrend = 1.5;
    private double counterTrendWeight = 0.30;
    private double alignmentBonus = 0.05;

    // Reference asset
    private String referenceSymbol = "BTCUSDT";
    private int referenceLookbackBars = 15;
    private double marketVetoPct = 0.8;
    private double referenceWeight = 0.25;

    // Weighted sum
    private double baseScore = 1.50;
    private double wickWeight = 0.15;
    private double wickExcessCap = 3.0;
    private double spikeWeight = 0.25;
    private double spikeExcessCap = 2.0;
    private double meanReversionFreeAtr = 0.5;
    private double meanReversionWeight = 0.10;
    private double missingHtfPenalty = 0.10;
    private double extraPassBonus = 0.05;
    private double longBias = 0.05;

    public Timeframe getHtfTimeframe() { return htfTimeframe; }
    public void setHtfTimeframe(Timeframe htfTimeframe) { this.htfTimeframe = htfTimeframe; }

    public int getHtfBars() { return htfBars; }
    public void setHtfBars(int htfBars) { this.htfBars = htfBars; }

    public int getTrendSmaPeriod() { return trendSmaPeriod; }
    public void setTrendSmaPeriod(int v) { this.trendSmaPeriod = v; }

    public int getTrendAtrPeriod() { return trendAtrPeriod; }
    public void setTrendAtrPeriod(int v) { this.trendAtrPeriod = v; }

    public int getTrendLookback() { return trendLookback; }
    public void setTrendLookback(int v) { this.trendLookback = v; }

    public double getStrongCounterTrend() { return strongCounterTrend; }
    public void setStrongCounterTrend(double v) { this.strongCounterTrend = v; }

    public double getCounterTrendWeight() { return counterTrendWeight; }
    public void setCounterTrendWeight(double v) { this.counterTrendWeight = v; }

    public double getAlignmentBonus() { return alignmentBonus; }
    public void setAlignmentBonus(double v) { this.alignmentBonus = v; }

    public String getReferenceSymbol() { return referenceSymbol; }
    public void setReferenceSymbol(String v) { this.referenceSymbol = v; }

    public int getReferenceLookbackBars() { return referenceLookbackBars; }
    public void setReferenceLookbackBars(int v) { this.referenceLookbackBars = v; }

    public double getMarketVetoPct() { return marketVetoPct; }
    public void setMarketVetoPct(double v) { this.marketVetoPct = v; }

    public double getReferenceWeight() { return referenceWeight; }
    public void setReferenceWeight(double v) { this.referenceWeight = v; }

    public double getBaseScore() { return baseScore; }
    public void setBaseScore(double v) { this.baseScore = v; }

    public double getWickWeight() { return wickWeight; }
    public void setWickWeight(double v) { this.wickWeight = v; }

    public double getWickExcessCap() { return wickExcessCap; }
    public void setWickExcessCap(double v) { this.wickExcessCap = v; }

    public double getSpikeWeight() { return spikeWeight; }
    public void setSpikeWeight(double v) { this.spikeWeight = v; }

    public double getSpikeExcessCap() { return spikeExcessCap; }
    public void setSpikeExcessCap(double v) { this.spikeExcessCap = v; }

    public double getMeanReversionFreeAtr() { return meanReversionFreeAtr; }
    public void setMeanReversionFreeAtr(double v) { this.meanReversionFreeAtr = v; }

    public double getMeanReversionWeight() { return meanReversionWeight; }
    public void setMeanReversionWeight(double v) { this.meanReversionWeight = v; }

    public double getMissingHtfPenalty() { return missingHtfPenalty; }
    public void setMissingHtfPenalty(double v) { this.missingHtfPenalty = v; }

    public double getExtraPassBonus() { return extraPassBonus; }
    public void setExtraPassBonus(double v) { this.extraPassBonus = v; }

    public double getLongBias() { return longBias; }
    public void setLongBias(double v) { this.longBias = v; }
}
