package com.wickscan.engine.threshold;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdSettings {

    private double base = 1.80;
    private double scoreMin = 1.40;
    private double scoreMax = 2.40;
    private double pad = 0.02;
    private double smoothing = 0.40;
    private double maxJump = 0.15;
    private int minSample = 20;
    private double explorationStep = 0.02;
    private int explorationMaxVetoes = 5;
    private double longOffset = 0.10;
    private double earlyStopBump = 0.05;

    // Sample-size tiers of the quantile level
    private int midSample = 40;
    private int largeSample = 150;
    private double smallQuantile = 0.90;
    private double midQuantile = 0.95;
    private double largeQuantile = 0.97;

    public double getBase() { return base; }
    public void setBase(double base) { this.base = base; }

    public double getScoreMin() { return scoreMin; }
    public void setScoreMin(double scoreMin) { this.scoreMin = scoreMin; }

    public double getScoreMax() { return scoreMax; }
    public void setScoreMax(double scoreMax) { this.scoreMax = scoreMax; }

    public double getPad() { return pad; }
    public void setPad(double pad) { this.pad = pad; }

    public double getSmoothing() { return smoothing; }
    public void setSmoothing(double smoothing) { this.smoothing = smoothing; }

    public double getMaxJump() { return maxJump; }
    public void setMaxJump(double maxJump) { this.maxJump = maxJump; }

    public int getMinSample() { return minSample; }
    public void setMinSample(int minSample) { this.minSample = minSample; }

    public double getExplorationStep() { return explorationStep; }
    public void setExplorationStep(double v) { this.explorationStep = v; }

    public int getExplorationMaxVetoes() { return explorationMaxVetoes; }
    public void setExplorationMaxVetoes(int v) { this.explorationMaxVetoes = v; }

    public double getLongOffset() { return longOffset; }
    public void setLongOffset(double longOffset) { this.longOffset = longOffset; }

    public double getEarlyStopBump() { return earlyStopBump; }
    public void setEarlyStopBump(double v) { this.earlyStopBump = v; }

    public int getMidSample() { return midSample; }
    public void setMidSample(int midSample) { this.midSample = midSample; }

    public int getLargeSample() { return largeSample; }
    public void setLargeSample(int largeSample) { this.largeSample = largeSample; }

    public double getSmallQuantile() { return smallQuantile; }
    public void setSmallQuantile(double v) { this.smallQuantile = v; }

    public double getMidQuantile() { return midQuantile; }
    public void setMidQuantile(double v) { this.midQuantile = v; }

    public double getLargeQuantile() { return largeQuantile; }
    public void setLargeQuantile(double v) { this.largeQuantile = v; }

    /**
     * Quantile level for a sample of {@code n} scores: lenient for small samples, strict for large ones.
     */
    public double quantileLevel(int n) {
        if (n < midSample) {
            return smallQuantile;
        }
        if (n < largeSample) {
            return midQuantile;
        }
        return largeQuantile;
    }
}
