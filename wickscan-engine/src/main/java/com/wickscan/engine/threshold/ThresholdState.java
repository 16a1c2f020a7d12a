package com.wickscan.engine.threshold;

/**
 * Persisted acceptance threshold.
 *
 * @param lastUpdate epoch millis of the last end-of-scan update, 0 if never updated
 */
public record ThresholdState(double value, long lastUpdate, double lastDelta) {

    public static ThresholdState initial(double base) {
        return new ThresholdState(base, 0L, 0.0);
    }
}
