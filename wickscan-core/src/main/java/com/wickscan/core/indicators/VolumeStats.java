package com.wickscan.core.indicators;

/**
 * Rolling statistics used to rank the volume of a bar against its recent history.
 */
public final class VolumeStats {

    private VolumeStats() {}

    /**
     * Z-score of {@code values[index]} against the {@code window} values ending at {@code index}
     * (sample standard deviation). Returns 0 when the window has no dispersion and NaN when
     * there is not enough history.
     */
    public static double zScore(double[] values, int window, int index) {
        if (window < 2 || index < window - 1 || index >= values.length) {
            return Double.NaN;
        }
        int from = index - window + 1;
        double mean = 0;
        for (int i = from; i <= index; i++) {
            mean += values[i];
        }
        mean /= window;

        double ss = 0;
        for (int i = from; i <= index; i++) {
            double d = values[i] - mean;
            ss += d * d;
        }
        double std = Math.sqrt(ss / (window - 1));
        if (std == 0 || !Double.isFinite(std)) {
            return 0;
        }
        return (values[index] - mean) / std;
    }
}
