package com.wickscan.core.indicators;

import java.util.Arrays;
import java.util.Collection;

/**
 * Empirical quantiles with linear interpolation between order statistics.
 */
public final class Quantiles {

    private Quantiles() {}

    /**
     * The {@code q}-quantile (0..1) of {@code values}. NaN entries are ignored;
     * returns NaN when nothing is left.
     */
    public static double quantile(double[] values, double q) {
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("Quantile level out of range: " + q);
        }
        double[] sorted = Arrays.stream(values).filter(Double::isFinite).sorted().toArray();
        if (sorted.length == 0) {
            return Double.NaN;
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        double frac = pos - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    public static double quantile(Collection<Double> values, double q) {
        return quantile(values.stream().mapToDouble(Double::doubleValue).toArray(), q);
    }
}
