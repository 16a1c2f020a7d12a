package com.wickscan.core.indicators;

import java.util.Arrays;

/**
 * Exponential moving average seeded with the SMA of the first {@code period} values.
 */
public final class EMA {

    private EMA() {}

    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        double multiplier = 2.0 / (period + 1);

        double sum = 0;
        for (int i = 0; i < period; i++) {
            sum += values[i];
        }
        result[period - 1] = sum / period;

        for (int i = period; i < n; i++) {
            result[i] = (values[i] - result[i - 1]) * multiplier + result[i - 1];
        }
        return result;
    }

    public static double latest(double[] values, int period) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return calculate(values, period)[values.length - 1];
    }
}
