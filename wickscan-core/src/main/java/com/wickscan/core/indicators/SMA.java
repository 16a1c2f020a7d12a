package com.wickscan.core.indicators;

import java.util.Arrays;

/**
 * Simple moving average over a value array.
 */
public final class SMA {

    private SMA() {}

    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        double sum = 0;
        for (int i = 0; i < period; i++) {
            sum += values[i];
        }
        result[period - 1] = sum / period;

        for (int i = period; i < n; i++) {
            sum += values[i] - values[i - period];
            result[i] = sum / period;
        }
        return result;
    }

    /**
     * Average of the {@code period} values ending at {@code index}, NaN if there are not enough.
     */
    public static double at(double[] values, int period, int index) {
        if (period <= 0 || index < period - 1 || index >= values.length) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = index - period + 1; i <= index; i++) {
            sum += values[i];
        }
        return sum / period;
    }
}
