package com.wickscan.core.indicators;

import java.util.Arrays;

/**
 * Relative Strength Index with Wilder smoothing, computed on closes.
 */
public final class RSI {

    private RSI() {}

    /**
     * RSI for every bar. Values before {@code period} are NaN.
     */
    public static double[] calculate(double[] closes, int period) {
        int n = closes.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period + 1) {
            return result;
        }

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }
        avgGain /= period;
        avgLoss /= period;
        result[period] = rsi(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double change = closes[i] - closes[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
            result[i] = rsi(avgGain, avgLoss);
        }
        return result;
    }

    public static double latest(double[] closes, int period) {
        if (closes.length == 0) {
            return Double.NaN;
        }
        return calculate(closes, period)[closes.length - 1];
    }

    private static double rsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100;
        }
        return 100 - (100 / (1 + avgGain / avgLoss));
    }
}
