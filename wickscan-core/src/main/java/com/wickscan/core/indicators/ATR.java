package com.wickscan.core.indicators;

import com.wickscan.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Average True Range with Wilder smoothing.
 */
public final class ATR {

    private ATR() {}

    /**
     * ATR for every bar. Warmup bars (before {@code period - 1}) are NaN.
     */
    public static double[] calculate(List<Candle> candles, int period) {
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period + 1) {
            return result;
        }

        double[] tr = trueRange(candles);

        double seed = 0;
        for (int i = 0; i < period; i++) {
            seed += tr[i];
        }
        result[period - 1] = seed / period;

        for (int i = period; i < n; i++) {
            result[i] = (result[i - 1] * (period - 1) + tr[i]) / period;
        }
        return result;
    }

    /**
     * ATR at the given bar, NaN during warmup or for an out-of-range index.
     */
    public static double at(List<Candle> candles, int period, int barIndex) {
        if (barIndex < 0 || barIndex >= candles.size()) {
            return Double.NaN;
        }
        return calculate(candles.subList(0, barIndex + 1), period)[barIndex];
    }

    /**
     * ATR of the last bar.
     */
    public static double latest(List<Candle> candles, int period) {
        return at(candles, period, candles.size() - 1);
    }

    static double[] trueRange(List<Candle> candles) {
        int n = candles.size();
        double[] tr = new double[n];
        if (n == 0) {
            return tr;
        }
        tr[0] = candles.get(0).range();
        for (int i = 1; i < n; i++) {
            Candle curr = candles.get(i);
            double prevClose = candles.get(i - 1).close();
            tr[i] = Math.max(curr.range(),
                Math.max(Math.abs(curr.high() - prevClose), Math.abs(curr.low() - prevClose)));
        }
        return tr;
    }
}
