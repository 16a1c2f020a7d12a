package com.wickscan.core.indicators;

import com.wickscan.core.model.Candle;

import java.util.List;

/**
 * Supertrend - ATR band trend follower. Trend is 1 (up) or -1 (down), NaN during warmup.
 */
public final class Supertrend {

    private Supertrend() {}

    public record Result(double[] upperBand, double[] lowerBand, double[] trend) {

        public double trendAt(int index) {
            return index >= 0 && index < trend.length ? trend[index] : Double.NaN;
        }

        /**
         * True when the trend direction changed on {@code index}.
         */
        public boolean flippedAt(int index) {
            if (index < 1 || index >= trend.length) {
                return false;
            }
            double prev = trend[index - 1];
            double curr = trend[index];
            return !Double.isNaN(prev) && !Double.isNaN(curr) && prev != curr;
        }
    }

    public static Result calculate(List<Candle> candles, int period, double multiplier) {
        int size = candles.size();
        double[] upper = new double[size];
        double[] lower = new double[size];
        double[] trend = new double[size];

        for (int i = 0; i < Math.min(period, size); i++) {
            upper[i] = Double.NaN;
            lower[i] = Double.NaN;
            trend[i] = Double.NaN;
        }
        if (size <= period) {
            return new Result(upper, lower, trend);
        }

        double[] atr = ATR.calculate(candles, period);

        Candle c = candles.get(period);
        double mid = (c.high() + c.low()) / 2;
        upper[period] = mid + multiplier * atr[period];
        lower[period] = mid - multiplier * atr[period];
        trend[period] = c.close() > mid ? 1 : -1;

        for (int i = period + 1; i < size; i++) {
            c = candles.get(i);
            double prevClose = candles.get(i - 1).close();
            mid = (c.high() + c.low()) / 2;
            double basicUpper = mid + multiplier * atr[i];
            double basicLower = mid - multiplier * atr[i];

            upper[i] = (basicUpper < upper[i - 1] || prevClose > upper[i - 1]) ? basicUpper : upper[i - 1];
            lower[i] = (basicLower > lower[i - 1] || prevClose < lower[i - 1]) ? basicLower : lower[i - 1];

            if (trend[i - 1] < 0 && c.close() > upper[i - 1]) {
                trend[i] = 1;
            } else if (trend[i - 1] > 0 && c.close() < lower[i - 1]) {
                trend[i] = -1;
            } else {
                trend[i] = trend[i - 1];
            }
        }
        return new Result(upper, lower, trend);
    }
}
