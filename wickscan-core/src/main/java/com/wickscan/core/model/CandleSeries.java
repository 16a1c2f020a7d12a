package com.wickscan.core.model;

import java.util.List;

/**
 * Immutable bar sequence keyed by symbol and timeframe, oldest bar first.
 */
public record CandleSeries(String symbol, Timeframe timeframe, List<Candle> candles) {

    public CandleSeries {
        candles = List.copyOf(candles);
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public Candle last() {
        return candles.get(candles.size() - 1);
    }

    public Candle get(int index) {
        return candles.get(index);
    }

    /**
     * Whether the bar at {@code index} has closed at {@code nowMs}.
     */
    public boolean isClosed(int index, long nowMs) {
        return candles.get(index).timestamp() + timeframe.toMillis() <= nowMs;
    }

    /**
     * Bars up to and including {@code index}.
     */
    public CandleSeries upTo(int index) {
        return new CandleSeries(symbol, timeframe, candles.subList(0, index + 1));
    }

    public double[] closes() {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = candles.get(i).close();
        }
        return out;
    }

    public double[] volumes() {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = candles.get(i).volume();
        }
        return out;
    }
}
