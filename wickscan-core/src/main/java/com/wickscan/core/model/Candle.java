package com.wickscan.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One OHLCV bar as returned by the exchange klines endpoint.
 * The timestamp is the bar open time in epoch milliseconds.
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {

    /**
     * Size of the open-close body.
     */
    @JsonIgnore
    public double bodySize() {
        return Math.abs(close - open);
    }

    /**
     * Full high-low range of the bar.
     */
    @JsonIgnore
    public double range() {
        return high - low;
    }

    @JsonIgnore
    public double bodyHigh() {
        return Math.max(open, close);
    }

    @JsonIgnore
    public double bodyLow() {
        return Math.min(open, close);
    }

    /**
     * Distance from the top of the body to the high.
     */
    @JsonIgnore
    public double upperWick() {
        return high - bodyHigh();
    }

    /**
     * Distance from the bottom of the body to the low.
     */
    @JsonIgnore
    public double lowerWick() {
        return bodyLow() - low;
    }

    @JsonIgnore
    public boolean isBullish() {
        return close >= open;
    }

    /**
     * True when every price and the volume are finite numbers.
     */
    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(open) && Double.isFinite(high) && Double.isFinite(low)
            && Double.isFinite(close) && Double.isFinite(volume);
    }
}
