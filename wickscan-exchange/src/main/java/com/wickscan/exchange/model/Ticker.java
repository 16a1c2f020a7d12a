package com.wickscan.exchange.model;

/**
 * Latest price snapshot. Bid/ask may be NaN when the venue omits them.
 */
public record Ticker(
    String symbol,
    double last,
    double bid,
    double ask,
    double quoteVolume,
    long timestamp
) {
    public boolean hasLast() {
        return Double.isFinite(last) && last > 0;
    }
}
