package com.wickscan.exchange.model;

/**
 * Listing metadata for one instrument.
 *
 * @param tickSize minimum price increment
 * @param contractType e.g. PERPETUAL; null for spot markets
 * @param active whether the market currently trades
 */
public record MarketInfo(
    String symbol,
    String baseAsset,
    String quoteAsset,
    double tickSize,
    String contractType,
    boolean active
) {
    public boolean isPerpetual() {
        return "PERPETUAL".equalsIgnoreCase(contractType);
    }
}
