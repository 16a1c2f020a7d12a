package com.wickscan.exchange.exception;

public class MarketNotFoundException extends ExchangeException {

    private final String symbol;

    public MarketNotFoundException(String symbol) {
        super("Unknown market: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
