package com.wickscan.core;

/**
 * Thrown at startup when a configured trading symbol cannot be found on the exchange.
 * The engine refuses to start.
 */
public class SymbolResolutionException extends RuntimeException {

    private final String symbol;

    public SymbolResolutionException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public SymbolResolutionException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
