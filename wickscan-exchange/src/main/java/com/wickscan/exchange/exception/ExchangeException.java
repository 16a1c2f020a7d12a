package com.wickscan.exchange.exception;

public class ExchangeException extends Exception {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same request later may succeed.
     */
    public boolean isTransient() {
        return false;
    }
}
