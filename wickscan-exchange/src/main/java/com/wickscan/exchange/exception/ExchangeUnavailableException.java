package com.wickscan.exchange.exception;

/**
 * Network failure, timeout or 5xx answer from the venue.
 */
public class ExchangeUnavailableException extends ExchangeException {

    public ExchangeUnavailableException(String message) {
        super(message);
    }

    public ExchangeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
