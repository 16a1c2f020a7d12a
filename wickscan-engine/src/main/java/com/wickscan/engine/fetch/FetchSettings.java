package com.wickscan.engine.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Concurrency, timeout and retry parameters of the market data fetcher.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FetchSettings {

    private int concurrency = 10;
    private long timeoutMs = 8000;
    private int maxRetries = 3;
    private long initialBackoffMs = 400;
    private double backoffMultiplier = 2.0;
    private long maxBackoffMs = 5000;
    private int fallbackLimit = 66;

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public long getInitialBackoffMs() { return initialBackoffMs; }
    public void setInitialBackoffMs(long v) { this.initialBackoffMs = v; }

    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double v) { this.backoffMultiplier = v; }

    public long getMaxBackoffMs() { return maxBackoffMs; }
    public void setMaxBackoffMs(long v) { this.maxBackoffMs = v; }

    public int getFallbackLimit() { return fallbackLimit; }
    public void setFallbackLimit(int fallbackLimit) { this.fallbackLimit = fallbackLimit; }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public long backoffFor(int attempt) {
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }
}
