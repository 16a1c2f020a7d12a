package com.wickscan.engine.fetch;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of the fetcher. Reset by the scan that reads them.
 */
public class FetchStats {

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public record Snapshot(long requests, long retries, long timeouts, long fallbacks, long failures) {
        @Override
        public String toString() {
            return String.format("req=%d retry=%d timeout=%d fallback=%d fail=%d",
                requests, retries, timeouts, fallbacks, failures);
        }
    }

    void request() { requests.incrementAndGet(); }
    void retry() { retries.incrementAndGet(); }
    void timeout() { timeouts.incrementAndGet(); }
    void fallback() { fallbacks.incrementAndGet(); }
    void failure() { failures.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(requests.get(), retries.get(), timeouts.get(), fallbacks.get(), failures.get());
    }

    /**
     * Read and zero all counters.
     */
    public Snapshot drain() {
        return new Snapshot(requests.getAndSet(0), retries.getAndSet(0), timeouts.getAndSet(0),
            fallbacks.getAndSet(0), failures.getAndSet(0));
    }
}
