package com.wickscan.engine.fetch;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Timeframe;
import com.wickscan.exchange.ExchangeGateway;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.exception.ExchangeUnavailableException;
import com.wickscan.exchange.exception.RateLimitException;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency access to exchange market data.
 *
 * Every exchange call of the engine goes through {@link #call(String, ExchangeCall)}: each attempt
 * runs with a timeout, transient failures are retried with exponential backoff, permanent ones are
 * returned immediately. Batch candle requests run on a fixed pool of {@code concurrency} workers so
 * outbound request rate does not grow with the universe. A failed symbol is simply missing from the
 * batch result.
 */
public class MarketDataFetcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarketDataFetcher.class);

    /**
     * One exchange request.
     */
    @FunctionalInterface
    public interface ExchangeCall<T> {
        T execute() throws ExchangeException;
    }

    private final ExchangeGateway gateway;
    private final FetchSettings settings;
    private final FetchStats stats = new FetchStats();
    private final ExecutorService workers;
    private final ExecutorService callExecutor;

    public MarketDataFetcher(ExchangeGateway gateway, FetchSettings settings) {
        this.gateway = gateway;
        this.settings = settings;
        this.workers = Executors.newFixedThreadPool(Math.max(1, settings.getConcurrency()),
            daemonThreads("fetch-worker"));
        this.callExecutor = Executors.newCachedThreadPool(daemonThreads("fetch-call"));
    }

    public ExchangeGateway getGateway() {
        return gateway;
    }

    public FetchStats getStats() {
        return stats;
    }

    // ========== Batch ==========

    /**
     * Most recent {@code limit} bars for every symbol, at most {@code concurrency} requests in flight.
     * Symbols whose data could not be fetched are absent from the result.
     *
     * @throws InterruptedException if the calling scan is cancelled; unfinished requests are cancelled
     */
    public Map<String, CandleSeries> fetchCandles(Collection<String> symbols, Timeframe timeframe, int limit)
            throws InterruptedException {
        List<String> ordered = new ArrayList<>(symbols);
        List<Callable<Optional<CandleSeries>>> tasks = new ArrayList<>(ordered.size());
        for (String symbol : ordered) {
            tasks.add(() -> fetchCandles(symbol, timeframe, limit));
        }

        List<Future<Optional<CandleSeries>>> futures = workers.invokeAll(tasks);

        Map<String, CandleSeries> result = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get().ifPresent(series -> result.put(series.symbol(), series));
            } catch (ExecutionException e) {
                log.warn("Candle task for {} failed", ordered.get(i), e.getCause());
            } catch (CancellationException e) {
                log.debug("Candle task for {} cancelled", ordered.get(i));
            }
        }
        return result;
    }

    // ========== Single symbol ==========

    /**
     * Bars for one symbol with retries, then one smaller fallback request.
     * Empty when the symbol stays unavailable.
     */
    public Optional<CandleSeries> fetchCandles(String symbol, Timeframe timeframe, int limit) {
        try {
            List<Candle> bars = call(symbol + " " + timeframe, () -> gateway.fetchCandles(symbol, timeframe, limit));
            return Optional.of(new CandleSeries(symbol, timeframe, bars));
        } catch (ExchangeException e) {
            if (!e.isTransient() || limit <= settings.getFallbackLimit() || Thread.currentThread().isInterrupted()) {
                stats.failure();
                log.warn("Candles unavailable for {} {}: {}", symbol, timeframe, e.getMessage());
                return Optional.empty();
            }
        }

        stats.fallback();
        int fallbackLimit = settings.getFallbackLimit();
        try {
            List<Candle> bars = attempt(() -> gateway.fetchCandles(symbol, timeframe, fallbackLimit));
            log.debug("Fallback fetch for {} {} returned {} bars", symbol, timeframe, bars.size());
            return Optional.of(new CandleSeries(symbol, timeframe, bars));
        } catch (ExchangeException e) {
            stats.failure();
            log.warn("Candles unavailable for {} {} after fallback: {}", symbol, timeframe, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<Ticker> fetchTicker(String symbol) {
        try {
            return Optional.of(call(symbol + " ticker", () -> gateway.fetchTicker(symbol)));
        } catch (ExchangeException e) {
            stats.failure();
            log.warn("Ticker unavailable for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    public Map<String, Ticker> fetchTickers() throws ExchangeException {
        return call("tickers", gateway::fetchTickers);
    }

    public Map<String, MarketInfo> listMarkets() throws ExchangeException {
        return call("markets", gateway::listMarkets);
    }

    // ========== Retrying primitive ==========

    /**
     * Run {@code request} with per-attempt timeout, retrying transient failures up to
     * {@code maxRetries} times with exponential backoff.
     *
     * @throws ExchangeException the last failure once retries are exhausted, or a permanent failure
     */
    public <T> T call(String what, ExchangeCall<T> request) throws ExchangeException {
        ExchangeException last = null;
        for (int attemptNo = 0; attemptNo <= settings.getMaxRetries(); attemptNo++) {
            if (attemptNo > 0) {
                stats.retry();
                long delay = settings.backoffFor(attemptNo);
                if (last instanceof RateLimitException rl) {
                    delay = Math.max(delay, rl.getRetryAfterMs());
                }
                log.debug("Retry {}/{} for {} in {} ms: {}", attemptNo, settings.getMaxRetries(), what, delay,
                    last.getMessage());
                if (!sleep(delay)) {
                    throw new ExchangeUnavailableException("Interrupted while retrying " + what, last);
                }
            }
            try {
                return attempt(request);
            } catch (ExchangeException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                last = e;
            }
        }
        throw last;
    }

    private <T> T attempt(ExchangeCall<T> request) throws ExchangeException {
        stats.request();
        Future<T> future = callExecutor.submit(request::execute);
        try {
            return future.get(settings.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            stats.timeout();
            throw new ExchangeUnavailableException("Timed out after " + settings.getTimeoutMs() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExchangeUnavailableException("Interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExchangeException ee) {
                throw ee;
            }
            throw new ExchangeException("Unexpected failure: " + cause, cause);
        }
    }

    private static boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
        callExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
