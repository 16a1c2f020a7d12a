package com.wickscan.exchange.paper;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Timeframe;
import com.wickscan.exchange.ExchangeGateway;
import com.wickscan.exchange.TickRounding;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.exception.ExchangeUnavailableException;
import com.wickscan.exchange.exception.MarketNotFoundException;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory venue. Markets, candles and tickers are fed by the caller; nothing touches the network.
 * Used for dry runs and as the test double of the engine.
 */
public class PaperExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeGateway.class);

    private final Map<String, MarketInfo> markets = new ConcurrentHashMap<>();
    private final Map<String, Ticker> tickers = new ConcurrentHashMap<>();
    private final Map<String, List<Candle>> candles = new ConcurrentHashMap<>();
    private final Map<String, ExchangeException> failures = new ConcurrentHashMap<>();
    private final AtomicInteger candleRequests = new AtomicInteger();
    private final AtomicBoolean connected = new AtomicBoolean();

    @Override
    public String getVenueName() {
        return "paper";
    }

    @Override
    public void connect() {
        connected.set(true);
        log.info("Paper venue connected with {} markets", markets.size());
    }

    @Override
    public void disconnect() {
        connected.set(false);
        log.info("Paper venue disconnected");
    }

    public boolean isConnected() {
        return connected.get();
    }

    // ========== Feeding ==========

    public PaperExchangeGateway addMarket(String symbol, String baseAsset, double tickSize) {
        markets.put(symbol, new MarketInfo(symbol, baseAsset, "USDT", tickSize, "PERPETUAL", true));
        return this;
    }

    public PaperExchangeGateway addMarket(MarketInfo market) {
        markets.put(market.symbol(), market);
        return this;
    }

    public void setTicker(Ticker ticker) {
        tickers.put(ticker.symbol(), ticker);
    }

    /**
     * Set last price, keeping the 24h volume of an earlier ticker.
     */
    public void setPrice(String symbol, double price) {
        Ticker prev = tickers.get(symbol);
        double volume = prev != null ? prev.quoteVolume() : 0;
        tickers.put(symbol, new Ticker(symbol, price, price, price, volume, System.currentTimeMillis()));
    }

    public void setCandles(String symbol, Timeframe timeframe, List<Candle> bars) {
        candles.put(key(symbol, timeframe), List.copyOf(bars));
    }

    /**
     * Make every following request for {@code symbol} fail with {@code error} until cleared.
     */
    public void failSymbol(String symbol, ExchangeException error) {
        failures.put(symbol, error);
    }

    public void clearFailure(String symbol) {
        failures.remove(symbol);
    }

    public int getCandleRequestCount() {
        return candleRequests.get();
    }

    // ========== Gateway ==========

    @Override
    public Map<String, MarketInfo> listMarkets() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(markets));
    }

    @Override
    public Map<String, Ticker> fetchTickers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tickers));
    }

    @Override
    public Ticker fetchTicker(String symbol) throws ExchangeException {
        checkFailure(symbol);
        Ticker ticker = tickers.get(symbol);
        if (ticker == null) {
            throw new ExchangeUnavailableException("No paper ticker for " + symbol);
        }
        return ticker;
    }

    @Override
    public List<Candle> fetchCandles(String symbol, Timeframe timeframe, int limit) throws ExchangeException {
        candleRequests.incrementAndGet();
        checkFailure(symbol);
        List<Candle> bars = candles.get(key(symbol, timeframe));
        if (bars == null) {
            if (!markets.containsKey(symbol)) {
                throw new MarketNotFoundException(symbol);
            }
            return List.of();
        }
        int from = Math.max(0, bars.size() - limit);
        return new ArrayList<>(bars.subList(from, bars.size()));
    }

    @Override
    public double roundToTick(String symbol, double price) throws ExchangeException {
        return TickRounding.round(price, tickSize(symbol));
    }

    @Override
    public double tickSize(String symbol) throws ExchangeException {
        MarketInfo market = markets.get(symbol);
        if (market == null) {
            throw new MarketNotFoundException(symbol);
        }
        return market.tickSize();
    }

    private void checkFailure(String symbol) throws ExchangeException {
        ExchangeException failure = failures.get(symbol);
        if (failure != null) {
            throw failure;
        }
    }

    private static String key(String symbol, Timeframe timeframe) {
        return symbol + ":" + timeframe.code();
    }
}
