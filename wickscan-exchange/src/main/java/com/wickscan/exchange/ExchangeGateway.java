package com.wickscan.exchange;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Timeframe;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;

import java.util.List;
import java.util.Map;

/**
 * Market data and precision access to one venue. Implementations must be safe to call
 * from many threads at once.
 */
public interface ExchangeGateway {

    String getVenueName();

    // Connection lifecycle
    void connect() throws ExchangeException;
    void disconnect();

    /**
     * All listed markets keyed by symbol.
     */
    Map<String, MarketInfo> listMarkets() throws ExchangeException;

    /**
     * 24h tickers for every market in one request.
     */
    Map<String, Ticker> fetchTickers() throws ExchangeException;

    Ticker fetchTicker(String symbol) throws ExchangeException;

    /**
     * The most recent {@code limit} bars, oldest first. The last bar may still be forming.
     */
    List<Candle> fetchCandles(String symbol, Timeframe timeframe, int limit) throws ExchangeException;

    /**
     * Round a price to the market's tick size.
     *
     * @throws com.wickscan.exchange.exception.MarketNotFoundException for unknown symbols
     */
    double roundToTick(String symbol, double price) throws ExchangeException;

    /**
     * Tick size of a market.
     */
    double tickSize(String symbol) throws ExchangeException;
}
