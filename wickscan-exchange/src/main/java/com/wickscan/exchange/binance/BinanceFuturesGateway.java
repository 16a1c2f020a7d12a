package com.wickscan.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Timeframe;
import com.wickscan.exchange.ExchangeConfig;
import com.wickscan.exchange.ExchangeGateway;
import com.wickscan.exchange.HttpClientFactory;
import com.wickscan.exchange.TickRounding;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.exception.ExchangeUnavailableException;
import com.wickscan.exchange.exception.MarketNotFoundException;
import com.wickscan.exchange.exception.RateLimitException;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binance USD-M futures REST gateway (public endpoints only).
 */
public class BinanceFuturesGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(BinanceFuturesGateway.class);
    private static final int MAX_KLINES_PER_REQUEST = 1500;
    private static final long DEFAULT_RETRY_AFTER_MS = 1000;
    private static final int INVALID_SYMBOL_CODE = -1121;

    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    private volatile Map<String, MarketInfo> markets = Map.of();

    public BinanceFuturesGateway(ExchangeConfig config) {
        this(config, HttpClientFactory.getClient(config));
    }

    public BinanceFuturesGateway(ExchangeConfig config, OkHttpClient client) {
        HttpUrl parsed = HttpUrl.parse(config.getBaseUrl());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid exchange base URL: " + config.getBaseUrl());
        }
        this.baseUrl = parsed;
        this.client = client;
        this.mapper = HttpClientFactory.getMapper();
    }

    @Override
    public String getVenueName() {
        return "binance";
    }

    @Override
    public void connect() throws ExchangeException {
        Map<String, MarketInfo> loaded = loadMarkets();
        log.info("Connected to Binance futures at {}: {} markets", baseUrl, loaded.size());
    }

    @Override
    public void disconnect() {
        markets = Map.of();
        log.info("Disconnected from Binance futures");
    }

    @Override
    public Map<String, MarketInfo> listMarkets() throws ExchangeException {
        return loadMarkets();
    }

    @Override
    public Map<String, Ticker> fetchTickers() throws ExchangeException {
        JsonNode stats = get(url("/fapi/v1/ticker/24hr").build());
        JsonNode books = get(url("/fapi/v1/ticker/bookTicker").build());

        Map<String, double[]> bidAsk = new HashMap<>();
        for (JsonNode book : books) {
            bidAsk.put(book.path("symbol").asText(), new double[] {
                number(book, "bidPrice"), number(book, "askPrice")
            });
        }

        Map<String, Ticker> tickers = new LinkedHashMap<>();
        for (JsonNode node : stats) {
            String symbol = node.path("symbol").asText();
            double[] quote = bidAsk.getOrDefault(symbol, new double[] {Double.NaN, Double.NaN});
            tickers.put(symbol, toTicker(node, quote[0], quote[1]));
        }
        return tickers;
    }

    @Override
    public Ticker fetchTicker(String symbol) throws ExchangeException {
        JsonNode stats = get(url("/fapi/v1/ticker/24hr").addQueryParameter("symbol", symbol).build());
        JsonNode book = get(url("/fapi/v1/ticker/bookTicker").addQueryParameter("symbol", symbol).build());
        return toTicker(stats, number(book, "bidPrice"), number(book, "askPrice"));
    }

    @Override
    public List<Candle> fetchCandles(String symbol, Timeframe timeframe, int limit) throws ExchangeException {
        HttpUrl klinesUrl = url("/fapi/v1/klines")
            .addQueryParameter("symbol", symbol)
            .addQueryParameter("interval", timeframe.code())
            .addQueryParameter("limit", String.valueOf(Math.min(limit, MAX_KLINES_PER_REQUEST)))
            .build();

        JsonNode root = get(klinesUrl);
        List<Candle> candles = new ArrayList<>(root.size());
        for (JsonNode kline : root) {
            // [openTime, open, high, low, close, volume, closeTime, quoteVolume, ...]
            candles.add(new Candle(
                kline.get(0).asLong(),
                Double.parseDouble(kline.get(1).asText()),
                Double.parseDouble(kline.get(2).asText()),
                Double.parseDouble(kline.get(3).asText()),
                Double.parseDouble(kline.get(4).asText()),
                Double.parseDouble(kline.get(5).asText())));
        }
        return candles;
    }

    @Override
    public double roundToTick(String symbol, double price) throws ExchangeException {
        return TickRounding.round(price, tickSize(symbol));
    }

    @Override
    public double tickSize(String symbol) throws ExchangeException {
        MarketInfo market = markets.get(symbol);
        if (market == null) {
            market = loadMarkets().get(symbol);
        }
        if (market == null) {
            throw new MarketNotFoundException(symbol);
        }
        return market.tickSize();
    }

    // ========== Internals ==========

    private Map<String, MarketInfo> loadMarkets() throws ExchangeException {
        JsonNode root = get(url("/fapi/v1/exchangeInfo").build());
        Map<String, MarketInfo> loaded = new LinkedHashMap<>();
        for (JsonNode s : root.path("symbols")) {
            double tick = 0;
            for (JsonNode filter : s.path("filters")) {
                if ("PRICE_FILTER".equals(filter.path("filterType").asText())) {
                    tick = number(filter, "tickSize");
                }
            }
            String symbol = s.path("symbol").asText();
            loaded.put(symbol, new MarketInfo(
                symbol,
                s.path("baseAsset").asText(),
                s.path("quoteAsset").asText(),
                tick,
                s.path("contractType").asText(null),
                "TRADING".equals(s.path("status").asText())));
        }
        markets = Collections.unmodifiableMap(loaded);
        return markets;
    }

    private Ticker toTicker(JsonNode stats, double bid, double ask) {
        return new Ticker(
            stats.path("symbol").asText(),
            number(stats, "lastPrice"),
            bid,
            ask,
            number(stats, "quoteVolume"),
            stats.path("closeTime").asLong(System.currentTimeMillis()));
    }

    private HttpUrl.Builder url(String path) {
        return baseUrl.newBuilder().encodedPath(path);
    }

    private JsonNode get(HttpUrl url) throws ExchangeException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            int code = response.code();

            if (code == 429 || code == 418) {
                throw new RateLimitException("Binance rate limit: " + code, retryAfterMs(response));
            }
            if (code >= 500) {
                throw new ExchangeUnavailableException("Binance server error: " + code);
            }
            if (!response.isSuccessful()) {
                throw clientError(url, code, text);
            }
            return mapper.readTree(text);
        } catch (IOException e) {
            throw new ExchangeUnavailableException("Binance request failed: " + url.encodedPath(), e);
        }
    }

    private ExchangeException clientError(HttpUrl url, int code, String body) {
        String symbol = url.queryParameter("symbol");
        try {
            JsonNode error = mapper.readTree(body);
            if (error.path("code").asInt() == INVALID_SYMBOL_CODE && symbol != null) {
                return new MarketNotFoundException(symbol);
            }
            return new ExchangeException("Binance error " + code + ": " + error.path("msg").asText(body));
        } catch (IOException e) {
            return new ExchangeException("Binance error " + code + ": " + body);
        }
    }

    private static long retryAfterMs(Response response) {
        String header = response.header("Retry-After");
        if (header == null) {
            return DEFAULT_RETRY_AFTER_MS;
        }
        try {
            return Long.parseLong(header.trim()) * 1000;
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER_MS;
        }
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.asText());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
