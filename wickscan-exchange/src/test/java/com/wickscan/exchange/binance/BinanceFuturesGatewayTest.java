package com.wickscan.exchange.binance;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Timeframe;
import com.wickscan.exchange.ExchangeConfig;
import com.wickscan.exchange.exception.ExchangeUnavailableException;
import com.wickscan.exchange.exception.MarketNotFoundException;
import com.wickscan.exchange.exception.RateLimitException;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BinanceFuturesGateway against a mock HTTP server.
 */
class BinanceFuturesGatewayTest {

    private static final String EXCHANGE_INFO = """
        {"symbols":[
          {"symbol":"BTCUSDT","baseAsset":"BTC","quoteAsset":"USDT","contractType":"PERPETUAL","status":"TRADING",
           "filters":[{"filterType":"PRICE_FILTER","tickSize":"0.10"},{"filterType":"LOT_SIZE","stepSize":"0.001"}]},
          {"symbol":"ETHUSDT_240628","baseAsset":"ETH","quoteAsset":"USDT","contractType":"CURRENT_QUARTER","status":"SETTLING",
           "filters":[{"filterType":"PRICE_FILTER","tickSize":"0.01"}]}
        ]}""";

    private MockWebServer server;
    private BinanceFuturesGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ExchangeConfig config = new ExchangeConfig();
        config.setBaseUrl(server.url("/").toString());
        OkHttpClient client = new OkHttpClient.Builder()
            .readTimeout(2, TimeUnit.SECONDS)
            .build();
        gateway = new BinanceFuturesGateway(config, client);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
    }

    @Nested
    @DisplayName("Market Data Tests")
    class MarketDataTests {

        @Test
        @DisplayName("Should parse klines into candles")
        void parsesKlines() throws Exception {
            // Given
            server.enqueue(json("""
                [[1700000000000,"100.0","101.5","99.5","101.0","1234.5",1700000059999,"0",10,"0","0","0"],
                 [1700000060000,"101.0","102.0","100.0","100.5","800",1700000119999,"0",5,"0","0","0"]]"""));

            // When
            List<Candle> candles = gateway.fetchCandles("BTCUSDT", Timeframe.M1, 2);

            // Then
            assertEquals(2, candles.size());
            Candle first = candles.get(0);
            assertEquals(1700000000000L, first.timestamp());
            assertEquals(101.5, first.high(), 1e-9);
            assertEquals(1234.5, first.volume(), 1e-9);

            RecordedRequest request = server.takeRequest();
            assertEquals("/fapi/v1/klines", request.getRequestUrl().encodedPath());
            assertEquals("BTCUSDT", request.getRequestUrl().queryParameter("symbol"));
            assertEquals("1m", request.getRequestUrl().queryParameter("interval"));
        }

        @Test
        @DisplayName("Should cap the kline limit at the venue maximum")
        void capsLimit() throws Exception {
            server.enqueue(json("[]"));

            gateway.fetchCandles("BTCUSDT", Timeframe.M5, 5000);

            assertEquals("1500", server.takeRequest().getRequestUrl().queryParameter("limit"));
        }

        @Test
        @DisplayName("Should merge 24h stats with book quotes")
        void mergesTickers() throws Exception {
            // Given
            server.enqueue(json("""
                [{"symbol":"BTCUSDT","lastPrice":"50000.1","quoteVolume":"123456789","closeTime":1700000000000}]"""));
            server.enqueue(json("""
                [{"symbol":"BTCUSDT","bidPrice":"50000.0","askPrice":"50000.2"}]"""));

            // When
            Map<String, Ticker> tickers = gateway.fetchTickers();

            // Then
            Ticker btc = tickers.get("BTCUSDT");
            assertNotNull(btc);
            assertEquals(50000.1, btc.last(), 1e-9);
            assertEquals(50000.0, btc.bid(), 1e-9);
            assertEquals(50000.2, btc.ask(), 1e-9);
            assertEquals(123456789, btc.quoteVolume(), 1e-3);
        }

        @Test
        @DisplayName("Should read listings with tick size and status")
        void listsMarkets() throws Exception {
            server.enqueue(json(EXCHANGE_INFO));

            Map<String, MarketInfo> markets = gateway.listMarkets();

            MarketInfo btc = markets.get("BTCUSDT");
            assertEquals(0.10, btc.tickSize(), 1e-12);
            assertTrue(btc.active());
            assertTrue(btc.isPerpetual());
            MarketInfo eth = markets.get("ETHUSDT_240628");
            assertFalse(eth.active());
            assertFalse(eth.isPerpetual());
        }

        @Test
        @DisplayName("Should round prices to the listed tick")
        void roundsToTick() throws Exception {
            server.enqueue(json(EXCHANGE_INFO));

            assertEquals(50000.3, gateway.roundToTick("BTCUSDT", 50000.27), 1e-9);
            // markets are cached after the first load
            assertEquals(50000.1, gateway.roundToTick("BTCUSDT", 50000.149), 1e-9);
            assertEquals(1, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("Error Mapping Tests")
    class ErrorMappingTests {

        @Test
        @DisplayName("Should map 429 to a transient rate limit with Retry-After")
        void rateLimited() {
            server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "3").setBody("{}"));

            RateLimitException e = assertThrows(RateLimitException.class,
                () -> gateway.fetchCandles("BTCUSDT", Timeframe.M1, 10));

            assertTrue(e.isTransient());
            assertEquals(3000, e.getRetryAfterMs());
        }

        @Test
        @DisplayName("Should map server errors to unavailable")
        void serverError() {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

            ExchangeUnavailableException e = assertThrows(ExchangeUnavailableException.class,
                () -> gateway.fetchCandles("BTCUSDT", Timeframe.M1, 10));

            assertTrue(e.isTransient());
        }

        @Test
        @DisplayName("Should map invalid symbol to a permanent market-not-found")
        void invalidSymbol() {
            server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}"));

            MarketNotFoundException e = assertThrows(MarketNotFoundException.class,
                () -> gateway.fetchCandles("NOPEUSDT", Timeframe.M1, 10));

            assertEquals("NOPEUSDT", e.getSymbol());
            assertFalse(e.isTransient());
        }

        @Test
        @DisplayName("Should fail tick lookup for unlisted symbols")
        void unknownTick() {
            server.enqueue(json(EXCHANGE_INFO));

            assertThrows(MarketNotFoundException.class, () -> gateway.tickSize("NOPEUSDT"));
        }
    }
}
