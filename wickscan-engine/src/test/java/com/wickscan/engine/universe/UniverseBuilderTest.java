package com.wickscan.engine.universe;

import com.wickscan.engine.fetch.FetchSettings;
import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import com.wickscan.exchange.paper.PaperExchangeGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UniverseBuilderTest {

    private PaperExchangeGateway gateway;
    private MarketDataFetcher fetcher;
    private UniverseBuilder builder;

    @BeforeEach
    void setUp() {
        gateway = new PaperExchangeGateway()
            .addMarket("AAAUSDT", "AAA", 0.01)
            .addMarket("BBBUSDT", "BBB", 0.01)
            .addMarket("CCCUSDT", "CCC", 0.01)
            .addMarket("USDCUSDT", "USDC", 0.0001)
            .addMarket("THINUSDT", "THIN", 0.01)
            .addMarket(new MarketInfo("DDDUSDT_240628", "DDD", "USDT", 0.01, "CURRENT_QUARTER", true))
            .addMarket(new MarketInfo("EEEUSDT", "EEE", "USDT", 0.01, "PERPETUAL", false));
        for (String symbol : List.of("CCCUSDT", "AAAUSDT", "BBBUSDT", "USDCUSDT", "DDDUSDT_240628", "EEEUSDT")) {
            gateway.setTicker(new Ticker(symbol, 1.5, 1.5, 1.5, 5_000_000, 0));
        }
        gateway.setTicker(new Ticker("THINUSDT", 1.5, 1.5, 1.5, 1_000, 0));
        gateway.setTicker(new Ticker("GHOSTUSDT", 1.5, 1.5, 1.5, 5_000_000, 0));

        fetcher = new MarketDataFetcher(gateway, new FetchSettings());
        builder = new UniverseBuilder(fetcher, new UniverseSettings(),
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        fetcher.close();
    }

    @Test
    @DisplayName("Should keep only liquid active perpetuals outside the stablecoin list")
    void filters() throws Exception {
        SymbolUniverse universe = builder.build(0);

        assertEquals(List.of("AAAUSDT", "BBBUSDT", "CCCUSDT"), universe.symbols());
        assertTrue(universe.tickers().containsKey("AAAUSDT"));
    }

    @Test
    @DisplayName("Should rotate the sorted list by the offset")
    void rotates() throws Exception {
        SymbolUniverse universe = builder.build(4);

        assertEquals(List.of("BBBUSDT", "CCCUSDT", "AAAUSDT"), universe.symbols());
        assertEquals(1, universe.offset());
        assertEquals(0, universe.nextOffset(2));
        assertEquals(2, universe.nextOffset(1));
    }

    @Test
    @DisplayName("Should split into chunks in scan order")
    void chunks() {
        SymbolUniverse universe = new SymbolUniverse(List.of("A", "B", "C", "D", "E"), Map.of(), 0);

        assertEquals(List.of(List.of("A", "B"), List.of("C", "D"), List.of("E")), universe.chunks(2));
        assertEquals(0, new SymbolUniverse(List.of(), Map.of(), 0).nextOffset(3));
    }
}
