package com.wickscan.exchange.paper;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Timeframe;
import com.wickscan.exchange.exception.ExchangeUnavailableException;
import com.wickscan.exchange.exception.MarketNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaperExchangeGatewayTest {

    private PaperExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new PaperExchangeGateway().addMarket("SOLUSDT", "SOL", 0.01);
    }

    @Test
    @DisplayName("Should return the most recent bars up to the limit")
    void servesTail() throws Exception {
        // Given
        List<Candle> bars = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            bars.add(new Candle(i * 60_000L, i, i, i, i, 1));
        }
        gateway.setCandles("SOLUSDT", Timeframe.M1, bars);

        // When
        List<Candle> tail = gateway.fetchCandles("SOLUSDT", Timeframe.M1, 3);

        // Then
        assertEquals(3, tail.size());
        assertEquals(7 * 60_000L, tail.get(0).timestamp());
        assertEquals(1, gateway.getCandleRequestCount());
    }

    @Test
    @DisplayName("Should answer empty for listed markets without data and fail for unknown ones")
    void unknownMarket() throws Exception {
        assertTrue(gateway.fetchCandles("SOLUSDT", Timeframe.M5, 10).isEmpty());
        assertThrows(MarketNotFoundException.class, () -> gateway.fetchCandles("XYZUSDT", Timeframe.M5, 10));
        assertThrows(MarketNotFoundException.class, () -> gateway.tickSize("XYZUSDT"));
    }

    @Test
    @DisplayName("Should inject failures until cleared")
    void injectedFailure() throws Exception {
        gateway.setPrice("SOLUSDT", 150.0);
        gateway.failSymbol("SOLUSDT", new ExchangeUnavailableException("down"));

        assertThrows(ExchangeUnavailableException.class, () -> gateway.fetchTicker("SOLUSDT"));

        gateway.clearFailure("SOLUSDT");
        assertEquals(150.0, gateway.fetchTicker("SOLUSDT").last(), 1e-9);
        assertEquals(150.01, gateway.roundToTick("SOLUSDT", 150.0061), 1e-9);
    }
}
