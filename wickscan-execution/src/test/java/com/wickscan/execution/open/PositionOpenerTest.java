package com.wickscan.execution.open;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.engine.gate.GateResult;
import com.wickscan.engine.score.CandidateSignal;
import com.wickscan.exchange.paper.PaperExchangeGateway;
import com.wickscan.execution.EngineContext;
import com.wickscan.execution.config.EngineConfig;
import com.wickscan.execution.journal.TradeLogStore;
import com.wickscan.execution.position.Position;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositionOpenerTest {

    private static final Instant NOW = Instant.ofEpochMilli(1_700_000_040_000L);
    private static final Candle SIGNAL_BAR = new Candle(1_699_999_980_000L, 100.0, 100.3, 98.0, 100.2, 5000);

    private PaperExchangeGateway paper;
    private MarketDataFetcher fetcher;
    private EngineContext ctx;
    private PositionOpener opener;
    private final List<String> notifications = new ArrayList<>();

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        config.getEntry().setEntrySettleMs(0);
        config.getEntry().setMaxConcurrentPositions(2);
        config.getScan().getFetch().setMaxRetries(0);
        config.getScan().getFetch().setTimeoutMs(2000);

        paper = new PaperExchangeGateway();
        paper.addMarket("BTCUSDT", "BTC", 0.1);
        paper.addMarket("ETHUSDT", "ETH", 0.1);
        fetcher = new MarketDataFetcher(paper, config.getScan().getFetch());
        ctx = new EngineContext(config, fetcher, TradeLogStore.NONE, notifications::add,
            Clock.fixed(NOW, ZoneOffset.UTC));
        opener = new PositionOpener(ctx);
    }

    @AfterEach
    void tearDown() {
        opener.close();
        fetcher.close();
    }

    private static CandidateSignal candidate(String symbol, Candle bar) {
        GateResult gate = new GateResult(symbol, Side.LONG, bar, 59, 1.0, 0.1, 0.5, 2.3, 3.0, -1.0,
            true, true, true);
        return new CandidateSignal(symbol, Side.LONG, 1.85, Timeframe.M1, gate);
    }

    private OpenOutcome submit(String symbol) {
        return opener.submit(candidate(symbol, SIGNAL_BAR), 1.80).join();
    }

    @Nested
    @DisplayName("Open Tests")
    class OpenTests {

        @Test
        @DisplayName("Should open at the rounded planned entry when the price touches it")
        void opens() {
            // Given: entry = 100 - 0.25 * 2 = 99.5
            paper.setPrice("BTCUSDT", 99.5);

            // When
            OpenOutcome outcome = submit("BTCUSDT");

            // Then
            assertEquals(OpenStatus.OPENED, outcome.status());
            Position p = outcome.position();
            assertEquals(99.5, p.getEntryPrice(), 1e-9);
            assertEquals(99.0, p.getStopLoss(), 1e-9);
            assertEquals(99.8, p.getTakeProfit(), 1e-9);
            assertEquals(1_700_000_040_000L, p.getEntryBarTimestamp());
            assertEquals("BTCUSDT-L-1699999980000", p.getId());
            assertEquals(1, ctx.getPositions().size());
            assertTrue(ctx.getCooldowns().isActive("BTCUSDT", NOW.toEpochMilli() + 60_000));
            assertEquals(1, notifications.size());
            assertEquals(0, ctx.getReservations().size());
            assertEquals(1L, opener.getCounters().get(OpenStatus.OPENED));
        }

        @Test
        @DisplayName("Should abandon when the price is away from the entry")
        void noTouch() {
            paper.setPrice("BTCUSDT", 100.5);

            OpenOutcome outcome = submit("BTCUSDT");

            assertEquals(OpenStatus.NO_TOUCH, outcome.status());
            assertNull(outcome.position());
            assertEquals(0, ctx.getPositions().size());
            assertFalse(ctx.getCooldowns().isActive("BTCUSDT", NOW.toEpochMilli()));
            assertEquals(0, ctx.getReservations().size());
        }
    }

    @Nested
    @DisplayName("Rejection Tests")
    class RejectionTests {

        @Test
        @DisplayName("Should report an exchange error for an unlisted symbol")
        void unlisted() {
            OpenOutcome outcome = submit("DOGEUSDT");

            assertEquals(OpenStatus.EXCHANGE_ERROR, outcome.status());
            assertEquals(0, ctx.getReservations().size());
        }

        @Test
        @DisplayName("Should report missing data when there is no live price")
        void noTicker() {
            OpenOutcome outcome = submit("ETHUSDT");

            assertEquals(OpenStatus.DATA_UNAVAILABLE, outcome.status());
            assertEquals(0, ctx.getReservations().size());
        }

        @Test
        @DisplayName("Should refuse a symbol with an attempt already in flight")
        void alreadyReserved() {
            // Given
            ReservationSet.Reservation held = ctx.getReservations().tryReserve("BTCUSDT").orElseThrow();
            paper.setPrice("BTCUSDT", 99.5);

            // When
            OpenOutcome outcome = submit("BTCUSDT");

            // Then
            assertEquals(OpenStatus.ALREADY_RESERVED, outcome.status());
            assertTrue(ctx.getReservations().isReserved("BTCUSDT"));
            held.release();
            assertEquals(0, ctx.getReservations().size());
        }

        @Test
        @DisplayName("Should refuse when open positions and reservations reach capacity")
        void capacity() {
            ctx.getPositions().add(Position.bracket("SOLUSDT-L-0", "SOLUSDT", Side.LONG, Timeframe.M1,
                10, 9.9, 10.1, NOW, 0, 20, 10, 1.9, 1.8));
            ReservationSet.Reservation held = ctx.getReservations().tryReserve("ETHUSDT").orElseThrow();

            OpenOutcome outcome = submit("BTCUSDT");

            assertEquals(OpenStatus.CAPACITY, outcome.status());
            held.release();
            assertEquals(0, ctx.getReservations().size());
        }

        @Test
        @DisplayName("Should report a failure and release the symbol when the attempt throws")
        void failure() {
            OpenOutcome outcome = opener.submit(candidate("BTCUSDT", null), 1.80).join();

            assertEquals(OpenStatus.FAILED, outcome.status());
            assertEquals(0, ctx.getReservations().size());
            assertEquals(0, ctx.getPositions().size());
        }
    }
}
