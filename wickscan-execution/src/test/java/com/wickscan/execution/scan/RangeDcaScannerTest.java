package com.wickscan.execution.scan;

import com.wickscan.core.SymbolResolutionException;
import com.wickscan.core.indicators.ATR;
import com.wickscan.core.model.Candle;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import com.wickscan.exchange.paper.PaperExchangeGateway;
import com.wickscan.execution.EngineContext;
import com.wickscan.execution.config.DcaSettings;
import com.wickscan.execution.config.EngineConfig;
import com.wickscan.execution.dca.PriceRange;
import com.wickscan.execution.dca.RangeAnalyzer;
import com.wickscan.execution.journal.TradeCloseEvent;
import com.wickscan.execution.journal.TradeLogStore;
import com.wickscan.execution.journal.TradeOpenEvent;
import com.wickscan.execution.journal.TradeUpdateEvent;
import com.wickscan.execution.position.DcaState;
import com.wickscan.execution.position.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RangeDcaScannerTest {

    private static final Instant NOW = Instant.parse("2026-02-08T10:15:30Z");
    private static final long HOUR = 3_600_000L;
    private static final long FIVE_MINUTES = 300_000L;

    private EngineConfig config;
    private EngineContext ctx;
    private PaperExchangeGateway paper;
    private RangeDcaScanner scanner;
    private final List<String> notifications = new CopyOnWriteArrayList<>();
    private final List<TradeOpenEvent> opens = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        config = new EngineConfig();
        config.getScan().getFetch().setMaxRetries(0);
        config.getDca().setSymbol("EURCUSDT");
        paper = new PaperExchangeGateway();
        TradeLogStore journal = new TradeLogStore() {
            @Override
            public void recordOpen(TradeOpenEvent event) {
                opens.add(event);
            }

            @Override
            public void recordUpdate(TradeUpdateEvent event) {
            }

            @Override
            public void recordClose(TradeCloseEvent event) {
            }
        };
        ctx = new EngineContext(config, new MarketDataFetcher(paper, config.getScan().getFetch()), journal,
            notifications::add, Clock.fixed(NOW, ZoneOffset.UTC));
        scanner = new RangeDcaScanner(ctx, new PositionMonitor(ctx));
    }

    /**
     * Hourly history that swung between 1.00 and 1.20 and has since settled at 1.05, so the tactical
     * range sits well inside the strategic one.
     */
    private static CandleSeries settledHistory() {
        long last = NOW.toEpochMilli() / HOUR * HOUR - HOUR;
        List<Candle> bars = new ArrayList<>();
        int count = 148;
        for (int i = 0; i < count; i++) {
            double close = i >= 100 ? 1.05 : (i % 2 == 0 ? 1.0 : 1.2);
            bars.add(new Candle(last - (count - 1 - i) * HOUR, close, close + 0.001, close - 0.001, close, 1000));
        }
        return new CandleSeries("EURCUSDT", Timeframe.H1, bars);
    }

    private static List<Candle> flatEntryBars(double price) {
        long last = NOW.toEpochMilli() / FIVE_MINUTES * FIVE_MINUTES - FIVE_MINUTES;
        List<Candle> bars = new ArrayList<>();
        for (int i = 119; i >= 0; i--) {
            bars.add(new Candle(last - i * FIVE_MINUTES, price, price * 1.0005, price * 0.9995, price, 500));
        }
        return bars;
    }

    @Nested
    @DisplayName("Startup")
    class StartupTests {

        @Test
        @DisplayName("Should refuse to start on an unknown symbol")
        void unknownSymbol() {
            SymbolResolutionException e = assertThrows(SymbolResolutionException.class, scanner::start);
            assertEquals("EURCUSDT", e.getSymbol());
        }

        @Test
        @DisplayName("Should refuse to start on an inactive market")
        void inactiveMarket() {
            paper.addMarket(new MarketInfo("EURCUSDT", "EURC", "USDT", 0.0001, "PERPETUAL", false));

            assertThrows(SymbolResolutionException.class, scanner::start);
        }

        @Test
        @DisplayName("Should report its parameters once started")
        void parameters() {
            paper.addMarket("EURCUSDT", "EURC", 0.0001);

            scanner.start();
            Map<String, Object> params = scanner.parameters();

            assertEquals("range-dca", params.get("strategy"));
            assertEquals("EURCUSDT", params.get("symbol"));
            assertFalse(params.containsKey("strategicRange"));
        }
    }

    @Nested
    @DisplayName("Scanning")
    class ScanTests {

        @Test
        @DisplayName("Should skip the scan while no range can be built")
        void noHistory() throws InterruptedException {
            // Given
            paper.addMarket("EURCUSDT", "EURC", 0.0001);
            scanner.start();

            // When
            ScanReport report = scanner.scan();

            // Then
            assertEquals(0, report.processed());
            assertEquals(0, report.submitted());
            assertTrue(scanner.getStrategicRange().isEmpty());
        }

        @Test
        @DisplayName("Should drop the forming bar")
        void closedOnly() {
            long bar = NOW.toEpochMilli() / 300_000L * 300_000L;
            CandleSeries series = new CandleSeries("EURCUSDT", Timeframe.M5, List.of(
                new Candle(bar - 300_000L, 1.0, 1.01, 0.99, 1.0, 10),
                new Candle(bar, 1.0, 1.01, 0.99, 1.0, 10)));

            CandleSeries closed = RangeDcaScanner.closedOnly(series, NOW.toEpochMilli());

            assertEquals(1, closed.size());
            assertEquals(bar - 300_000L, closed.candles().get(0).timestamp());
        }
    }

    @Nested
    @DisplayName("Opening")
    class OpenTests {

        @Test
        @DisplayName("Should open a long at the inner border with the full ladder inside the range")
        void opensInsideRange() throws InterruptedException {
            // Given
            DcaSettings dca = config.getDca();
            dca.setEntryScoreThreshold(0.0);
            CandleSeries hourly = settledHistory();
            RangeAnalyzer analyzer = new RangeAnalyzer(dca);
            PriceRange strategic = analyzer.strategic(hourly).orElseThrow();
            PriceRange tactical = analyzer.tactical(hourly).orElseThrow();
            assertTrue(tactical.lower() > strategic.lower());
            double price = tactical.lower();

            paper.addMarket("EURCUSDT", "EURC", 0.0001);
            paper.setCandles("EURCUSDT", Timeframe.H1, hourly.candles());
            paper.setCandles("EURCUSDT", Timeframe.M5, flatEntryBars(price));
            paper.setTicker(new Ticker("EURCUSDT", price, price, price, 2_000_000, NOW.toEpochMilli()));
            scanner.start();

            // When
            ScanReport report = scanner.scan();

            // Then
            assertEquals(1, report.submitted());
            assertEquals(strategic, scanner.getStrategicRange().orElseThrow());
            assertEquals(1, ctx.getPositions().size());
            Position position = ctx.getPositions().getActive().get(0);
            assertEquals(Side.LONG, position.getSide());
            assertEquals(price, position.getEntryPrice(), 1e-12);

            DcaState state = position.getDca();
            double planned = state.getStepMargins().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(dca.getBank() * dca.getCumDepositFracAtFull(), planned, 1e-6);
            assertEquals(dca.getLevels(), state.getStepMargins().size());
            assertEquals(1, state.getStepsFilled());

            double expectedGrowth = dca.growthFor(strategic.width()
                / ATR.latest(hourly.candles(), dca.getRangeAtrPeriod()));
            assertEquals(expectedGrowth, state.getGrowth(), 1e-12);

            List<Double> ladder = state.getLadder();
            assertEquals(dca.getLevels() - 1, ladder.size());
            double previous = price;
            for (double level : ladder) {
                assertTrue(level < previous, "ladder falls for a long");
                assertTrue(level >= strategic.lower() - 1e-12, "level " + level + " below " + strategic);
                previous = level;
            }
            assertEquals(strategic.lower(), ladder.get(ladder.size() - 1), 1e-9);

            assertFalse(ctx.getReservations().isReserved("EURCUSDT"));
            assertEquals(1, opens.size());
            assertEquals("range-dca", opens.get(0).getStrategy());
            assertEquals(position.getId(), opens.get(0).getSignalId());
            assertEquals(1, notifications.size());
            assertTrue(notifications.get(0).contains("EURCUSDT"));
        }

        @Test
        @DisplayName("Should not open between the entry zones")
        void midRange() throws InterruptedException {
            // Given
            config.getDca().setEntryScoreThreshold(0.0);
            CandleSeries hourly = settledHistory();
            PriceRange tactical = new RangeAnalyzer(config.getDca()).tactical(hourly).orElseThrow();
            double price = (tactical.lower() + tactical.upper()) / 2;
            paper.addMarket("EURCUSDT", "EURC", 0.0001);
            paper.setCandles("EURCUSDT", Timeframe.H1, hourly.candles());
            paper.setCandles("EURCUSDT", Timeframe.M5, flatEntryBars(price));
            paper.setTicker(new Ticker("EURCUSDT", price, price, price, 2_000_000, NOW.toEpochMilli()));
            scanner.start();

            // When
            ScanReport report = scanner.scan();

            // Then
            assertEquals(0, report.submitted());
            assertEquals(0, ctx.getPositions().size());
            assertTrue(opens.isEmpty());
            assertTrue(notifications.isEmpty());
        }
    }
}
