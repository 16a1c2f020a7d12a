package com.wickscan.execution;

import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.engine.threshold.ThresholdState;
import com.wickscan.exchange.paper.PaperExchangeGateway;
import com.wickscan.execution.config.EngineConfig;
import com.wickscan.execution.journal.TradeLogStore;
import com.wickscan.execution.position.ExitReason;
import com.wickscan.execution.position.Position;
import com.wickscan.execution.state.EngineSnapshot;
import com.wickscan.execution.state.EngineStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ScanEngineTest {

    private static final Instant NOW = Instant.parse("2026-02-08T10:15:00Z");

    @TempDir
    Path dir;

    private PaperExchangeGateway paper;
    private EngineStateStore store;
    private ScanEngine engine;
    private final List<String> notifications = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        config.getScan().getFetch().setMaxRetries(0);
        config.getScheduler().setLoopIntervalMs(20);
        config.getScheduler().setStopTimeoutSeconds(5);
        paper = new PaperExchangeGateway();
        paper.addMarket("BTCUSDT", "BTC", 0.1);
        store = new EngineStateStore(dir.resolve("engine-state.json"));
        engine = new ScanEngine(config, paper, TradeLogStore.NONE, notifications::add, store,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    private static Position position(String id) {
        return Position.bracket(id, "BTCUSDT", Side.LONG, Timeframe.M1, 100.0, 99.8, 100.3,
            NOW.minusSeconds(600), NOW.minusSeconds(600).toEpochMilli(), 20, 10.0, 1.9, 1.8);
    }

    @Nested
    @DisplayName("Control Tests")
    class ControlTests {

        @Test
        @DisplayName("Should report status without being started")
        void status() {
            engine.getContext().getPositions().add(position("BTCUSDT-L-1"));

            EngineStatus status = engine.status();

            assertFalse(status.running());
            assertEquals("wick-spike", status.strategy());
            assertEquals(1, status.activePositions());
            assertEquals(10, status.maxPositions());
            assertEquals("BTCUSDT-L-1", status.positions().get(0).id());
            assertNull(status.positions().get(0).stepsFilled());
            assertTrue(status.thresholdLong() >= status.thresholdShort());
            assertEquals("1m", status.parameters().get("timeframe"));
        }

        @Test
        @DisplayName("Should force close at the live price and persist")
        void forceClose() {
            // Given
            Position p = position("BTCUSDT-L-1");
            engine.getContext().getPositions().add(p);
            paper.setPrice("BTCUSDT", 100.1);

            // When
            boolean closed = engine.forceClose("BTCUSDT-L-1");

            // Then
            assertTrue(closed);
            assertEquals(ExitReason.FORCE_CLOSE, p.getExitReason());
            assertEquals(0, engine.getContext().getPositions().size());
            assertTrue(engine.getContext().getCooldowns().isActive("BTCUSDT", NOW.toEpochMilli()));
            assertTrue(store.load().orElseThrow().positions().isEmpty());
            assertFalse(engine.forceClose("BTCUSDT-L-1"));
        }

        @Test
        @DisplayName("Should not close without a live price")
        void noPrice() {
            engine.getContext().getPositions().add(position("BTCUSDT-L-1"));

            assertFalse(engine.forceClose("BTCUSDT-L-1"));
            assertEquals(0, engine.forceCloseAll());
            assertEquals(1, engine.getContext().getPositions().size());
        }

        @Test
        @DisplayName("Should toggle scanning and persist the flag")
        void toggle() {
            engine.enable();
            assertTrue(store.load().orElseThrow().enabled());

            engine.disable();
            assertFalse(engine.status().enabled());
            assertFalse(store.load().orElseThrow().enabled());
        }
    }

    @Nested
    @DisplayName("Lifecycle Tests")
    class LifecycleTests {

        @Test
        @DisplayName("Should restore the previous session on start and persist on stop")
        void restoresSession() {
            // Given
            store.save(new EngineSnapshot(NOW, false, new ThresholdState(2.05, 1L, 0.05),
                List.of(position("BTCUSDT-L-1")), Map.of("ETHUSDT", NOW.toEpochMilli() + 60_000), 7));

            // When
            assertDoesNotThrow(() -> engine.start());

            // Then
            assertTrue(engine.isStarted());
            assertTrue(paper.isConnected());
            EngineStatus status = engine.status();
            assertTrue(status.running());
            assertFalse(status.enabled());
            assertEquals(2.05, status.thresholdShort(), 1e-9);
            assertEquals(1, status.activePositions());
            assertTrue(engine.getContext().getCooldowns().isActive("ETHUSDT", NOW.toEpochMilli()));

            engine.stop();

            assertFalse(engine.isStarted());
            assertFalse(engine.getScheduler().isRunning());
            assertFalse(paper.isConnected());
            EngineSnapshot saved = store.load().orElseThrow();
            assertEquals(1, saved.positions().size());
            assertEquals(7, saved.rotationOffset());
            assertTrue(notifications.stream().anyMatch(n -> n.contains("Engine stopped")));
        }

        @Test
        @DisplayName("Should refuse to start again once stopped")
        void stopIsTerminal() throws Exception {
            // Given
            engine.start();
            engine.stop();

            // When / Then
            assertThrows(IllegalStateException.class, () -> engine.start());
            assertFalse(engine.isStarted());
            assertFalse(paper.isConnected());
        }
    }
}
