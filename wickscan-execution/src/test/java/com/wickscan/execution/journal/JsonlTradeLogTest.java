package com.wickscan.execution.journal;

import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.execution.config.TrailSettings;
import com.wickscan.execution.position.Position;
import com.wickscan.execution.position.PositionLifecycle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlTradeLogTest {

    private static final Instant OPENED = Instant.parse("2026-02-08T10:15:00Z");
    private static final Clock CLOCK = Clock.fixed(OPENED, ZoneOffset.UTC);

    @TempDir
    Path dir;

    private static Position position() {
        return Position.bracket("BTCUSDT-L-1770545640000", "BTCUSDT", Side.LONG, Timeframe.M1,
            100.0, 99.8, 100.3, OPENED, OPENED.toEpochMilli(), 20, 10.0, 1.9, 1.8);
    }

    @Test
    @DisplayName("Should write one line per event into the file of the day")
    void writesDailyFile() throws Exception {
        // Given
        JsonlTradeLog tradeLog = new JsonlTradeLog(dir, CLOCK);
        Position p = position();
        new PositionLifecycle(new TrailSettings()).forceClose(p, 100.1, OPENED.plusSeconds(300));

        // When
        tradeLog.recordOpen(new TradeOpenEvent("wick-spike", p));
        tradeLog.recordClose(new TradeCloseEvent(p));
        tradeLog.close();

        // Then
        Path file = dir.resolve("2026-02-08.jsonl");
        assertTrue(Files.exists(file));
        assertEquals(2, Files.readAllLines(file).size());

        List<TradeEvent> events = tradeLog.readDate(LocalDate.of(2026, 2, 8));
        assertEquals(2, events.size());
        TradeOpenEvent open = assertInstanceOf(TradeOpenEvent.class, events.get(0));
        assertEquals("wick-spike", open.getStrategy());
        assertEquals(Side.LONG, open.getSide());
        assertEquals("1m", open.getTimeframe());
        assertEquals(99.8, open.getStopLoss(), 1e-9);
        TradeCloseEvent close = assertInstanceOf(TradeCloseEvent.class, events.get(1));
        assertEquals(300, close.getHoldingSeconds());
        assertEquals(2.0, close.getPnlPct(), 1e-6);
    }

    @Test
    @DisplayName("Should skip an event written before, even after a restart")
    void idempotent() throws Exception {
        // Given
        JsonlTradeLog first = new JsonlTradeLog(dir, CLOCK);
        TradeOpenEvent event = new TradeOpenEvent("wick-spike", position());
        first.recordOpen(event);
        first.recordOpen(event);
        first.close();

        // When
        JsonlTradeLog second = new JsonlTradeLog(dir, CLOCK);
        assertTrue(second.contains(event));
        second.recordOpen(new TradeOpenEvent("wick-spike", position()));
        second.close();

        // Then
        assertEquals(1, second.readAll().size());
        assertEquals(1, Files.readAllLines(dir.resolve("2026-02-08.jsonl")).size());
    }

    @Test
    @DisplayName("Should read nothing from an empty directory")
    void empty() {
        JsonlTradeLog tradeLog = new JsonlTradeLog(dir.resolve("trades"), CLOCK);

        assertTrue(tradeLog.readAll().isEmpty());
        assertTrue(Files.isDirectory(dir.resolve("trades")));
    }
}
