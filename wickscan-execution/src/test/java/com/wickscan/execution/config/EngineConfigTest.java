package com.wickscan.execution.config;

import com.wickscan.core.model.Timeframe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should fall back to defaults when the file is missing")
    void missingFile() throws Exception {
        EngineConfig config = EngineConfig.load(dir.resolve("engine.yaml"));

        assertEquals(SchedulerSettings.Strategy.WICK_SPIKE, config.getScheduler().getStrategy());
        assertEquals(1.80, config.getScan().getThreshold().getBase(), 1e-9);
        assertEquals(7862, config.getControl().getPort());
    }

    @Test
    @DisplayName("Should read a partial file and keep defaults for the rest")
    void partialFile() throws Exception {
        // Given
        Path file = dir.resolve("engine.yaml");
        Files.writeString(file, String.join("\n",
            "scheduler:",
            "  strategy: RANGE_DCA",
            "  entryTimeframe: 5m",
            "entry:",
            "  leverage: 10",
            "someFutureSection:",
            "  key: value",
            ""));

        // When
        EngineConfig config = EngineConfig.load(file);

        // Then
        assertEquals(SchedulerSettings.Strategy.RANGE_DCA, config.getScheduler().getStrategy());
        assertEquals(Timeframe.M5, config.getScheduler().getEntryTimeframe());
        assertEquals(10, config.getEntry().getLeverage());
        assertEquals(0.30, config.getEntry().getTpPct(), 1e-9);
        assertEquals(2, config.getEntry().getMarginTiers().size());
    }

    @Test
    @DisplayName("Should write a file that reads back the same")
    void saveAndLoad() throws Exception {
        EngineConfig config = new EngineConfig();
        config.getDca().setSymbol("SOLUSDT");
        config.getScan().getUniverse().setMinQuoteVolume(1_000_000);
        Path file = dir.resolve("nested").resolve("engine.yaml");

        config.save(file);
        EngineConfig loaded = EngineConfig.load(file);

        assertEquals("SOLUSDT", loaded.getDca().getSymbol());
        assertEquals(1_000_000, loaded.getScan().getUniverse().getMinQuoteVolume(), 1e-9);
        assertEquals(3, loaded.getDca().getTrailStages().size());
    }

    @Test
    @DisplayName("Should take Telegram secrets from the environment")
    void environment() {
        EngineConfig config = new EngineConfig().applyEnvironment(Map.of(
            EngineConfig.ENV_TELEGRAM_TOKEN, " 123:abc ",
            EngineConfig.ENV_TELEGRAM_CHATS, "111, 222,,"));

        assertTrue(config.getNotifier().isTelegramEnabled());
        assertEquals("123:abc", config.getNotifier().getTelegramToken());
        assertEquals(List.of("111", "222"), config.getNotifier().getTelegramChatIds());
    }

    @Test
    @DisplayName("Should leave the notifier alone without environment values")
    void noEnvironment() {
        EngineConfig config = new EngineConfig().applyEnvironment(Map.of());

        assertFalse(config.getNotifier().isTelegramEnabled());
    }
}
