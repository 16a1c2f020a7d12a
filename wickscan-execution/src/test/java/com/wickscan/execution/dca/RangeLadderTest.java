package com.wickscan.execution.dca;

import com.wickscan.core.model.Side;
import com.wickscan.execution.config.DcaSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangeLadderTest {

    private DcaSettings settings;
    private RangeLadder ladder;

    @BeforeEach
    void setUp() {
        settings = new DcaSettings();
        ladder = new RangeLadder(settings);
    }

    private void assertOrdered(Side side, double entry, List<Double> levels, double minGapPct) {
        double previous = entry;
        for (double level : levels) {
            double gap = side.sign() * (previous - level) / previous * 100.0;
            assertTrue(gap >= minGapPct - 1e-9, "gap " + gap + " before " + level);
            previous = level;
        }
    }

    @Test
    @DisplayName("Should merge tactical and strategic levels below a long entry")
    void longLadder() {
        List<Double> levels = ladder.build(Side.LONG, 100, new PriceRange(98, 102), new PriceRange(90, 110), 1.0, 6);

        assertEquals(6, levels.size());
        assertEquals(98.8, levels.get(0), 1e-9);
        assertEquals(96.0, levels.get(3), 1e-9);
        assertEquals(90.0, levels.get(5), 1e-9);
        assertOrdered(Side.LONG, 100, levels, settings.getLadderMinGapPct());
    }

    @Test
    @DisplayName("Should rise above a short entry")
    void shortLadder() {
        List<Double> levels = ladder.build(Side.SHORT, 100, new PriceRange(98, 102), new PriceRange(90, 110), 1.0, 6);

        assertEquals(6, levels.size());
        assertEquals(101.2, levels.get(0), 1e-9);
        assertEquals(110.0, levels.get(5), 1e-9);
        assertOrdered(Side.SHORT, 100, levels, settings.getLadderMinGapPct());
    }

    @Test
    @DisplayName("Should keep every level inside the strategic range")
    void insideStrategicRange() {
        List<Double> levels = ladder.build(Side.LONG, 1.05, new PriceRange(1.05, 1.15), new PriceRange(1.0, 1.2),
            0.002, 6);

        assertEquals(6, levels.size());
        assertOrdered(Side.LONG, 1.05, levels, settings.getLadderMinGapPct());
        for (double level : levels) {
            assertTrue(level >= 1.0, "level " + level + " below the strategic border");
        }
        assertEquals(1.0, levels.get(5), 1e-12);
    }

    @Test
    @DisplayName("Should thin levels to the minimum gap and extend beyond the deepest one")
    void thinsAndExtends() {
        settings.setLadderMinGapPct(0.25);

        List<Double> levels = ladder.build(Side.LONG, 100, null, new PriceRange(99, 110), 1.0, 6);

        assertEquals(List.of(99.7, 99.4, 99.0), levels.subList(0, 3).stream()
            .map(v -> Math.round(v * 1e6) / 1e6).toList());
        assertEquals(List.of(98.0, 97.0, 96.0), levels.subList(3, 6));
        assertOrdered(Side.LONG, 100, levels, 0.25);
    }

    @Test
    @DisplayName("Should fall back to ATR multiples without ranges")
    void atrFallback() {
        List<Double> levels = ladder.build(Side.LONG, 100, null, null, 1.0, 8);

        assertEquals(List.of(99.0, 98.0, 97.0, 96.0, 95.0, 94.0, 93.0, 92.0), levels);
    }
}
