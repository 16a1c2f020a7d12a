package com.wickscan.execution.open;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.engine.gate.GateResult;
import com.wickscan.engine.score.CandidateSignal;
import com.wickscan.execution.config.EntrySettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/** Unit tests for EntryPlanner. */
class EntryPlannerTest {

    private final EntryPlanner planner = new EntryPlanner(new EntrySettings());

    private static CandidateSignal candidate(Side side, Candle bar, double score) {
        GateResult gate = new GateResult("BTCUSDT", side, bar, 59, 1.0, 0.1, 0.5, 2.3, 3.0, 0.0,
            true, true, true);
        return new CandidateSignal("BTCUSDT", side, score, Timeframe.M1, gate);
    }

    @Test
    @DisplayName("Should retrace a quarter of the lower tail for a base long")
    void baseLong() {
        Candle bar = new Candle(0, 100.0, 100.3, 98.0, 100.2, 1);

        EntryPlan plan = planner.plan(candidate(Side.LONG, bar, 1.85), 1.80);

        assertEquals(99.5, plan.entry(), 1e-9);
        assertEquals(99.0, plan.stopLoss(), 1e-9);
        assertEquals(99.5 * 1.003, plan.takeProfit(), 1e-9);
    }

    @Test
    @DisplayName("Should use the deepest tier the score margin reaches")
    void tiered() {
        Candle bar = new Candle(0, 100.0, 100.3, 98.0, 100.2, 1);

        EntryPlan plan = planner.plan(candidate(Side.LONG, bar, 2.15), 1.80);

        assertEquals(99.2, plan.entry(), 1e-9);
        assertEquals(99.2 * 1.0045, plan.takeProfit(), 1e-9);
    }

    @Test
    @DisplayName("Should mirror the plan for shorts")
    void baseShort() {
        Candle bar = new Candle(0, 100.2, 102.0, 99.9, 100.0, 1);

        EntryPlan plan = planner.plan(candidate(Side.SHORT, bar, 1.85), 1.80);

        assertEquals(100.65, plan.entry(), 1e-9);
        assertEquals(101.15, plan.stopLoss(), 1e-9);
        assertEquals(100.65 * 0.997, plan.takeProfit(), 1e-9);
    }

    @Test
    @DisplayName("Should take the widest touch band and accept prices inside it")
    void touch() {
        Candle bar = new Candle(0, 100.0, 100.3, 98.0, 100.2, 1);

        double tolerance = planner.touchTolerance(99.5, bar, Side.LONG, 1.0, 0.1);

        assertEquals(0.3, tolerance, 1e-9);
        assertTrue(planner.touches(99.75, 99.5, tolerance));
        assertTrue(planner.touches(99.25, 99.5, tolerance));
        assertFalse(planner.touches(99.9, 99.5, tolerance));
        assertFalse(planner.touches(Double.NaN, 99.5, tolerance));
    }
}
