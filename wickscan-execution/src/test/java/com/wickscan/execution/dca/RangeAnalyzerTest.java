package com.wickscan.execution.dca;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.execution.config.DcaSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/** Unit tests for RangeAnalyzer and RangeEntryScorer. */
class RangeAnalyzerTest {

    private static final long HOUR = 3_600_000L;

    private final DcaSettings settings = new DcaSettings();

    private static CandleSeries flat(int n) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(new Candle(i * HOUR, 1.0, 1.01, 0.99, 1.0, 1000));
        }
        return new CandleSeries("EURCUSDT", Timeframe.H1, out);
    }

    private static CandleSeries rising(int n) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(new Candle(i * HOUR, 100 + i, 101 + i, 99.5 + i, 101 + i, 100));
        }
        return new CandleSeries("EURCUSDT", Timeframe.H1, out);
    }

    @Nested
    @DisplayName("Range Tests")
    class RangeTests {

        private final RangeAnalyzer analyzer = new RangeAnalyzer(settings);

        @Test
        @DisplayName("Should widen a quiet range to EMA plus or minus k ATR")
        void widensQuietRange() {
            PriceRange range = analyzer.strategic(flat(100)).orElseThrow();

            assertEquals(0.97, range.lower(), 1e-9);
            assertEquals(1.03, range.upper(), 1e-9);
            assertEquals(range, analyzer.tactical(flat(100)).orElseThrow());
        }

        @Test
        @DisplayName("Should need enough bars for the EMA")
        void insufficientBars() {
            assertTrue(analyzer.strategic(flat(50)).isEmpty());
            assertTrue(analyzer.tactical(flat(50)).isEmpty());
        }

        @Test
        @DisplayName("Should cap the strategic lookback")
        void strategicBars() {
            assertEquals(1500, analyzer.strategicBars(HOUR));
            assertEquals(90, analyzer.strategicBars(24 * HOUR));
        }
    }

    @Nested
    @DisplayName("Entry Score Tests")
    class EntryScoreTests {

        private final RangeEntryScorer scorer = new RangeEntryScorer(settings);
        private final PriceRange range = new PriceRange(0.95, 1.05);

        @Test
        @DisplayName("Should pick the side from the border zone")
        void zoneSide() {
            assertEquals(Side.LONG, scorer.zoneSide(0.951, range).orElseThrow());
            assertEquals(Side.SHORT, scorer.zoneSide(1.049, range).orElseThrow());
            assertTrue(scorer.zoneSide(1.0, range).isEmpty());
        }

        @Test
        @DisplayName("Should fade the border term over a fifth of the range")
        void borderTerm() {
            assertEquals(1.0, RangeEntryScorer.borderTerm(Side.LONG, 0.95, range), 1e-9);
            assertEquals(0.5, RangeEntryScorer.borderTerm(Side.LONG, 0.96, range), 1e-9);
            assertEquals(0.0, RangeEntryScorer.borderTerm(Side.LONG, 1.0, range), 1e-9);
            assertEquals(1.0, RangeEntryScorer.borderTerm(Side.SHORT, 1.05, range), 1e-9);
        }

        @Test
        @DisplayName("Should keep the score in [0, 1] and count the border weight")
        void bounded() {
            double score = scorer.score(Side.LONG, flat(80), range, 0.95);

            assertTrue(score >= settings.getWeightBorder() - 1e-9);
            assertTrue(score <= 1.0);
            assertEquals(0.0, scorer.score(Side.LONG, flat(1), range, 0.95));
        }

        @Test
        @DisplayName("Should confirm a reversal only in the trend direction")
        void reversal() {
            assertTrue(scorer.reversalConfirmed(Side.LONG, rising(30)));
            assertFalse(scorer.reversalConfirmed(Side.SHORT, rising(30)));
            assertFalse(scorer.reversalConfirmed(Side.LONG, null));
        }
    }
}
