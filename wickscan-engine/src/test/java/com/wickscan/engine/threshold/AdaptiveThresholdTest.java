package com.wickscan.engine.threshold;

import com.wickscan.core.model.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the end-of-scan threshold update.
 */
class AdaptiveThresholdTest {

    private AdaptiveThreshold threshold;

    @BeforeEach
    void setUp() {
        threshold = new AdaptiveThreshold(new ThresholdSettings());
    }

    private static List<Double> repeat(double value, int n) {
        return new ArrayList<>(Collections.nCopies(n, value));
    }

    @Nested
    @DisplayName("Quantile Update Tests")
    class QuantileUpdateTests {

        @Test
        @DisplayName("Should blend the padded 95th percentile into the old value")
        void smoothsTowardTarget() {
            // Given: 60 scores whose 95th percentile is 2.1
            List<Double> scores = repeat(1.5, 56);
            scores.addAll(List.of(2.1, 2.1, 2.1, 2.2));

            // When
            ThresholdState state = threshold.update(new ScanSample(scores, 1, 0, false), 1_000L);

            // Then: 0.6 * 1.8 + 0.4 * 2.12 = 1.928
            assertEquals(1.93, state.value(), 1e-9);
            assertEquals(1_000L, state.lastUpdate());
            assertEquals(0.13, state.lastDelta(), 1e-9);
        }

        @Test
        @DisplayName("Should clip a large move to the maximum jump")
        void clipsJump() {
            ThresholdState state = threshold.update(new ScanSample(repeat(2.4, 60), 0, 0, false), 1L);

            assertEquals(1.95, state.value(), 1e-9);
        }

        @Test
        @DisplayName("Should fold the early-stop bump into the target")
        void earlyStopBump() {
            List<Double> scores = repeat(1.5, 56);
            scores.addAll(List.of(2.1, 2.1, 2.1, 2.2));

            ThresholdState state = threshold.update(new ScanSample(scores, 3, 0, true), 1L);

            // target 2.17: 0.6 * 1.8 + 0.4 * 2.17 = 1.948
            assertEquals(1.95, state.value(), 1e-9);
        }

        @Test
        @DisplayName("Should ignore non-finite scores when sizing the sample")
        void ignoresNaN() {
            List<Double> scores = repeat(Double.NaN, 40);
            scores.addAll(repeat(2.0, 5));

            ThresholdState state = threshold.update(new ScanSample(scores, 1, 0, false), 1L);

            assertEquals(1.80, state.value(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Small Sample Tests")
    class SmallSampleTests {

        @Test
        @DisplayName("Should explore downward when nothing opened and few vetoes fired")
        void explores() {
            ThresholdState state = threshold.update(new ScanSample(repeat(1.6, 5), 0, 2, false), 1L);

            assertEquals(1.78, state.value(), 1e-9);
        }

        @Test
        @DisplayName("Should hold when a trade was opened")
        void holds() {
            assertEquals(1.80, threshold.update(new ScanSample(List.of(1.9), 1, 0, false), 1L).value(), 1e-9);
        }

        @Test
        @DisplayName("Should hold when many vetoes fired")
        void holdsOnVetoes() {
            assertEquals(1.80, threshold.update(new ScanSample(List.of(), 0, 6, false), 1L).value(), 1e-9);
        }

        @Test
        @DisplayName("Should bump upward on early stop")
        void bumpsOnEarlyStop() {
            assertEquals(1.85, threshold.update(new ScanSample(List.of(2.0), 3, 0, true), 1L).value(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Bounds Tests")
    class BoundsTests {

        @Test
        @DisplayName("Should never leave the configured bounds")
        void staysInBounds() {
            for (int i = 0; i < 100; i++) {
                ThresholdState state = threshold.update(new ScanSample(List.of(), 0, 0, false), i);
                assertTrue(threshold.inBounds(state.value()));
            }
            assertEquals(1.40, threshold.value(), 1e-9);

            for (int i = 0; i < 100; i++) {
                threshold.update(new ScanSample(repeat(9.0, 200), 0, 0, true), i);
                assertTrue(threshold.inBounds(threshold.value()));
            }
            assertTrue(threshold.value() > 2.3, "value " + threshold.value());
        }

        @Test
        @DisplayName("Should clamp a restored value and offset longs")
        void restoreAndOffset() {
            threshold.restore(new ThresholdState(5.0, 10L, 0.1));

            assertEquals(2.40, threshold.thresholdFor(Side.SHORT), 1e-9);
            assertEquals(2.50, threshold.thresholdFor(Side.LONG), 1e-9);
            assertEquals(10L, threshold.getState().lastUpdate());
        }

        @Test
        @DisplayName("Should ignore an unusable restored state")
        void ignoresBadRestore() {
            threshold.restore(new ThresholdState(Double.NaN, 1L, 0));
            threshold.restore(null);

            assertEquals(1.80, threshold.value(), 1e-9);
        }
    }
}
