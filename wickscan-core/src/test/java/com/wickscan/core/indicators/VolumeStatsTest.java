package com.wickscan.core.indicators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VolumeStatsTest {

    @Test
    @DisplayName("Should score a spike against its window")
    void spike() {
        double[] volumes = {1, 1, 1, 1, 5};

        double z = VolumeStats.zScore(volumes, 5, 4);

        // mean 1.8, sample std sqrt(3.2)
        assertEquals(3.2 / Math.sqrt(3.2), z, 1e-9);
    }

    @Test
    @DisplayName("Should return 0 for a flat window and NaN without history")
    void degenerate() {
        double[] volumes = {2, 2, 2, 2};

        assertEquals(0.0, VolumeStats.zScore(volumes, 4, 3));
        assertTrue(Double.isNaN(VolumeStats.zScore(volumes, 4, 2)));
        assertTrue(Double.isNaN(VolumeStats.zScore(volumes, 1, 3)));
    }
}
