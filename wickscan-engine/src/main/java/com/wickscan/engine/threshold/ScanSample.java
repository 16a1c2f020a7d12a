package com.wickscan.engine.threshold;

import java.util.List;

/**
 * What one scan cycle produced, as seen by the threshold controller.
 *
 * @param scores every non-vetoed score computed during the scan
 * @param opened open attempts submitted during the scan
 * @param vetoes hard vetoes fired during the scan
 * @param earlyStop whether the scan stopped at its per-scan open limit
 */
public record ScanSample(List<Double> scores, int opened, int vetoes, boolean earlyStop) {

    public ScanSample {
        scores = List.copyOf(scores);
    }

    public double[] finiteScores() {
        return scores.stream().mapToDouble(Double::doubleValue).filter(Double::isFinite).toArray();
    }
}
