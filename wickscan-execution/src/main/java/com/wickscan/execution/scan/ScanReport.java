package com.wickscan.execution.scan;

import com.wickscan.engine.gate.GateRejection;

import java.util.Map;

/**
 * Summary of one scan cycle.
 *
 * @param processed symbols evaluated before the scan ended
 * @param submitted open attempts started
 * @param threshold threshold value after the end-of-scan update
 */
public record ScanReport(
    String strategy,
    long startedAt,
    long durationMs,
    int universeSize,
    int processed,
    int gatePassed,
    int scored,
    int vetoes,
    int submitted,
    boolean earlyStop,
    boolean budgetExceeded,
    double threshold,
    Map<GateRejection, Integer> rejections
) {
    public ScanReport {
        rejections = Map.copyOf(rejections);
    }

    public static ScanReport empty(String strategy, long startedAt, long durationMs, double threshold) {
        return new ScanReport(strategy, startedAt, durationMs, 0, 0, 0, 0, 0, 0, false, false, threshold, Map.of());
    }

    public String summary() {
        return String.format("%s: %d/%d symbols, %d passed gate, %d scored, %d vetoed, %d submitted%s%s, thr=%.2f in %d ms",
            strategy, processed, universeSize, gatePassed, scored, vetoes, submitted,
            earlyStop ? " (early stop)" : "", budgetExceeded ? " (budget exceeded)" : "",
            threshold, durationMs);
    }
}
