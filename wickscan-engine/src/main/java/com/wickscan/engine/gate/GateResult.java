package com.wickscan.engine.gate;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Side;

/**
 * Metrics of one signal bar and the outcome of each sub-test.
 *
 * @param signalIndex index of the signal bar inside the evaluated series
 * @param spikeMultiple bar range divided by ATR
 * @param smaDistanceAtr signed distance of the close from the short SMA, in ATR units
 */
public record GateResult(
    String symbol,
    Side side,
    Candle signalBar,
    int signalIndex,
    double atr,
    double bodyAtr,
    double wickRatio,
    double spikeMultiple,
    double volumeZ,
    double smaDistanceAtr,
    boolean wickPass,
    boolean rangePass,
    boolean volumePass
) {
    public int passCount() {
        return (wickPass ? 1 : 0) + (rangePass ? 1 : 0) + (volumePass ? 1 : 0);
    }

    /**
     * Range test mandatory, plus at least one of wick and volume.
     */
    public boolean passed() {
        return rangePass && (wickPass || volumePass);
    }

    public String describe() {
        return String.format("%s %s wick=%.2f%s spike=%.2f%s volZ=%.2f%s dist=%.2f",
            symbol, side, wickRatio, mark(wickPass), spikeMultiple, mark(rangePass),
            volumeZ, mark(volumePass), smaDistanceAtr);
    }

    private static String mark(boolean pass) {
        return pass ? "+" : "-";
    }
}
