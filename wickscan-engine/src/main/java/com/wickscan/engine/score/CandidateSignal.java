package com.wickscan.engine.score;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.engine.gate.GateResult;

/**
 * A scored candidate. Lives for one scan; consumed by the opener or discarded.
 */
public record CandidateSignal(
    String symbol,
    Side side,
    double score,
    Timeframe timeframe,
    GateResult gate
) {
    public Candle signalBar() {
        return gate.signalBar();
    }

    public long entryBarTimestamp() {
        return gate.signalBar().timestamp();
    }

    public double atr() {
        return gate.atr();
    }
}
