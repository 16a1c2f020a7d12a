package com.wickscan.engine.score;

/**
 * Hard vetoes that reject a candidate before any score is computed.
 */
public enum ScoreVeto {
    /** Higher-timeframe trend strongly opposes the trade. */
    COUNTER_TREND,
    /** Reference asset moving sharply against the trade. */
    MARKET_AGAINST
}
