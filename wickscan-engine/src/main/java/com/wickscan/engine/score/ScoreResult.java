package com.wickscan.engine.score;

import java.util.Optional;

/**
 * Score of a gate-passed candidate, or the veto that rejected it.
 *
 * @param trendAgainst higher-timeframe slope against the side, NaN without higher-timeframe data
 * @param referenceAgainstPct reference-asset move against the side in percent, NaN when unknown
 */
public record ScoreResult(double score, ScoreVeto veto, double trendAgainst, double referenceAgainstPct) {

    public static ScoreResult vetoed(ScoreVeto veto, double trendAgainst, double referenceAgainstPct) {
        return new ScoreResult(Double.NaN, veto, trendAgainst, referenceAgainstPct);
    }

    public boolean isVetoed() {
        return veto != null;
    }

    public Optional<ScoreVeto> vetoReason() {
        return Optional.ofNullable(veto);
    }
}
