package com.wickscan.engine.score;

import com.wickscan.core.indicators.ATR;
import com.wickscan.core.indicators.SMA;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Side;
import com.wickscan.engine.gate.GateResult;
import com.wickscan.engine.gate.GateSettings;

/**
 * Turns gate metrics plus trend context into one real-valued score. Pure: the same bars always
 * give the same score.
 */
public class Scorer {

    private final ScoreSettings settings;
    private final GateSettings gateSettings;

    public Scorer(ScoreSettings settings, GateSettings gateSettings) {
        this.settings = settings;
        this.gateSettings = gateSettings;
    }

    public ScoreSettings getSettings() {
        return settings;
    }

    /**
     * @param gate gate-passed metrics of the signal bar
     * @param htf higher-timeframe bars of the same symbol, null when unavailable
     * @param referenceMovePct reference-asset percent move over the lookback, NaN when unavailable
     */
    public ScoreResult score(GateResult gate, CandleSeries htf, double referenceMovePct) {
        Side side = gate.side();
        int sign = side.sign();

        double slope = htf != null ? trendSlope(htf) : Double.NaN;
        double trendAgainst = Double.isFinite(slope) ? -sign * slope : Double.NaN;
        double refAgainst = Double.isFinite(referenceMovePct) ? -sign * referenceMovePct : Double.NaN;

        if (Double.isFinite(trendAgainst) && trendAgainst >= settings.getStrongCounterTrend()) {
            return ScoreResult.vetoed(ScoreVeto.COUNTER_TREND, trendAgainst, refAgainst);
        }
        if (Double.isFinite(refAgainst) && refAgainst >= settings.getMarketVetoPct()) {
            return ScoreResult.vetoed(ScoreVeto.MARKET_AGAINST, trendAgainst, refAgainst);
        }

        double score = settings.getBaseScore();

        double wickExcess = clamp(gate.wickRatio() - gateSettings.minWickRatio(side), 0, settings.getWickExcessCap());
        score += settings.getWickWeight() * wickExcess;

        double spikeExcess = clamp(gate.spikeMultiple() - gateSettings.getMinSpikeAtr(), 0, settings.getSpikeExcessCap());
        score += settings.getSpikeWeight() * spikeExcess;

        if (Double.isFinite(trendAgainst)) {
            if (trendAgainst > 0) {
                score -= settings.getCounterTrendWeight() * trendAgainst;
            } else if (trendAgainst < 0) {
                score += settings.getAlignmentBonus();
            }
        } else {
            score -= settings.getMissingHtfPenalty();
        }

        if (Double.isFinite(refAgainst)) {
            score -= settings.getReferenceWeight() * Math.max(0, refAgainst);
        }

        // Price already stretched past the mean in the trade direction leaves less room to revert.
        double stretch = sign * gate.smaDistanceAtr() - settings.getMeanReversionFreeAtr();
        score -= settings.getMeanReversionWeight() * Math.max(0, stretch);

        if (gate.passCount() == 3) {
            score += settings.getExtraPassBonus();
        }
        if (side == Side.LONG) {
            score -= settings.getLongBias();
        }

        return new ScoreResult(score, null, trendAgainst, refAgainst);
    }

    /**
     * Change of the trend SMA over the lookback, in units of the higher-timeframe ATR.
     * NaN when the series is too short.
     */
    public double trendSlope(CandleSeries htf) {
        int last = htf.size() - 1;
        int back = last - settings.getTrendLookback();
        if (back < settings.getTrendSmaPeriod() - 1) {
            return Double.NaN;
        }
        double[] closes = htf.closes();
        double smaNow = SMA.at(closes, settings.getTrendSmaPeriod(), last);
        double smaBack = SMA.at(closes, settings.getTrendSmaPeriod(), back);
        double atr = ATR.calculate(htf.candles(), settings.getTrendAtrPeriod())[last];
        if (!Double.isFinite(smaNow) || !Double.isFinite(smaBack) || !Double.isFinite(atr) || atr <= 0) {
            return Double.NaN;
        }
        return (smaNow - smaBack) / atr;
    }

    /**
     * Percent move of the reference asset over its lookback, using closed bars only.
     * NaN when the series is null or too short.
     */
    public double referenceMovePct(CandleSeries reference, long nowMs) {
        if (reference == null || reference.isEmpty()) {
            return Double.NaN;
        }
        int last = reference.size() - 1;
        if (!reference.isClosed(last, nowMs)) {
            last--;
        }
        int from = last - settings.getReferenceLookbackBars();
        if (from < 0) {
            return Double.NaN;
        }
        double start = reference.get(from).close();
        double end = reference.get(last).close();
        if (start <= 0 || !Double.isFinite(start) || !Double.isFinite(end)) {
            return Double.NaN;
        }
        return (end - start) / start * 100.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
