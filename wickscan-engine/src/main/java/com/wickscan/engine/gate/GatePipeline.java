package com.wickscan.engine.gate;

import com.wickscan.core.indicators.ATR;
import com.wickscan.core.indicators.SMA;
import com.wickscan.core.indicators.VolumeStats;
import com.wickscan.core.model.Candle;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Statistical pre-filter for wick-spike candidates.
 *
 * Checks run cheapest first: engine-state eligibility, history and bar freshness, price floor,
 * then indicator metrics on the last closed bar. A symbol passes when the spike-range test passes
 * together with the wick test or the volume test.
 */
public class GatePipeline {

    private static final Logger log = LoggerFactory.getLogger(GatePipeline.class);

    private final GateSettings settings;
    private final SymbolEligibility eligibility;

    public GatePipeline(GateSettings settings, SymbolEligibility eligibility) {
        this.settings = settings;
        this.eligibility = eligibility;
    }

    public GateSettings getSettings() {
        return settings;
    }

    /**
     * Evaluate the most recent closed bar of {@code series} at wall-clock {@code nowMs}.
     */
    public GateDecision evaluate(CandleSeries series, long nowMs) {
        String symbol = series.symbol();

        if (eligibility.isCoolingDown(symbol, nowMs)) {
            return GateDecision.reject(symbol, GateRejection.COOLDOWN);
        }
        if (eligibility.isAtPositionLimit(symbol, settings.getMaxPositionsPerSymbol())) {
            return GateDecision.reject(symbol, GateRejection.POSITION_LIMIT);
        }

        int required = settings.requiredBars();
        if (series.size() < required) {
            return GateDecision.reject(symbol, GateRejection.INSUFFICIENT_HISTORY);
        }

        int idx = series.size() - 1;
        if (!series.isClosed(idx, nowMs)) {
            idx--;
            if (idx + 1 < required) {
                return GateDecision.reject(symbol, GateRejection.STALE_BAR);
            }
        }

        Candle bar = series.get(idx);
        long tfMs = series.timeframe().toMillis();
        long closedAt = bar.timestamp() + tfMs;
        if (nowMs - closedAt > settings.getMaxBarAgeBars() * tfMs) {
            return GateDecision.reject(symbol, GateRejection.STALE_BAR);
        }
        if (!bar.isFinite()) {
            return GateDecision.reject(symbol, GateRejection.NON_FINITE);
        }
        if (bar.close() < settings.getMinPrice()) {
            return GateDecision.reject(symbol, GateRejection.PRICE_FLOOR);
        }

        List<Candle> history = series.candles().subList(0, idx + 1);
        double atr = ATR.calculate(history, settings.getAtrPeriod())[idx];
        double volumeZ = VolumeStats.zScore(series.volumes(), settings.getVolWindow(), idx);
        double sma = SMA.at(series.closes(), settings.getSmaPeriod(), idx);
        if (!Double.isFinite(atr) || atr <= 0 || !Double.isFinite(volumeZ) || !Double.isFinite(sma)) {
            return GateDecision.reject(symbol, GateRejection.NON_FINITE);
        }

        double body = bar.bodySize();
        double bodyAtr = body / atr;
        if (bodyAtr < settings.getMinBodyAtrFraction()) {
            return GateDecision.reject(symbol, GateRejection.MICRO_BODY);
        }

        double upper = bar.upperWick();
        double lower = bar.lowerWick();
        if (upper <= 0 && lower <= 0) {
            return GateDecision.reject(symbol, GateRejection.NO_WICK);
        }

        // A dominant lower wick is a rejected down-spike: fade it long.
        Side side = lower > upper ? Side.LONG : Side.SHORT;
        double wickRatio = Math.max(upper, lower) / body;
        double spikeMultiple = bar.range() / atr;
        double smaDistance = (bar.close() - sma) / atr;

        boolean wickPass = wickRatio >= settings.minWickRatio(side);
        boolean rangePass = spikeMultiple >= settings.getMinSpikeAtr()
            && spikeMultiple <= settings.maxSpikeAtr(side);
        boolean volumePass = volumeZ >= settings.getVolZThreshold();

        GateResult result = new GateResult(symbol, side, bar, idx, atr, bodyAtr, wickRatio, spikeMultiple,
            volumeZ, smaDistance, wickPass, rangePass, volumePass);

        if (!rangePass) {
            return GateDecision.reject(result, GateRejection.RANGE_FAILED);
        }
        if (!result.passed()) {
            return GateDecision.reject(result, GateRejection.NOT_ENOUGH_TESTS);
        }

        log.debug("Gate pass: {}", result.describe());
        return GateDecision.pass(result);
    }
}
