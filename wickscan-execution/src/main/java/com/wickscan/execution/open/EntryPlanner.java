package com.wickscan.execution.open;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.Side;
import com.wickscan.engine.score.CandidateSignal;
import com.wickscan.execution.config.EntrySettings;

/**
 * Entry, stop and target for a candidate, plus the live-price touch tolerance.
 */
public class EntryPlanner {

    private final EntrySettings settings;

    public EntryPlanner(EntrySettings settings) {
        this.settings = settings;
    }

    /**
     * Entry retraces {@code f} of the tail beyond the body; better candidates (larger margin over
     * the threshold) use a deeper tail fraction and a wider target.
     */
    public EntryPlan plan(CandidateSignal candidate, double threshold) {
        Candle bar = candidate.signalBar();
        Side side = candidate.side();

        double tail = settings.getTailFraction();
        double tpPct = settings.getTpPct();
        EntrySettings.MarginTier tier = settings.tierFor(candidate.score() - threshold);
        if (tier != null) {
            tail = tier.getTailFraction();
            tpPct = settings.getTpPct() * tier.getTpMultiplier();
        }

        double entry = side == Side.LONG
            ? bar.bodyLow() - tail * (bar.bodyLow() - bar.low())
            : bar.bodyHigh() + tail * (bar.high() - bar.bodyHigh());

        double slDistance = Math.max(entry * settings.getSlPct() / 100.0, settings.getSlAtrMult() * candidate.atr());
        int sign = side.sign();
        double stop = entry - sign * slDistance;
        double target = entry * (1 + sign * tpPct / 100.0);
        return new EntryPlan(candidate.symbol(), side, entry, stop, target, tail, tpPct);
    }

    /**
     * Half-width of the band around the entry the live price must be in.
     */
    public double touchTolerance(double entry, Candle signalBar, Side side, double atr, double tickSize) {
        double wick = side == Side.LONG ? signalBar.lowerWick() : signalBar.upperWick();
        double tolerance = Math.max(settings.getTouchTicks() * tickSize,
            Math.max(settings.getTouchWickFraction() * wick,
                Double.isFinite(atr) ? settings.getTouchAtrFraction() * atr : 0));
        if (entry < settings.getLowPriceCutoff()) {
            tolerance = Math.max(tolerance, entry * settings.getLowPriceTolerancePct() / 100.0);
        }
        return Math.max(tolerance, entry * settings.getMinTolerancePct() / 100.0);
    }

    public boolean touches(double price, double entry, double tolerance) {
        return Double.isFinite(price) && Math.abs(price - entry) <= tolerance;
    }
}
