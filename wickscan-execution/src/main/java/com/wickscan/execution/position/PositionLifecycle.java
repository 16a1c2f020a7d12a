package com.wickscan.execution.position;

import com.wickscan.core.model.Candle;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Side;
import com.wickscan.execution.config.TrailSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * ACTIVE → CLOSED state machine of fixed-bracket positions.
 *
 * Completed bars after the entry bar are replayed in order; a bar whose range brackets the stop
 * or the target exits at that bracket price, and the stop wins when both are bracketed. While the
 * entry bar is still forming only a live price is available, and exits fill at that price.
 */
public class PositionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PositionLifecycle.class);

    private final TrailSettings trail;

    public PositionLifecycle(TrailSettings trail) {
        this.trail = trail;
    }

    /**
     * True while the bar the position was opened on has not closed yet.
     */
    public static boolean onEntryBar(Position position, long nowMs) {
        return nowMs < position.getEntryBarTimestamp() + position.getTimeframe().toMillis();
    }

    /**
     * Replay completed bars not yet evaluated.
     */
    public List<LifecycleUpdate> evaluateBars(Position position, CandleSeries bars, long nowMs) {
        List<LifecycleUpdate> updates = new ArrayList<>();
        if (!position.isActive() || bars == null) {
            return updates;
        }
        long tfMs = position.getTimeframe().toMillis();
        for (Candle bar : bars.candles()) {
            if (bar.timestamp() <= position.getLastEvaluatedBarTs()) {
                continue;
            }
            if (bar.timestamp() + tfMs > nowMs) {
                break;
            }
            if (!bar.isFinite()) {
                position.setLastEvaluatedBarTs(bar.timestamp());
                continue;
            }
            LifecycleUpdate exit = checkBracket(position, bar.high(), bar.low(),
                Instant.ofEpochMilli(bar.timestamp() + tfMs));
            position.setLastEvaluatedBarTs(bar.timestamp());
            if (exit != null) {
                updates.add(exit);
                return updates;
            }
            position.trackExcursion(bar.high(), bar.low());
            maybeTrail(position, updates);
        }
        return updates;
    }

    /**
     * Evaluate a live price; used while the entry bar is still forming.
     */
    public List<LifecycleUpdate> evaluatePrice(Position position, double price, Instant now) {
        List<LifecycleUpdate> updates = new ArrayList<>();
        if (!position.isActive() || !Double.isFinite(price) || price <= 0) {
            return updates;
        }
        position.trackExcursion(price, price);
        LifecycleUpdate exit = checkBracket(position, price, price, now);
        if (exit != null) {
            updates.add(exit);
            return updates;
        }
        maybeTrail(position, updates);
        return updates;
    }

    /**
     * Close at {@code price} on operator request. Empty when the position was already closed.
     */
    public List<LifecycleUpdate> forceClose(Position position, double price, Instant now) {
        if (!position.close(ExitReason.FORCE_CLOSE, price, now)) {
            return List.of();
        }
        log.info("Force closed {} at {}", position, price);
        return List.of(new LifecycleUpdate(position, LifecycleUpdate.Type.CLOSED, price));
    }

    private LifecycleUpdate checkBracket(Position p, double high, double low, Instant at) {
        double sl = p.getStopLoss();
        double tp = p.getTakeProfit();
        boolean stopHit = Double.isFinite(sl) && (p.getSide() == Side.LONG ? low <= sl : high >= sl);
        boolean targetHit = Double.isFinite(tp) && (p.getSide() == Side.LONG ? high >= tp : low <= tp);

        ExitReason reason;
        double exitPrice;
        if (stopHit) {
            reason = p.isTrailArmed() ? ExitReason.TRAILING_STOP : ExitReason.STOP_LOSS;
            exitPrice = high == low ? high : sl;
            // The rest of the bar trades after the fill
            p.trackExcursion(exitPrice, exitPrice);
        } else if (targetHit) {
            reason = ExitReason.TAKE_PROFIT;
            exitPrice = high == low ? high : tp;
            if (p.getSide() == Side.LONG) {
                p.trackExcursion(exitPrice, low);
            } else {
                p.trackExcursion(high, exitPrice);
            }
        } else {
            return null;
        }
        if (!p.close(reason, exitPrice, at)) {
            return null;
        }
        log.info("{} {} {} exit at {} pnl={}%", reason, p.getSide(), p.getSymbol(), exitPrice,
            String.format("%.2f", p.getRealizedPnlPct()));
        return new LifecycleUpdate(p, LifecycleUpdate.Type.CLOSED, exitPrice);
    }

    private void maybeTrail(Position p, List<LifecycleUpdate> updates) {
        if (!trail.isEnabled() || p.isTrailArmed()) {
            return;
        }
        if (p.mfePct() < trail.getTriggerPct()) {
            return;
        }
        int sign = p.getSide().sign();
        double lockStop = p.getEntryPrice() * (1 + sign * trail.getLockPct() / 100.0);
        double current = p.getStopLoss();
        if (Double.isFinite(current) && sign * (lockStop - current) <= 0) {
            return;
        }
        p.armTrail(lockStop);
        log.info("Trail armed on {} {}: stop -> {}", p.getSide(), p.getSymbol(), lockStop);
        updates.add(new LifecycleUpdate(p, LifecycleUpdate.Type.STOP_MOVED, lockStop));
    }
}
