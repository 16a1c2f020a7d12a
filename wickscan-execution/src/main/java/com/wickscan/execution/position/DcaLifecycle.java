package com.wickscan.execution.position;

import com.wickscan.core.model.Side;
import com.wickscan.execution.config.DcaSettings;
import com.wickscan.execution.dca.LiquidationEstimator;
import com.wickscan.execution.dca.PriceRange;
import com.wickscan.execution.dca.TrailingStopRatchet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State machine of averaging positions, evaluated on every live price.
 *
 * Order per tick: exits (target, armed trailing stop), breakout freeze, retest fill, ladder fill,
 * liquidation estimate, trail ratchet. At most one step fills per tick.
 */
public class DcaLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DcaLifecycle.class);

    /**
     * Market context of one evaluation.
     *
     * @param strategic current strategic range, null when not yet built
     * @param atr entry-timeframe ATR, NaN when unavailable
     * @param reversalConfirmed whether the trend has turned toward the position side
     */
    public record Context(PriceRange strategic, double atr, boolean reversalConfirmed, double tickSize) {}

    private final DcaSettings settings;
    private final TrailingStopRatchet ratchet;

    public DcaLifecycle(DcaSettings settings) {
        this.settings = settings;
        this.ratchet = new TrailingStopRatchet(settings);
    }

    public List<LifecycleUpdate> evaluate(Position position, double price, Context ctx, Instant now) {
        List<LifecycleUpdate> updates = new ArrayList<>();
        DcaState dca = position.getDca();
        if (!position.isActive() || dca == null || !Double.isFinite(price) || price <= 0) {
            return updates;
        }
        Side side = position.getSide();
        position.trackExcursion(price, price);

        // ========== Exits ==========

        if (side.sign() * (price - position.getTakeProfit()) >= 0) {
            close(position, ExitReason.TAKE_PROFIT, price, now, updates);
            return updates;
        }
        if (dca.getTrailStage() > 0 && TrailingStopRatchet.isHit(side, price, position.getStopLoss())) {
            close(position, ExitReason.TRAILING_STOP, price, now, updates);
            return updates;
        }

        // ========== Breakout freeze and retest ==========

        PriceRange range = ctx.strategic();
        if (range != null) {
            boolean outside = side == Side.LONG ? price < range.lower() : price > range.upper();
            if (!dca.isFrozen() && outside) {
                boolean reserve = dca.remainingSteps() > 0;
                dca.freeze(reserve, price);
                log.info("Breakout on {} {} at {}: ladder frozen, final step {}", side, position.getSymbol(),
                    price, reserve ? "held for retest" : "not available");
                updates.add(new LifecycleUpdate(position, LifecycleUpdate.Type.FROZEN, price));
            } else if (dca.isFrozen()) {
                dca.trackBreakoutExtreme(side, price);
            }

            if (dca.isFrozen() && dca.isReservedFinalStep() && reentered(side, price, range)
                && ctx.reversalConfirmed()) {
                dca.fill(price, dca.finalStepMargin(), position.getLeverage(), now.toEpochMilli(), true);
                dca.consumeReservedStep();
                position.refreshAveraging();
                log.info("Retest fill on {} {} at {} avg={}", side, position.getSymbol(), price, dca.getAvgPrice());
                updates.add(new LifecycleUpdate(position, LifecycleUpdate.Type.DCA_STEP, price));
            }
        }

        // ========== Ladder ==========

        double next = dca.nextLadderPrice();
        if (Double.isFinite(next) && side.sign() * (next - price) >= 0) {
            dca.fill(price, dca.nextStepMargin(), position.getLeverage(), now.toEpochMilli(), false);
            position.refreshAveraging();
            log.info("DCA step {}/{} on {} {} at {} avg={}", dca.getStepsFilled(), dca.getLevels(), side,
                position.getSymbol(), price, dca.getAvgPrice());
            updates.add(new LifecycleUpdate(position, LifecycleUpdate.Type.DCA_STEP, price));
        }

        dca.setLiquidationPrice(LiquidationEstimator.estimate(side, dca.getAvgPrice(), dca.getQuantity(),
            dca.cumulativeMargin(), settings.getMaintenanceMarginRatio()));

        // ========== Trail ==========

        Optional<TrailingStopRatchet.Move> move = ratchet.next(side, dca.getAvgPrice(), position.getTakeProfit(),
            price, dca.getTrailStage(), position.getStopLoss(), ctx.atr(), ctx.tickSize());
        if (move.isPresent()) {
            TrailingStopRatchet.Move m = move.get();
            boolean stopChanged = Double.compare(m.stop(), position.getStopLoss()) != 0;
            dca.setTrailStage(m.stage());
            position.moveStop(m.stop());
            if (stopChanged) {
                log.info("Trail stage {} on {} {}: stop -> {}", m.stage(), side, position.getSymbol(), m.stop());
                updates.add(new LifecycleUpdate(position, LifecycleUpdate.Type.STOP_MOVED, m.stop()));
            }
        }
        return updates;
    }

    private boolean reentered(Side side, double price, PriceRange range) {
        double band = settings.getReentryBandPct() / 100.0;
        return side == Side.LONG
            ? price >= range.lower() * (1 + band)
            : price <= range.upper() * (1 - band);
    }

    private void close(Position position, ExitReason reason, double price, Instant now,
                       List<LifecycleUpdate> updates) {
        if (position.close(reason, price, now)) {
            log.info("{} {} {} exit at {} pnl={} USDT", reason, position.getSide(), position.getSymbol(), price,
                String.format("%.2f", position.getRealizedPnlUsd()));
            updates.add(new LifecycleUpdate(position, LifecycleUpdate.Type.CLOSED, price));
        }
    }
}
