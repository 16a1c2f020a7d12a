package com.wickscan.execution.scan;

import com.wickscan.core.model.CandleSeries;
import com.wickscan.exchange.model.Ticker;
import com.wickscan.execution.EngineContext;
import com.wickscan.execution.journal.TradeCloseEvent;
import com.wickscan.execution.journal.TradeUpdateEvent;
import com.wickscan.execution.notify.NotificationFormatter;
import com.wickscan.execution.position.LifecycleUpdate;
import com.wickscan.execution.position.Position;
import com.wickscan.execution.position.PositionLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Drives fixed-bracket positions through their lifecycle and publishes every resulting update:
 * trade log, notification, and on close removal from the book plus a cooldown.
 */
public class PositionMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);
    private static final int MAX_BARS = 1500;

    private final EngineContext ctx;
    private final PositionLifecycle lifecycle;

    public PositionMonitor(EngineContext ctx) {
        this.ctx = ctx;
        this.lifecycle = new PositionLifecycle(ctx.getConfig().getTrail());
    }

    public PositionLifecycle getLifecycle() {
        return lifecycle;
    }

    /**
     * Evaluate every active fixed-bracket position once.
     */
    public void monitorBrackets() {
        for (Position p : ctx.getPositions().getActive()) {
            if (p.isAveraging()) {
                continue;
            }
            try {
                List<LifecycleUpdate> updates;
                synchronized (p) {
                    updates = evaluate(p);
                }
                apply(updates);
            } catch (RuntimeException e) {
                log.warn("Monitor failed for {}: {}", p, e.getMessage(), e);
            }
        }
    }

    private List<LifecycleUpdate> evaluate(Position p) {
        long now = ctx.now();
        if (PositionLifecycle.onEntryBar(p, now)) {
            Optional<Ticker> ticker = ctx.getFetcher().fetchTicker(p.getSymbol());
            if (ticker.isEmpty() || !ticker.get().hasLast()) {
                return List.of();
            }
            return lifecycle.evaluatePrice(p, ticker.get().last(), ctx.getClock().instant());
        }
        long tfMs = p.getTimeframe().toMillis();
        int limit = (int) Math.min(MAX_BARS, (now - p.getLastEvaluatedBarTs()) / tfMs + 2);
        Optional<CandleSeries> bars = ctx.getFetcher().fetchCandles(p.getSymbol(), p.getTimeframe(), limit);
        if (bars.isEmpty()) {
            log.debug("No bars for {}, retrying next tick", p.getSymbol());
            return List.of();
        }
        return lifecycle.evaluateBars(p, bars.get(), now);
    }

    /**
     * Close {@code p} at {@code price} on operator request.
     *
     * @return false when the position was already closed
     */
    public boolean forceClose(Position p, double price) {
        List<LifecycleUpdate> updates;
        synchronized (p) {
            updates = lifecycle.forceClose(p, price, ctx.getClock().instant());
        }
        apply(updates);
        return !updates.isEmpty();
    }

    /**
     * Publish lifecycle updates. A close removes the position and starts its cooldown.
     */
    public void apply(List<LifecycleUpdate> updates) {
        for (LifecycleUpdate u : updates) {
            Position p = u.position();
            if (u.isClose()) {
                ctx.getPositions().remove(p);
                ctx.getCooldowns().startFor(p.getSymbol(), ctx.cooldownMs(), ctx.now());
                ctx.journal(store -> store.recordClose(new TradeCloseEvent(p)));
            } else {
                ctx.journal(store -> store.recordUpdate(new TradeUpdateEvent(u, ctx.getClock().instant())));
            }
            ctx.sendNotification(NotificationFormatter.updated(u));
        }
    }
}
