package com.wickscan.execution;

import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.engine.gate.SymbolEligibility;
import com.wickscan.engine.threshold.AdaptiveThreshold;
import com.wickscan.execution.config.EngineConfig;
import com.wickscan.execution.cooldown.CooldownRegistry;
import com.wickscan.execution.journal.TradeLogStore;
import com.wickscan.execution.notify.Notifier;
import com.wickscan.execution.open.ReservationSet;
import com.wickscan.execution.position.PositionBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Process-wide engine state, owned by the scheduler and handed to every component.
 *
 * Write access per field: reservations by the opener only, position fields by the lifecycle only,
 * positions and cooldowns by the opener (on open) and the monitor (on close), the threshold and the
 * rotation offset by the scan.
 */
public class EngineContext implements SymbolEligibility {

    private static final Logger log = LoggerFactory.getLogger(EngineContext.class);

    private final EngineConfig config;
    private final MarketDataFetcher fetcher;
    private final Clock clock;
    private final PositionBook positions = new PositionBook();
    private final ReservationSet reservations = new ReservationSet();
    private final CooldownRegistry cooldowns = new CooldownRegistry();
    private final AdaptiveThreshold threshold;
    private final TradeLogStore tradeLog;
    private final Notifier notifier;
    private final AtomicBoolean enabled = new AtomicBoolean();
    private final AtomicInteger rotationOffset = new AtomicInteger();

    public EngineContext(EngineConfig config, MarketDataFetcher fetcher, TradeLogStore tradeLog,
                         Notifier notifier, Clock clock) {
        this.config = config;
        this.fetcher = fetcher;
        this.tradeLog = tradeLog;
        this.notifier = notifier;
        this.clock = clock;
        this.threshold = new AdaptiveThreshold(config.getScan().getThreshold());
    }

    public EngineConfig getConfig() { return config; }
    public MarketDataFetcher getFetcher() { return fetcher; }
    public Clock getClock() { return clock; }
    public PositionBook getPositions() { return positions; }
    public ReservationSet getReservations() { return reservations; }
    public CooldownRegistry getCooldowns() { return cooldowns; }
    public AdaptiveThreshold getThreshold() { return threshold; }
    public TradeLogStore getTradeLog() { return tradeLog; }
    public Notifier getNotifier() { return notifier; }
    public AtomicBoolean getEnabled() { return enabled; }
    public AtomicInteger getRotationOffset() { return rotationOffset; }

    public long now() {
        return clock.millis();
    }

    public long cooldownMs() {
        return config.getEntry().getCooldownMinutes() * 60_000L;
    }

    @Override
    public boolean isCoolingDown(String symbol, long nowMs) {
        return cooldowns.isActive(symbol, nowMs);
    }

    @Override
    public boolean isAtPositionLimit(String symbol, int maxPerSymbol) {
        return positions.countForSymbol(symbol) >= maxPerSymbol;
    }

    /**
     * Send a notification; failures are logged and never reach the caller.
     */
    public void sendNotification(String text) {
        try {
            notifier.send(text);
        } catch (RuntimeException e) {
            log.error("Notification failed", e);
        }
    }

    /**
     * Write to the trade log; failures are logged and never reach the caller.
     */
    public void journal(Consumer<TradeLogStore> write) {
        try {
            write.accept(tradeLog);
        } catch (RuntimeException e) {
            log.error("Trade log write failed", e);
        }
    }
}
