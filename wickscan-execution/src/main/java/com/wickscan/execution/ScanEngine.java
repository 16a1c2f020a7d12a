package com.wickscan.execution;

import com.wickscan.core.model.Side;
import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.exchange.ExchangeGateway;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.model.Ticker;
import com.wickscan.execution.config.EngineConfig;
import com.wickscan.execution.journal.TradeLogStore;
import com.wickscan.execution.notify.Notifier;
import com.wickscan.execution.open.PositionOpener;
import com.wickscan.execution.position.DcaState;
import com.wickscan.execution.position.Position;
import com.wickscan.execution.scan.PositionMonitor;
import com.wickscan.execution.scan.RangeDcaScanner;
import com.wickscan.execution.scan.ScanReport;
import com.wickscan.execution.scan.ScanStrategy;
import com.wickscan.execution.scan.WickSpikeScanner;
import com.wickscan.execution.state.EngineSnapshot;
import com.wickscan.execution.state.EngineStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Engine facade: wires the components of the configured strategy and exposes the control surface
 * (enable/disable, status, force close).
 */
public class ScanEngine implements EngineControl, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

    private final EngineConfig config;
    private final ExchangeGateway gateway;
    private final EngineStateStore stateStore;
    private final MarketDataFetcher fetcher;
    private final EngineContext ctx;
    private final PositionOpener opener;
    private final PositionMonitor monitor;
    private final ScanStrategy strategy;
    private final ScanScheduler scheduler;

    private volatile boolean started;
    private volatile boolean stopped;

    public ScanEngine(EngineConfig config, ExchangeGateway gateway, TradeLogStore tradeLog, Notifier notifier,
                      EngineStateStore stateStore, Clock clock) {
        this.config = config;
        this.gateway = gateway;
        this.stateStore = stateStore;
        this.fetcher = new MarketDataFetcher(gateway, config.getScan().getFetch());
        this.ctx = new EngineContext(config, fetcher, tradeLog, notifier, clock);
        this.opener = new PositionOpener(ctx);
        this.monitor = new PositionMonitor(ctx);
        this.strategy = switch (config.getScheduler().getStrategy()) {
            case WICK_SPIKE -> new WickSpikeScanner(ctx, opener, monitor);
            case RANGE_DCA -> new RangeDcaScanner(ctx, monitor);
        };
        this.scheduler = new ScanScheduler(ctx, strategy, this::persist);
    }

    /**
     * Connect, restore the previous session and start the scheduler.
     *
     * @throws ExchangeException when the exchange cannot be reached
     * @throws com.wickscan.core.SymbolResolutionException when the strategy symbol does not exist
     * @throws IllegalStateException when the engine was already stopped; its pools are gone
     */
    public synchronized void start() throws ExchangeException {
        if (stopped) {
            throw new IllegalStateException("Engine was stopped and cannot be restarted");
        }
        if (started) {
            return;
        }
        gateway.connect();
        boolean enabled = config.getControl().isStartEnabled();
        Optional<EngineSnapshot> snapshot = stateStore != null ? stateStore.load() : Optional.empty();
        if (snapshot.isPresent()) {
            EngineSnapshot s = snapshot.get();
            ctx.getThreshold().restore(s.threshold());
            ctx.getPositions().restore(s.positions());
            ctx.getCooldowns().restore(s.cooldowns());
            ctx.getRotationOffset().set(Math.max(0, s.rotationOffset()));
            enabled = s.enabled();
            log.info("Session restored from {} (saved {})", stateStore.getFile(), s.savedAt());
        }
        ctx.getEnabled().set(enabled);
        scheduler.start();
        started = true;
        log.info("Engine started on {} with strategy {} (enabled={})", gateway.getVenueName(), strategy.name(), enabled);
        ctx.sendNotification("▶️ Engine started: " + strategy.name() + (enabled ? "" : " (disabled)"));
    }

    @Override
    public void enable() {
        if (!ctx.getEnabled().getAndSet(true)) {
            log.info("Engine enabled");
            ctx.sendNotification("✅ Scanning enabled");
            persist();
        }
    }

    @Override
    public void disable() {
        if (ctx.getEnabled().getAndSet(false)) {
            log.info("Engine disabled");
            ctx.sendNotification("⏸ Scanning disabled");
            persist();
        }
    }

    @Override
    public EngineStatus status() {
        List<EngineStatus.PositionView> views = ctx.getPositions().getActive().stream()
            .map(ScanEngine::view)
            .toList();
        ScanReport last = scheduler.getLastReport();
        return new EngineStatus(
            scheduler.isRunning(),
            ctx.getEnabled().get(),
            strategy.name(),
            ctx.getPositions().size(),
            config.getEntry().getMaxConcurrentPositions(),
            ctx.getReservations().size(),
            ctx.getThreshold().thresholdFor(Side.SHORT),
            ctx.getThreshold().thresholdFor(Side.LONG),
            strategy.parameters(),
            opener.getCounters(),
            views,
            last != null ? last.summary() : null);
    }

    private static EngineStatus.PositionView view(Position p) {
        DcaState dca = p.getDca();
        return new EngineStatus.PositionView(p.getId(), p.getSymbol(), p.getSide().name(), p.getEntryPrice(),
            p.basePrice(), p.getStopLoss(), p.getTakeProfit(), p.getNotionalUsd(),
            dca != null ? dca.getStepsFilled() : null,
            dca != null ? dca.getLiquidationPrice() : null,
            String.valueOf(p.getOpenedAt()));
    }

    /**
     * Close one active position at the live price.
     *
     * @return false when the position is unknown, already closed, or no price is available
     */
    @Override
    public boolean forceClose(String id) {
        Optional<Position> position = ctx.getPositions().get(id);
        if (position.isEmpty()) {
            log.warn("Force close: no active position {}", id);
            return false;
        }
        Position p = position.get();
        Optional<Ticker> ticker = fetcher.fetchTicker(p.getSymbol());
        if (ticker.isEmpty() || !ticker.get().hasLast()) {
            log.warn("Force close of {} failed: no live price", id);
            return false;
        }
        boolean closed = monitor.forceClose(p, ticker.get().last());
        if (closed) {
            persist();
        }
        return closed;
    }

    /**
     * @return number of positions closed
     */
    @Override
    public int forceCloseAll() {
        int closed = 0;
        for (Position p : ctx.getPositions().getActive()) {
            if (forceClose(p.getId())) {
                closed++;
            }
        }
        log.info("Force closed {} positions", closed);
        return closed;
    }

    public EngineSnapshot snapshot() {
        return new EngineSnapshot(ctx.getClock().instant(), ctx.getEnabled().get(), ctx.getThreshold().getState(),
            ctx.getPositions().getActive(), ctx.getCooldowns().snapshot(), ctx.getRotationOffset().get());
    }

    void persist() {
        if (stateStore != null) {
            stateStore.save(snapshot());
        }
    }

    /**
     * Stop scanning, wait for the in-flight scan, persist and disconnect. Terminal: a stopped engine
     * cannot be started again.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        stopped = true;
        scheduler.stop();
        opener.close();
        persist();
        fetcher.close();
        gateway.disconnect();
        ctx.sendNotification("⏹ Engine stopped");
        log.info("Engine stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStarted() {
        return started;
    }

    public EngineContext getContext() {
        return ctx;
    }

    public ScanScheduler getScheduler() {
        return scheduler;
    }

    public ScanStrategy getStrategy() {
        return strategy;
    }
}
