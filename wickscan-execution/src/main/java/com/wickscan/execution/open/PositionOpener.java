package com.wickscan.execution.open;

import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.engine.score.CandidateSignal;
import com.wickscan.exchange.ExchangeGateway;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.model.Ticker;
import com.wickscan.execution.EngineContext;
import com.wickscan.execution.config.EntrySettings;
import com.wickscan.execution.journal.TradeOpenEvent;
import com.wickscan.execution.notify.NotificationFormatter;
import com.wickscan.execution.position.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens fixed-bracket positions for accepted candidates.
 *
 * {@link #submit} checks capacity and reserves the symbol on the caller's thread, then runs the open
 * on the opener pool so a slow touch check never blocks the scan. The reservation is released by a
 * completion callback, once, whatever the outcome.
 */
public class PositionOpener implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PositionOpener.class);

    public static final String STRATEGY = "wick-spike";

    private final EngineContext ctx;
    private final EntrySettings settings;
    private final EntryPlanner planner;
    private final ExecutorService executor;
    private final Map<OpenStatus, AtomicLong> counters = new EnumMap<>(OpenStatus.class);

    public PositionOpener(EngineContext ctx) {
        this.ctx = ctx;
        this.settings = ctx.getConfig().getEntry();
        this.planner = new EntryPlanner(settings);
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, settings.getOpenerThreads()), r -> {
            Thread t = new Thread(r, "position-opener-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (OpenStatus s : OpenStatus.values()) {
            counters.put(s, new AtomicLong());
        }
    }

    /**
     * Start an open attempt for {@code candidate}.
     *
     * @param threshold side-adjusted threshold the candidate cleared
     */
    public synchronized CompletableFuture<OpenOutcome> submit(CandidateSignal candidate, double threshold) {
        String symbol = candidate.symbol();
        if (atCapacity()) {
            return completed(OpenOutcome.rejected(symbol, OpenStatus.CAPACITY,
                inFlight() + "/" + settings.getMaxConcurrentPositions()));
        }
        Optional<ReservationSet.Reservation> reserved = ctx.getReservations().tryReserve(symbol);
        if (reserved.isEmpty()) {
            return completed(OpenOutcome.rejected(symbol, OpenStatus.ALREADY_RESERVED, null));
        }
        ReservationSet.Reservation reservation = reserved.get();

        CompletableFuture<OpenOutcome> attempt;
        try {
            attempt = CompletableFuture.supplyAsync(() -> open(candidate, threshold), executor);
        } catch (RejectedExecutionException e) {
            reservation.release();
            return completed(OpenOutcome.rejected(symbol, OpenStatus.FAILED, "opener stopped"));
        }
        return attempt
            .handle((outcome, error) -> {
                if (error != null) {
                    log.error("Open attempt for {} failed", symbol, error);
                    return OpenOutcome.rejected(symbol, OpenStatus.FAILED, String.valueOf(error.getMessage()));
                }
                return outcome;
            })
            .whenComplete((outcome, error) -> {
                reservation.release();
                if (outcome != null) {
                    counters.get(outcome.status()).incrementAndGet();
                }
            });
    }

    /**
     * Whether open positions plus in-flight reservations already fill every slot.
     */
    public boolean atCapacity() {
        return inFlight() >= settings.getMaxConcurrentPositions();
    }

    private int inFlight() {
        return ctx.getReservations().size() + ctx.getPositions().size();
    }

    private CompletableFuture<OpenOutcome> completed(OpenOutcome outcome) {
        counters.get(outcome.status()).incrementAndGet();
        log.debug("Open of {} skipped: {}", outcome.symbol(), outcome.status());
        return CompletableFuture.completedFuture(outcome);
    }

    OpenOutcome open(CandidateSignal candidate, double threshold) {
        String symbol = candidate.symbol();
        if (settings.getEntrySettleMs() > 0) {
            try {
                Thread.sleep(settings.getEntrySettleMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OpenOutcome.rejected(symbol, OpenStatus.FAILED, "interrupted");
            }
        }

        MarketDataFetcher fetcher = ctx.getFetcher();
        ExchangeGateway gateway = fetcher.getGateway();
        EntryPlan raw = planner.plan(candidate, threshold);
        EntryPlan plan;
        double tick;
        try {
            tick = fetcher.call("tickSize " + symbol, () -> gateway.tickSize(symbol));
            plan = raw.withPrices(
                fetcher.call("round " + symbol, () -> gateway.roundToTick(symbol, raw.entry())),
                fetcher.call("round " + symbol, () -> gateway.roundToTick(symbol, raw.stopLoss())),
                fetcher.call("round " + symbol, () -> gateway.roundToTick(symbol, raw.takeProfit())));
        } catch (ExchangeException e) {
            log.warn("Open of {} abandoned, precision lookup failed: {}", symbol, e.getMessage());
            return OpenOutcome.rejected(symbol, OpenStatus.EXCHANGE_ERROR, e.getMessage());
        }

        Optional<Ticker> ticker = ctx.getFetcher().fetchTicker(symbol);
        if (ticker.isEmpty() || !ticker.get().hasLast()) {
            log.warn("Open of {} abandoned, no live price", symbol);
            return OpenOutcome.rejected(symbol, OpenStatus.DATA_UNAVAILABLE, null);
        }
        double price = ticker.get().last();
        double tolerance = planner.touchTolerance(plan.entry(), candidate.signalBar(), candidate.side(),
            candidate.atr(), tick);
        if (!planner.touches(price, plan.entry(), tolerance)) {
            log.info("No touch on {} {}: price {} entry {} tolerance {}", candidate.side(), symbol, price,
                plan.entry(), tolerance);
            return OpenOutcome.rejected(symbol, OpenStatus.NO_TOUCH,
                String.format("price %s vs entry %s", price, plan.entry()));
        }

        Instant now = ctx.getClock().instant();
        Timeframe tf = candidate.timeframe();
        long entryBar = now.toEpochMilli() / tf.toMillis() * tf.toMillis();
        Position position = Position.bracket(signalId(candidate), symbol, candidate.side(), tf,
            plan.entry(), plan.stopLoss(), plan.takeProfit(), now, entryBar,
            settings.getLeverage(), settings.getPositionSizeUsdt(), candidate.score(), threshold);

        ctx.getPositions().add(position);
        ctx.getCooldowns().startFor(symbol, ctx.cooldownMs(), now.toEpochMilli());
        log.info("Opened {} {} @ {} SL={} TP={} score={} thr={}", candidate.side(), symbol, plan.entry(),
            plan.stopLoss(), plan.takeProfit(), String.format("%.3f", candidate.score()),
            String.format("%.2f", threshold));
        ctx.journal(store -> store.recordOpen(new TradeOpenEvent(STRATEGY, position)));
        ctx.sendNotification(NotificationFormatter.opened(STRATEGY, position));
        return OpenOutcome.opened(position);
    }

    static String signalId(CandidateSignal c) {
        return c.symbol() + "-" + (c.side() == Side.LONG ? "L" : "S") + "-" + c.entryBarTimestamp();
    }

    public Map<OpenStatus, Long> getCounters() {
        Map<OpenStatus, Long> out = new EnumMap<>(OpenStatus.class);
        counters.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    public EntryPlanner getPlanner() {
        return planner;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Opener pool did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
