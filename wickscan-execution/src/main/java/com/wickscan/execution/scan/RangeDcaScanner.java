package com.wickscan.execution.scan;

import com.wickscan.core.SymbolResolutionException;
import com.wickscan.core.indicators.ATR;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;
import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import com.wickscan.execution.EngineContext;
import com.wickscan.execution.config.DcaSettings;
import com.wickscan.execution.dca.DcaPlan;
import com.wickscan.execution.dca.PriceRange;
import com.wickscan.execution.dca.RangeAnalyzer;
import com.wickscan.execution.dca.RangeEntryScorer;
import com.wickscan.execution.dca.RangeLadder;
import com.wickscan.execution.journal.TradeOpenEvent;
import com.wickscan.execution.notify.NotificationFormatter;
import com.wickscan.execution.open.ReservationSet;
import com.wickscan.execution.position.DcaLifecycle;
import com.wickscan.execution.position.DcaState;
import com.wickscan.execution.position.LifecycleUpdate;
import com.wickscan.execution.position.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-symbol range strategy: enters near a border of the strategic range and averages into the
 * position along a ladder until the target, a trailing stop, or a breakout freeze takes over.
 */
public class RangeDcaScanner implements ScanStrategy {

    private static final Logger log = LoggerFactory.getLogger(RangeDcaScanner.class);

    public static final String STRATEGY = "range-dca";

    private final EngineContext ctx;
    private final DcaSettings settings;
    private final RangeAnalyzer analyzer;
    private final RangeEntryScorer scorer;
    private final RangeLadder ladder;
    private final DcaLifecycle lifecycle;
    private final PositionMonitor monitor;

    private volatile PriceRange strategic;
    private volatile PriceRange tactical;
    private volatile double rangeAtr = Double.NaN;
    private volatile long rangesBuiltAt;
    private volatile CandleSeries entryBars;
    private volatile double tickSize;

    public RangeDcaScanner(EngineContext ctx, PositionMonitor monitor) {
        this.ctx = ctx;
        this.settings = ctx.getConfig().getDca();
        this.analyzer = new RangeAnalyzer(settings);
        this.scorer = new RangeEntryScorer(settings);
        this.ladder = new RangeLadder(settings);
        this.lifecycle = new DcaLifecycle(settings);
        this.monitor = monitor;
    }

    @Override
    public String name() {
        return STRATEGY;
    }

    /**
     * Resolve the configured symbol; the engine must not start without it.
     */
    @Override
    public void start() {
        String symbol = settings.getSymbol();
        Map<String, MarketInfo> markets;
        try {
            markets = ctx.getFetcher().listMarkets();
            MarketInfo market = markets.get(symbol);
            if (market == null || !market.active()) {
                throw new SymbolResolutionException(symbol, "Symbol " + symbol + " is not tradable on "
                    + ctx.getFetcher().getGateway().getVenueName());
            }
            tickSize = market.tickSize();
        } catch (ExchangeException e) {
            throw new SymbolResolutionException(symbol, "Cannot resolve " + symbol + ": " + e.getMessage(), e);
        }
        log.info("Range strategy on {} (tick {})", symbol, tickSize);
    }

    @Override
    public ScanReport scan() throws InterruptedException {
        long started = ctx.now();
        String symbol = settings.getSymbol();
        MarketDataFetcher fetcher = ctx.getFetcher();

        if (strategic == null || started - rangesBuiltAt >= settings.getRangeRebuildMinutes() * 60_000L) {
            rebuildRanges(fetcher, started);
        }
        Optional<CandleSeries> fetched = fetcher.fetchCandles(symbol, settings.getEntryTimeframe(), settings.getEntryBars());
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("scan cancelled");
        }
        if (fetched.isPresent()) {
            entryBars = closedOnly(fetched.get(), ctx.now());
        }
        PriceRange range = strategic;
        CandleSeries bars = entryBars;
        if (range == null || bars == null || bars.isEmpty()) {
            log.warn("No range or bars for {}, skipping scan", symbol);
            return report(started, 0, 0, 0);
        }

        if (ctx.getPositions().hasSymbol(symbol) || ctx.getCooldowns().isActive(symbol, ctx.now())) {
            return report(started, 1, 0, 0);
        }

        Optional<Ticker> ticker = fetcher.fetchTicker(symbol);
        if (ticker.isEmpty() || !ticker.get().hasLast()) {
            return report(started, 1, 0, 0);
        }
        double price = ticker.get().last();
        if (!range.contains(price)) {
            log.debug("{} at {} outside the strategic range {}", symbol, price, range);
            return report(started, 1, 0, 0);
        }
        PriceRange entryRange = RangeEntryScorer.entryRange(tactical, range);
        Optional<Side> zone = scorer.zoneSide(price, entryRange);
        if (zone.isEmpty()) {
            log.debug("{} at {} outside entry zones of {}", symbol, price, entryRange);
            return report(started, 1, 0, 0);
        }
        Side side = zone.get();
        double score = scorer.score(side, bars, entryRange, price);
        log.debug("{} {} range score {}", side, symbol, String.format("%.3f", score));
        if (score < settings.getEntryScoreThreshold()) {
            return report(started, 1, 1, 0);
        }
        return report(started, 1, 1, open(side, price, score, bars) ? 1 : 0);
    }

    private boolean open(Side side, double price, double score, CandleSeries bars) {
        String symbol = settings.getSymbol();
        Optional<ReservationSet.Reservation> reserved = ctx.getReservations().tryReserve(symbol);
        if (reserved.isEmpty()) {
            return false;
        }
        try (ReservationSet.Reservation ignored = reserved.get()) {
            double atr = ATR.latest(bars.candles(), settings.getAtrPeriod());
            double growth = settings.growthFor(Double.isFinite(rangeAtr) && rangeAtr > 0
                ? strategic.width() / rangeAtr : Double.NaN);
            DcaPlan plan = DcaPlan.of(settings.getBank(), settings.getCumDepositFracAtFull(), settings.getLevels(), growth);
            List<Double> levels = ladder.build(side, price, tactical, strategic, atr, plan.levels() - 1);
            DcaState state = new DcaState(plan.stepMargins(), growth, levels, settings.getTpPct());

            Instant now = ctx.getClock().instant();
            Timeframe tf = settings.getEntryTimeframe();
            long entryBar = now.toEpochMilli() / tf.toMillis() * tf.toMillis();
            Position position = Position.averaging(symbol + "-DCA-" + now.toEpochMilli(), symbol, side, tf, price,
                now, entryBar, settings.getLeverage(), state, score);
            ctx.getPositions().add(position);

            log.info("Opened {} {} @ {} growth={} ladder={} tp={}", side, symbol, price, growth, levels,
                position.getTakeProfit());
            ctx.journal(store -> store.recordOpen(new TradeOpenEvent(STRATEGY, position)));
            ctx.sendNotification(NotificationFormatter.opened(STRATEGY, position));
            return true;
        }
    }

    private void rebuildRanges(MarketDataFetcher fetcher, long now) {
        Timeframe tf = settings.getRangeTimeframe();
        int limit = analyzer.strategicBars(tf.toMillis());
        Optional<CandleSeries> hourly = fetcher.fetchCandles(settings.getSymbol(), tf, limit);
        if (hourly.isEmpty()) {
            log.warn("Range bars unavailable for {}", settings.getSymbol());
            return;
        }
        CandleSeries closed = closedOnly(hourly.get(), now);
        Optional<PriceRange> s = analyzer.strategic(closed);
        Optional<PriceRange> t = analyzer.tactical(closed);
        if (s.isEmpty()) {
            log.warn("Not enough history to build the range of {}", settings.getSymbol());
            return;
        }
        strategic = s.get();
        tactical = t.orElse(null);
        rangeAtr = ATR.latest(closed.candles(), settings.getRangeAtrPeriod());
        rangesBuiltAt = now;
        log.info("Ranges of {}: strategic {} tactical {}", settings.getSymbol(), strategic, tactical);
    }

    static CandleSeries closedOnly(CandleSeries series, long nowMs) {
        if (!series.isEmpty() && !series.isClosed(series.size() - 1, nowMs)) {
            return series.upTo(series.size() - 2);
        }
        return series;
    }

    @Override
    public void monitor() {
        for (Position p : ctx.getPositions().getActive()) {
            if (!p.isAveraging()) {
                continue;
            }
            try {
                Optional<Ticker> ticker = ctx.getFetcher().fetchTicker(p.getSymbol());
                if (ticker.isEmpty() || !ticker.get().hasLast()) {
                    continue;
                }
                CandleSeries bars = entryBars;
                double atr = bars != null ? ATR.latest(bars.candles(), settings.getAtrPeriod()) : Double.NaN;
                boolean reversal = scorer.reversalConfirmed(p.getSide(), bars);
                DcaLifecycle.Context context = new DcaLifecycle.Context(strategic, atr, reversal, tickSize);
                List<LifecycleUpdate> updates;
                synchronized (p) {
                    updates = lifecycle.evaluate(p, ticker.get().last(), context, ctx.getClock().instant());
                }
                monitor.apply(updates);
            } catch (RuntimeException e) {
                log.warn("Monitor failed for {}: {}", p, e.getMessage(), e);
            }
        }
        monitor.monitorBrackets();
    }

    private ScanReport report(long started, int processed, int scored, int submitted) {
        return new ScanReport(name(), started, ctx.now() - started, 1, processed, scored, scored, 0, submitted,
            false, false, settings.getEntryScoreThreshold(), Map.of());
    }

    public Optional<PriceRange> getStrategicRange() {
        return Optional.ofNullable(strategic);
    }

    public Optional<PriceRange> getTacticalRange() {
        return Optional.ofNullable(tactical);
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("strategy", name());
        p.put("symbol", settings.getSymbol());
        p.put("timeframe", settings.getEntryTimeframe().code());
        p.put("bank", settings.getBank());
        p.put("levels", settings.getLevels());
        p.put("leverage", settings.getLeverage());
        p.put("tpPct", settings.getTpPct());
        p.put("entryScoreThreshold", settings.getEntryScoreThreshold());
        PriceRange s = strategic;
        if (s != null) {
            p.put("strategicRange", List.of(s.lower(), s.upper()));
        }
        PriceRange t = tactical;
        if (t != null) {
            p.put("tacticalRange", List.of(t.lower(), t.upper()));
        }
        return p;
    }
}
