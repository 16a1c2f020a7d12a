package com.wickscan.execution.scan;

import com.wickscan.core.model.CandleSeries;
import com.wickscan.engine.ScanConfig;
import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.engine.gate.GateDecision;
import com.wickscan.engine.gate.GatePipeline;
import com.wickscan.engine.gate.GateRejection;
import com.wickscan.engine.gate.GateResult;
import com.wickscan.engine.score.CandidateSignal;
import com.wickscan.engine.score.ScoreResult;
import com.wickscan.engine.score.Scorer;
import com.wickscan.engine.threshold.AdaptiveThreshold;
import com.wickscan.engine.threshold.ScanSample;
import com.wickscan.engine.universe.SymbolUniverse;
import com.wickscan.engine.universe.UniverseBuilder;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.execution.EngineContext;
import com.wickscan.execution.config.EngineConfig;
import com.wickscan.execution.config.SchedulerSettings;
import com.wickscan.execution.open.OpenOutcome;
import com.wickscan.execution.open.OpenStatus;
import com.wickscan.execution.open.PositionOpener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Multi-symbol wick-spike strategy: gate, score and threshold over the rotated universe, opening
 * fixed-bracket positions.
 */
public class WickSpikeScanner implements ScanStrategy {

    private static final Logger log = LoggerFactory.getLogger(WickSpikeScanner.class);

    private final EngineContext ctx;
    private final ScanConfig scan;
    private final SchedulerSettings scheduler;
    private final UniverseBuilder universeBuilder;
    private final GatePipeline gate;
    private final Scorer scorer;
    private final PositionOpener opener;
    private final PositionMonitor monitor;

    public WickSpikeScanner(EngineContext ctx, PositionOpener opener, PositionMonitor monitor) {
        EngineConfig config = ctx.getConfig();
        this.ctx = ctx;
        this.scan = config.getScan();
        this.scheduler = config.getScheduler();
        this.universeBuilder = new UniverseBuilder(ctx.getFetcher(), scan.getUniverse(), ctx.getClock());
        this.gate = new GatePipeline(scan.getGate(), ctx);
        this.scorer = new Scorer(scan.getScore(), scan.getGate());
        this.opener = opener;
        this.monitor = monitor;
    }

    @Override
    public String name() {
        return PositionOpener.STRATEGY;
    }

    @Override
    public ScanReport scan() throws InterruptedException {
        long started = ctx.now();
        long deadline = started + scheduler.getScanBudgetSeconds() * 1000L;
        AdaptiveThreshold threshold = ctx.getThreshold();
        MarketDataFetcher fetcher = ctx.getFetcher();

        if (opener.atCapacity()) {
            log.info("All {} position slots in use, skipping scan",
                ctx.getConfig().getEntry().getMaxConcurrentPositions());
            return ScanReport.empty(name(), started, ctx.now() - started, threshold.value());
        }

        SymbolUniverse universe;
        try {
            universe = universeBuilder.build(ctx.getRotationOffset().get());
        } catch (ExchangeException e) {
            log.warn("Universe unavailable, skipping scan: {}", e.getMessage());
            return ScanReport.empty(name(), started, ctx.now() - started, threshold.value());
        }

        double referenceMove = referenceMove(fetcher, started);

        List<Double> scores = new ArrayList<>();
        Map<GateRejection, Integer> rejections = new EnumMap<>(GateRejection.class);
        int processed = 0;
        int gatePassed = 0;
        int vetoes = 0;
        int submitted = 0;
        boolean earlyStop = false;
        boolean budgetExceeded = false;

        chunks:
        for (List<String> chunk : universe.chunks(scheduler.getChunkSize())) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("scan cancelled");
            }
            if (ctx.now() >= deadline) {
                budgetExceeded = true;
                log.info("Scan budget of {}s exceeded after {} symbols", scheduler.getScanBudgetSeconds(), processed);
                break;
            }
            List<String> wanted = chunk.stream()
                .filter(s -> !ctx.getReservations().isReserved(s))
                .toList();
            Map<String, CandleSeries> bars = fetcher.fetchCandles(wanted, scheduler.getEntryTimeframe(),
                scheduler.getEntryBars());
            long now = ctx.now();

            for (String symbol : chunk) {
                processed++;
                CandleSeries series = bars.get(symbol);
                if (series == null) {
                    continue;
                }
                GateDecision decision = gate.evaluate(series, now);
                if (!decision.passed()) {
                    rejections.merge(decision.rejection(), 1, Integer::sum);
                    continue;
                }
                gatePassed++;
                GateResult g = decision.result();
                CandleSeries htf = fetcher.fetchCandles(symbol, scan.getScore().getHtfTimeframe(),
                    scan.getScore().getHtfBars()).orElse(null);
                ScoreResult score = scorer.score(g, htf, referenceMove);
                if (score.isVetoed()) {
                    vetoes++;
                    log.debug("{} {} vetoed: {}", g.side(), symbol, score.vetoReason());
                    continue;
                }
                scores.add(score.score());
                double required = threshold.thresholdFor(g.side());
                log.debug("{} {} score={} thr={} [{}]", g.side(), symbol, String.format("%.3f", score.score()),
                    String.format("%.2f", required), g.describe());
                if (score.score() < required) {
                    continue;
                }
                CandidateSignal candidate = new CandidateSignal(symbol, g.side(), score.score(),
                    scheduler.getEntryTimeframe(), g);
                OpenOutcome immediate = opener.submit(candidate, required).getNow(null);
                if (immediate != null && immediate.status() == OpenStatus.CAPACITY) {
                    log.info("Position slots filled, ending scan after {} symbols", processed);
                    break chunks;
                }
                if (immediate != null && immediate.status() == OpenStatus.ALREADY_RESERVED) {
                    continue;
                }
                submitted++;
                if (submitted >= scheduler.getMaxOpensPerScan()) {
                    earlyStop = true;
                    log.info("Reached {} opens this scan, stopping early", submitted);
                    break chunks;
                }
            }
        }

        ctx.getRotationOffset().set(universe.nextOffset(processed));
        threshold.update(new ScanSample(scores, submitted, vetoes, earlyStop), ctx.now());

        ScanReport report = new ScanReport(name(), started, ctx.now() - started, universe.size(), processed,
            gatePassed, scores.size(), vetoes, submitted, earlyStop, budgetExceeded, threshold.value(), rejections);
        log.info("Scan {}", report.summary());
        return report;
    }

    private double referenceMove(MarketDataFetcher fetcher, long now) {
        String reference = scan.getScore().getReferenceSymbol();
        if (reference == null || reference.isBlank()) {
            return Double.NaN;
        }
        Optional<CandleSeries> bars = fetcher.fetchCandles(reference, scheduler.getEntryTimeframe(),
            scan.getScore().getReferenceLookbackBars() + 2);
        double move = bars.map(b -> scorer.referenceMovePct(b, now)).orElse(Double.NaN);
        if (Double.isNaN(move)) {
            log.warn("Reference {} unavailable, market veto disabled for this scan", reference);
        }
        return move;
    }

    @Override
    public void monitor() {
        monitor.monitorBrackets();
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> p = new LinkedHashMap<>();
        var entry = ctx.getConfig().getEntry();
        p.put("strategy", name());
        p.put("timeframe", scheduler.getEntryTimeframe().code());
        p.put("leverage", entry.getLeverage());
        p.put("positionSizeUsdt", entry.getPositionSizeUsdt());
        p.put("slPct", entry.getSlPct());
        p.put("tpPct", entry.getTpPct());
        p.put("riskReward", entry.riskReward());
        p.put("maxConcurrentPositions", entry.getMaxConcurrentPositions());
        p.put("maxOpensPerScan", scheduler.getMaxOpensPerScan());
        p.put("cooldownMinutes", entry.getCooldownMinutes());
        p.put("rotationOffset", ctx.getRotationOffset().get());
        return p;
    }
}
