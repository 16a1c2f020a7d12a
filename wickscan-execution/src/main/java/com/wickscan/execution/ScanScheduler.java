package com.wickscan.execution;

import com.wickscan.execution.config.SchedulerSettings;
import com.wickscan.execution.scan.ScanReport;
import com.wickscan.execution.scan.ScanStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a {@link ScanStrategy}.
 *
 * One loop thread launches a scan on the scan thread whenever none is in flight, the engine is
 * enabled and the cadence has elapsed, and runs the position monitor itself on its own cadence, so
 * a long scan never starves exits. Housekeeping purges expired cooldowns and persists state; a
 * heartbeat logs diagnostics. An unexpected exception in the loop is logged and followed by a
 * back-off sleep.
 */
public class ScanScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScanScheduler.class);

    private final EngineContext ctx;
    private final ScanStrategy strategy;
    private final SchedulerSettings settings;
    private final Runnable persist;
    private final ExecutorService scanExecutor;

    private final AtomicLong scansCompleted = new AtomicLong();
    private final AtomicLong scansFailed = new AtomicLong();
    private final AtomicLong loopErrors = new AtomicLong();

    private volatile boolean running;
    private volatile Thread loopThread;
    private volatile Future<ScanReport> scanFuture;
    private volatile ScanReport lastReport;

    private long lastScanStart = Long.MIN_VALUE / 2;
    private long lastMonitor = Long.MIN_VALUE / 2;
    private long lastHousekeeping;
    private long lastHeartbeat;

    /**
     * @param persist saves engine state; called after every scan and on housekeeping
     */
    public ScanScheduler(EngineContext ctx, ScanStrategy strategy, Runnable persist) {
        this.ctx = ctx;
        this.strategy = strategy;
        this.settings = ctx.getConfig().getScheduler();
        this.persist = persist;
        this.scanExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "scan-" + strategy.name());
            t.setDaemon(true);
            return t;
        });
        this.lastHousekeeping = ctx.now();
        this.lastHeartbeat = ctx.now();
    }

    /**
     * Validate the strategy and start the loop.
     *
     * @throws com.wickscan.core.SymbolResolutionException when the strategy cannot resolve its symbol
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        strategy.start();
        long now = ctx.now();
        lastHousekeeping = now;
        lastHeartbeat = now;
        running = true;
        Thread t = new Thread(this::loop, "scan-scheduler");
        t.setDaemon(true);
        loopThread = t;
        t.start();
        log.info("Scheduler started: strategy={}, scan every {}s, monitor every {}s",
            strategy.name(), settings.getScanIntervalSeconds(), settings.getMonitorIntervalSeconds());
    }

    private void loop() {
        while (running) {
            try {
                tick();
            } catch (RuntimeException e) {
                loopErrors.incrementAndGet();
                log.error("Scheduler loop error, backing off {}s", settings.getErrorBackoffSeconds(), e);
                if (!sleep(settings.getErrorBackoffSeconds() * 1000L)) {
                    break;
                }
                continue;
            }
            if (!sleep(settings.getLoopIntervalMs())) {
                break;
            }
        }
        log.info("Scheduler loop exited");
    }

    /**
     * One scheduler cycle. Package-private so tests can step the loop.
     */
    void tick() {
        long now = ctx.now();
        collectScan();

        if (ctx.getEnabled().get() && scanFuture == null
            && now - lastScanStart >= settings.getScanIntervalSeconds() * 1000L) {
            lastScanStart = now;
            scanFuture = scanExecutor.submit(strategy::scan);
        }

        if (now - lastMonitor >= settings.getMonitorIntervalSeconds() * 1000L) {
            lastMonitor = now;
            strategy.monitor();
        }

        if (now - lastHousekeeping >= settings.getHousekeepingMinutes() * 60_000L) {
            lastHousekeeping = now;
            ctx.getCooldowns().purgeExpired(now);
            persist.run();
        }

        if (now - lastHeartbeat >= settings.getHeartbeatMinutes() * 60_000L) {
            lastHeartbeat = now;
            heartbeat();
        }
    }

    private void collectScan() {
        Future<ScanReport> f = scanFuture;
        if (f == null || !f.isDone()) {
            return;
        }
        scanFuture = null;
        try {
            lastReport = f.get();
            scansCompleted.incrementAndGet();
        } catch (ExecutionException e) {
            scansFailed.incrementAndGet();
            log.error("Scan failed", e.getCause());
        } catch (CancellationException e) {
            log.info("Scan was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        persist.run();
    }

    private void heartbeat() {
        var stats = ctx.getFetcher().getStats().drain();
        log.info("Heartbeat: enabled={} positions={} reserved={} cooldowns={} threshold={} scans={} failed={} loopErrors={} fetch={}",
            ctx.getEnabled().get(), ctx.getPositions().size(), ctx.getReservations().size(),
            ctx.getCooldowns().size(), String.format("%.2f", ctx.getThreshold().value()),
            scansCompleted.get(), scansFailed.get(), loopErrors.get(), stats);
    }

    private boolean sleep(long ms) {
        try {
            Thread.sleep(Math.max(1, ms));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stop the loop, cancel an in-flight scan and wait for it to finish.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        long timeoutMs = settings.getStopTimeoutSeconds() * 1000L;

        Future<ScanReport> f = scanFuture;
        if (f != null) {
            f.cancel(true);
        }
        scanExecutor.shutdownNow();
        try {
            if (!scanExecutor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Scan did not stop within {}s", settings.getStopTimeoutSeconds());
            }
            Thread t = loopThread;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
                t.join(timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scanFuture = null;
        log.info("Scheduler stopped after {} scans", scansCompleted.get());
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isScanInFlight() {
        Future<ScanReport> f = scanFuture;
        return f != null && !f.isDone();
    }

    public ScanReport getLastReport() {
        return lastReport;
    }

    public long getScansCompleted() {
        return scansCompleted.get();
    }

    public long getLoopErrors() {
        return loopErrors.get();
    }

    public ScanStrategy getStrategy() {
        return strategy;
    }
}
