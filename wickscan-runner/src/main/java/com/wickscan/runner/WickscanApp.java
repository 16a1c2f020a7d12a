package com.wickscan.runner;

import com.wickscan.core.SymbolResolutionException;
import com.wickscan.exchange.ExchangeGateway;
import com.wickscan.exchange.ExchangeGatewayFactory;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.execution.ScanEngine;
import com.wickscan.execution.config.EngineConfig;
import com.wickscan.execution.journal.JsonlTradeLog;
import com.wickscan.execution.notify.CompositeNotifier;
import com.wickscan.execution.notify.LogNotifier;
import com.wickscan.execution.notify.Notifier;
import com.wickscan.execution.state.EngineStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Scanner entry point.
 *
 * Usage: {@code wickscan [config.yaml]}. Without an argument the config is read from
 * {@code ~/.wickscan/engine.yaml}; missing files fall back to defaults.
 */
public class WickscanApp {
    private static final Logger LOG = LoggerFactory.getLogger(WickscanApp.class);

    private final EngineConfig config;
    private final ExchangeGateway gateway;
    private final Notifier notifier;
    private final JsonlTradeLog tradeLog;
    private final ScanEngine engine;
    private ControlApiServer controlApi;

    WickscanApp(EngineConfig config, ExchangeGateway gateway, Notifier notifier, Clock clock) {
        this.config = config;
        this.gateway = gateway;
        this.notifier = notifier;
        this.tradeLog = new JsonlTradeLog(config.getStorage().tradeLogPath(), clock);
        this.engine = new ScanEngine(config, gateway, tradeLog, notifier,
            new EngineStateStore(config.getStorage().statePath()), clock);
    }

    void start() throws ExchangeException, IOException {
        engine.start();
        if (config.getControl().isEnabled()) {
            Path portFile = config.getStorage().statePath().resolveSibling("control-api.port");
            controlApi = new ControlApiServer(engine, config.getControl(), portFile);
            controlApi.start();
        }
    }

    void stop() {
        if (controlApi != null) {
            controlApi.stop();
        }
        engine.stop();
        tradeLog.close();
        notifier.close();
    }

    ScanEngine getEngine() {
        return engine;
    }

    static Notifier createNotifier(EngineConfig config) {
        List<Notifier> delegates = new ArrayList<>();
        delegates.add(new LogNotifier());
        if (config.getNotifier().isTelegramEnabled()) {
            TelegramNotifier telegram = new TelegramNotifier(config.getNotifier());
            if (telegram.isEnabled()) {
                delegates.add(telegram);
            } else {
                LOG.warn("Telegram enabled but token or chat ids missing; messages go to the log only");
            }
        }
        return new CompositeNotifier(delegates);
    }

    public static void main(String[] args) {
        LOG.info("Wickscan starting...");

        Path configPath = args.length > 0 ? Path.of(args[0]) : EngineConfig.defaultPath();
        EngineConfig config;
        try {
            config = EngineConfig.load(configPath).applyEnvironment(System.getenv());
        } catch (IOException e) {
            LOG.error("Failed to read config {}", configPath, e);
            System.exit(2);
            return;
        }
        LOG.info("Config: {} (strategy {}, venue {})", configPath,
            config.getScheduler().getStrategy(), config.getExchange().getVenue());

        WickscanApp app;
        try {
            ExchangeGateway gateway = ExchangeGatewayFactory.create(config.getExchange());
            app = new WickscanApp(config, gateway, createNotifier(config), Clock.systemUTC());
            app.start();
        } catch (SymbolResolutionException e) {
            LOG.error("Symbol {} cannot be traded: {}", e.getSymbol(), e.getMessage());
            System.exit(3);
            return;
        } catch (ExchangeException | IOException e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        CountDownLatch done = new CountDownLatch(1);
        WickscanApp running = app;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            running.stop();
            done.countDown();
        }, "wickscan-shutdown"));

        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
