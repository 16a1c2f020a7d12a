package com.wickscan.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.wickscan.execution.EngineControl;
import com.wickscan.execution.config.ControlSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Local HTTP control surface for the engine.
 *
 * Endpoints:
 *   GET  /status                  - Engine state, thresholds and open positions
 *   POST /enable                  - Resume scanning
 *   POST /disable                 - Pause scanning (open positions keep being monitored)
 *   POST /positions/close?id=...  - Close one position at the live price
 *   POST /positions/close-all     - Close every open position
 */
public class ControlApiServer {

    private static final Logger log = LoggerFactory.getLogger(ControlApiServer.class);
    private static final int MAX_PORT_ATTEMPTS = 10;

    private final EngineControl engine;
    private final ControlSettings settings;
    private final Path portFile;
    private final ObjectMapper mapper = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private HttpServer server;
    private ExecutorService executor;
    private int actualPort;

    /**
     * @param portFile where the bound port is written, or null to skip
     */
    public ControlApiServer(EngineControl engine, ControlSettings settings, Path portFile) {
        this.engine = engine;
        this.settings = settings;
        this.portFile = portFile;
    }

    public void start() throws IOException {
        int basePort = settings.getPort();
        IOException lastException = null;
        for (int i = 0; i < MAX_PORT_ATTEMPTS; i++) {
            int tryPort = basePort == 0 ? 0 : basePort + i;
            try {
                server = HttpServer.create(new InetSocketAddress(settings.getHost(), tryPort), 0);
                actualPort = server.getAddress().getPort();
                break;
            } catch (IOException e) {
                lastException = e;
            }
        }

        if (server == null) {
            throw new IOException("Could not find free port in range " +
                basePort + "-" + (basePort + MAX_PORT_ATTEMPTS - 1), lastException);
        }

        executor = Executors.newFixedThreadPool(2);
        server.setExecutor(executor);
        server.createContext("/status", this::handleStatus);
        server.createContext("/enable", this::handleEnable);
        server.createContext("/disable", this::handleDisable);
        server.createContext("/positions/close-all", this::handleCloseAll);
        server.createContext("/positions/close", this::handleClose);

        server.start();

        if (portFile != null) {
            try {
                Files.createDirectories(portFile.getParent());
                Files.writeString(portFile, String.valueOf(actualPort));
            } catch (IOException e) {
                log.warn("Failed to write port file: {}", e.getMessage());
            }
        }

        log.info("Control API started on http://{}:{}", settings.getHost(), actualPort);
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            executor.shutdownNow();
            server = null;
            log.info("Control API stopped");
        }
        if (portFile != null) {
            try {
                Files.deleteIfExists(portFile);
            } catch (IOException e) {
                log.debug("Failed to delete port file: {}", e.getMessage());
            }
        }
    }

    public int getPort() {
        return actualPort;
    }

    // ========== Handlers ==========

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "GET")) return;
        String json;
        try {
            json = mapper.writeValueAsString(engine.status());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize status", e);
            sendJson(exchange, 500, "{\"error\":\"" + escape(e.getOriginalMessage()) + "\"}");
            return;
        }
        sendJson(exchange, 200, json);
    }

    private void handleEnable(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "POST")) return;
        engine.enable();
        log.info("Control API: enable");
        sendJson(exchange, 200, "{\"enabled\":true}");
    }

    private void handleDisable(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "POST")) return;
        engine.disable();
        log.info("Control API: disable");
        sendJson(exchange, 200, "{\"enabled\":false}");
    }

    private void handleClose(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "POST")) return;
        String id = queryParam(exchange, "id");
        if (id == null || id.isBlank()) {
            sendJson(exchange, 400, "{\"error\":\"Missing id\"}");
            return;
        }
        log.info("Control API: close {}", id);
        boolean closed = engine.forceClose(id);
        if (closed) {
            sendJson(exchange, 200, "{\"closed\":true,\"id\":\"" + escape(id) + "\"}");
        } else {
            sendJson(exchange, 404, "{\"closed\":false,\"id\":\"" + escape(id) + "\"}");
        }
    }

    private void handleCloseAll(HttpExchange exchange) throws IOException {
        if (!checkMethod(exchange, "POST")) return;
        log.info("Control API: close all");
        int closed = engine.forceCloseAll();
        sendJson(exchange, 200, "{\"closed\":" + closed + "}");
    }

    // ========== Helpers ==========

    private boolean checkMethod(HttpExchange exchange, String method) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            sendJson(exchange, 405, "{\"error\":\"Method not allowed\"}");
            return false;
        }
        return true;
    }

    private void sendJson(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static String queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (key.equals(name)) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static String escape(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
