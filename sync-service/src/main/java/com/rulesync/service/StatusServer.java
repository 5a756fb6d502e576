package com.rulesync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rulesync.core.model.FileError;
import com.rulesync.core.publish.PublishReport;
import com.rulesync.core.reconcile.KindOutcome;
import com.rulesync.core.reconcile.ReconcileController;
import com.rulesync.core.reconcile.ReconcileReport;
import com.rulesync.core.reconcile.SyncNowResult;
import com.rulesync.core.sync.SyncResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server exposing probes, workload status and the manual
 * sync action.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with body {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: {@code 200} once the first reconcile pass has
 * completed, {@code 503} before</li>
 * <li>{@code GET /status}: state, status, version, last sync result and the
 * per-kind outcome of the last pass, as JSON</li>
 * <li>{@code POST /sync-now}: run a one-shot sync and a pass; {@code 200}
 * with the sync output, or {@code 500} with the failure message and
 * detail lines</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] STARTING_RESPONSE = "{\"status\":\"STARTING\"}".getBytes(StandardCharsets.UTF_8);

    private final ReconcileController controller;
    private final Supplier<SyncNowResult> syncAction;
    private final String version;
    private final ObjectMapper mapper;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param controller controller whose state is reported
     * @param syncAction runs the manual sync
     * @param version    git-sync version, or {@code null} if unknown
     */
    public StatusServer(ReconcileController controller, Supplier<SyncNowResult> syncAction, String version) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.syncAction = Objects.requireNonNull(syncAction, "syncAction must not be null");
        this.version = version;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Status port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health",
                    exchange -> handleGet(exchange, () -> reply(exchange, 200, HEALTH_RESPONSE)));
            server.createContext("/readiness",
                    exchange -> handleGet(exchange, () -> handleReadiness(exchange)));
            server.createContext("/status",
                    exchange -> handleGet(exchange, () -> handleStatus(exchange)));
            server.createContext("/sync-now", this::handleSyncNow);

            // A manual sync can run for minutes; probes must still be answered meanwhile.
            server.setExecutor(Executors.newFixedThreadPool(2, r -> {
                Thread t = new Thread(r, "status-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Status server started on port {}", getPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start status server on port " + port + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Status server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (controller.getLastReport() == null) {
            reply(exchange, 503, STARTING_RESPONSE);
        } else {
            reply(exchange, 200, HEALTH_RESPONSE);
        }
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", controller.getState());
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("level", controller.getStatus().getLevel());
        status.put("message", controller.getStatus().getMessage());
        body.put("status", status);
        body.put("version", version);
        body.put("passes", controller.getPassCount());

        ReconcileReport report = controller.getLastReport();
        if (report != null) {
            body.put("lastSync", syncJson(report.getSyncResult()));
            body.put("lastPass", reportJson(report));
        }
        replyJson(exchange, 200, body);
    }

    private void handleSyncNow(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equals(exchange.getRequestMethod())) {
                reply(exchange, 405, new byte[0]);
                return;
            }
            SyncNowResult result = syncAction.get();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", result.isSuccess());
            if (result.isSuccess()) {
                body.put("output", result.getOutput());
                body.put("warnings", result.getDetails());
            } else {
                body.put("message", result.getMessage());
                body.put("details", result.getDetails());
            }
            replyJson(exchange, result.isSuccess() ? 200 : 500, body);
        } finally {
            exchange.close();
        }
    }

    // ---------------------------------------------------------------
    // JSON views
    // ---------------------------------------------------------------

    private static Map<String, Object> syncJson(SyncResult sync) {
        if (sync == null) {
            return null;
        }
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("outcome", sync.getOutcome());
        json.put("revision", sync.getRevision());
        json.put("timestamp", sync.getTimestamp());
        json.put("message", sync.getMessage());
        return json;
    }

    private static Map<String, Object> reportJson(ReconcileReport report) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("reason", report.getReason());
        json.put("finishedAt", report.getFinishedAt());
        Map<String, Object> kinds = new LinkedHashMap<>();
        for (KindOutcome outcome : report.getOutcomes().values()) {
            Map<String, Object> kind = new LinkedHashMap<>();
            kind.put("status", outcome.getStatus());
            kind.put("message", outcome.getMessage());
            kind.put("digest", outcome.getDigest() != null ? outcome.getDigest().toHex() : null);
            PublishReport published = outcome.getPublishReport();
            if (published != null) {
                kind.put("added", published.getAdded());
                kind.put("updated", published.getUpdated());
                kind.put("removed", published.getRemoved());
            }
            kind.put("errors", errorsJson(outcome.getErrors()));
            kinds.put(outcome.getKind().id(), kind);
        }
        json.put("kinds", kinds);
        return json;
    }

    private static List<Map<String, Object>> errorsJson(List<FileError> errors) {
        return errors.stream()
                .map(e -> {
                    Map<String, Object> json = new LinkedHashMap<>();
                    json.put("path", e.getSourcePath());
                    json.put("type", e.getType());
                    json.put("message", e.getMessage());
                    return json;
                })
                .toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Handler {
        void handle() throws IOException;
    }

    private static void handleGet(HttpExchange exchange, Handler handler) throws IOException {
        try {
            if (!"GET".equals(exchange.getRequestMethod())) {
                reply(exchange, 405, new byte[0]);
                return;
            }
            handler.handle();
        } finally {
            exchange.close();
        }
    }

    private void replyJson(HttpExchange exchange, int code, Object body) throws IOException {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.error("Cannot encode status response: {}", e.getMessage(), e);
            reply(exchange, 500, new byte[0]);
            return;
        }
        reply(exchange, code, bytes);
    }

    private static void reply(HttpExchange exchange, int code, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, body.length == 0 ? -1 : body.length);
        if (body.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }
}
