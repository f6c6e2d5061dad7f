package com.monitintel.service.api;

import com.monitintel.collectors.api.SnapshotStore;
import com.monitintel.collectors.logs.LogAggregator;
import com.monitintel.core.events.Event;
import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.Snapshot;
import com.monitintel.core.util.JsonUtils;
import com.monitintel.service.pipeline.Advisory;
import com.monitintel.service.store.EventStore;
import com.monitintel.service.store.FailureStateStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only JSON views over snapshots, failure state, logs, events and diagnostics.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final int DEFAULT_HISTORY_DAYS = 7;
    private static final String LOGS_PREFIX = "/api/logs/";

    private final int port;
    private final SnapshotStore snapshotStore;
    private final FailureStateStore failureStateStore;
    private final EventStore eventStore;
    private final LogAggregator logAggregator;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Supplier<Optional<Advisory>> latestAdvisory;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            SnapshotStore snapshotStore,
            FailureStateStore failureStateStore,
            EventStore eventStore,
            LogAggregator logAggregator,
            DiagnosticsTracker diagnosticsTracker,
            Supplier<Optional<Advisory>> latestAdvisory,
            Clock clock
    ) {
        this.port = port;
        this.snapshotStore = snapshotStore;
        this.failureStateStore = failureStateStore;
        this.eventStore = eventStore;
        this.logAggregator = logAggregator;
        this.diagnosticsTracker = diagnosticsTracker == null ? DiagnosticsTracker.empty() : diagnosticsTracker;
        this.latestAdvisory = latestAdvisory == null ? Optional::empty : latestAdvisory;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4, runnable -> {
                Thread thread = new Thread(runnable, "api-worker");
                thread.setDaemon(true);
                return thread;
            });
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/status", guarded(this::handleStatus));
            server.createContext("/api/history", guarded(this::handleHistory));
            server.createContext("/api/failures", guarded(this::handleFailures));
            server.createContext(LOGS_PREFIX, guarded(this::handleLogs));
            server.createContext("/api/events", guarded(this::handleEvents));
            server.createContext("/api/diagnostics", guarded(this::handleDiagnostics));
            server.createContext("/api/analysis", guarded(this::handleAnalysis));
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server on port " + port, e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        long snapshots;
        try {
            snapshots = snapshotStore.count();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Health check could not reach the database", e);
            writeJson(exchange, 503, Map.of("status", "degraded", "database", "unreachable"));
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok", "database", "connected", "snapshots", snapshots));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        List<Map<String, Object>> services = new ArrayList<>();
        for (Snapshot snapshot : snapshotStore.latestPerService()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", snapshot.serviceName());
            row.put("status", snapshot.status());
            row.put("healthy", snapshot.healthy());
            row.put("observedAt", snapshot.observedAt());
            services.add(row);
        }
        writeJson(exchange, 200, services);
    }

    private void handleHistory(HttpExchange exchange) throws IOException {
        String service;
        int days;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            service = query.get("service");
            days = query.containsKey("days") ? Integer.parseInt(query.get("days")) : DEFAULT_HISTORY_DAYS;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (service == null || service.isBlank() || days <= 0) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        Instant now = clock.instant();
        List<Snapshot> snapshots = new ArrayList<>(snapshotStore.query(service, now.minus(Duration.ofDays(days)), now.plusSeconds(1)));
        if (snapshots.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_history", "service", service));
            return;
        }
        Collections.reverse(snapshots);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Snapshot snapshot : snapshots) {
            rows.add(Map.of("observedAt", snapshot.observedAt(), "status", snapshot.status(), "healthy", snapshot.healthy()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", service);
        body.put("days", days);
        body.put("total", snapshots.size());
        body.put("failures", snapshots.stream().filter(snapshot -> !snapshot.healthy()).count());
        body.put("snapshots", rows);
        writeJson(exchange, 200, body);
    }

    private void handleFailures(HttpExchange exchange) throws IOException {
        writeJson(exchange, 200, failureStateStore.all());
    }

    private void handleLogs(HttpExchange exchange) throws IOException {
        String rawPath = exchange.getRequestURI().getRawPath();
        String service = URLDecoder.decode(rawPath.substring(LOGS_PREFIX.length()), StandardCharsets.UTF_8);
        if (service.isBlank() || service.contains("/")) {
            writeJson(exchange, 400, Map.of("error", "service_required"));
            return;
        }
        LogExcerpt excerpt = logAggregator.fetch(service);
        writeJson(exchange, 200, excerpt);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : 200;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        List<Event> events = eventStore.query(since, type, Math.max(1, limit));
        writeJson(exchange, 200, events);
    }

    private void handleDiagnostics(HttpExchange exchange) throws IOException {
        writeJson(exchange, 200, diagnosticsTracker.snapshot());
    }

    private void handleAnalysis(HttpExchange exchange) throws IOException {
        Optional<Advisory> advisory = latestAdvisory.get();
        if (advisory.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_analysis_yet"));
            return;
        }
        writeJson(exchange, 200, advisory.get());
    }

    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            if (!ensureGet(exchange)) {
                return;
            }
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Request " + exchange.getRequestURI() + " failed", e);
                writeJson(exchange, 500, Map.of("error", "internal_error"));
            }
        };
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
