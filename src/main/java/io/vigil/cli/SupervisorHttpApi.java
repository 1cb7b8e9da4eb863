package io.vigil.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.error.StoreUnavailableException;
import io.vigil.error.SupervisorException;
import io.vigil.model.AssertionOutcome;
import io.vigil.model.EffectiveStatus;
import io.vigil.model.EntryType;
import io.vigil.model.ExecutionRecord;
import io.vigil.model.InstanceFilter;
import io.vigil.model.InstanceStatus;
import io.vigil.runtime.VigilRuntime;
import io.vigil.stream.StreamItem;
import io.vigil.stream.Subscription;
import io.vigil.stream.TranscriptFanout;
import io.vigil.transcript.EmitRequest;
import io.vigil.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * JSON-over-HTTP surface for workers, the orchestrator and dashboards. Transcript streams are
 * served as server-sent events.
 *
 * <p>A stream request is answered on the request pool, then its write loop moves to a separate
 * stream pool, so open streams never occupy the threads that serve heartbeats and emits. At most
 * {@code maxStreams} streams are open at once; further stream requests get 503.
 */
public final class SupervisorHttpApi implements AutoCloseable {
    public static final int DEFAULT_MAX_STREAMS = 256;
    private static final long STREAM_POLL_SECONDS = 15L;

    private final VigilRuntime runtime;
    private HttpServer server;
    private ExecutorService executor;
    private ExecutorService streamExecutor;
    private Semaphore streamSlots;
    private int maxStreams;

    public SupervisorHttpApi(VigilRuntime runtime) {
        this.runtime = runtime;
    }

    public int start(String host, int port, int threads) throws IOException {
        return start(host, port, threads, DEFAULT_MAX_STREAMS);
    }

    public synchronized int start(String host, int port, int threads, int maxStreams) throws IOException {
        this.maxStreams = Math.max(1, maxStreams);
        streamSlots = new Semaphore(this.maxStreams);
        streamExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "vigil-stream");
            t.setDaemon(true);
            return t;
        });
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        server.createContext("/api/instances", this::handleInstances);
        server.createContext("/api/executions", this::handleExecutions);
        server.createContext("/api/stream", exchange -> guarded(exchange, () -> {
            requireMethod(exchange, "GET");
            stream(exchange, TranscriptFanout.ALL_EXECUTIONS, null);
        }));
        server.createContext("/api/summary", exchange -> guarded(exchange, () -> {
            requireMethod(exchange, "GET");
            writeJson(exchange, runtime.summary(), 200);
        }));
        server.createContext("/health", exchange -> guarded(exchange, () -> {
            VigilRuntime.HealthOutcome health = runtime.health();
            writeJson(exchange, health, health.ok() ? 200 : 503);
        }));
        server.createContext("/metrics", exchange -> guarded(exchange, () -> {
            byte[] bytes = runtime.metricsText().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }));
        executor = Executors.newFixedThreadPool(Math.max(2, threads), r -> {
            Thread t = new Thread(r, "vigil-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        return server.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
        if (streamExecutor != null) {
            streamExecutor.shutdownNow();
            streamExecutor = null;
        }
    }

    private void handleInstances(HttpExchange exchange) {
        guarded(exchange, () -> {
            String[] parts = pathParts(exchange, "/api/instances");
            Map<String, String> params = parseParams(exchange);
            if (parts.length == 0) {
                if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    Long pid = params.containsKey("pid") && !params.get("pid").isBlank()
                            ? Long.parseLong(params.get("pid").trim())
                            : null;
                    writeJson(exchange, runtime.createInstance(params.get("taskId"), params.get("taskListId"), pid), 201);
                    return;
                }
                requireMethod(exchange, "GET");
                writeJson(exchange, runtime.listInstances(filterFrom(params)), 200);
                return;
            }
            String instanceId = parts[0];
            if (parts.length == 1) {
                requireMethod(exchange, "GET");
                EffectiveStatus status = runtime.effectiveStatus(instanceId);
                writeJson(exchange, status, status.found() ? 200 : 404);
                return;
            }
            requireMethod(exchange, "POST");
            switch (parts[1]) {
                case "heartbeat" -> {
                    String ts = params.get("timestamp");
                    Long timestamp = ts == null || ts.isBlank() ? null : Long.parseLong(ts.trim());
                    writeJson(exchange, runtime.heartbeat(instanceId, timestamp), 200);
                }
                case "process" -> writeJson(exchange, runtime.attachProcess(instanceId, Long.parseLong(required(params, "pid"))), 200);
                case "running" -> writeJson(exchange, runtime.markRunning(instanceId), 200);
                case "terminal" -> writeJson(exchange, runtime.markTerminal(
                        instanceId,
                        InstanceStatus.fromString(required(params, "status")),
                        params.get("reason")
                ), 200);
                default -> writeJson(exchange, Map.of("error", "not_found"), 404);
            }
        });
    }

    private void handleExecutions(HttpExchange exchange) {
        guarded(exchange, () -> {
            String[] parts = pathParts(exchange, "/api/executions");
            if (parts.length == 0) {
                writeJson(exchange, Map.of("error", "not_found"), 404);
                return;
            }
            String executionId = parts[0];
            if (parts.length == 1) {
                requireMethod(exchange, "GET");
                Optional<ExecutionRecord> execution = runtime.getExecution(executionId);
                if (execution.isEmpty()) {
                    writeJson(exchange, Map.of("error", "not_found", "executionId", executionId), 404);
                    return;
                }
                writeJson(exchange, execution.get(), 200);
                return;
            }
            switch (parts[1]) {
                case "entries" -> {
                    requireMethod(exchange, "POST");
                    ObjectNode body = readJsonBody(exchange);
                    JsonNode payload = body.get("payload");
                    EmitRequest request = new EmitRequest(
                            executionId,
                            body.path("instanceId").asText(null),
                            body.path("taskId").asText(null),
                            EntryType.fromString(body.path("entryType").asText(null)),
                            body.path("category").asText(null),
                            body.path("summary").asText(null),
                            payload != null && payload.isObject() ? (ObjectNode) payload : null
                    );
                    writeJson(exchange, runtime.emit(request), 201);
                }
                case "dropped" -> {
                    requireMethod(exchange, "POST");
                    Map<String, String> params = parseParams(exchange);
                    long total = runtime.reportDroppedEvents(executionId, Long.parseLong(required(params, "count")));
                    writeJson(exchange, Map.of("executionId", executionId, "droppedEvents", total), 200);
                }
                case "transcript" -> {
                    requireMethod(exchange, "GET");
                    Map<String, String> params = parseParams(exchange);
                    var page = runtime.getTranscript(
                            executionId,
                            parseLongOrDefault(params.get("from"), 1L),
                            parseIntOrDefault(params.get("limit"), 1_000)
                    );
                    writeJson(exchange, page, page.found() ? 200 : 404);
                }
                case "tool-uses" -> {
                    requireMethod(exchange, "GET");
                    Map<String, String> params = parseParams(exchange);
                    writeJson(exchange, runtime.listToolUses(executionId, Boolean.parseBoolean(params.get("errorsOnly"))), 200);
                }
                case "assertions" -> {
                    requireMethod(exchange, "GET");
                    Map<String, String> params = parseParams(exchange);
                    String result = params.get("result");
                    writeJson(exchange, runtime.listAssertions(
                            executionId,
                            result == null || result.isBlank() ? null : AssertionOutcome.fromString(result)
                    ), 200);
                }
                case "stream" -> {
                    requireMethod(exchange, "GET");
                    Map<String, String> params = parseParams(exchange);
                    String from = params.get("from");
                    stream(exchange, executionId, from == null || from.isBlank() ? null : Long.parseLong(from.trim()));
                }
                default -> writeJson(exchange, Map.of("error", "not_found"), 404);
            }
        });
    }

    private void stream(HttpExchange exchange, String executionId, Long fromSequence) throws IOException {
        if (!streamSlots.tryAcquire()) {
            writeJson(exchange, Map.of("error", "too_many_streams", "maxStreams", maxStreams), 503);
            return;
        }
        Subscription subscription;
        try {
            subscription = runtime.subscribe(executionId, fromSequence);
        } catch (RuntimeException e) {
            streamSlots.release();
            throw e;
        }
        try {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("Connection", "keep-alive");
            exchange.sendResponseHeaders(200, 0);
            streamExecutor.execute(() -> pump(exchange, subscription));
        } catch (IOException | RuntimeException e) {
            subscription.close();
            streamSlots.release();
            throw e;
        }
    }

    private void pump(HttpExchange exchange, Subscription subscription) {
        try (subscription; OutputStream os = exchange.getResponseBody()) {
            while (true) {
                StreamItem item = subscription.poll(STREAM_POLL_SECONDS, TimeUnit.SECONDS);
                if (item == null) {
                    if (subscription.isFinished()) {
                        return;
                    }
                    os.write(": keepalive\n\n".getBytes(StandardCharsets.UTF_8));
                } else if (item.isGap()) {
                    os.write(frame("gap", item.resumeFrom()));
                    os.flush();
                    return;
                } else {
                    os.write(frame("entry", item.entry()));
                }
                os.flush();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            System.err.println("WARN stream closed on " + exchange.getRequestURI() + ": " + e.getMessage());
        } finally {
            exchange.close();
            streamSlots.release();
        }
    }

    private static byte[] frame(String event, Object data) {
        return ("event: " + event + "\ndata: " + Jsons.toCompactJson(data) + "\n\n").getBytes(StandardCharsets.UTF_8);
    }

    private void guarded(HttpExchange exchange, ExchangeAction action) {
        try {
            action.run();
        } catch (MethodNotAllowed e) {
            respondQuietly(exchange, Map.of("error", "method_not_allowed"), 405);
        } catch (InstanceTerminatedException e) {
            respondQuietly(exchange, errorBody(e), 410);
        } catch (StoreUnavailableException e) {
            respondQuietly(exchange, errorBody(e), 503);
        } catch (SupervisorException e) {
            respondQuietly(exchange, errorBody(e), 409);
        } catch (NumberFormatException e) {
            respondQuietly(exchange, Map.of("error", "bad_request", "message", "invalid number: " + e.getMessage()), 400);
        } catch (IllegalArgumentException e) {
            String message = e.getMessage() == null ? "" : e.getMessage();
            int status = message.startsWith("Unknown instance: ") || message.startsWith("Unknown execution: ") ? 404 : 400;
            respondQuietly(exchange, Map.of("error", status == 404 ? "not_found" : "bad_request", "message", message), status);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exchange.close();
        } catch (IOException e) {
            System.err.println("WARN http io failure on " + exchange.getRequestURI() + ": " + e.getMessage());
            exchange.close();
        } catch (RuntimeException e) {
            System.err.println("WARN http handler failed on " + exchange.getRequestURI() + ": " + e);
            respondQuietly(exchange, Map.of("error", "internal_error", "message", String.valueOf(e.getMessage())), 500);
        }
    }

    private static Map<String, Object> errorBody(SupervisorException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.code());
        body.put("message", e.getMessage());
        return body;
    }

    private static void respondQuietly(HttpExchange exchange, Object body, int status) {
        try {
            writeJson(exchange, body, status);
        } catch (IOException e) {
            System.err.println("WARN failed to write error response: " + e.getMessage());
            exchange.close();
        }
    }

    private static InstanceFilter filterFrom(Map<String, String> params) {
        String status = params.get("status");
        return new InstanceFilter(
                status == null || status.isBlank() ? null : InstanceStatus.fromString(status),
                params.get("taskListId"),
                params.get("taskId"),
                Boolean.parseBoolean(params.get("staleOnly")),
                Boolean.parseBoolean(params.get("includeArchived")),
                parseIntOrDefault(params.get("limit"), 500)
        );
    }

    private static void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            throw new MethodNotAllowed();
        }
    }

    private static String required(Map<String, String> params, String key) {
        String value = params.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value.trim();
    }

    private static String[] pathParts(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        rest = rest.replaceAll("^/+", "").replaceAll("/+$", "");
        return rest.isEmpty() ? new String[0] : rest.split("/");
    }

    static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static ObjectNode readJsonBody(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8).trim();
        return Jsons.readObject(body);
    }

    private static Map<String, String> parseParams(HttpExchange exchange) throws IOException {
        Map<String, String> out = new LinkedHashMap<>(parseQuery(exchange.getRequestURI()));
        String method = exchange.getRequestMethod();
        if (!"POST".equalsIgnoreCase(method)) {
            return out;
        }
        byte[] raw = exchange.getRequestBody().readAllBytes();
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            return out;
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("application/json") || body.startsWith("{")) {
            ObjectNode node = Jsons.readObject(body);
            node.fieldNames().forEachRemaining(key -> {
                JsonNode value = node.path(key);
                if (value.isNull()) {
                    out.put(key, "");
                } else if (value.isValueNode()) {
                    out.put(key, value.asText());
                } else {
                    out.put(key, value.toString());
                }
            });
            return out;
        }
        out.putAll(parseQueryString(body));
        return out;
    }

    private static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    private static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    private static long parseLongOrDefault(String raw, long fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Long.parseLong(raw.trim());
    }

    private static int parseIntOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Integer.parseInt(raw.trim());
    }

    @FunctionalInterface
    private interface ExchangeAction {
        void run() throws IOException, InterruptedException;
    }

    private static final class MethodNotAllowed extends RuntimeException {
        MethodNotAllowed() {
            super("method not allowed");
        }
    }
}
