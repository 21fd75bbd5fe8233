package io.crontask.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.crontask.core.control.JobControlService;
import io.crontask.core.control.JobNotFoundException;
import io.crontask.core.control.JobRequest;
import io.crontask.core.control.JobView;
import io.crontask.core.history.ExecutionRecord;
import io.crontask.core.history.RunPage;
import io.crontask.core.job.DuplicateJobException;
import io.crontask.core.job.HttpCallAction;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON over HTTP front for {@link JobControlService}.
 *
 * <pre>
 * GET    /health
 * POST   /jobs                 GET /jobs
 * GET    /jobs/{id}            DELETE /jobs/{id}
 * POST   /jobs/{id}/pause      POST /jobs/{id}/resume
 * GET    /jobs/{id}/runs?limit=20&amp;offset=0
 * </pre>
 */
public final class JobApiServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobApiServer.class);
    private static final int DEFAULT_RUNS_LIMIT = 20;

    private final JobControlService control;
    private final String host;
    private final int requestedPort;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public JobApiServer(JobControlService control, String host, int port) {
        this.control = Objects.requireNonNull(control, "control must not be null");
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path(exchange -> sendError(exchange, 404, "not_found", "no such endpoint"))
            .addExactPath("/health", this::handleHealth)
            .addPrefixPath("/jobs", exchange -> handleApi(exchange, this::routeJobs));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Job API listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    public String host() {
        return host;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendError(exchange, 405, "method_not_allowed", "use GET");
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleApi(HttpServerExchange exchange, ApiHandler handler) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> handleApi(exchange, handler));
            return;
        }
        try {
            handler.handle(exchange);
        } catch (JobNotFoundException e) {
            sendErrorQuietly(exchange, 404, "not_found", e.getMessage());
        } catch (DuplicateJobException e) {
            sendErrorQuietly(exchange, 409, "conflict", e.getMessage());
        } catch (JsonProcessingException e) {
            sendErrorQuietly(exchange, 400, "invalid_json", e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            sendErrorQuietly(exchange, 400, "invalid_request", e.getMessage());
        } catch (IOException e) {
            LOG.warn("Store unavailable while serving {} {}", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendErrorQuietly(exchange, 503, "store_unavailable", "job store is temporarily unavailable");
        } catch (Exception e) {
            LOG.error("Unhandled error serving {} {}", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendErrorQuietly(exchange, 500, "internal_error", "unexpected server error");
        }
    }

    private void routeJobs(HttpServerExchange exchange) throws Exception {
        List<String> segments = segments(exchange.getRelativePath());
        String method = exchange.getRequestMethod().toString().toUpperCase();

        if (segments.isEmpty()) {
            switch (method) {
                case "GET" -> listJobs(exchange);
                case "POST" -> createJob(exchange);
                default -> sendError(exchange, 405, "method_not_allowed", "use GET or POST");
            }
            return;
        }

        String id = segments.get(0);
        if (segments.size() == 1) {
            switch (method) {
                case "GET" -> sendJson(exchange, 200, toJobPayload(control.get(id)));
                case "DELETE" -> {
                    control.delete(id);
                    sendJson(exchange, 200, result(id, "deleted"));
                }
                default -> sendError(exchange, 405, "method_not_allowed", "use GET or DELETE");
            }
            return;
        }

        if (segments.size() == 2) {
            String action = segments.get(1);
            switch (action) {
                case "pause" -> {
                    if (requirePost(exchange, method)) {
                        sendJson(exchange, 200, result(id, control.pause(id).status()));
                    }
                }
                case "resume" -> {
                    if (requirePost(exchange, method)) {
                        sendJson(exchange, 200, result(id, control.resume(id).status()));
                    }
                }
                case "runs" -> {
                    if ("GET".equals(method)) {
                        listRuns(exchange, id);
                    } else {
                        sendError(exchange, 405, "method_not_allowed", "use GET");
                    }
                }
                default -> sendError(exchange, 404, "not_found", "no such endpoint");
            }
            return;
        }
        sendError(exchange, 404, "not_found", "no such endpoint");
    }

    private void createJob(HttpServerExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        if (!body.isObject()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        JobRequest request = new JobRequest(
            readText(body, "id"),
            readText(body, "cron"),
            readText(body, "url"),
            readText(body, "method"),
            readHeaders(body),
            readText(body, "body")
        );
        JobView created = control.create(request);
        sendJson(exchange, 200, result(created.id(), created.status()));
    }

    private void listJobs(HttpServerExchange exchange) throws IOException {
        List<Map<String, Object>> items = new ArrayList<>();
        for (JobView view : control.list()) {
            items.add(toJobPayload(view));
        }
        sendJson(exchange, 200, Map.of("items", items));
    }

    private void listRuns(HttpServerExchange exchange, String id) throws IOException {
        int limit = parseQueryInt(exchange, "limit", DEFAULT_RUNS_LIMIT);
        int offset = parseQueryInt(exchange, "offset", 0);
        RunPage page = control.runs(id, limit, offset);

        List<Map<String, Object>> items = new ArrayList<>();
        for (ExecutionRecord record : page.items()) {
            items.add(toRunPayload(record));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("total", page.total());
        payload.put("limit", page.limit());
        payload.put("offset", page.offset());
        payload.put("items", items);
        sendJson(exchange, 200, payload);
    }

    private boolean requirePost(HttpServerExchange exchange, String method) throws IOException {
        if ("POST".equals(method)) {
            return true;
        }
        sendError(exchange, 405, "method_not_allowed", "use POST");
        return false;
    }

    private Map<String, Object> result(String id, String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        payload.put("status", status);
        return payload;
    }

    private Map<String, Object> toJobPayload(JobView view) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", view.id());
        payload.put("cron", view.cron());
        payload.put("url", view.url());
        payload.put("method", view.method());
        payload.put("headers", view.headers().isEmpty() ? null : view.headers());
        payload.put("body", view.body());
        payload.put("next_run_time", view.nextRunTime());
        payload.put("status", view.status());
        return payload;
    }

    private Map<String, Object> toRunPayload(ExecutionRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", record.jobId());
        if (record.action() instanceof HttpCallAction http) {
            payload.put("url", http.url());
            payload.put("method", http.method().name());
        }
        payload.put("cron", record.cron());
        payload.put("status_code", record.statusCode());
        payload.put("ok", record.ok());
        payload.put("response_text", record.responseText());
        payload.put("elapsed_ms", record.elapsedMs());
        payload.put("error", record.error());
        payload.put("run_at", record.runAt());
        return payload;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendError(HttpServerExchange exchange, int status, String code, String detail) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", code);
        payload.put("detail", detail);
        sendJson(exchange, status, payload);
    }

    private void sendErrorQuietly(HttpServerExchange exchange, int status, String code, String detail) {
        try {
            sendError(exchange, status, code, detail);
        } catch (IOException e) {
            LOG.debug("Could not send {} response", status, e);
        }
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private String readText(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return node.asText();
    }

    private Map<String, String> readHeaders(JsonNode body) {
        JsonNode node = body.get("headers");
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("headers must be an object of strings");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isValueNode() || entry.getValue().isNull()) {
                throw new IllegalArgumentException("header " + entry.getKey() + " must be a string");
            }
            headers.put(entry.getKey(), entry.getValue().asText());
        }
        return headers;
    }

    private int parseQueryInt(HttpServerExchange exchange, String key, int fallback) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        String raw = values.peekFirst().trim();
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer");
        }
    }

    private static List<String> segments(String relativePath) {
        List<String> segments = new ArrayList<>();
        if (relativePath == null) {
            return segments;
        }
        for (String part : relativePath.split("/")) {
            if (!part.isEmpty()) {
                segments.add(part);
            }
        }
        return segments;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port; using {}", fallbackPort, e);
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ApiHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
