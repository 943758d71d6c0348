// file: server/src/main/java/io/opledger/server/WebServer.java
package io.opledger.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opledger.core.BackendUnavailableException;
import io.opledger.core.InsertOutcome;
import io.opledger.core.audit.AuditEvent;
import io.opledger.server.dto.*;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over RegistryService.
 *
 * Responsibilities:
 *  - Parse HTTP method + path, query parameters and the wait-limit header.
 *  - Decode JSON request bodies into DTOs and encode results back.
 *  - Map exceptions to HTTP status codes.
 *  - Emit one access-log line per request.
 *
 * Path layout:
 *   - POST /registry/operations          submit an operation (JSON body)
 *   - GET  /registry/signer?...          who recorded operationKind/recordId/nonce
 *   - GET  /registry/history?signer=..   everything a signer recorded, in order
 *   - GET  /registry/fingerprint?...     fingerprint of an operation, no side effects
 *   - GET  /admin/health                 liveness plus ledger size and pending writes
 *
 * Submissions block on the ledger, so requests are dispatched off the IO
 * threads before anything else happens.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    static final String WAIT_HEADER = "X-Registry-Wait-Ms";

    private final Undertow server;
    // a fractional nonce is malformed input, not something to truncate
    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    private final RegistryService registry;

    public WebServer(int port, RegistryService registry) {
        this.registry = registry;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::route);
            return;
        }
        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        switch (path) {
            case "/registry/operations" -> {
                if ("POST".equals(method)) handleSubmit(exchange); else methodNotAllowed(exchange, method, path);
            }
            case "/registry/signer" -> {
                if ("GET".equals(method)) handleSigner(exchange); else methodNotAllowed(exchange, method, path);
            }
            case "/registry/history" -> {
                if ("GET".equals(method)) handleHistory(exchange); else methodNotAllowed(exchange, method, path);
            }
            case "/registry/fingerprint" -> {
                if ("GET".equals(method)) handleFingerprint(exchange); else methodNotAllowed(exchange, method, path);
            }
            case "/admin/health" -> {
                send(exchange, 200, Map.of(
                        "status", "ok",
                        "entries", registry.ledgerSize(),
                        "pending", registry.pendingCount()));
                RequestLogger.logRequest(method, path, 200, 0, -1, null);
            }
            default -> {
                send(exchange, 404, Map.of("error", "not found"));
                RequestLogger.logRequest(method, path, 404, 0, -1, null);
            }
        }
    }

    // ---------- handlers ----------

    /** POST /registry/operations */
    private void handleSubmit(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status;
        long registryMs = -1L;
        Throwable error = null;
        try {
            byte[] data = readBody(ex);
            if (data.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                var req = json.readValue(data, SubmitRequest.class);
                if (req.nonce == null) {
                    throw new IllegalArgumentException("nonce is required");
                }
                Duration wait = waitLimit(ex);

                long rStart = System.nanoTime();
                InsertOutcome outcome = registry.record(req.operationKind, req.recordId, req.nonce, req.signer, wait);
                registryMs = (System.nanoTime() - rStart) / 1_000_000L;

                var dto = new SubmitResponse();
                dto.accepted = outcome.accepted();
                dto.fingerprint = outcome.fingerprint().hex();
                dto.sequenceNumber = outcome instanceof InsertOutcome.Accepted a ? a.sequenceNumber() : null;
                status = 200;
                send(ex, status, dto);
            }
        } catch (Exception e) {
            error = e;
            status = fail(ex, e);
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest("POST", ex.getRequestPath(), status, totalMs, registryMs, error);
    }

    /** GET /registry/signer?operationKind=..&recordId=..&nonce=.. */
    private void handleSigner(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status;
        Throwable error = null;
        try {
            String kind = requiredParam(ex, "operationKind");
            String recordId = requiredParam(ex, "recordId");
            long nonce = parseNonce(requiredParam(ex, "nonce"));

            var event = registry.eventFor(kind, recordId, nonce);
            if (event.isEmpty()) {
                status = 404;
                send(ex, status, Map.of("found", false));
            } else {
                AuditEvent e = event.get();
                var dto = new SignerResponse();
                dto.found = true;
                dto.signer = e.signer();
                dto.fingerprint = e.fingerprint().hex();
                dto.sequenceNumber = e.sequenceNumber();
                status = 200;
                send(ex, status, dto);
            }
        } catch (Exception e) {
            error = e;
            status = fail(ex, e);
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, -1, error);
    }

    /** GET /registry/history?signer=.. */
    private void handleHistory(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status;
        Throwable error = null;
        try {
            String signer = requiredParam(ex, "signer");
            if (signer.isBlank()) {
                throw new IllegalArgumentException("signer must not be empty");
            }
            List<AuditEvent> events = registry.historyOf(signer);
            List<AuditEventView> views = new ArrayList<>(events.size());
            for (AuditEvent e : events) {
                views.add(AuditEventView.of(e));
            }
            var dto = new HistoryResponse();
            dto.signer = signer;
            dto.count = views.size();
            dto.events = views;
            status = 200;
            send(ex, status, dto);
        } catch (Exception e) {
            error = e;
            status = fail(ex, e);
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, -1, error);
    }

    /** GET /registry/fingerprint?operationKind=..&recordId=..&nonce=.. */
    private void handleFingerprint(HttpServerExchange ex) {
        int status;
        Throwable error = null;
        try {
            var dto = new FingerprintResponse();
            dto.fingerprint = registry.fingerprintOf(
                    requiredParam(ex, "operationKind"),
                    requiredParam(ex, "recordId"),
                    parseNonce(requiredParam(ex, "nonce"))).hex();
            status = 200;
            send(ex, status, dto);
        } catch (Exception e) {
            error = e;
            status = fail(ex, e);
        }
        RequestLogger.logRequest("GET", ex.getRequestPath(), status, 0, -1, error);
    }

    // ---------- helpers ----------

    /** Map an exception to a status, send the error body, return the status. */
    private int fail(HttpServerExchange ex, Exception e) {
        int status;
        Map<String, Object> body;
        if (e instanceof JsonProcessingException) {
            status = 400;
            body = Map.of("error", "invalid JSON");
        } else if (e instanceof IllegalArgumentException) {
            status = 400;
            body = Map.of("error", String.valueOf(e.getMessage()));
        } else if (e instanceof BackendUnavailableException) {
            status = 503;
            body = Map.of("error", "backend unavailable", "message", String.valueOf(e.getMessage()));
        } else if (e instanceof CoalescerTimeoutException) {
            status = 504;
            body = Map.of("error", "timed out waiting for ledger", "message", String.valueOf(e.getMessage()));
        } else {
            status = 500;
            body = Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage()));
        }
        send(ex, status, body);
        return status;
    }

    /** Reads at most MAX_BODY_BYTES + 1 bytes; a longer result means the body is too large. */
    private static byte[] readBody(HttpServerExchange ex) throws IOException {
        ex.startBlocking();
        InputStream in = ex.getInputStream();
        byte[] data = in.readNBytes(MAX_BODY_BYTES + 1);
        if (data.length > MAX_BODY_BYTES) {
            // drain so the client sees our 413 instead of a reset
            in.transferTo(OutputStream.nullOutputStream());
        }
        return data;
    }

    /** Header value if present, otherwise the service default. */
    private Duration waitLimit(HttpServerExchange ex) {
        String raw = ex.getRequestHeaders().getFirst(WAIT_HEADER);
        if (raw == null || raw.isBlank()) {
            return registry.defaultTimeout();
        }
        try {
            long ms = Long.parseLong(raw.trim());
            if (ms < 0) {
                throw new IllegalArgumentException(WAIT_HEADER + " must not be negative");
            }
            return Duration.ofMillis(ms);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(WAIT_HEADER + " must be a number of milliseconds");
        }
    }

    private static String requiredParam(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("missing query parameter: " + name);
        }
        return values.getFirst();
    }

    private static long parseNonce(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("nonce must be an integer");
        }
    }

    private void methodNotAllowed(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
