// file: server/src/main/java/io/mural/server/WebServer.java
package io.mural.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mural.core.Message;
import io.mural.server.auth.AuthorizationException;
import io.mural.server.dto.LoginRequest;
import io.mural.server.dto.LoginResponse;
import io.mural.server.dto.MessageDto;
import io.mural.server.dto.MessagesResponse;
import io.mural.server.dto.PeerStatusDto;
import io.mural.server.dto.PostMessageRequest;
import io.mural.server.dto.ReconcileResponse;
import io.mural.server.replication.ReconciliationReport;
import io.mural.storage.DuplicateMessageIdException;
import io.mural.storage.StorageException;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over a BoardNode.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert engine results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging through RequestLogger.
 *
 * Path layout:
 *   - POST /login               {username,password} -> {token}
 *   - GET  /messages            whole board in display order
 *   - POST /messages            {content, author?, token?} -> 201 + message
 *   - POST /admin/offline       start simulated outage
 *   - POST /admin/online        end outage; reconciliation runs in the background
 *   - POST /admin/reconcile     synchronous reconciliation round
 *   - GET  /admin/peers         peer registry view
 *   - GET  /admin/health        basic health check
 *
 * Admin routes require the X-Admin-Token header when the cluster config sets
 * an admin token. Requests are dispatched off the IO thread because writes
 * fsync and reconciliation waits on peers.
 */
public final class WebServer {

    static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final BoardNode node;
    private final String adminToken;

    /** Result of one handler: status code, JSON body, and time spent in the engine. */
    private record Reply(int status, Object body, long boardMillis) {
        static Reply of(int status, Object body) {
            return new Reply(status, body, -1L);
        }
    }

    public WebServer(int port, BoardNode node) {
        this(port, "0.0.0.0", node);
    }

    public WebServer(int port, String bindHost, BoardNode node) {
        this.node = node;
        this.adminToken = node.cluster().adminToken();

        this.server = Undertow.builder()
                .addHttpListener(port, bindHost)
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::handle);
                        return;
                    }
                    handle(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- dispatch ----------

    private void handle(HttpServerExchange ex) {
        long start = System.nanoTime();
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        Reply reply;
        Throwable error = null;
        try {
            reply = route(ex, method, path);
        } catch (AuthorizationException denied) {
            error = denied;
            reply = Reply.of(401, Map.of("error", denied.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            error = jsonEx;
            reply = Reply.of(400, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            error = bad;
            reply = Reply.of(400, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (DuplicateMessageIdException dup) {
            error = dup;
            reply = Reply.of(409, Map.of("error", "duplicate message id", "id", dup.id().toString()));
        } catch (StorageException se) {
            error = se;
            reply = Reply.of(500, Map.of("error", "storage failure", "message", String.valueOf(se.getMessage())));
        } catch (Exception e) {
            error = e;
            reply = Reply.of(500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }

        send(ex, reply.status(), reply.body());
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(node.nodeId(), method, path, reply.status(), totalMs, reply.boardMillis(), error);
    }

    private Reply route(HttpServerExchange ex, String method, String path) throws IOException {
        return switch (path) {
            case "/login" -> "POST".equals(method) ? handleLogin(ex) : methodNotAllowed();
            case "/messages" -> switch (method) {
                case "GET" -> handleList();
                case "POST" -> handlePost(ex);
                default -> methodNotAllowed();
            };
            default -> path.startsWith("/admin/")
                    ? routeAdmin(ex, method, path)
                    : Reply.of(404, Map.of("error", "not found"));
        };
    }

    private Reply routeAdmin(HttpServerExchange ex, String method, String path) {
        if ("/admin/health".equals(path) && "GET".equals(method)) {
            return handleHealth();
        }
        if (adminToken != null && !adminToken.equals(ex.getRequestHeaders().getFirst(ADMIN_TOKEN_HEADER))) {
            throw new AuthorizationException("admin token required");
        }
        return switch (path) {
            case "/admin/offline" -> "POST".equals(method) ? handleOffline() : methodNotAllowed();
            case "/admin/online" -> "POST".equals(method) ? handleOnline() : methodNotAllowed();
            case "/admin/reconcile" -> "POST".equals(method) ? handleReconcile() : methodNotAllowed();
            case "/admin/peers" -> "GET".equals(method) ? handlePeers() : methodNotAllowed();
            default -> Reply.of(404, Map.of("error", "not found"));
        };
    }

    // ---------- handlers ----------

    /** POST /login */
    private Reply handleLogin(HttpServerExchange ex) throws IOException {
        byte[] body = readBody(ex);
        if (body == null) {
            return tooLarge();
        }
        LoginRequest req = json.readValue(body, LoginRequest.class);
        if (req == null) {
            throw new IllegalArgumentException("JSON body required");
        }
        var resp = new LoginResponse();
        resp.token = node.auth().login(req.username, req.password);
        return Reply.of(200, resp);
    }

    /** GET /messages */
    private Reply handleList() {
        long sStart = System.nanoTime();
        List<Message> all = node.board().messages();
        long boardMs = (System.nanoTime() - sStart) / 1_000_000L;

        var dto = new MessagesResponse();
        dto.nodeId = node.nodeId();
        dto.messages = new ArrayList<>(all.size());
        for (Message m : all) {
            dto.messages.add(MessageDto.from(m));
        }
        return new Reply(200, dto, boardMs);
    }

    /** POST /messages */
    private Reply handlePost(HttpServerExchange ex) throws IOException {
        byte[] body = readBody(ex);
        if (body == null) {
            return tooLarge();
        }
        PostMessageRequest req = json.readValue(body, PostMessageRequest.class);
        if (req == null) {
            throw new IllegalArgumentException("JSON body required");
        }
        String token = req.token != null && !req.token.isBlank() ? req.token : bearerToken(ex);

        long sStart = System.nanoTime();
        Message m = node.board().post(token, req.author, req.content);
        long boardMs = (System.nanoTime() - sStart) / 1_000_000L;

        return new Reply(201, MessageDto.from(m), boardMs);
    }

    /** GET /admin/health */
    private Reply handleHealth() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("nodeId", node.nodeId());
        body.put("mode", node.state().mode().name());
        body.put("messages", node.board().size());
        return Reply.of(200, body);
    }

    /** POST /admin/offline */
    private Reply handleOffline() {
        boolean changed = node.simulator().goOffline();
        return Reply.of(200, Map.of("mode", node.simulator().mode().name(), "changed", changed));
    }

    /** POST /admin/online: the reconciliation round is not awaited. */
    private Reply handleOnline() {
        boolean wasOffline = node.state().isOffline();
        node.simulator().goOnline();
        return Reply.of(200, Map.of("mode", node.simulator().mode().name(), "reconciling", wasOffline));
    }

    /** POST /admin/reconcile */
    private Reply handleReconcile() {
        long sStart = System.nanoTime();
        ReconciliationReport report = node.reconciliation().reconcileAll();
        long boardMs = (System.nanoTime() - sStart) / 1_000_000L;
        return new Reply(200, ReconcileResponse.from(report, node.state().mode().name()), boardMs);
    }

    /** GET /admin/peers */
    private Reply handlePeers() {
        List<PeerStatusDto> peers = node.registry().listPeers().stream()
                .map(PeerStatusDto::from)
                .toList();
        return Reply.of(200, Map.of("nodeId", node.nodeId(), "peers", peers));
    }

    // ---------- helpers ----------

    private static Reply methodNotAllowed() {
        return Reply.of(405, Map.of("error", "method not allowed"));
    }

    private static Reply tooLarge() {
        return Reply.of(413, Map.of("error", "request body too large"));
    }

    /**
     * Read the whole body, or return null if it exceeds MAX_BODY_BYTES. An
     * oversized body is drained so the client still gets the 413 response.
     */
    private static byte[] readBody(HttpServerExchange ex) throws IOException {
        ex.startBlocking();
        try (InputStream in = ex.getInputStream()) {
            byte[] data = in.readNBytes(MAX_BODY_BYTES + 1);
            if (data.length > MAX_BODY_BYTES) {
                in.transferTo(OutputStream.nullOutputStream());
                return null;
            }
            return data;
        }
    }

    private static String bearerToken(HttpServerExchange ex) {
        String header = ex.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header == null || !header.startsWith("Bearer ")) {
            return null;
        }
        return header.substring("Bearer ".length()).trim();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
