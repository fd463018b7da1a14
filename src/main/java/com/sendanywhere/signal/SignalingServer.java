package com.sendanywhere.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.ErrorResponses;
import com.sendanywhere.error.TransferException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import io.javalin.websocket.WsContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP and WebSocket front end of a {@link SignalingHub}.
 *
 * <pre>
 * POST /pair/create?transfer_id=ID     body: manifest JSON
 * GET  /pair/{code}/info
 * WS   /ws/{code}/{role}               role: sender | receiver
 * GET  /stats
 * GET  /                               health
 * </pre>
 */
public class SignalingServer {

    private static final Logger log = LoggerFactory.getLogger(SignalingServer.class);

    public static final String SERVICE_NAME = "Send Anywhere Signaling Server";
    public static final String VERSION = "0.1.0";

    /** Adapts one Javalin WebSocket session to the hub. */
    private static final class WsPeer implements SignalPeer {
        final WsContext ctx;
        final String code;
        final Role role;

        WsPeer(WsContext ctx, String code, Role role) {
            this.ctx = ctx;
            this.code = code;
            this.role = role;
        }

        @Override
        public synchronized void send(String text) throws IOException {
            if (!ctx.session.isOpen()) {
                throw new IOException("WebSocket " + ctx.getSessionId() + " is closed");
            }
            ctx.send(text);
        }

        @Override
        public void close() {
            ctx.closeSession();
        }
    }

    private final SignalingHub hub;
    private final String host;
    private final int port;
    private final Map<String, WsPeer> peers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Javalin app;

    public SignalingServer(SignalingHub hub, String host, int port) {
        this.hub = hub;
        this.host = host;
        this.port = port;
    }

    public void start() {
        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinJackson(Json.mapper()));
            config.jetty.wsFactoryConfig(factory -> factory.setIdleTimeout(hub.ttl()));
        });
        ErrorResponses.install(app);

        app.post("/pair/create", this::handleCreate);
        app.get("/pair/{code}/info", this::handleInfo);
        app.get("/stats", this::handleStats);
        app.get("/", this::handleHealth);
        app.head("/", ctx -> ctx.status(200));

        app.ws("/ws/{code}/{role}", ws -> {
            ws.onConnect(this::onConnect);
            ws.onMessage(ctx -> {
                WsPeer peer = peers.get(ctx.getSessionId());
                if (peer != null) {
                    hub.relay(peer.code, peer.role, peer, ctx.message());
                }
            });
            ws.onClose(ctx -> onClose(ctx.getSessionId()));
            ws.onError(ctx -> {
                log.warn("WebSocket {} error: {}", ctx.getSessionId(),
                        ctx.error() != null ? ctx.error().toString() : "unknown");
                onClose(ctx.getSessionId());
            });
        });

        app.start(host, port);
        running.set(true);
        log.info("Signaling server listening on {}:{} (pair code ttl: {})", host, app.port(), hub.ttl());
    }

    public void stop() {
        running.set(false);
        if (app != null) {
            app.stop();
        }
        log.info("Signaling server stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public int port() {
        return app.port();
    }

    public SignalingHub hub() {
        return hub;
    }

    private void onConnect(WsContext ctx) {
        String code = ctx.pathParam("code");
        String roleName = ctx.pathParam("role");
        WsPeer peer = new WsPeer(ctx, code, Role.fromWireName(roleName));
        peers.put(ctx.getSessionId(), peer);
        if (!hub.connect(code, roleName, peer)) {
            peers.remove(ctx.getSessionId());
        }
    }

    private void onClose(String sessionId) {
        WsPeer peer = peers.remove(sessionId);
        if (peer != null && peer.role != null) {
            hub.disconnect(peer.code, peer.role, peer);
        }
    }

    // --- handlers ---

    private void handleCreate(Context ctx) throws TransferException {
        String transferId = ctx.queryParam("transfer_id");
        String raw = ctx.body();
        if (raw.isBlank() && ctx.queryParam("manifest") != null) {
            raw = ctx.queryParam("manifest");
        }
        JsonNode manifest;
        try {
            manifest = Json.mapper().readTree(raw);
        } catch (IOException e) {
            throw TransferException.invalidInput("Manifest is not valid JSON: " + e.getMessage());
        }
        PairCodeInfo info = hub.issuePairCode(transferId, manifest);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pair_code", info.code());
        body.put("transfer_id", info.transferId());
        body.put("expires_in", info.expiresIn());
        ctx.json(body);
    }

    private void handleInfo(Context ctx) throws TransferException {
        PairInfo info = hub.getInfo(ctx.pathParam("code"));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pair_code", info.code());
        body.put("transfer_id", info.transferId());
        body.put("manifest", info.manifest());
        body.put("status", info.status().wireName());
        body.put("expires_in", info.expiresIn());
        ctx.json(body);
    }

    private void handleStats(Context ctx) {
        HubStats stats = hub.stats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active_pairs", stats.activePairs());
        body.put("total_pair_codes", stats.totalPairCodes());
        body.put("active_connections", stats.activeConnections());
        ctx.json(body);
    }

    private void handleHealth(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("status", "running");
        body.put("version", VERSION);
        ctx.json(body);
    }
}
