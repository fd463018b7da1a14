package com.sendanywhere.relay;

import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.ErrorResponses;
import com.sendanywhere.error.TransferException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP front end of a {@link RelayStore}.
 *
 * <pre>
 * POST   /transfer/create?transfer_id=ID     body: manifest JSON
 * POST   /transfer/{id}/chunk/{chunkId}      body: raw chunk bytes
 * GET    /transfer/{id}/chunk/{chunkId}
 * GET    /transfer/{id}/manifest
 * GET    /transfer/{id}/status
 * DELETE /transfer/{id}
 * GET    /cleanup
 * GET    /                                   health
 * </pre>
 */
public class RelayServer {

    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    public static final String SERVICE_NAME = "Send Anywhere Relay Server";
    public static final String VERSION = "0.1.0";
    private static final long MAX_REQUEST_BYTES = 64L * 1024 * 1024;

    private final RelayStore store;
    private final String host;
    private final int port;
    private final Duration sweepInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Javalin app;
    private ScheduledExecutorService sweeper;

    /**
     * @param sweepInterval period of the background sweep; zero or negative disables it
     */
    public RelayServer(RelayStore store, String host, int port, Duration sweepInterval) {
        this.store = store;
        this.host = host;
        this.port = port;
        this.sweepInterval = sweepInterval;
    }

    public void start() {
        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.http.maxRequestSize = MAX_REQUEST_BYTES;
            config.jsonMapper(new JavalinJackson(Json.mapper()));
        });
        ErrorResponses.install(app);

        app.post("/transfer/create", this::handleCreate);
        app.post("/transfer/{id}/chunk/{chunkId}", this::handleUploadChunk);
        app.get("/transfer/{id}/chunk/{chunkId}", this::handleDownloadChunk);
        app.get("/transfer/{id}/manifest", this::handleManifest);
        app.get("/transfer/{id}/status", this::handleStatus);
        app.delete("/transfer/{id}", this::handleDelete);
        app.get("/cleanup", this::handleCleanup);
        app.get("/", this::handleHealth);
        app.head("/", ctx -> ctx.status(200));

        app.start(host, port);
        running.set(true);
        log.info("Relay server listening on {}:{} (storage: {}, retention: {})",
                host, app.port(), store.root().toAbsolutePath(), store.retention());

        if (!sweepInterval.isZero() && !sweepInterval.isNegative()) {
            sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "relay-sweeper");
                t.setDaemon(true);
                return t;
            });
            long periodMs = sweepInterval.toMillis();
            sweeper.scheduleAtFixedRate(this::scheduledSweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
    }

    public void stop() {
        running.set(false);
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        if (app != null) {
            app.stop();
        }
        log.info("Relay server stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return app.port();
    }

    private void scheduledSweep() {
        try {
            store.sweep();
        } catch (TransferException e) {
            log.error("Scheduled sweep failed: {}", e.getMessage(), e);
        }
    }

    // --- handlers ---

    private void handleCreate(Context ctx) throws TransferException {
        String transferId = ctx.queryParam("transfer_id");
        if (transferId == null || transferId.isBlank()) {
            throw TransferException.invalidInput("Missing transfer_id");
        }
        Manifest manifest = Manifests.parse(ctx.body());
        store.create(transferId, manifest);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "created");
        body.put("transfer_id", transferId);
        body.put("total_chunks", manifest.totalChunks());
        ctx.json(body);
    }

    private void handleUploadChunk(Context ctx) throws TransferException {
        int chunkId = ErrorResponses.intParam(ctx, "chunkId");
        ChunkReceipt receipt = store.putChunk(ctx.pathParam("id"), chunkId, ctx.bodyAsBytes());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "uploaded");
        body.put("chunk_id", receipt.chunkId());
        body.put("hash", receipt.hash());
        body.put("size", receipt.size());
        ctx.json(body);
    }

    private void handleDownloadChunk(Context ctx) throws TransferException {
        int chunkId = ErrorResponses.intParam(ctx, "chunkId");
        byte[] data = store.getChunk(ctx.pathParam("id"), chunkId);
        ctx.contentType("application/octet-stream")
                .header("Content-Disposition", "attachment; filename=\"" + RelayStore.chunkFileName(chunkId) + "\"")
                .result(data);
    }

    private void handleManifest(Context ctx) throws TransferException {
        ctx.json(store.getManifest(ctx.pathParam("id")));
    }

    private void handleStatus(Context ctx) throws TransferException {
        RelayStatus status = store.status(ctx.pathParam("id"));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("transfer_id", status.transferId());
        body.put("total_chunks", status.totalChunks());
        body.put("uploaded_chunks", status.uploadedChunks());
        body.put("progress", status.progress());
        body.put("available_chunks", status.availableChunks());
        body.put("complete", status.complete());
        ctx.json(body);
    }

    private void handleDelete(Context ctx) throws TransferException {
        String transferId = ctx.pathParam("id");
        store.delete(transferId);
        ctx.json(Map.of("status", "deleted", "transfer_id", transferId));
    }

    private void handleCleanup(Context ctx) throws TransferException {
        List<String> deleted = store.sweep();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "cleaned");
        body.put("deleted_count", deleted.size());
        body.put("deleted_transfers", deleted);
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
