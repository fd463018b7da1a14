package com.sendanywhere.lan;

import com.sendanywhere.chunk.ChunkLayout;
import com.sendanywhere.chunk.ChunkManager;
import com.sendanywhere.chunk.FileManifest;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.ErrorResponses;
import com.sendanywhere.error.NotFoundException;
import com.sendanywhere.error.NotFoundReason;
import com.sendanywhere.error.TransferException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves one manifest's chunks straight from the sender's disk.
 *
 * <pre>
 * GET /manifest
 * GET /chunk/{chunkId}                   single file
 * GET /file/{fileIndex}/chunk/{chunkId}  folder
 * GET /                                  health
 * </pre>
 */
public class LanTransferServer {

    private static final Logger log = LoggerFactory.getLogger(LanTransferServer.class);

    private static final String ROUTE_HOST = "8.8.8.8";
    private static final int ROUTE_PORT = 80;

    private final Manifest manifest;
    private final ChunkLayout layout;
    private final ChunkManager chunks;
    private final String host;
    private final int port;
    private Javalin app;

    public LanTransferServer(Manifest manifest, String host, int port) throws TransferException {
        Manifests.validate(manifest);
        this.manifest = manifest;
        this.layout = ChunkLayout.of(manifest);
        this.chunks = new ChunkManager(manifest.chunkSize());
        this.host = host;
        this.port = port;
    }

    /**
     * Start serving.
     *
     * @return the address to advertise to the receiver
     */
    public String start() {
        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinJackson(Json.mapper()));
        });
        ErrorResponses.install(app);

        app.get("/manifest", ctx -> ctx.json(Manifests.toTree(manifest)));
        app.get("/chunk/{chunkId}", this::handleChunk);
        app.get("/file/{fileIndex}/chunk/{chunkId}", this::handleFileChunk);
        app.get("/", this::handleHealth);

        app.start(host, port);
        String address = localAddress();
        log.info("LAN server for {} started at http://{}:{}", manifest.name(), address, app.port());
        return address;
    }

    public void stop() {
        if (app != null) {
            app.stop();
            log.info("LAN server stopped");
        }
    }

    public int port() {
        return app.port();
    }

    /**
     * The address this host uses to reach the outside world, found by pointing
     * a UDP socket at a public address. Nothing is sent. Falls back to loopback.
     */
    public static String localAddress() {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.connect(new InetSocketAddress(ROUTE_HOST, ROUTE_PORT));
            InetAddress local = socket.getLocalAddress();
            if (local != null && !local.isAnyLocalAddress()) {
                return local.getHostAddress();
            }
            log.debug("No routable local address, using loopback");
        } catch (IOException | RuntimeException e) {
            log.debug("Local address discovery failed, using loopback: {}", e.toString());
        }
        return "127.0.0.1";
    }

    // --- handlers ---

    private void handleChunk(Context ctx) throws TransferException {
        if (layout.isFolder()) {
            throw TransferException.invalidInput("Folder transfer: use /file/{fileIndex}/chunk/{chunkId}");
        }
        sendChunk(ctx, layout.slot(0).file(), ErrorResponses.intParam(ctx, "chunkId"));
    }

    private void handleFileChunk(Context ctx) throws TransferException {
        if (!layout.isFolder()) {
            throw TransferException.invalidInput("Single file transfer: use /chunk/{chunkId}");
        }
        int fileIndex = ErrorResponses.intParam(ctx, "fileIndex");
        if (fileIndex < 0 || fileIndex >= layout.slots().size()) {
            throw new NotFoundException(NotFoundReason.FILE_UNKNOWN, "File index out of range: " + fileIndex);
        }
        sendChunk(ctx, layout.slot(fileIndex).file(), ErrorResponses.intParam(ctx, "chunkId"));
    }

    private void sendChunk(Context ctx, FileManifest file, int chunkId) throws TransferException {
        if (chunkId < 0 || chunkId >= file.totalChunks()) {
            throw TransferException.invalidInput("Chunk " + chunkId + " out of range for " + file.fileName()
                    + " (" + file.totalChunks() + " chunks)");
        }
        Path source = Paths.get(file.filePath());
        byte[] data = chunks.readChunk(source, chunkId);
        log.debug("Served chunk {} of {} ({} bytes)", chunkId, file.fileName(), data.length);
        ctx.contentType("application/octet-stream")
                .header("Content-Disposition", String.format("attachment; filename=\"chunk_%06d\"", chunkId))
                .result(data);
    }

    private void handleHealth(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "Send Anywhere LAN Transfer");
        body.put("status", "running");
        body.put("transfer", manifest.name());
        body.put("total_chunks", layout.totalChunks());
        ctx.json(body);
    }
}
