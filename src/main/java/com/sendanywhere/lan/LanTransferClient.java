package com.sendanywhere.lan;

import com.fasterxml.jackson.databind.JsonNode;
import com.sendanywhere.chunk.ChunkLayout;
import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.HttpErrors;
import com.sendanywhere.error.TransferException;
import com.sendanywhere.transfer.ChunkTransport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Read-only {@link ChunkTransport} over a {@link LanTransferServer}. Global
 * chunk ids are mapped back to (file, chunk) through the manifest's
 * {@link ChunkLayout}.
 */
public class LanTransferClient implements ChunkTransport {

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient http;
    private volatile ChunkLayout layout;

    public LanTransferClient(String host, int port, Duration connectTimeout, Duration requestTimeout) {
        this.baseUrl = "http://" + host + ":" + port;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public void create(Manifest manifest) throws TransferException {
        throw TransferException.invalidInput("LAN transport is read-only");
    }

    @Override
    public ChunkReceipt put(int chunkId, byte[] data) throws TransferException {
        throw TransferException.invalidInput("LAN transport is read-only");
    }

    @Override
    public Manifest manifest() throws TransferException {
        HttpResponse<String> response = HttpErrors.send(http,
                request("/manifest").GET().build(), HttpResponse.BodyHandlers.ofString());
        if (!HttpErrors.isSuccess(response.statusCode())) {
            throw HttpErrors.fromResponse(response.statusCode(), response.body(), "get manifest");
        }
        JsonNode tree;
        try {
            tree = Json.mapper().readTree(response.body());
        } catch (IOException e) {
            throw TransferException.invalidInput("Malformed manifest from " + baseUrl + ": " + e.getMessage());
        }
        Manifest manifest = Manifests.fromTree(tree);
        layout = ChunkLayout.of(manifest);
        return manifest;
    }

    /** Chunk of a single-file transfer. */
    public byte[] chunk(int chunkId) throws TransferException {
        return bytes("/chunk/" + chunkId, "download chunk " + chunkId);
    }

    /** Chunk {@code chunkId} of file {@code fileIndex} in a folder transfer. */
    public byte[] fileChunk(int fileIndex, int chunkId) throws TransferException {
        return bytes("/file/" + fileIndex + "/chunk/" + chunkId,
                "download chunk " + chunkId + " of file " + fileIndex);
    }

    @Override
    public byte[] get(int chunkId) throws TransferException {
        ChunkLayout current = layout;
        if (current == null) {
            manifest();
            current = layout;
        }
        if (!current.isFolder()) {
            return chunk(chunkId);
        }
        ChunkLayout.ChunkRef ref;
        try {
            ref = current.locate(chunkId);
        } catch (IndexOutOfBoundsException e) {
            throw TransferException.invalidInput(e.getMessage());
        }
        return fileChunk(ref.fileIndex(), ref.localChunkId());
    }

    @Override
    public String describe() {
        return "LAN " + baseUrl;
    }

    private byte[] bytes(String path, String what) throws TransferException {
        HttpResponse<byte[]> response = HttpErrors.send(http,
                request(path).GET().build(), HttpResponse.BodyHandlers.ofByteArray());
        if (!HttpErrors.isSuccess(response.statusCode())) {
            throw HttpErrors.fromResponse(response.statusCode(),
                    new String(response.body(), StandardCharsets.UTF_8), what);
        }
        return response.body();
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout);
    }
}
