package com.sendanywhere.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.sendanywhere.chunk.ChunkReceipt;
import com.sendanywhere.chunk.Manifest;
import com.sendanywhere.chunk.Manifests;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.HttpErrors;
import com.sendanywhere.error.TransferException;
import com.sendanywhere.transfer.ChunkTransport;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for {@link RelayServer}.
 */
public class RelayClient {

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient http;

    public RelayClient(String baseUrl, Duration connectTimeout, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    /** @return total chunk count the relay registered */
    public int create(String transferId, Manifest manifest) throws TransferException {
        HttpRequest request = request("/transfer/create?transfer_id=" + encode(transferId))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Manifests.toJson(manifest)))
                .build();
        JsonNode body = json(request, "create transfer " + transferId);
        return requireField(body, "total_chunks").asInt();
    }

    public ChunkReceipt putChunk(String transferId, int chunkId, byte[] data) throws TransferException {
        HttpRequest request = request("/transfer/" + encode(transferId) + "/chunk/" + chunkId)
                .header("Content-Type", "application/octet-stream")
                .POST(HttpRequest.BodyPublishers.ofByteArray(data))
                .build();
        JsonNode body = json(request, "upload chunk " + chunkId);
        return new ChunkReceipt(
                requireField(body, "chunk_id").asInt(),
                requireField(body, "hash").asText(),
                requireField(body, "size").asInt());
    }

    public byte[] getChunk(String transferId, int chunkId) throws TransferException {
        HttpRequest request = request("/transfer/" + encode(transferId) + "/chunk/" + chunkId).GET().build();
        HttpResponse<byte[]> response = HttpErrors.send(http, request, HttpResponse.BodyHandlers.ofByteArray());
        if (!HttpErrors.isSuccess(response.statusCode())) {
            throw HttpErrors.fromResponse(response.statusCode(),
                    new String(response.body(), StandardCharsets.UTF_8), "download chunk " + chunkId);
        }
        return response.body();
    }

    public Manifest getManifest(String transferId) throws TransferException {
        HttpRequest request = request("/transfer/" + encode(transferId) + "/manifest").GET().build();
        return Manifests.fromTree(json(request, "get manifest of " + transferId));
    }

    public RelayStatus status(String transferId) throws TransferException {
        HttpRequest request = request("/transfer/" + encode(transferId) + "/status").GET().build();
        JsonNode body = json(request, "status of " + transferId);
        List<Integer> available = new ArrayList<>();
        for (JsonNode id : requireField(body, "available_chunks")) {
            available.add(id.asInt());
        }
        return new RelayStatus(
                requireField(body, "transfer_id").asText(),
                requireField(body, "total_chunks").asInt(),
                requireField(body, "uploaded_chunks").asInt(),
                requireField(body, "progress").asDouble(),
                available,
                requireField(body, "complete").asBoolean());
    }

    public void delete(String transferId) throws TransferException {
        HttpRequest request = request("/transfer/" + encode(transferId)).DELETE().build();
        json(request, "delete " + transferId);
    }

    /** @return ids removed by the relay's retention sweep */
    public List<String> cleanup() throws TransferException {
        JsonNode body = json(request("/cleanup").GET().build(), "cleanup");
        List<String> deleted = new ArrayList<>();
        for (JsonNode id : requireField(body, "deleted_transfers")) {
            deleted.add(id.asText());
        }
        return deleted;
    }

    public boolean isHealthy() {
        try {
            JsonNode body = json(request("/").GET().build(), "health");
            return "running".equals(body.path("status").asText());
        } catch (TransferException e) {
            return false;
        }
    }

    /**
     * Transport bound to one transfer id, for {@code TransferEngine}.
     */
    public ChunkTransport transport(String transferId) {
        return new ChunkTransport() {
            @Override
            public void create(Manifest manifest) throws TransferException {
                RelayClient.this.create(transferId, manifest);
            }

            @Override
            public ChunkReceipt put(int chunkId, byte[] data) throws TransferException {
                return putChunk(transferId, chunkId, data);
            }

            @Override
            public byte[] get(int chunkId) throws TransferException {
                return getChunk(transferId, chunkId);
            }

            @Override
            public Manifest manifest() throws TransferException {
                return getManifest(transferId);
            }

            @Override
            public String describe() {
                return "relay " + baseUrl + " / " + transferId;
            }
        };
    }

    // --- plumbing ---

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout);
    }

    private JsonNode json(HttpRequest request, String what) throws TransferException {
        HttpResponse<String> response = HttpErrors.send(http, request, HttpResponse.BodyHandlers.ofString());
        if (!HttpErrors.isSuccess(response.statusCode())) {
            throw HttpErrors.fromResponse(response.statusCode(), response.body(), what);
        }
        try {
            return Json.mapper().readTree(response.body());
        } catch (IOException e) {
            throw TransferException.invalidInput("Malformed response to " + what + ": " + e.getMessage());
        }
    }

    private static JsonNode requireField(JsonNode body, String field) throws TransferException {
        JsonNode value = body == null ? null : body.get(field);
        if (value == null || value.isNull()) {
            throw TransferException.invalidInput("Relay response is missing '" + field + "'");
        }
        return value;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
