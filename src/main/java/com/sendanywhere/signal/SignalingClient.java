package com.sendanywhere.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.sendanywhere.config.Json;
import com.sendanywhere.error.HttpErrors;
import com.sendanywhere.error.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client for {@link SignalingServer}: pairing code HTTP calls and the role
 * scoped WebSocket channel.
 */
public class SignalingClient {

    private static final Logger log = LoggerFactory.getLogger(SignalingClient.class);

    /** Receives every frame arriving on a pairing channel. */
    public interface SignalListener {
        void onFrame(JsonNode frame);

        default void onClosed(int statusCode, String reason) {}

        default void onError(Throwable error) {
            log.warn("Signaling channel error: {}", error.toString());
        }
    }

    /** An open pairing channel. */
    public interface SignalSession extends AutoCloseable {
        void send(JsonNode message) throws TransferException;

        @Override
        void close();
    }

    private final String baseUrl;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final HttpClient http;

    public SignalingClient(String baseUrl, Duration connectTimeout, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public PairCodeInfo createPairCode(String transferId, JsonNode manifest) throws TransferException {
        HttpRequest request = request("/pair/create?transfer_id=" + encode(transferId))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(manifest.toString()))
                .build();
        JsonNode body = json(request, "create pair code");
        return new PairCodeInfo(
                requireField(body, "pair_code").asText(),
                requireField(body, "transfer_id").asText(),
                requireField(body, "expires_in").asLong());
    }

    public PairInfo getInfo(String code) throws TransferException {
        JsonNode body = json(request("/pair/" + encode(code) + "/info").GET().build(), "pair code " + code);
        PairStatus status;
        try {
            status = PairStatus.fromWireName(requireField(body, "status").asText());
        } catch (IllegalArgumentException e) {
            throw TransferException.invalidInput(e.getMessage());
        }
        return new PairInfo(
                requireField(body, "pair_code").asText(),
                requireField(body, "transfer_id").asText(),
                requireField(body, "manifest"),
                status,
                requireField(body, "expires_in").asLong());
    }

    public HubStats stats() throws TransferException {
        JsonNode body = json(request("/stats").GET().build(), "stats");
        return new HubStats(
                requireField(body, "active_pairs").asInt(),
                requireField(body, "total_pair_codes").asInt(),
                requireField(body, "active_connections").asInt());
    }

    /**
     * Open the pairing channel for {@code code} as {@code role}. The first frame
     * the listener sees is {@code connected} or {@code error}.
     */
    public SignalSession open(String code, Role role, SignalListener listener) throws TransferException {
        URI uri = URI.create(baseUrl.replaceFirst("^http", "ws") + "/ws/" + encode(code) + "/" + role.wireName());
        CompletableFuture<WebSocket> future = http.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new FrameAssembler(listener));
        WebSocket ws;
        try {
            ws = future.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw TransferException.network("Could not open " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransferException.network("Interrupted opening " + uri, e);
        }
        log.debug("Opened signaling channel {}", uri);
        return new SignalSession() {
            @Override
            public synchronized void send(JsonNode message) throws TransferException {
                try {
                    ws.sendText(message.toString(), true).get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (ExecutionException | TimeoutException e) {
                    throw TransferException.network("Send on " + uri + " failed: " + e.getMessage(), e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw TransferException.network("Interrupted sending on " + uri, e);
                }
            }

            @Override
            public void close() {
                if (!ws.isOutputClosed()) {
                    ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
                }
            }
        };
    }

    /** Joins partial text messages and hands whole frames to the listener. */
    private static final class FrameAssembler implements WebSocket.Listener {
        private final SignalListener listener;
        private final StringBuilder buffer = new StringBuilder();

        FrameAssembler(SignalListener listener) {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String text = buffer.toString();
                buffer.setLength(0);
                try {
                    listener.onFrame(Json.mapper().readTree(text));
                } catch (IOException e) {
                    log.warn("Dropping non-JSON signaling frame: {}", e.getMessage());
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
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
            throw TransferException.invalidInput("Signaling response is missing '" + field + "'");
        }
        return value;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
