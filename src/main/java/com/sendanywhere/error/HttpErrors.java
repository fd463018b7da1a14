package com.sendanywhere.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.sendanywhere.config.Json;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Client-side half of the structured error contract: turns HTTP failures back
 * into the {@link ErrorCategory} taxonomy.
 */
public final class HttpErrors {

    private HttpErrors() {}

    /**
     * Send and return the response, or raise {@code NETWORK_FAILURE} for
     * connection faults and timeouts. An interrupt keeps the interrupt flag
     * set and the {@link InterruptedException} as cause, so retry loops stop.
     */
    public static <T> HttpResponse<T> send(HttpClient client, HttpRequest request,
                                           HttpResponse.BodyHandler<T> handler) throws TransferException {
        try {
            return client.send(request, handler);
        } catch (IOException e) {
            throw TransferException.network(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransferException.network("Interrupted during " + request.method() + " " + request.uri(), e);
        }
    }

    /**
     * Map a non-2xx response. 404 keeps its not-found reason; other 4xx are
     * terminal; 5xx are treated as transient.
     */
    public static TransferException fromResponse(int status, String body, String what) {
        JsonNode error = parse(body);
        String detail = error != null && error.hasNonNull("detail") ? error.get("detail").asText() : body;
        String message = what + ": HTTP " + status + (detail == null || detail.isBlank() ? "" : " " + detail);

        if (status == 404) {
            NotFoundReason reason = error != null ? NotFoundReason.fromWireName(error.path("reason").asText(null)) : null;
            return new NotFoundException(reason != null ? reason : NotFoundReason.TRANSFER_UNKNOWN, message);
        }
        ErrorCategory category = error != null ? ErrorCategory.fromWireName(error.path("error").asText(null)) : null;
        if (status >= 500) {
            return new TransferException(ErrorCategory.NETWORK_FAILURE, message);
        }
        return new TransferException(category != null ? category : ErrorCategory.INVALID_INPUT, message);
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = Json.mapper().readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            return null;
        }
    }
}
