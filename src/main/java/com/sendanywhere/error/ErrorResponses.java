package com.sendanywhere.error;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders {@link TransferException}s as {@code {error, reason?, detail}} JSON
 * with a matching HTTP status. Shared by every Javalin app in the project.
 */
public final class ErrorResponses {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponses.class);

    private ErrorResponses() {}

    public static void install(Javalin app) {
        app.exception(TransferException.class, (e, ctx) -> render(ctx, e));
        app.exception(Exception.class, (e, ctx) -> {
            if (e instanceof HttpResponseException hre) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", hre.getStatus() == 404 ? ErrorCategory.NOT_FOUND.wireName() : ErrorCategory.INVALID_INPUT.wireName());
                body.put("detail", hre.getMessage());
                ctx.status(hre.getStatus()).json(body);
                return;
            }
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            render(ctx, TransferException.ioFailure(e.getMessage() != null ? e.getMessage() : e.toString(), e));
        });
    }

    public static void render(Context ctx, TransferException e) {
        int status = httpStatus(e.category());
        if (status >= 500) {
            log.error("{} {} failed: {}", ctx.method(), ctx.path(), e.getMessage(), e);
        } else {
            log.debug("{} {} -> {} {}", ctx.method(), ctx.path(), status, e.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.category().wireName());
        if (e instanceof NotFoundException nf && nf.reason() != null) {
            body.put("reason", nf.reason().wireName());
        }
        body.put("detail", e.getMessage());
        ctx.status(status).json(body);
    }

    public static int httpStatus(ErrorCategory category) {
        return switch (category) {
            case NOT_FOUND -> 404;
            case INVALID_INPUT -> 400;
            case HASH_MISMATCH -> 422;
            case NETWORK_FAILURE -> 502;
            case EXHAUSTED -> 503;
            case IO_FAILURE, MANIFEST_CORRUPT -> 500;
        };
    }

    public static int intParam(Context ctx, String name) throws TransferException {
        String raw = ctx.pathParam(name);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw TransferException.invalidInput("Path parameter '" + name + "' is not an integer: " + raw);
        }
    }
}
