package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.ConflictException;
import ai.flagkeeper.online.FeatureNotFoundException;
import ai.flagkeeper.online.JTry;
import ai.flagkeeper.online.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RequestBody;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

// Response and request body plumbing shared by the flag and admin handlers
final class HandlerSupport {
    private static final Logger logger = LoggerFactory.getLogger(HandlerSupport.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private HandlerSupport() {
    }

    static <T> JTry<T> parseBody(RequestBody body, Class<T> type) {
        try {
            return JTry.success(objectMapper.readValue(body.asString(), type));
        } catch (Exception e) {
            return JTry.failure(e);
        }
    }

    static int statusFor(Throwable err) {
        if (err instanceof ValidationException) {
            return 422;
        }
        if (err instanceof ConflictException) {
            return 409;
        }
        if (err instanceof FeatureNotFoundException) {
            return 404;
        }
        return 500;
    }

    static void respond(RoutingContext ctx, int statusCode, JsonObject body) {
        ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(body.encode());
    }

    static void respondNoContent(RoutingContext ctx) {
        ctx.response()
                .setStatusCode(204)
                .end();
    }

    static void respondErrors(RoutingContext ctx, int statusCode, List<String> errors) {
        respond(ctx, statusCode, new JsonObject().put("errors", errors));
    }

    static void respondBadRequest(RoutingContext ctx, Throwable err) {
        logger.error("Unable to parse request body", err);
        respondErrors(ctx, 400, Collections.singletonList(String.valueOf(err.getMessage())));
    }

    static void respondFailure(RoutingContext ctx, Throwable err) {
        int statusCode = statusFor(err);
        if (statusCode == 500) {
            logger.error("Request to {} failed", ctx.normalizedPath(), err);
        } else {
            logger.debug("Request to {} rejected: {}", ctx.normalizedPath(), err.getMessage());
        }
        respondErrors(ctx, statusCode, Collections.singletonList(String.valueOf(err.getMessage())));
    }
}
