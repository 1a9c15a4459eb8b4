package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.EvaluationRequest;
import ai.flagkeeper.online.EvaluationResponse;
import ai.flagkeeper.online.FlagEvaluator;
import ai.flagkeeper.online.JTry;
import ai.flagkeeper.service.FlagMetrics;
import ai.flagkeeper.service.model.EvaluateFlagsResponse;
import ai.flagkeeper.service.model.EvaluateRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RequestBody;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static ai.flagkeeper.service.model.EvaluateFlagsResponse.Result.Status.Failure;
import static ai.flagkeeper.service.model.EvaluateFlagsResponse.Result.Status.Success;

/**
 * Flag evaluation endpoints.
 * Bulk: POST a list of {featureKey, userId, groups} and get one result per entry, in the same order.
 * Individual results fail on their own (status 'Failure') when the store can't be read for them, while
 * the overall response is still a 200. A body we can't parse is a 400.
 * As an example:
 * { results: [ {"status": "Success", "featureKey": "dark_mode", "enabled": true}, {"status": "Failure", "error": ...} ] }
 * Single: GET /:key?userId=...&amp;groups=a,b returns {"featureKey": ..., "enabled": ...}, or a 500 if the
 * store can't be read.
 * Evaluation blocks on the store, so it runs on a worker thread.
 */
public class EvaluateHandler implements Handler<RoutingContext> {

    public enum Mode {
        Bulk,
        Single
    }

    private static final Logger logger = LoggerFactory.getLogger(EvaluateHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Mode mode;
    private final FlagEvaluator evaluator;
    private final FlagMetrics metrics;

    public EvaluateHandler(Mode mode, FlagEvaluator evaluator, FlagMetrics metrics) {
        this.mode = mode;
        this.evaluator = evaluator;
        this.metrics = metrics;
    }

    @Override
    public void handle(RoutingContext ctx) {
        if (mode == Mode.Bulk) {
            handleBulk(ctx);
        } else {
            handleSingle(ctx);
        }
    }

    private void handleBulk(RoutingContext ctx) {
        JTry<List<EvaluationRequest>> maybeRequests = parseEvaluationRequests(ctx.body());
        if (!maybeRequests.isSuccess()) {
            HandlerSupport.respondBadRequest(ctx, maybeRequests.getException());
            return;
        }

        List<EvaluationRequest> requests = maybeRequests.getValue();
        logger.debug("Evaluating {} flag requests", requests.size());
        long startNanos = System.nanoTime();
        Future<List<EvaluationResponse>> maybeResponses =
                ctx.vertx().executeBlocking(() -> evaluator.evaluateAll(requests), false);

        maybeResponses.onSuccess(responses -> {
            metrics.recordLatency("bulk", startNanos);
            responses.forEach(metrics::recordResponse);
            List<EvaluateFlagsResponse.Result> results = responses.stream()
                    .map(EvaluateHandler::toResult)
                    .collect(Collectors.toList());
            EvaluateFlagsResponse body = EvaluateFlagsResponse.builder().results(results).build();
            HandlerSupport.respond(ctx, 200, JsonObject.mapFrom(body));
        });

        maybeResponses.onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }

    private void handleSingle(RoutingContext ctx) {
        EvaluationRequest request = new EvaluationRequest(
                ctx.pathParam("key"), firstOrNull(ctx.queryParam("userId")), parseGroups(ctx.queryParam("groups")));
        logger.debug("Evaluating {}", request);

        long startNanos = System.nanoTime();
        Future<Boolean> maybeEnabled = ctx.vertx().executeBlocking(() -> evaluator.isEnabled(request), false);
        maybeEnabled.onComplete(ar -> metrics.recordLatency("single", startNanos));
        maybeEnabled.onSuccess(enabled -> {
            metrics.recordDecision(enabled);
            HandlerSupport.respond(ctx, 200, new JsonObject().put("featureKey", request.featureKey).put("enabled", enabled));
        });
        maybeEnabled.onFailure(err -> {
            metrics.recordFailure();
            HandlerSupport.respondFailure(ctx, err);
        });
    }

    public static EvaluateFlagsResponse.Result toResult(EvaluationResponse response) {
        EvaluateFlagsResponse.Result.Builder builder = EvaluateFlagsResponse.Result.builder()
                .featureKey(response.request.featureKey)
                .userId(response.request.userId);
        if (response.enabled.isSuccess()) {
            return builder.status(Success).enabled(response.enabled.getValue()).build();
        } else {
            return builder.status(Failure).error(response.enabled.getException().getMessage()).build();
        }
    }

    public static JTry<List<EvaluationRequest>> parseEvaluationRequests(RequestBody body) {
        TypeReference<List<EvaluateRequest>> ref = new TypeReference<List<EvaluateRequest>>() { };
        try {
            List<EvaluateRequest> entries = objectMapper.readValue(body.asString(), ref);
            List<EvaluationRequest> requests = entries.stream()
                    .map(EvaluateRequest::toEvaluationRequest)
                    .collect(Collectors.toList());
            return JTry.success(requests);
        } catch (Exception e) {
            return JTry.failure(e);
        }
    }

    private static String firstOrNull(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    // groups may be repeated and/or comma separated: ?groups=a,b&groups=c
    static List<String> parseGroups(List<String> rawGroups) {
        List<String> groups = new ArrayList<>();
        if (rawGroups == null) {
            return groups;
        }
        for (String raw : rawGroups) {
            for (String group : raw.split(",")) {
                String trimmed = group.trim();
                if (!trimmed.isEmpty()) {
                    groups.add(trimmed);
                }
            }
        }
        return groups;
    }
}
