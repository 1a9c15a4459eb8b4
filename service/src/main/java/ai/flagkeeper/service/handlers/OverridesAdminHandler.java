package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.Feature;
import ai.flagkeeper.online.FeatureNotFoundException;
import ai.flagkeeper.online.FlagStore;
import ai.flagkeeper.online.FlagValidations;
import ai.flagkeeper.online.JTry;
import ai.flagkeeper.online.TargetType;
import ai.flagkeeper.online.ValidationException;
import ai.flagkeeper.service.model.FlagJson;
import ai.flagkeeper.service.model.OverrideRequest;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.Collections;

/**
 * Admin endpoints for the overrides of feature /:key.
 * Create expects {targetType: User|Group, targetIdentifier, enabled}; an override for a target that
 * already has one is a 409, the existing override is left alone. Destroy is idempotent: removing an
 * override that is already gone is still a 204.
 */
public class OverridesAdminHandler implements Handler<RoutingContext> {

    public enum Action {
        Index,
        Create,
        Destroy
    }

    private final Action action;
    private final FlagStore flagStore;

    public OverridesAdminHandler(Action action, FlagStore flagStore) {
        this.action = action;
        this.flagStore = flagStore;
    }

    @Override
    public void handle(RoutingContext ctx) {
        switch (action) {
            case Index:
                index(ctx);
                break;
            case Create:
                create(ctx);
                break;
            case Destroy:
                destroy(ctx);
                break;
            default:
                throw new IllegalStateException("Unknown action " + action);
        }
    }

    private void index(RoutingContext ctx) {
        String key = ctx.pathParam("key");
        ctx.vertx().executeBlocking(() -> flagStore.listOverrides(requireFeature(key)), false)
                .onSuccess(overrides -> HandlerSupport.respond(ctx, 200,
                        new JsonObject().put("overrides", FlagJson.overridesToJson(overrides))))
                .onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }

    private void create(RoutingContext ctx) {
        String key = ctx.pathParam("key");
        JTry<OverrideRequest> maybeRequest = HandlerSupport.parseBody(ctx.body(), OverrideRequest.class);
        if (!maybeRequest.isSuccess()) {
            HandlerSupport.respondBadRequest(ctx, maybeRequest.getException());
            return;
        }
        OverrideRequest request = maybeRequest.getValue();

        JTry<TargetType> maybeTargetType = validate(request);
        if (!maybeTargetType.isSuccess()) {
            HandlerSupport.respondFailure(ctx, maybeTargetType.getException());
            return;
        }
        TargetType targetType = maybeTargetType.getValue();

        ctx.vertx().executeBlocking(() -> flagStore.createOverride(
                        requireFeature(key), targetType, request.targetIdentifier, request.enabled), false)
                .onSuccess(override -> HandlerSupport.respond(ctx, 201, FlagJson.toJson(override)))
                .onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }

    private void destroy(RoutingContext ctx) {
        String key = ctx.pathParam("key");
        long overrideId;
        try {
            overrideId = Long.parseLong(ctx.pathParam("id"));
        } catch (NumberFormatException e) {
            HandlerSupport.respondErrors(ctx, 400, Collections.singletonList("Invalid override id: " + ctx.pathParam("id")));
            return;
        }

        ctx.vertx().executeBlocking(() -> {
                    Feature feature = requireFeature(key);
                    flagStore.findOverrideById(feature, overrideId)
                            .ifPresent(override -> flagStore.deleteOverride(override.getId()));
                    return null;
                }, false)
                .onSuccess(v -> HandlerSupport.respondNoContent(ctx))
                .onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }

    /**
     * Checks the request before anything is written. The result holds the parsed target type.
     */
    static JTry<TargetType> validate(OverrideRequest request) {
        if (request.enabled == null) {
            return JTry.failure(new ValidationException("enabled must be true or false"));
        }
        return TargetType.parse(request.targetType)
                .flatMap(targetType -> FlagValidations.validateOverride(targetType, request.targetIdentifier)
                        .map(identifier -> targetType));
    }

    private Feature requireFeature(String key) {
        return flagStore.findFeature(key).orElseThrow(() -> new FeatureNotFoundException(key));
    }
}
