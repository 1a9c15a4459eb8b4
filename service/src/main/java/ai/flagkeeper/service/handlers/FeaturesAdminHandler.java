package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.FeatureNotFoundException;
import ai.flagkeeper.online.FlagStore;
import ai.flagkeeper.online.JTry;
import ai.flagkeeper.service.model.FeatureRequest;
import ai.flagkeeper.service.model.FlagJson;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Admin endpoints for features.
 * Index lists all features ordered by key. Create expects {key, defaultEnabled, description} and
 * answers 201, or 409 when the key is taken and 422 when it is blank. Update changes defaultEnabled
 * and/or description of /:key. Destroy removes the feature together with its overrides.
 */
public class FeaturesAdminHandler implements Handler<RoutingContext> {

    public enum Action {
        Index,
        Create,
        Update,
        Destroy
    }

    private final Action action;
    private final FlagStore flagStore;

    public FeaturesAdminHandler(Action action, FlagStore flagStore) {
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
            case Update:
                update(ctx);
                break;
            case Destroy:
                destroy(ctx);
                break;
            default:
                throw new IllegalStateException("Unknown action " + action);
        }
    }

    private void index(RoutingContext ctx) {
        ctx.vertx().executeBlocking(() -> flagStore.listFeatures(), false)
                .onSuccess(features -> HandlerSupport.respond(ctx, 200,
                        new JsonObject().put("features", FlagJson.featuresToJson(features))))
                .onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }

    private void create(RoutingContext ctx) {
        JTry<FeatureRequest> maybeRequest = HandlerSupport.parseBody(ctx.body(), FeatureRequest.class);
        if (!maybeRequest.isSuccess()) {
            HandlerSupport.respondBadRequest(ctx, maybeRequest.getException());
            return;
        }
        FeatureRequest request = maybeRequest.getValue();
        boolean defaultEnabled = request.defaultEnabled != null && request.defaultEnabled;

        ctx.vertx().executeBlocking(() -> flagStore.createFeature(request.key, defaultEnabled, request.description), false)
                .onSuccess(feature -> HandlerSupport.respond(ctx, 201, FlagJson.toJson(feature)))
                .onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }

    private void update(RoutingContext ctx) {
        String key = ctx.pathParam("key");
        JTry<FeatureRequest> maybeRequest = HandlerSupport.parseBody(ctx.body(), FeatureRequest.class);
        if (!maybeRequest.isSuccess()) {
            HandlerSupport.respondBadRequest(ctx, maybeRequest.getException());
            return;
        }
        FeatureRequest request = maybeRequest.getValue();

        ctx.vertx().executeBlocking(() -> flagStore.updateFeature(key, request.defaultEnabled, request.description), false)
                .onSuccess(feature -> HandlerSupport.respond(ctx, 200, FlagJson.toJson(feature)))
                .onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }

    private void destroy(RoutingContext ctx) {
        String key = ctx.pathParam("key");
        ctx.vertx().executeBlocking(() -> flagStore.deleteFeature(key), false)
                .onSuccess(deleted -> {
                    if (deleted) {
                        HandlerSupport.respondNoContent(ctx);
                    } else {
                        HandlerSupport.respondFailure(ctx, new FeatureNotFoundException(key));
                    }
                })
                .onFailure(err -> HandlerSupport.respondFailure(ctx, err));
    }
}
