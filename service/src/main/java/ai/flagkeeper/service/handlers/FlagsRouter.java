package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.FlagEvaluator;
import ai.flagkeeper.service.FlagMetrics;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;

import static ai.flagkeeper.service.handlers.EvaluateHandler.Mode.Bulk;
import static ai.flagkeeper.service.handlers.EvaluateHandler.Mode.Single;

// Configures the routes for our flag evaluation endpoints
// We support bulk evaluation via POST and single lookups via GET
public class FlagsRouter {

    public static Router createFlagsRoutes(Vertx vertx, FlagEvaluator evaluator, FlagMetrics metrics) {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());

        router.post("/evaluate").handler(new EvaluateHandler(Bulk, evaluator, metrics));
        router.get("/:key").handler(new EvaluateHandler(Single, evaluator, metrics));

        return router;
    }
}
