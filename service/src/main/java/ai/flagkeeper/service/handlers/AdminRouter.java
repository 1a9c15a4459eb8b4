package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.FlagStore;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;

// Configures the JSON routes used to manage features and their overrides.
// These go straight to the FlagStore; evaluation stays in FlagsRouter.
public class AdminRouter {

    public static Router createAdminRoutes(Vertx vertx, FlagStore flagStore) {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());

        router.get("/features").handler(new FeaturesAdminHandler(FeaturesAdminHandler.Action.Index, flagStore));
        router.post("/features").handler(new FeaturesAdminHandler(FeaturesAdminHandler.Action.Create, flagStore));
        router.put("/features/:key").handler(new FeaturesAdminHandler(FeaturesAdminHandler.Action.Update, flagStore));
        router.delete("/features/:key").handler(new FeaturesAdminHandler(FeaturesAdminHandler.Action.Destroy, flagStore));

        router.get("/features/:key/overrides").handler(new OverridesAdminHandler(OverridesAdminHandler.Action.Index, flagStore));
        router.post("/features/:key/overrides").handler(new OverridesAdminHandler(OverridesAdminHandler.Action.Create, flagStore));
        router.delete("/features/:key/overrides/:id").handler(new OverridesAdminHandler(OverridesAdminHandler.Action.Destroy, flagStore));

        return router;
    }
}
