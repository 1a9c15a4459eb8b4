package ai.flagkeeper.service;

import ai.flagkeeper.online.FlagEvaluator;
import ai.flagkeeper.online.FlagStore;
import ai.flagkeeper.service.handlers.AdminRouter;
import ai.flagkeeper.service.handlers.FlagsRouter;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the flag webservice. We wire up the evaluation and admin routes and launch the HTTP
 * service here. A single verticle is enough as both route groups share one FlagStore.
 */
public class WebServiceVerticle extends AbstractVerticle {
    private static final Logger logger = LoggerFactory.getLogger(WebServiceVerticle.class);

    private HttpServer server;
    private FlagStore flagStore;

    @Override
    public void start(Promise<Void> startPromise) throws Exception {
        // building a JDBC store opens the pool, so it happens off the event loop
        ConfigStore.load(vertx)
                .compose(cfgStore -> vertx.executeBlocking(() -> FlagStoreProvider.buildFlagStore(cfgStore), false)
                        .onSuccess(store -> {
                            flagStore = store;
                            startHttpServer(cfgStore.getServerPort(), cfgStore.encodeConfig(), store, startPromise);
                        }))
                .onFailure(err -> {
                    logger.error("Failed to set up the flag service", err);
                    startPromise.fail(err);
                });
    }

    protected void startHttpServer(int port, String configJsonString, FlagStore store, Promise<Void> startPromise) {
        Router router = Router.router(vertx);

        // Flag evaluation
        FlagMetrics metrics = FlagMetrics.fromVertxBackend();
        router.route("/v1/flags/*").subRouter(FlagsRouter.createFlagsRoutes(vertx, new FlagEvaluator(store), metrics));

        // Feature and override administration
        router.route("/v1/admin/*").subRouter(AdminRouter.createAdminRoutes(vertx, store));

        // Health check route
        router.get("/ping").handler(ctx -> {
            ctx.json("Pong!");
        });

        // Add route to show current configuration
        router.get("/config").handler(ctx -> {
            ctx.response()
               .putHeader("content-type", "application/json")
               .end(configJsonString);
        });

        // Start HTTP server
        HttpServerOptions httpOptions =
                new HttpServerOptions()
                        .setTcpKeepAlive(true)
                        .setIdleTimeout(60);
        server = vertx.createHttpServer(httpOptions);
        server.requestHandler(router)
                .listen(port)
                .onSuccess(server -> {
                    logger.info("HTTP server started on port {}", server.actualPort());
                    startPromise.complete();
                })
                .onFailure(err -> {
                    logger.error("Failed to start HTTP server", err);
                    startPromise.fail(err);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping HTTP server...");
        if (server != null) {
            server.close()
                    .onSuccess(v -> {
                        logger.info("HTTP server stopped successfully");
                        closeFlagStore();
                        stopPromise.complete();
                    })
                    .onFailure(err -> {
                        logger.error("Failed to stop HTTP server", err);
                        closeFlagStore();
                        stopPromise.fail(err);
                    });
        } else {
            closeFlagStore();
            stopPromise.complete();
        }
    }

    private void closeFlagStore() {
        if (flagStore != null) {
            flagStore.close();
        }
    }
}
