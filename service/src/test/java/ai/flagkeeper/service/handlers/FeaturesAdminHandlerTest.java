package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.Feature;
import ai.flagkeeper.online.InMemoryFlagStore;
import ai.flagkeeper.online.TargetType;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.unit.Async;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import io.vertx.ext.web.RequestBody;
import io.vertx.ext.web.RoutingContext;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(VertxUnitRunner.class)
public class FeaturesAdminHandlerTest {

    @Mock
    private RoutingContext routingContext;

    @Mock
    private HttpServerResponse response;

    @Mock
    RequestBody requestBody;

    private InMemoryFlagStore store;
    private Vertx vertx;

    @Before
    public void setUp(TestContext context) {
        MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();
        store = new InMemoryFlagStore();

        when(routingContext.vertx()).thenReturn(vertx);
        when(routingContext.response()).thenReturn(response);
        when(response.putHeader(anyString(), anyString())).thenReturn(response);
        when(response.setStatusCode(anyInt())).thenReturn(response);
        when(routingContext.body()).thenReturn(requestBody);
    }

    @After
    public void tearDown(TestContext context) {
        vertx.close(context.asyncAssertSuccess());
    }

    @Test
    public void testCreateFeature(TestContext context) {
        Async async = context.async();
        when(requestBody.asString()).thenReturn("{\"key\":\"dark_mode\",\"defaultEnabled\":true,\"description\":\"Dark theme\"}");

        ArgumentCaptor<String> responseCaptor = ArgumentCaptor.forClass(String.class);
        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(201);
                verify(response).end(responseCaptor.capture());
                JsonObject body = new JsonObject(responseCaptor.getValue());
                context.assertEquals("dark_mode", body.getString("key"));
                context.assertTrue(body.getBoolean("defaultEnabled"));
                context.assertEquals("Dark theme", body.getString("description"));
                context.assertTrue(store.findFeature("dark_mode").get().isDefaultEnabled());
            });
            async.complete();
        });
    }

    @Test
    public void testCreateFeatureDefaultsToDisabled(TestContext context) {
        Async async = context.async();
        when(requestBody.asString()).thenReturn("{\"key\":\"dark_mode\"}");

        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(201);
                context.assertFalse(store.findFeature("dark_mode").get().isDefaultEnabled());
            });
            async.complete();
        });
    }

    @Test
    public void testDuplicateKeyIsConflict(TestContext context) {
        Async async = context.async();
        store.createFeature("dark_mode", false, null);
        when(requestBody.asString()).thenReturn("{\"key\":\"dark_mode\",\"defaultEnabled\":true}");

        ArgumentCaptor<String> responseCaptor = ArgumentCaptor.forClass(String.class);
        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(409);
                verify(response).end(responseCaptor.capture());
                JsonArray errors = new JsonObject(responseCaptor.getValue()).getJsonArray("errors");
                context.assertTrue(errors.getString(0).contains("dark_mode"));
                context.assertFalse(store.findFeature("dark_mode").get().isDefaultEnabled());
            });
            async.complete();
        });
    }

    @Test
    public void testBlankKeyIsUnprocessable(TestContext context) {
        Async async = context.async();
        when(requestBody.asString()).thenReturn("{\"key\":\"\"}");

        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(422);
                context.assertTrue(store.listFeatures().isEmpty());
            });
            async.complete();
        });
    }

    @Test
    public void testMalformedBodyIsBadRequest(TestContext context) {
        Async async = context.async();
        when(requestBody.asString()).thenReturn("{\"key\" \"dark_mode\"}");

        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> verify(response).setStatusCode(400));
            async.complete();
        });
    }

    @Test
    public void testUpdateKeepsOmittedFields(TestContext context) {
        Async async = context.async();
        store.createFeature("dark_mode", false, "Dark theme");
        when(routingContext.pathParam("key")).thenReturn("dark_mode");
        when(requestBody.asString()).thenReturn("{\"defaultEnabled\":true}");

        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Update, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(200);
                Feature updated = store.findFeature("dark_mode").get();
                context.assertTrue(updated.isDefaultEnabled());
                context.assertEquals("Dark theme", updated.getDescription());
            });
            async.complete();
        });
    }

    @Test
    public void testUpdateUnknownFeatureIsNotFound(TestContext context) {
        Async async = context.async();
        when(routingContext.pathParam("key")).thenReturn("dark_mode");
        when(requestBody.asString()).thenReturn("{\"defaultEnabled\":true}");

        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Update, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> verify(response).setStatusCode(404));
            async.complete();
        });
    }

    @Test
    public void testIndexIsOrderedByKey(TestContext context) {
        Async async = context.async();
        store.createFeature("new_checkout", true, null);
        store.createFeature("dark_mode", false, null);

        ArgumentCaptor<String> responseCaptor = ArgumentCaptor.forClass(String.class);
        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Index, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(200);
                verify(response).end(responseCaptor.capture());
                JsonArray features = new JsonObject(responseCaptor.getValue()).getJsonArray("features");
                context.assertEquals(2, features.size());
                context.assertEquals("dark_mode", features.getJsonObject(0).getString("key"));
                context.assertEquals("new_checkout", features.getJsonObject(1).getString("key"));
            });
            async.complete();
        });
    }

    @Test
    public void testDestroyCascadesToOverrides(TestContext context) {
        Async async = context.async();
        Feature feature = store.createFeature("dark_mode", false, null);
        store.createOverride(feature, TargetType.User, "123", true);
        when(routingContext.pathParam("key")).thenReturn("dark_mode");

        new FeaturesAdminHandler(FeaturesAdminHandler.Action.Destroy, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(204);
                verify(response).end();
                context.assertFalse(store.findFeature("dark_mode").isPresent());
                context.assertTrue(store.listOverrides(feature).isEmpty());
            });
            async.complete();
        });
    }
}
