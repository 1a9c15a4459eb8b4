package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.Feature;
import ai.flagkeeper.online.FeatureOverride;
import ai.flagkeeper.online.InMemoryFlagStore;
import ai.flagkeeper.online.TargetType;
import ai.flagkeeper.online.ValidationException;
import ai.flagkeeper.service.model.OverrideRequest;
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
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(VertxUnitRunner.class)
public class OverridesAdminHandlerTest {

    @Mock
    private RoutingContext routingContext;

    @Mock
    private HttpServerResponse response;

    @Mock
    RequestBody requestBody;

    private InMemoryFlagStore store;
    private Feature feature;
    private Vertx vertx;

    @Before
    public void setUp(TestContext context) {
        MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();
        store = new InMemoryFlagStore();
        feature = store.createFeature("dark_mode", false, null);

        when(routingContext.vertx()).thenReturn(vertx);
        when(routingContext.response()).thenReturn(response);
        when(response.putHeader(anyString(), anyString())).thenReturn(response);
        when(response.setStatusCode(anyInt())).thenReturn(response);
        when(routingContext.body()).thenReturn(requestBody);
        when(routingContext.pathParam("key")).thenReturn("dark_mode");
    }

    @After
    public void tearDown(TestContext context) {
        vertx.close(context.asyncAssertSuccess());
    }

    @Test
    public void testCreateOverride(TestContext context) {
        Async async = context.async();
        when(requestBody.asString()).thenReturn("{\"targetType\":\"Group\",\"targetIdentifier\":\"beta_testers\",\"enabled\":true}");

        ArgumentCaptor<String> responseCaptor = ArgumentCaptor.forClass(String.class);
        new OverridesAdminHandler(OverridesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(201);
                verify(response).end(responseCaptor.capture());
                JsonObject body = new JsonObject(responseCaptor.getValue());
                context.assertEquals("Group", body.getString("targetType"));
                context.assertEquals("beta_testers", body.getString("targetIdentifier"));
                context.assertTrue(body.getBoolean("enabled"));
                context.assertTrue(store.findOverride(feature, TargetType.Group, "beta_testers").isPresent());
            });
            async.complete();
        });
    }

    @Test
    public void testDuplicateOverrideIsConflict(TestContext context) {
        Async async = context.async();
        FeatureOverride original = store.createOverride(feature, TargetType.User, "123", true);
        when(requestBody.asString()).thenReturn("{\"target_type\":\"User\",\"target_identifier\":\"123\",\"enabled\":false}");

        new OverridesAdminHandler(OverridesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(409);
                context.assertEquals(original, store.findOverride(feature, TargetType.User, "123").get());
            });
            async.complete();
        });
    }

    @Test
    public void testUnknownTargetTypeIsUnprocessable(TestContext context) {
        Async async = context.async();
        when(requestBody.asString()).thenReturn("{\"targetType\":\"Region\",\"targetIdentifier\":\"eu\",\"enabled\":true}");

        ArgumentCaptor<String> responseCaptor = ArgumentCaptor.forClass(String.class);
        new OverridesAdminHandler(OverridesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(422);
                verify(response).end(responseCaptor.capture());
                JsonArray errors = new JsonObject(responseCaptor.getValue()).getJsonArray("errors");
                context.assertTrue(errors.getString(0).contains("target_type"));
                context.assertTrue(store.listOverrides(feature).isEmpty());
            });
            async.complete();
        });
    }

    @Test
    public void testOverrideForUnknownFeatureIsNotFound(TestContext context) {
        Async async = context.async();
        when(routingContext.pathParam("key")).thenReturn("light_mode");
        when(requestBody.asString()).thenReturn("{\"targetType\":\"User\",\"targetIdentifier\":\"123\",\"enabled\":true}");

        new OverridesAdminHandler(OverridesAdminHandler.Action.Create, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> verify(response).setStatusCode(404));
            async.complete();
        });
    }

    @Test
    public void testIndexListsOverrides(TestContext context) {
        Async async = context.async();
        store.createOverride(feature, TargetType.User, "123", true);
        store.createOverride(feature, TargetType.Group, "admins", false);

        ArgumentCaptor<String> responseCaptor = ArgumentCaptor.forClass(String.class);
        new OverridesAdminHandler(OverridesAdminHandler.Action.Index, store).handle(routingContext);

        vertx.setTimer(1000, id -> {
            context.verify(v -> {
                verify(response).setStatusCode(200);
                verify(response).end(responseCaptor.capture());
                JsonArray overrides = new JsonObject(responseCaptor.getValue()).getJsonArray("overrides");
                context.assertEquals(2, overrides.size());
                context.assertEquals("User", overrides.getJsonObject(0).getString("targetType"));
                context.assertEquals("Group", overrides.getJsonObject(1).getString("targetType"));
            });
            async.complete();
        });
    }

    @Test
    public void testDestroyIsIdempotent(TestContext context) {
        Async async = context.async();
        FeatureOverride override = store.createOverride(feature, TargetType.User, "123", true);
        when(routingContext.pathParam("id")).thenReturn(String.valueOf(override.getId()));

        OverridesAdminHandler handler = new OverridesAdminHandler(OverridesAdminHandler.Action.Destroy, store);
        handler.handle(routingContext);

        vertx.setTimer(500, first -> {
            handler.handle(routingContext);
            vertx.setTimer(500, second -> {
                context.verify(v -> {
                    verify(response, times(2)).setStatusCode(204);
                    context.assertTrue(store.listOverrides(feature).isEmpty());
                });
                async.complete();
            });
        });
    }

    @Test
    public void testValidateRequest(TestContext context) {
        OverrideRequest request = new OverrideRequest();
        request.targetType = "User";
        request.targetIdentifier = "123";
        context.assertTrue(OverridesAdminHandler.validate(request).getException() instanceof ValidationException);

        request.enabled = false;
        context.assertEquals(TargetType.User, OverridesAdminHandler.validate(request).getValue());

        request.targetIdentifier = " ";
        context.assertFalse(OverridesAdminHandler.validate(request).isSuccess());
    }
}
