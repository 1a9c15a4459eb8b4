package ai.flagkeeper.service.handlers;

import ai.flagkeeper.online.EvaluationRequest;
import ai.flagkeeper.online.JTry;
import io.vertx.ext.web.RequestBody;
import org.junit.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class EvaluateHandlerJsonSerDeTest {

    @Test
    public void testParsingOfSimpleRequests() {
        String mockRequest = "[{\"featureKey\":\"dark_mode\",\"userId\":\"123\",\"groups\":[\"beta_testers\",\"admins\"]}]";
        RequestBody mockRequestBody = mock(RequestBody.class);
        when(mockRequestBody.asString()).thenReturn(mockRequest);

        JTry<List<EvaluationRequest>> maybeRequest = EvaluateHandler.parseEvaluationRequests(mockRequestBody);
        assertTrue(maybeRequest.isSuccess());
        List<EvaluationRequest> reqs = maybeRequest.getValue();
        assertEquals(1, reqs.size());
        EvaluationRequest req = reqs.get(0);
        assertEquals("dark_mode", req.featureKey);
        assertEquals("123", req.userId);
        assertEquals(new LinkedHashSet<>(Arrays.asList("beta_testers", "admins")), req.groups);
    }

    @Test
    public void testSnakeCaseAndNumericUserId() {
        String mockRequest = "[{\"feature_key\":\"dark_mode\",\"user_id\":123}]";
        RequestBody mockRequestBody = mock(RequestBody.class);
        when(mockRequestBody.asString()).thenReturn(mockRequest);

        JTry<List<EvaluationRequest>> maybeRequest = EvaluateHandler.parseEvaluationRequests(mockRequestBody);
        assertTrue(maybeRequest.isSuccess());
        EvaluationRequest req = maybeRequest.getValue().get(0);
        assertEquals("dark_mode", req.featureKey);
        assertEquals("123", req.userId);
        assertTrue(req.groups.isEmpty());
    }

    @Test
    public void testParsingInvalidRequest() {
        // mess up the colon after the featureKey field
        String mockRequest = "[{\"featureKey\"\"dark_mode\"}]";
        RequestBody mockRequestBody = mock(RequestBody.class);
        when(mockRequestBody.asString()).thenReturn(mockRequest);

        JTry<List<EvaluationRequest>> maybeRequest = EvaluateHandler.parseEvaluationRequests(mockRequestBody);
        assertFalse(maybeRequest.isSuccess());
        assertNotNull(maybeRequest.getException());
    }

    @Test
    public void testParsingNonListBody() {
        RequestBody mockRequestBody = mock(RequestBody.class);
        when(mockRequestBody.asString()).thenReturn("{\"featureKey\":\"dark_mode\"}");

        assertFalse(EvaluateHandler.parseEvaluationRequests(mockRequestBody).isSuccess());
    }

    @Test
    public void testParsingMissingBody() {
        RequestBody mockRequestBody = mock(RequestBody.class);
        when(mockRequestBody.asString()).thenReturn(null);

        assertFalse(EvaluateHandler.parseEvaluationRequests(mockRequestBody).isSuccess());
    }
}
