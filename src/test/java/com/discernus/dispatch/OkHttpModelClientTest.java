package com.discernus.dispatch;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.discernus.health.FailureClass;
import com.discernus.health.ModelDescriptor;
import com.discernus.health.QuotaClass;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OkHttpModelClientTest {
    private MockWebServer server;
    private OkHttpModelClient client;
    private final ModelDescriptor model = new ModelDescriptor(
            "gpt-4o", "openai", "flagship", QuotaClass.DYNAMIC_SHARED, null, 2.5, 10.0, Duration.ofSeconds(5));

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ProviderEndpoint endpoint = new ProviderEndpoint(server.url("/v1/").toString(), "secret");
        client = new OkHttpModelClient(new OkHttpClient(), Map.of("openai", endpoint));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldPostChatCompletionAndReadUsage() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"choices":[{"message":{"role":"assistant","content":"hello"}}],
                 "usage":{"prompt_tokens":12,"completion_tokens":3}}
                """));

        ModelResponse response = client.complete(model, new ModelRequest("Say hello", 50, 0.0));

        assertEquals("hello", response.text());
        assertEquals(15, response.totalTokens());
        RecordedRequest recorded = server.takeRequest();
        assertEquals("/v1/chat/completions", recorded.getPath());
        assertEquals("Bearer secret", recorded.getHeader("Authorization"));
        String body = recorded.getBody().readUtf8();
        assertTrue(body.contains("\"model\":\"gpt-4o\""));
        assertTrue(body.contains("\"max_tokens\":50"));
    }

    @Test
    void shouldSeparateQuotaViolationFromCapacityOn429() {
        server.enqueue(new MockResponse().setResponseCode(429)
                .setBody("{\"error\":{\"type\":\"insufficient_quota\"}}"));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"slow down\"}"));

        ModelCallException quota = assertThrows(ModelCallException.class, () -> client.complete(model, ModelRequest.of("x")));
        ModelCallException capacity = assertThrows(ModelCallException.class, () -> client.complete(model, ModelRequest.of("x")));

        assertEquals(FailureClass.QUOTA_VIOLATION, quota.failureClass());
        assertEquals(429, quota.statusCode());
        assertEquals(FailureClass.CAPACITY_EXHAUSTED, capacity.failureClass());
    }

    @Test
    void shouldTreatUnreadableSuccessBodyAsServerError() {
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        ModelCallException error = assertThrows(ModelCallException.class, () -> client.complete(model, ModelRequest.of("x")));

        assertEquals(FailureClass.SERVER_ERROR, error.failureClass());
    }

    @Test
    void shouldRejectUnknownProviderWithoutCalling() {
        ModelDescriptor orphan = ModelDescriptor.dynamicShared("m", "nowhere", "flagship");

        ModelCallException error = assertThrows(ModelCallException.class, () -> client.complete(orphan, ModelRequest.of("x")));

        assertEquals(FailureClass.INVALID_REQUEST, error.failureClass());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void shouldClassifyStatusCodes() {
        assertEquals(FailureClass.CAPACITY_EXHAUSTED, OkHttpModelClient.classify(529, ""));
        assertEquals(FailureClass.CAPACITY_EXHAUSTED, OkHttpModelClient.classify(503, "model overloaded"));
        assertEquals(FailureClass.AUTHENTICATION, OkHttpModelClient.classify(401, ""));
        assertEquals(FailureClass.AUTHENTICATION, OkHttpModelClient.classify(403, ""));
        assertEquals(FailureClass.TIMEOUT, OkHttpModelClient.classify(408, ""));
        assertEquals(FailureClass.SERVER_ERROR, OkHttpModelClient.classify(500, "boom"));
        assertEquals(FailureClass.INVALID_REQUEST, OkHttpModelClient.classify(400, "bad field"));
    }
}
