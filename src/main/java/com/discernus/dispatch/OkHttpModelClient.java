package com.discernus.dispatch;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.discernus.health.FailureClass;
import com.discernus.health.ModelDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Client for OpenAI-compatible {@code /chat/completions} endpoints, one per provider. */
public class OkHttpModelClient implements ModelClient {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, ProviderEndpoint> providers;

    public OkHttpModelClient(OkHttpClient httpClient, Map<String, ProviderEndpoint> providers) {
        this.httpClient = httpClient;
        this.providers = Map.copyOf(providers);
    }

    @Override
    public ModelResponse complete(ModelDescriptor model, ModelRequest request) {
        ProviderEndpoint endpoint = providers.get(model.provider());
        if (endpoint == null) {
            throw new ModelCallException(FailureClass.INVALID_REQUEST, "No endpoint configured for provider " + model.provider());
        }
        Request httpRequest = buildRequest(endpoint, model, request);
        OkHttpClient client = httpClient.newBuilder().callTimeout(model.timeout()).build();
        try (Response response = client.newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new ModelCallException(classify(response.code(), text), response.code(),
                        model.id() + " returned HTTP " + response.code() + ": " + abbreviate(text), null);
            }
            return parse(model, text);
        } catch (InterruptedIOException e) {
            throw new ModelCallException(FailureClass.TIMEOUT, -1, model.id() + " timed out: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ModelCallException(FailureClass.NETWORK, -1, model.id() + " unreachable: " + e.getMessage(), e);
        }
    }

    static FailureClass classify(int status, String body) {
        String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
        if (status == 429) {
            if (lower.contains("insufficient_quota") || lower.contains("quota")) {
                return FailureClass.QUOTA_VIOLATION;
            }
            return FailureClass.CAPACITY_EXHAUSTED;
        }
        if (status == 529 || lower.contains("overloaded")) {
            return FailureClass.CAPACITY_EXHAUSTED;
        }
        if (status == 401 || status == 403) {
            return FailureClass.AUTHENTICATION;
        }
        if (status == 408) {
            return FailureClass.TIMEOUT;
        }
        if (status >= 500) {
            return FailureClass.SERVER_ERROR;
        }
        return FailureClass.INVALID_REQUEST;
    }

    private Request buildRequest(ProviderEndpoint endpoint, ModelDescriptor model, ModelRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model.id());
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "user", "content", request.prompt()));
        payload.put("messages", messages);
        payload.put("temperature", request.temperature());
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new ModelCallException(FailureClass.INVALID_REQUEST, -1, "Could not encode request: " + e.getMessage(), e);
        }
        Request.Builder builder = new Request.Builder()
                .url(endpoint.baseUrl() + "/chat/completions")
                .post(RequestBody.create(json, JSON));
        if (endpoint.apiKey() != null && !endpoint.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + endpoint.apiKey());
        }
        return builder.build();
    }

    private ModelResponse parse(ModelDescriptor model, String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ModelCallException(FailureClass.SERVER_ERROR, 200, model.id() + " returned unreadable JSON", e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ModelCallException(FailureClass.SERVER_ERROR, 200, model.id() + " response had no message content", null);
        }
        JsonNode usage = root.path("usage");
        return new ModelResponse(content.asText(), usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0));
    }

    private static String abbreviate(String text) {
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }
}
