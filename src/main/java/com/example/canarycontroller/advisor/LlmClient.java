package com.example.canarycontroller.advisor;

import com.example.canarycontroller.config.CanaryProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Minimal client for OpenAI-compatible chat completion endpoints.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    private static final String OPENAI_API_URL = "https://api.openai.com/v1/chat/completions";
    private static final MediaType JSON = MediaType.get("application/json");

    private final CanaryProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    /**
     * @return the assistant's reply, empty when the model returned no content
     * @throws IOException on transport failures and non-2xx responses
     */
    public Optional<String> complete(List<ChatMessage> messages) throws IOException {
        CanaryProperties.AdvisorConfig config = properties.getAdvisor();
        String requestBody = buildRequestBody(messages, config);
        log.debug("LLM request with {} messages to model {}", messages.size(), config.getModel());

        Request request = new Request.Builder()
                .url(apiUrl(config))
                .addHeader("Authorization", "Bearer " + config.getApiKey())
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(requestBody, JSON))
                .build();

        OkHttpClient client = httpClient.newBuilder()
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() != null ? response.body().string() : "";
                throw new IOException("LLM API error " + response.code() + ": " + errorBody);
            }
            String body = response.body() != null ? response.body().string() : "";
            return parseResponse(body);
        }
    }

    String apiUrl(CanaryProperties.AdvisorConfig config) {
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            String base = config.getBaseUrl().endsWith("/")
                    ? config.getBaseUrl().substring(0, config.getBaseUrl().length() - 1)
                    : config.getBaseUrl();
            return base + "/v1/chat/completions";
        }
        return OPENAI_API_URL;
    }

    String buildRequestBody(List<ChatMessage> messages, CanaryProperties.AdvisorConfig config) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("temperature", config.getTemperature());
        root.put("max_tokens", config.getMaxTokens());

        ArrayNode messagesArray = root.putArray("messages");
        for (ChatMessage msg : messages) {
            ObjectNode msgNode = messagesArray.addObject();
            msgNode.put("role", msg.getRole().name().toLowerCase());
            msgNode.put("content", msg.getContent());
        }
        return objectMapper.writeValueAsString(root);
    }

    Optional<String> parseResponse(String responseBody) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode choices = root.get("choices");
        if (choices == null || choices.isEmpty()) {
            return Optional.empty();
        }
        JsonNode message = choices.get(0).get("message");
        if (message == null || !message.has("content") || message.get("content").isNull()) {
            return Optional.empty();
        }
        String content = message.get("content").asText();
        return content.isBlank() ? Optional.empty() : Optional.of(content.trim());
    }
}
