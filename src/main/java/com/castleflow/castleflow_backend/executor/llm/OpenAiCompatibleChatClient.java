package com.castleflow.castleflow_backend.executor.llm;

import com.castleflow.castleflow_backend.api.ChatOptions;
import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions against any OpenAI-compatible endpoint (OpenAI, Groq, OpenRouter,
 * a local llama.cpp server, ...). Configured through {@code automate.ai.*}.
 */
@Component
public class OpenAiCompatibleChatClient implements AiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleChatClient.class);

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper;
    private final AutomateProperties.Ai settings;

    public OpenAiCompatibleChatClient(AutomateProperties properties, ObjectMapper mapper) {
        this.settings = properties.getAi();
        this.mapper = mapper;
    }

    @Override
    public boolean isConfigured() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public ChatCompletion complete(String prompt, ChatOptions options) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (options.systemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", options.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", prompt));
        return completeMessages(messages, options);
    }

    @Override
    public ChatCompletion completeMessages(List<Map<String, Object>> messages, ChatOptions options) {
        String model = options.model() != null ? options.model() : settings.getModel();
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", messages);
            body.put("max_tokens", options.maxTokens() != null ? options.maxTokens() : settings.getMaxTokens());
            if (options.temperature() != null) {
                body.put("temperature", options.temperature());
            }
            String jsonBody = mapper.writeValueAsString(body);
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(settings.getEndpoint()))
                    .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + settings.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[ai] HTTP {} from {}", httpResp.statusCode(), settings.getEndpoint());
                return ChatCompletion.error("AI API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> resp = mapper.readValue(httpResp.body(), Map.class);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> choices = (List<Map<String, Object>>) resp.get("choices");
            if (choices == null || choices.isEmpty()) {
                return ChatCompletion.error("AI API returned no choices");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
            String text = message != null ? (String) message.get("content") : null;
            @SuppressWarnings("unchecked")
            Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
            int inputTokens = usage != null ? ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue() : 0;
            int outputTokens = usage != null ? ((Number) usage.getOrDefault("completion_tokens", 0)).intValue() : 0;
            String usedModel = (String) resp.getOrDefault("model", model);
            return ChatCompletion.ok(text != null ? text : "", usedModel, inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChatCompletion.error("AI call interrupted");
        } catch (Exception e) {
            log.error("[ai] Exception calling {}", settings.getEndpoint(), e);
            return ChatCompletion.error("AI client exception: " + e.getMessage());
        }
    }

    private String extractError(String body) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> parsed = mapper.readValue(body, Map.class);
            Object err = parsed.get("error");
            if (err instanceof Map<?, ?> errMap && errMap.get("message") != null) {
                return errMap.get("message").toString();
            }
        } catch (Exception e) {
            log.debug("[ai] Error body is not JSON: {}", e.getMessage());
        }
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
