package com.castleflow.castleflow_backend.api;

import com.castleflow.castleflow_backend.executor.llm.AiChatClient;
import com.castleflow.castleflow_backend.executor.llm.ChatCompletion;
import com.castleflow.castleflow_backend.model.execution.LogEntry;
import com.castleflow.castleflow_backend.model.execution.LogLevel;
import com.castleflow.castleflow_backend.model.execution.NotificationEntry;
import com.castleflow.castleflow_backend.model.execution.NotificationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SystemApi} for server-side runs. Log lines are collected for the result and
 * mirrored to the {@code automate.script} logger; notifications are only collected.
 */
public class BackendSystemApi implements SystemApi {

    private static final Logger SCRIPT_LOG = LoggerFactory.getLogger("automate.script");

    private final List<LogEntry> logs = new ArrayList<>();
    private final List<NotificationEntry> notifications = new ArrayList<>();
    private final AiChatClient aiClient;
    private final SpeechClient speechClient;
    private final Clock clock;

    private final LogApi logApi = this::append;
    private final AiApi aiApi = new AiApi() {
        @Override
        public String chat(String prompt, ChatOptions options) {
            requireConfigured();
            return unwrap(aiClient.complete(prompt, options != null ? options : ChatOptions.DEFAULTS)).content();
        }

        @Override
        public String chatVision(String prompt, String image, ChatOptions options) {
            requireConfigured();
            ChatOptions effective = options != null ? options : ChatOptions.DEFAULTS;
            List<Map<String, Object>> messages = new ArrayList<>();
            if (effective.systemPrompt() != null) {
                messages.add(Map.of("role", "system", "content", effective.systemPrompt()));
            }
            messages.add(Map.of("role", "user", "content", List.of(
                    Map.of("type", "text", "text", prompt != null ? prompt : ""),
                    Map.of("type", "image_url", "image_url", Map.of("url", imageUrl(image))))));
            return unwrap(aiClient.completeMessages(messages, effective)).content();
        }

        @Override
        public Map<String, Object> chatMessages(List<Map<String, Object>> messages, ChatOptions options) {
            requireConfigured();
            if (messages == null || messages.isEmpty()) {
                throw new IllegalArgumentException("chatMessages needs at least one message");
            }
            ChatCompletion completion = unwrap(aiClient.completeMessages(messages, options != null ? options : ChatOptions.DEFAULTS));
            Map<String, Object> usage = new LinkedHashMap<>();
            usage.put("promptTokens", completion.inputTokens());
            usage.put("completionTokens", completion.outputTokens());
            usage.put("totalTokens", completion.inputTokens() + completion.outputTokens());
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("content", completion.content());
            response.put("model", completion.model());
            response.put("usage", usage);
            return response;
        }

        private void requireConfigured() {
            if (!isConfigured()) {
                throw new IllegalStateException("AI is not configured");
            }
        }

        @Override
        public boolean isConfigured() {
            return aiClient != null && aiClient.isConfigured();
        }
    };
    private final SpeechApi speechApi = new SpeechApi() {
        @Override
        public void say(String text, SpeechOptions options) {
            if (speechClient == null) {
                throw new IllegalStateException("Text-to-speech is not configured");
            }
            speechClient.say(text, options != null ? options : SpeechOptions.DEFAULTS);
        }

        @Override
        public void stop() {
            if (speechClient != null) {
                speechClient.stop();
            }
        }

        @Override
        public boolean isTtsConfigured() {
            return speechClient != null;
        }

        // No speech recognition on the server
        @Override
        public boolean isSttConfigured() {
            return false;
        }
    };

    public BackendSystemApi(AiChatClient aiClient, SpeechClient speechClient, Clock clock) {
        this.aiClient = aiClient;
        this.speechClient = speechClient;
        this.clock = clock;
    }

    @Override
    public LogApi log() {
        return logApi;
    }

    @Override
    public AiApi ai() {
        return aiApi;
    }

    @Override
    public SpeechApi speech() {
        return speechApi;
    }

    @Override
    public void notify(String message, NotificationSeverity severity) {
        NotificationSeverity effective = severity != null ? severity : NotificationSeverity.INFO;
        notifications.add(new NotificationEntry(message, effective, clock.millis()));
        SCRIPT_LOG.info("[notification:{}] {}", effective.getKey(), message);
    }

    @Override
    public List<LogEntry> logs() {
        return logs;
    }

    @Override
    public List<NotificationEntry> notifications() {
        return notifications;
    }

    private static ChatCompletion unwrap(ChatCompletion completion) {
        if (!completion.success()) {
            throw new IllegalStateException(completion.error());
        }
        return completion;
    }

    // Bare base64 is taken as a JPEG; data: and http(s) URLs pass through
    static String imageUrl(String image) {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("chatVision needs an image");
        }
        if (image.startsWith("data:") || image.startsWith("http://") || image.startsWith("https://")) {
            return image;
        }
        return "data:image/jpeg;base64," + image;
    }

    private void append(LogLevel level, String message) {
        LogLevel effective = level != null ? level : LogLevel.INFO;
        logs.add(new LogEntry(effective, message, clock.millis()));
        switch (effective) {
            case WARN -> SCRIPT_LOG.warn(message);
            case ERROR -> SCRIPT_LOG.error(message);
            case DEBUG -> SCRIPT_LOG.debug(message);
            default -> SCRIPT_LOG.info(message);
        }
    }
}
