package com.castleflow.castleflow_backend.api;

import com.castleflow.castleflow_backend.model.execution.LogEntry;
import com.castleflow.castleflow_backend.model.execution.LogLevel;
import com.castleflow.castleflow_backend.model.execution.NotificationEntry;
import com.castleflow.castleflow_backend.model.execution.NotificationSeverity;

import java.util.List;
import java.util.Map;

/**
 * The host capabilities a flow may use. One instance backs one top-level run and is
 * shared with every subflow it calls, so {@link #logs()} and {@link #notifications()}
 * accumulate across the whole call tree.
 */
public interface SystemApi {

    LogApi log();

    AiApi ai();

    SpeechApi speech();

    void notify(String message, NotificationSeverity severity);

    List<LogEntry> logs();

    List<NotificationEntry> notifications();

    interface LogApi {

        void write(LogLevel level, String message);

        default void info(String message) {
            write(LogLevel.INFO, message);
        }

        default void warn(String message) {
            write(LogLevel.WARN, message);
        }

        default void error(String message) {
            write(LogLevel.ERROR, message);
        }

        default void debug(String message) {
            write(LogLevel.DEBUG, message);
        }
    }

    interface AiApi {

        String chat(String prompt, ChatOptions options);

        String chatVision(String prompt, String image, ChatOptions options);

        // Returns {content, model, usage}
        Map<String, Object> chatMessages(List<Map<String, Object>> messages, ChatOptions options);

        boolean isConfigured();
    }

    interface SpeechApi {

        void say(String text, SpeechOptions options);

        void stop();

        boolean isTtsConfigured();

        boolean isSttConfigured();
    }
}
