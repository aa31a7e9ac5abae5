package com.castleflow.castleflow_backend.api;

import java.util.Map;

// Null fields fall back to the configured defaults
public record ChatOptions(String systemPrompt, String model, Double temperature, Integer maxTokens) {

    public static final ChatOptions DEFAULTS = new ChatOptions(null, null, null, null);

    public static ChatOptions from(Map<String, ?> options) {
        if (options == null) {
            return DEFAULTS;
        }
        return new ChatOptions(
                blankToNull(options.get("systemPrompt")),
                blankToNull(options.get("model")),
                options.get("temperature") instanceof Number n ? n.doubleValue() : null,
                options.get("maxTokens") instanceof Number n ? n.intValue() : null);
    }

    static String blankToNull(Object value) {
        if (value == null) return null;
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
