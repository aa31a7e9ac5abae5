package com.castleflow.castleflow_backend.api;

import java.util.Map;

public record SpeechOptions(String voice, Double speed) {

    public static final SpeechOptions DEFAULTS = new SpeechOptions(null, null);

    public static SpeechOptions from(Map<String, ?> options) {
        if (options == null) {
            return DEFAULTS;
        }
        return new SpeechOptions(
                ChatOptions.blankToNull(options.get("voice")),
                options.get("speed") instanceof Number n ? n.doubleValue() : null);
    }
}
