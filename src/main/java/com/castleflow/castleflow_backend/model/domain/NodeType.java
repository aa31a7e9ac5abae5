package com.castleflow.castleflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeType {
    // Entry points
    START("start", FlowRuntime.UNIVERSAL),
    MANUAL_TRIGGER("manual_trigger", FlowRuntime.UNIVERSAL),
    WEBHOOK_TRIGGER("webhook_trigger", FlowRuntime.UNIVERSAL),
    SCHEDULE_TRIGGER("schedule_trigger", FlowRuntime.UNIVERSAL),

    // Actions
    JS_EXECUTE("js_execute", FlowRuntime.UNIVERSAL),
    SYSTEM_API("system_api", FlowRuntime.UNIVERSAL),
    LOG("log", FlowRuntime.UNIVERSAL),
    NOTIFICATION("notification", FlowRuntime.CLIENT),
    LLM_CALL("llm_call", FlowRuntime.UNIVERSAL),
    TTS("tts", FlowRuntime.CLIENT),
    STT("stt", FlowRuntime.CLIENT),
    CALL_FLOW("call_flow", FlowRuntime.UNIVERSAL),

    // Control flow
    IF_ELSE("if_else", FlowRuntime.UNIVERSAL),
    SWITCH("switch", FlowRuntime.UNIVERSAL),
    FOR_LOOP("for_loop", FlowRuntime.UNIVERSAL),
    WHILE_LOOP("while_loop", FlowRuntime.UNIVERSAL),
    FOREACH("foreach", FlowRuntime.UNIVERSAL),
    MERGE("merge", FlowRuntime.UNIVERSAL),
    RATE_LIMIT("rate_limit", FlowRuntime.UNIVERSAL),

    // Variables
    READ_VARIABLE("read_variable", FlowRuntime.UNIVERSAL),
    WRITE_VARIABLE("write_variable", FlowRuntime.UNIVERSAL),

    COMMENT("comment", FlowRuntime.UNIVERSAL),

    // Anything the editor knows about but this engine does not
    UNKNOWN("unknown", FlowRuntime.UNIVERSAL);

    private final String key;
    private final FlowRuntime runtime;

    NodeType(String key, FlowRuntime runtime) {
        this.key = key;
        this.runtime = runtime;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public FlowRuntime getRuntime() {
        return runtime;
    }

    @JsonCreator
    public static NodeType fromKey(String key) {
        if (key == null) {
            return UNKNOWN;
        }
        for (NodeType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
