package com.castleflow.castleflow_backend.executor.llm;

import com.castleflow.castleflow_backend.api.ChatOptions;

import java.util.List;
import java.util.Map;

public interface AiChatClient {

    /** False when no credentials are configured; callers must not call {@link #complete} then. */
    boolean isConfigured();

    ChatCompletion complete(String prompt, ChatOptions options);

    // Messages are sent as given: {role, content} where content may be a string or a parts array
    ChatCompletion completeMessages(List<Map<String, Object>> messages, ChatOptions options);
}
