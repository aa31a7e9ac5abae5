package com.castleflow.castleflow_backend.executor.llm;

public record ChatCompletion(boolean success,
                             String content,
                             String model,
                             int inputTokens,
                             int outputTokens,
                             String error) {

    public static ChatCompletion ok(String content, String model, int inputTokens, int outputTokens) {
        return new ChatCompletion(true, content, model, inputTokens, outputTokens, null);
    }

    public static ChatCompletion error(String error) {
        return new ChatCompletion(false, null, null, 0, 0, error);
    }
}
