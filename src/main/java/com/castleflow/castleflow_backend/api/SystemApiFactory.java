package com.castleflow.castleflow_backend.api;

import com.castleflow.castleflow_backend.executor.llm.AiChatClient;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class SystemApiFactory {

    private final AiChatClient aiClient;
    private final ObjectProvider<SpeechClient> speechClient;
    private final Clock clock;

    public SystemApi create() {
        return new BackendSystemApi(aiClient, speechClient.getIfAvailable(), clock);
    }
}
