package com.castleflow.castleflow_backend.api;

import com.castleflow.castleflow_backend.executor.llm.AiChatClient;
import com.castleflow.castleflow_backend.executor.llm.ChatCompletion;
import com.castleflow.castleflow_backend.model.execution.LogEntry;
import com.castleflow.castleflow_backend.model.execution.LogLevel;
import com.castleflow.castleflow_backend.model.execution.NotificationEntry;
import com.castleflow.castleflow_backend.model.execution.NotificationSeverity;
import com.castleflow.castleflow_backend.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackendSystemApiTest {

    private final MutableClock clock = new MutableClock(Instant.ofEpochMilli(1_000));

    @Test
    void collectsLogLinesWithLevelAndTimestamp() {
        BackendSystemApi api = new BackendSystemApi(null, null, clock);

        api.log().info("one");
        api.log().write(null, "defaulted");
        api.log().debug("three");

        assertThat(api.logs()).extracting(LogEntry::level).containsExactly(LogLevel.INFO, LogLevel.INFO, LogLevel.DEBUG);
        assertThat(api.logs()).allSatisfy(e -> assertThat(e.timestamp()).isEqualTo(1_000L));
    }

    @Test
    void notificationsDefaultToInfo() {
        BackendSystemApi api = new BackendSystemApi(null, null, clock);

        api.notify("Saved", null);
        api.notify("Oops", NotificationSeverity.ERROR);

        assertThat(api.notifications()).extracting(NotificationEntry::severity)
                .containsExactly(NotificationSeverity.INFO, NotificationSeverity.ERROR);
    }

    @Test
    void aiDelegatesToConfiguredClient() {
        AiChatClient client = mock(AiChatClient.class);
        when(client.isConfigured()).thenReturn(true);
        when(client.complete("hi", ChatOptions.DEFAULTS)).thenReturn(ChatCompletion.ok("hello", "m", 1, 1));
        BackendSystemApi api = new BackendSystemApi(client, null, clock);

        assertThat(api.ai().isConfigured()).isTrue();
        assertThat(api.ai().chat("hi", null)).isEqualTo("hello");
    }

    @Test
    void aiWithoutCredentialsIsNotConfigured() {
        AiChatClient client = mock(AiChatClient.class);
        when(client.isConfigured()).thenReturn(false);
        BackendSystemApi api = new BackendSystemApi(client, null, clock);

        assertThat(api.ai().isConfigured()).isFalse();
        assertThatThrownBy(() -> api.ai().chat("hi", ChatOptions.DEFAULTS))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("AI is not configured");
    }

    @Test
    void speechNeedsAClient() {
        SpeechClient speech = mock(SpeechClient.class);

        new BackendSystemApi(null, speech, clock).speech().say("hey", null);

        verify(speech).say("hey", SpeechOptions.DEFAULTS);
        assertThat(new BackendSystemApi(null, null, clock).speech().isTtsConfigured()).isFalse();
        assertThatThrownBy(() -> new BackendSystemApi(null, null, clock).speech().say("hey", null))
                .hasMessage("Text-to-speech is not configured");
    }

    @Test
    @SuppressWarnings("unchecked")
    void chatVisionSendsTextAndImageParts() {
        AiChatClient client = mock(AiChatClient.class);
        when(client.isConfigured()).thenReturn(true);
        when(client.completeMessages(any(), any())).thenReturn(ChatCompletion.ok("A receipt", "m", 10, 2));
        BackendSystemApi api = new BackendSystemApi(client, null, clock);

        String answer = api.ai().chatVision("What is this?", "aGVsbG8=", new ChatOptions("Be brief", null, null, null));

        assertThat(answer).isEqualTo("A receipt");
        ArgumentCaptor<List<Map<String, Object>>> sent = ArgumentCaptor.forClass(List.class);
        verify(client).completeMessages(sent.capture(), any());
        assertThat(sent.getValue()).hasSize(2);
        assertThat(sent.getValue().get(0)).containsEntry("role", "system").containsEntry("content", "Be brief");
        assertThat(sent.getValue().get(1).get("content")).isEqualTo(List.of(
                Map.of("type", "text", "text", "What is this?"),
                Map.of("type", "image_url", "image_url", Map.of("url", "data:image/jpeg;base64,aGVsbG8="))));
    }

    @Test
    void imageUrlsPassThroughUnchanged() {
        assertThat(BackendSystemApi.imageUrl("data:image/png;base64,AAA")).isEqualTo("data:image/png;base64,AAA");
        assertThat(BackendSystemApi.imageUrl("https://example.org/a.jpg")).isEqualTo("https://example.org/a.jpg");
        assertThatThrownBy(() -> BackendSystemApi.imageUrl(" ")).hasMessage("chatVision needs an image");
    }

    @Test
    void chatMessagesReturnsContentModelAndUsage() {
        AiChatClient client = mock(AiChatClient.class);
        when(client.isConfigured()).thenReturn(true);
        List<Map<String, Object>> messages = List.of(Map.of("role", "user", "content", "hi"));
        when(client.completeMessages(messages, ChatOptions.DEFAULTS)).thenReturn(ChatCompletion.ok("hello", "gpt", 7, 3));

        Map<String, Object> response = new BackendSystemApi(client, null, clock).ai().chatMessages(messages, null);

        assertThat(response)
                .containsEntry("content", "hello")
                .containsEntry("model", "gpt")
                .containsEntry("usage", Map.of("promptTokens", 7, "completionTokens", 3, "totalTokens", 10));
        assertThatThrownBy(() -> new BackendSystemApi(client, null, clock).ai().chatMessages(List.of(), null))
                .hasMessage("chatMessages needs at least one message");
    }

    @Test
    void speechStopAndRecognitionFlags() {
        SpeechClient speech = mock(SpeechClient.class);
        BackendSystemApi api = new BackendSystemApi(null, speech, clock);

        api.speech().stop();
        new BackendSystemApi(null, null, clock).speech().stop();

        verify(speech).stop();
        assertThat(api.speech().isTtsConfigured()).isTrue();
        assertThat(api.speech().isSttConfigured()).isFalse();
    }

    @Test
    void providerErrorIsRaised() {
        AiChatClient client = mock(AiChatClient.class);
        when(client.isConfigured()).thenReturn(true);
        when(client.complete(any(), any())).thenReturn(ChatCompletion.error("AI API error 401: bad key"));

        assertThatThrownBy(() -> new BackendSystemApi(client, null, clock).ai().chat("hi", null))
                .hasMessage("AI API error 401: bad key");
    }
}
