package com.castleflow.castleflow_backend.api;

/**
 * Text-to-speech output. No implementation ships with the backend; register a bean
 * to make {@code speech.say} available to flows.
 */
public interface SpeechClient {

    void say(String text, SpeechOptions options);

    default void stop() {
    }
}
