package com.castleflow.castleflow_backend.config;

import com.castleflow.castleflow_backend.model.domain.FlowRuntime;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "automate")
public class AutomateProperties {

    // Scanned recursively for *.automate.json
    private String flowsDirectory = "./flows";

    private Engine engine = new Engine();
    private Sandbox sandbox = new Sandbox();
    private Ai ai = new Ai();

    @Data
    public static class Engine {
        private FlowRuntime runtime = FlowRuntime.BACKEND;
        private int maxNodeExecutions = 10_000;
        private int maxCallDepth = 10;
        // Nested loop bodies and subflow calls still use the Java stack
        private long workerStackSize = 64L * 1024 * 1024;
        private int workerThreads = 4;
    }

    @Data
    public static class Sandbox {
        private long timeoutMs = 120_000;
    }

    @Data
    public static class Ai {
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private int maxTokens = 1024;
        private int timeoutSeconds = 60;
    }
}
