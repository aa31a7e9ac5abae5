package com.castleflow.castleflow_backend.model.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionResultJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesLowercaseEnumsAndOmitsNulls() throws Exception {
        ExecutionLogEntry entry = ExecutionLogEntry.builder()
                .nodeId("n1").nodeName("Greet").nodeType("js_execute")
                .status(NodeStatus.RUNNING).startTime(100L).build();
        entry.complete("Hello", 150L);
        ExecutionResult result = ExecutionResult.builder()
                .success(true)
                .executionLog(List.of(entry))
                .logs(List.of(new LogEntry(LogLevel.WARN, "careful", 120L)))
                .notifications(List.of(new NotificationEntry("Done", NotificationSeverity.SUCCESS, 140L)))
                .variables(Map.of("greeting", "Hello"))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.has("error")).isFalse();
        assertThat(json.at("/executionLog/0/status").asText()).isEqualTo("completed");
        assertThat(json.at("/executionLog/0/endTime").asLong()).isEqualTo(150L);
        assertThat(json.at("/executionLog/0").has("error")).isFalse();
        assertThat(json.at("/logs/0/level").asText()).isEqualTo("warn");
        assertThat(json.at("/notifications/0/severity").asText()).isEqualTo("success");
    }

    @Test
    void survivesARoundTrip() throws Exception {
        ExecutionLogEntry failed = ExecutionLogEntry.builder()
                .nodeId("bad").nodeName("Bad").nodeType("js_execute")
                .status(NodeStatus.RUNNING).startTime(1L).build();
        failed.fail("boom", 2L);
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("list", new ArrayList<>(List.of(1, "two")));
        ExecutionResult original = ExecutionResult.builder()
                .success(false)
                .executionLog(new ArrayList<>(List.of(failed)))
                .logs(new ArrayList<>(List.of(new LogEntry(LogLevel.ERROR, "boom", 2L))))
                .notifications(new ArrayList<>())
                .variables(variables)
                .error("boom")
                .build();

        ExecutionResult copy = mapper.readValue(mapper.writeValueAsString(original), ExecutionResult.class);

        assertThat(copy).isEqualTo(original);
    }

    @Test
    void rejectedResultAlwaysHasAnError() {
        ExecutionResult result = ExecutionResult.rejected("  ", List.of(), List.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Unknown error");
        assertThat(result.getExecutionLog()).isEmpty();
        assertThat(result.getVariables()).isEmpty();
    }
}
