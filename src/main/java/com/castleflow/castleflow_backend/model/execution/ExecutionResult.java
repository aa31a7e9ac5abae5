package com.castleflow.castleflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one flow run. Plain data only, so it can go over the wire as JSON
 * and come back unchanged. A failed result always carries a non-empty {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResult {

    private boolean success;
    private List<ExecutionLogEntry> executionLog;
    private List<LogEntry> logs;
    private List<NotificationEntry> notifications;
    private Map<String, Object> variables;
    private String error;

    // Nothing ran before this failure
    public static ExecutionResult rejected(String error, List<LogEntry> logs, List<NotificationEntry> notifications) {
        return ExecutionResult.builder()
                .success(false)
                .executionLog(new ArrayList<>())
                .logs(new ArrayList<>(logs))
                .notifications(new ArrayList<>(notifications))
                .variables(new LinkedHashMap<>())
                .error(error != null && !error.isBlank() ? error : "Unknown error")
                .build();
    }
}
