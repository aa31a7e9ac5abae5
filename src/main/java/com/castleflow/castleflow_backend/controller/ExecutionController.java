package com.castleflow.castleflow_backend.controller;

import com.castleflow.castleflow_backend.service.FlowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final FlowService flowService;

    @PostMapping("/abort")
    public Map<String, Object> abortAll() {
        return Map.of("aborted", flowService.abortAll());
    }

    @PostMapping("/{executionId}/abort")
    public ResponseEntity<Map<String, Object>> abort(@PathVariable String executionId) {
        if (!flowService.abort(executionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("executionId", executionId, "aborted", true));
    }
}
