package com.castleflow.castleflow_backend.controller;

import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.model.execution.WebhookRequest;
import com.castleflow.castleflow_backend.service.FlowService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Public entry for {@code webhook_trigger} nodes: {@code <any method> /api/webhooks/{flowId}/{nodeId}}.
 * The body, method, headers and query string reach the flow as the trigger node's result.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final FlowService flowService;

    @RequestMapping(value = "/{flowId}/{nodeId}",
            method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE})
    public ExecutionResult trigger(@PathVariable String flowId,
                                   @PathVariable String nodeId,
                                   @RequestBody(required = false) Object payload,
                                   @RequestHeader Map<String, String> headers,
                                   @RequestParam Map<String, String> query,
                                   HttpServletRequest request) {
        log.info("Webhook {} {}/{}", request.getMethod(), flowId, nodeId);
        WebhookRequest webhook = new WebhookRequest(payload, request.getMethod(), headers, query);
        return flowService.executeWebhook(flowId, nodeId, webhook, FlowService.newExecutionId());
    }
}
