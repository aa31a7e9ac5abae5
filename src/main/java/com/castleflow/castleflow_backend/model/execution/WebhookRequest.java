package com.castleflow.castleflow_backend.model.execution;

import java.util.Map;

public record WebhookRequest(Object payload,
                             String method,
                             Map<String, String> headers,
                             Map<String, String> query) {
}
