package com.castleflow.castleflow_backend.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class FlowNotFoundException extends ResponseStatusException {

    public FlowNotFoundException(String flowId) {
        super(HttpStatus.NOT_FOUND, "Flow not found: " + flowId);
    }
}
