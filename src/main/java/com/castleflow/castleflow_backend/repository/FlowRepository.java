package com.castleflow.castleflow_backend.repository;

import com.castleflow.castleflow_backend.model.domain.AutomateFlow;

import java.util.List;
import java.util.Optional;

public interface FlowRepository {

    Optional<AutomateFlow> findById(String flowId);

    List<AutomateFlow> findAll();

    default int reload() {
        return findAll().size();
    }
}
