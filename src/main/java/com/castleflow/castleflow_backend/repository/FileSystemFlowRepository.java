package com.castleflow.castleflow_backend.repository;

import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Flows stored as {@code *.automate.json} files anywhere below {@code automate.flows-directory}.
 * The directory is read at startup and on {@link #reload()}; files that fail to parse are
 * skipped with a warning.
 */
@Slf4j
@Component
public class FileSystemFlowRepository implements FlowRepository {

    static final String FLOW_FILE_SUFFIX = ".automate.json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private volatile Map<String, AutomateFlow> flows = Map.of();

    public FileSystemFlowRepository(AutomateProperties properties, ObjectMapper objectMapper) {
        this.directory = Paths.get(properties.getFlowsDirectory());
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    public Optional<AutomateFlow> findById(String flowId) {
        return Optional.ofNullable(flows.get(flowId));
    }

    @Override
    public List<AutomateFlow> findAll() {
        return new ArrayList<>(flows.values());
    }

    @Override
    public synchronized int reload() {
        if (!Files.isDirectory(directory)) {
            log.warn("Flows directory {} does not exist, no flows loaded", directory.toAbsolutePath());
            flows = Map.of();
            return 0;
        }

        Map<String, AutomateFlow> loaded = new LinkedHashMap<>();
        try (Stream<Path> files = Files.walk(directory)) {
            files.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(FLOW_FILE_SUFFIX))
                    .sorted()
                    .forEach(path -> read(path).ifPresent(flow -> {
                        AutomateFlow previous = loaded.put(flow.getId(), flow);
                        if (previous != null) {
                            log.warn("Flow id '{}' declared twice, {} wins", flow.getId(), path);
                        }
                    }));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan flows directory " + directory, e);
        }
        flows = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} flow(s) from {}", loaded.size(), directory.toAbsolutePath());
        return loaded.size();
    }

    private Optional<AutomateFlow> read(Path path) {
        try {
            AutomateFlow flow = objectMapper.readValue(path.toFile(), AutomateFlow.class);
            if (flow.getId() == null || flow.getId().isBlank()) {
                log.warn("Skipping {}: flow has no id", path);
                return Optional.empty();
            }
            return Optional.of(flow);
        } catch (IOException e) {
            log.warn("Skipping unreadable flow file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
