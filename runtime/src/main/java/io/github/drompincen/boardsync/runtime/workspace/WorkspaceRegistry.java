package io.github.drompincen.boardsync.runtime.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workspaces known to this machine: those the bd daemons list in
 * {@code ~/.beads/registry.json} plus any registered at runtime.
 */
@Component
public class WorkspaceRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceRegistry.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileEntry(
            @JsonProperty("workspace_path") String workspacePath,
            @JsonProperty("database_path") String databasePath,
            @JsonProperty("pid") long pid,
            @JsonProperty("version") String version
    ) {}

    private final ObjectMapper objectMapper;
    private final Path registryFile;
    private final Map<String, WorkspaceInfo> registered = new ConcurrentHashMap<>();

    public WorkspaceRegistry(ObjectMapper objectMapper,
                             @Value("${boardsync.workspace.registry-file:}") String registryFile) {
        this.objectMapper = objectMapper;
        this.registryFile = registryFile == null || registryFile.isBlank()
                ? Path.of(System.getProperty("user.home"), ".beads", "registry.json")
                : Path.of(registryFile);
    }

    public void register(String path, String database) {
        String normalized = Path.of(path).toAbsolutePath().normalize().toString();
        log.info("Registering workspace {} (db: {})", normalized, database);
        registered.put(normalized, new WorkspaceInfo(normalized, database, ProcessHandle.current().pid(), "dynamic"));
    }

    /**
     * File entries first, then runtime registrations; one entry per workspace path.
     */
    public List<WorkspaceInfo> available() {
        Map<String, WorkspaceInfo> byPath = new LinkedHashMap<>();
        for (FileEntry e : readRegistryFile()) {
            if (e.workspacePath() == null || e.workspacePath().isEmpty()) continue;
            byPath.putIfAbsent(e.workspacePath(),
                    new WorkspaceInfo(e.workspacePath(), e.databasePath(), e.pid(), e.version()));
        }
        registered.forEach(byPath::putIfAbsent);
        return new ArrayList<>(byPath.values());
    }

    private List<FileEntry> readRegistryFile() {
        if (!Files.isRegularFile(registryFile)) {
            return List.of();
        }
        try {
            List<FileEntry> entries = objectMapper.readValue(registryFile.toFile(), new TypeReference<List<FileEntry>>() {});
            return entries != null ? entries : List.of();
        } catch (IOException e) {
            log.warn("Unable to read workspace registry {}: {}", registryFile, e.getMessage());
            return List.of();
        }
    }
}
