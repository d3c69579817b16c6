package io.github.drompincen.boardsync.runtime.workspace;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkspaceConfig(
        @JsonProperty("root_dir") String rootDir,
        @JsonProperty("db_path") String dbPath
) {}
