package io.github.drompincen.boardsync.runtime.workspace;

public record WorkspaceInfo(
        String path,
        String database,
        long pid,
        String version
) {}
