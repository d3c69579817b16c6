package io.github.drompincen.boardsync.runtime.workspace;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The workspace every bd invocation currently runs against.
 */
@Component
public class WorkspaceContext {

    private final AtomicReference<WorkspaceConfig> current = new AtomicReference<>();
    private final String explicitDb;

    public WorkspaceContext(@Value("${boardsync.workspace.root:}") String root,
                            @Value("${boardsync.workspace.db:}") String explicitDb) {
        this.explicitDb = explicitDb;
        String initialRoot = root == null || root.isBlank() ? System.getProperty("user.dir") : root;
        current.set(configFor(Path.of(initialRoot)));
    }

    public WorkspaceConfig current() {
        return current.get();
    }

    /**
     * Switches to {@code root} and returns the previous workspace.
     */
    public WorkspaceConfig switchTo(Path root) {
        return current.getAndSet(configFor(root));
    }

    public WorkspaceConfig configFor(Path root) {
        Path resolvedRoot = root.toAbsolutePath().normalize();
        Path db = DbPathResolver.resolve(resolvedRoot, System.getenv(), explicitDb).path();
        return new WorkspaceConfig(resolvedRoot.toString(), db.toString());
    }
}
