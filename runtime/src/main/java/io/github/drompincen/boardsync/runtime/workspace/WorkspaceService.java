package io.github.drompincen.boardsync.runtime.workspace;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.boardsync.protocol.ws.MessageType;
import io.github.drompincen.boardsync.runtime.ProtocolException;
import io.github.drompincen.boardsync.runtime.refresh.RefreshScheduler;
import io.github.drompincen.boardsync.runtime.subscription.PushEmitter;
import io.github.drompincen.boardsync.runtime.subscription.SubscriptionPublisher;
import io.github.drompincen.boardsync.runtime.watch.DbWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private final WorkspaceContext context;
    private final WorkspaceRegistry registry;
    private final DbWatcher watcher;
    private final SubscriptionPublisher publisher;
    private final PushEmitter emitter;
    private final RefreshScheduler scheduler;

    public WorkspaceService(WorkspaceContext context, WorkspaceRegistry registry, DbWatcher watcher,
                            SubscriptionPublisher publisher, PushEmitter emitter, RefreshScheduler scheduler) {
        this.context = context;
        this.registry = registry;
        this.watcher = watcher;
        this.publisher = publisher;
        this.emitter = emitter;
        this.scheduler = scheduler;
    }

    public WorkspaceConfig current() {
        return context.current();
    }

    public Map<String, Object> listWorkspaces() {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("workspaces", registry.available());
        reply.put("current", context.current());
        return reply;
    }

    public Map<String, Object> setWorkspace(JsonNode payload) {
        String path = payload != null && payload.path("path").isTextual() ? payload.path("path").asText() : "";
        if (path.isEmpty()) {
            throw ProtocolException.badRequest("payload requires { path: string } (absolute workspace path)");
        }
        return setWorkspace(Path.of(path));
    }

    /**
     * Points every later bd call at {@code root}. When the database changes, the watcher
     * follows it, cached list content is dropped, clients are told, and a refresh is scheduled.
     */
    public Map<String, Object> setWorkspace(Path root) {
        WorkspaceConfig previous = context.switchTo(root);
        WorkspaceConfig next = context.current();
        boolean changed = previous == null || !next.dbPath().equals(previous.dbPath());
        if (changed) {
            log.info("Workspace changed: {} -> {}", previous != null ? previous.dbPath() : "", next.dbPath());
            watcher.rebind(next);
            publisher.resetContent();
            emitter.broadcast(MessageType.WORKSPACE_CHANGED, next);
            scheduler.onStoreChanged();
        }
        registry.register(next.rootDir(), next.dbPath());
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("changed", changed);
        reply.put("workspace", next);
        return reply;
    }
}
