package io.github.drompincen.boardsync.runtime.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionKeys;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import io.github.drompincen.boardsync.protocol.ws.ErrorObject;
import io.github.drompincen.boardsync.runtime.ProtocolException;
import io.github.drompincen.boardsync.runtime.refresh.RefreshPass;
import io.github.drompincen.boardsync.runtime.source.FetchResult;
import io.github.drompincen.boardsync.runtime.source.ItemSource;
import io.github.drompincen.boardsync.runtime.subscription.SubscriptionRequestValidator.SubscribeRequest;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Subscribe, unsubscribe and refresh flows: fetches lists, folds them into the registry
 * and publishes snapshots and deltas to the subscribed connections.
 */
@Service
public class SubscriptionPublisher implements RefreshPass {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionPublisher.class);

    private final ItemSource source;
    private final SubscriptionRegistry registry;
    private final ConnectionTable connections;
    private final PushEmitter emitter;
    private final WorkspaceContext workspace;
    private final Executor refreshExecutor;

    @Autowired
    public SubscriptionPublisher(ItemSource source, SubscriptionRegistry registry, ConnectionTable connections,
                                 PushEmitter emitter, WorkspaceContext workspace,
                                 @Value("${boardsync.refresh.parallelism:4}") int parallelism) {
        this(source, registry, connections, emitter, workspace, refreshPool(parallelism));
    }

    public SubscriptionPublisher(ItemSource source, SubscriptionRegistry registry, ConnectionTable connections,
                                 PushEmitter emitter, WorkspaceContext workspace, Executor refreshExecutor) {
        this.source = source;
        this.registry = registry;
        this.connections = connections;
        this.emitter = emitter;
        this.workspace = workspace;
        this.refreshExecutor = refreshExecutor;
    }

    private static ExecutorService refreshPool(int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, parallelism), r -> {
            Thread t = new Thread(r, "refresh-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Fetches, folds and publishes the initial list under the key lock, so a concurrent
     * refresh of the same key runs entirely before or after it.
     */
    public Map<String, Object> subscribe(PushConnection connection, JsonNode payload) {
        SubscribeRequest request = SubscriptionRequestValidator.validate(payload);
        String clientId = request.clientId();
        SubscriptionSpec spec = request.spec();
        String key = SubscriptionKeys.keyOf(spec);

        registry.withKeyLock(key, () -> {
            subscribeLocked(connection, clientId, spec, key);
            return null;
        });

        log.info("Connection {} subscribed {} to {}", connection.id(), clientId, key);
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("id", clientId);
        reply.put("key", key);
        return reply;
    }

    private void subscribeLocked(PushConnection connection, String clientId, SubscriptionSpec spec, String key) {
        FetchResult initial;
        try {
            initial = source.fetch(spec, workspace.current());
        } catch (RuntimeException e) {
            log.warn("Initial fetch for {} threw: {}", key, e.getMessage(), e);
            throw new ProtocolException(ErrorObject.of(ErrorObject.BD_ERROR,
                    e.getMessage() != null ? e.getMessage() : "Failed to load list").withDetail("key", key));
        }
        if (!initial.ok()) {
            log.warn("Initial fetch for {} failed: {}", key, initial.error().message());
            throw new ProtocolException(initial.error().withDetail("key", key));
        }

        ConnectionSubscriptionState state = connections.register(connection);
        registry.attach(spec, connection);
        ConnectionSubscriptionState.Binding previous = state.get(clientId).orElse(null);
        state.put(clientId, key, spec);
        if (previous != null && !previous.key().equals(key)) {
            detachIfUnused(connection, state, previous);
        }

        boolean published;
        try {
            boolean hadContent = registry.get(key).map(e -> !e.itemsById().isEmpty()).orElse(false);
            Delta delta = registry.applyItems(key, initial.items());
            if (hadContent && !delta.isEmpty()) {
                publishToOthers(connection, clientId, key, delta);
            }
            published = emitter.snapshot(connection, clientId, key, initial.items());
        } catch (RuntimeException e) {
            log.warn("Snapshot publish for {} threw: {}", key, e.getMessage(), e);
            published = false;
        }
        if (!published) {
            state.remove(clientId);
            detachIfUnused(connection, state, new ConnectionSubscriptionState.Binding(key, spec));
            if (!connection.isOpen()) {
                disconnect(connection);
            }
            throw new ProtocolException(ErrorObject.of(ErrorObject.BD_ERROR, "Failed to publish snapshot")
                    .withDetail("key", key));
        }
    }

    /**
     * Replies {@code unsubscribed: true} when the binding existed and the connection no longer
     * receives pushes for it. Another client id on the same connection keeps the key attached.
     */
    public Map<String, Object> unsubscribe(PushConnection connection, JsonNode payload) {
        String clientId = payload != null && payload.path("id").isTextual() ? payload.path("id").asText() : "";
        if (clientId.isEmpty()) {
            throw ProtocolException.badRequest("payload.id must be a non-empty string");
        }
        boolean removed = false;
        ConnectionSubscriptionState state = connections.state(connection).orElse(null);
        if (state != null) {
            ConnectionSubscriptionState.Binding binding = state.remove(clientId).orElse(null);
            if (binding != null) {
                removed = detachIfUnused(connection, state, binding);
            }
        }
        log.info("Connection {} unsubscribed {} (removed={})", connection.id(), clientId, removed);
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("id", clientId);
        reply.put("unsubscribed", removed);
        return reply;
    }

    public void disconnect(PushConnection connection) {
        connections.remove(connection);
        registry.onDisconnect(connection);
        log.info("Connection {} closed, subscriptions released", connection.id());
    }

    /**
     * Drops all cached list content and re-attaches every live binding, so the next refresh
     * pass sends fresh snapshots, empty ones included. Used when the workspace database changes.
     */
    public void resetContent() {
        registry.clear();
        for (PushConnection connection : connections.connections()) {
            connections.state(connection).ifPresent(state ->
                    state.bindings().values().forEach(b -> {
                        String key = registry.attach(b.spec(), connection);
                        registry.get(key).ifPresent(RegistryEntry::markSnapshotPending);
                    }));
        }
    }

    @Override
    public void refreshAll() {
        Map<String, SubscriptionSpec> specs = connections.activeSpecs();
        if (specs.isEmpty()) {
            return;
        }
        log.debug("Refreshing {} active subscription keys", specs.size());
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        specs.forEach((key, spec) -> futures.add(CompletableFuture
                .runAsync(() -> refreshAndPublish(key, spec), refreshExecutor)
                .exceptionally(e -> {
                    log.warn("Refresh failed for {}: {}", key, e.getMessage());
                    return null;
                })));
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    /**
     * Refetches one key under its lock and publishes the change: a snapshot when the entry had
     * no content before or was reset, otherwise upserts then deletes. A failed fetch leaves the
     * key untouched.
     */
    void refreshAndPublish(String key, SubscriptionSpec spec) {
        registry.withKeyLock(key, () -> {
            FetchResult result = source.fetch(spec, workspace.current());
            if (!result.ok()) {
                log.warn("Refresh failed for {}: {}", key, result.error().message());
                return null;
            }
            RegistryEntry before = registry.get(key).orElse(null);
            boolean forceSnapshot = before != null && before.takeSnapshotPending();
            boolean wasEmpty = before == null || before.itemsById().isEmpty();
            Delta delta = registry.applyItems(key, result.items());
            if (delta.isEmpty() && !forceSnapshot) {
                return null;
            }
            RegistryEntry entry = registry.get(key).orElse(null);
            if (entry == null) {
                return null;
            }
            for (PushConnection subscriber : entry.subscribers()) {
                if (!subscriber.isOpen()) continue;
                if (wasEmpty || forceSnapshot) {
                    emitter.snapshotAll(subscriber, key, result.items());
                } else {
                    emitter.delta(subscriber, key, delta, entry.itemsById());
                }
            }
            return null;
        });
    }

    @PreDestroy
    public void shutdown() {
        if (refreshExecutor instanceof ExecutorService pool) {
            pool.shutdownNow();
        }
    }

    private void publishToOthers(PushConnection subscribing, String clientId, String key, Delta delta) {
        RegistryEntry entry = registry.get(key).orElse(null);
        if (entry == null) return;
        Map<String, Issue> items = entry.itemsById();
        for (PushConnection subscriber : entry.subscribers()) {
            if (!subscriber.isOpen()) continue;
            emitter.delta(subscriber, key, delta, items, subscriber == subscribing ? clientId : null);
        }
    }

    /**
     * Detaches the connection from the binding's key unless another client id still uses it.
     * Returns false only when a detach ran and found nothing to remove.
     */
    private boolean detachIfUnused(PushConnection connection, ConnectionSubscriptionState state,
                                   ConnectionSubscriptionState.Binding binding) {
        if (state.clientIdsFor(binding.key()).isEmpty()) {
            return registry.detach(binding.spec(), connection);
        }
        return true;
    }
}
