package io.github.drompincen.boardsync.runtime.subscription;

import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-connection bookkeeping: which client subscription ids map to which key, and the
 * revision sequence for each key. Client ids bound to the same key share one sequence.
 */
public class ConnectionSubscriptionState {

    public record Binding(String key, SubscriptionSpec spec) {}

    private final Map<String, Binding> subs = new LinkedHashMap<>();
    private final Map<String, Long> revisions = new HashMap<>();

    public synchronized void put(String clientId, String key, SubscriptionSpec spec) {
        subs.put(clientId, new Binding(key, spec));
    }

    public synchronized Optional<Binding> get(String clientId) {
        return Optional.ofNullable(subs.get(clientId));
    }

    public synchronized Optional<Binding> remove(String clientId) {
        return Optional.ofNullable(subs.remove(clientId));
    }

    public synchronized List<String> clientIdsFor(String key) {
        List<String> ids = new ArrayList<>();
        subs.forEach((clientId, binding) -> {
            if (binding.key().equals(key)) ids.add(clientId);
        });
        return ids;
    }

    /**
     * Increments and returns the revision for {@code key}; the first call returns 1.
     */
    public synchronized long nextRevision(String key) {
        return revisions.merge(key, 1L, Long::sum);
    }

    public synchronized Map<String, Binding> bindings() {
        return new LinkedHashMap<>(subs);
    }
}
