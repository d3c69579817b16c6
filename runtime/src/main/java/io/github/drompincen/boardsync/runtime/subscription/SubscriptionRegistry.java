package io.github.drompincen.boardsync.runtime.subscription;

import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionKeys;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Shared, deduplicated view of every subscribed list, keyed by canonical subscription key.
 * <p>
 * All fetch, diff and apply work for a key runs inside {@link #withKeyLock}; different keys
 * proceed in parallel. Locks live in their own map so {@link #clear()} never hands out a
 * second lock for a key that is still held.
 */
@Component
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Map<String, RegistryEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public String attach(SubscriptionSpec spec, PushConnection connection) {
        String key = SubscriptionKeys.keyOf(spec);
        entries.compute(key, (k, entry) -> {
            RegistryEntry target = entry != null ? entry : new RegistryEntry();
            if (target.addSubscriber(connection)) {
                log.debug("Attached {} to {}", connection.id(), k);
            }
            return target;
        });
        return key;
    }

    public boolean detach(SubscriptionSpec spec, PushConnection connection) {
        RegistryEntry entry = entries.get(SubscriptionKeys.keyOf(spec));
        return entry != null && entry.removeSubscriber(connection);
    }

    /**
     * Removes the connection everywhere and evicts entries nobody watches anymore.
     */
    public void onDisconnect(PushConnection connection) {
        for (String key : entries.keySet()) {
            entries.computeIfPresent(key, (k, entry) -> {
                entry.removeSubscriber(connection);
                if (entry.subscribers().isEmpty()) {
                    log.debug("Evicted idle subscription {}", k);
                    return null;
                }
                return entry;
            });
        }
    }

    /**
     * Replaces the content of {@code key} and returns what changed. The delta is computed
     * against the previous content before it is overwritten.
     */
    public Delta applyItems(String key, List<Issue> items) {
        RegistryEntry entry = entries.computeIfAbsent(key, k -> new RegistryEntry());
        Map<String, Issue> next = new LinkedHashMap<>();
        for (Issue issue : items) {
            if (issue.id() != null && !issue.id().isEmpty()) {
                next.put(issue.id(), issue);
            }
        }
        Delta delta = Delta.compute(entry.itemsById(), next);
        entry.replaceItems(next);
        return delta;
    }

    public <T> T withKeyLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Optional<RegistryEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void clear() {
        log.info("Clearing {} subscription entries", entries.size());
        entries.clear();
    }
}
