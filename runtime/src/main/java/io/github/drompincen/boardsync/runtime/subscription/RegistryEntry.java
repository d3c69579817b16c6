package io.github.drompincen.boardsync.runtime.subscription;

import io.github.drompincen.boardsync.protocol.api.Issue;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known content of one subscription key and the connections watching it.
 */
public class RegistryEntry {

    private volatile Map<String, Issue> itemsById = Map.of();
    private final Set<PushConnection> subscribers = ConcurrentHashMap.newKeySet();
    private volatile boolean snapshotPending;

    public Map<String, Issue> itemsById() {
        return itemsById;
    }

    void replaceItems(Map<String, Issue> items) {
        this.itemsById = Collections.unmodifiableMap(items);
    }

    /**
     * Forces the next refresh of this key to send snapshots, even when its content is unchanged.
     */
    void markSnapshotPending() {
        snapshotPending = true;
    }

    boolean takeSnapshotPending() {
        boolean pending = snapshotPending;
        snapshotPending = false;
        return pending;
    }

    public Set<PushConnection> subscribers() {
        return Collections.unmodifiableSet(subscribers);
    }

    boolean addSubscriber(PushConnection connection) {
        return subscribers.add(connection);
    }

    boolean removeSubscriber(PushConnection connection) {
        return subscribers.remove(connection);
    }
}
