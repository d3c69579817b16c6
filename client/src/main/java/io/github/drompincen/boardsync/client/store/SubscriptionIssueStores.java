package io.github.drompincen.boardsync.client.store;

import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.subscription.PushEnvelope;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionKeys;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One {@link SubscriptionIssueStore} per client subscription id. Re-registering an id with a
 * different spec replaces its store, so the new list starts from a fresh revision baseline.
 */
public class SubscriptionIssueStores {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionIssueStores.class);

    private record Registration(SubscriptionIssueStore store, String key, Runnable detach) {}

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public Runnable register(String clientId, SubscriptionSpec spec) {
        return register(clientId, spec, null);
    }

    /**
     * Ensures a store exists for {@code clientId}. Returns a handle that unregisters it.
     */
    public synchronized Runnable register(String clientId, SubscriptionSpec spec, Comparator<Issue> order) {
        String nextKey = spec != null ? SubscriptionKeys.keyOf(spec) : "";
        Registration current = registrations.get(clientId);
        log.debug("Registering {} key={} (prev={})", clientId, nextKey, current != null ? current.key() : "");
        if (current == null) {
            registrations.put(clientId, newRegistration(clientId, nextKey, order));
        } else if (!current.key().isEmpty() && !nextKey.isEmpty() && !current.key().equals(nextKey)) {
            current.detach().run();
            current.store().dispose();
            registrations.put(clientId, newRegistration(clientId, nextKey, order));
        } else if (!nextKey.equals(current.key())) {
            registrations.put(clientId, new Registration(current.store(), nextKey, current.detach()));
        }
        return () -> unregister(clientId);
    }

    public synchronized void unregister(String clientId) {
        Registration removed = registrations.remove(clientId);
        if (removed != null) {
            log.debug("Unregistering {}", clientId);
            removed.detach().run();
            removed.store().dispose();
        }
    }

    public Optional<SubscriptionIssueStore> getStore(String clientId) {
        Registration registration = registrations.get(clientId);
        return registration != null ? Optional.of(registration.store()) : Optional.empty();
    }

    /**
     * A copy of the ordered items for {@code clientId}; empty when it is not registered.
     */
    public List<Issue> snapshotFor(String clientId) {
        return getStore(clientId).<List<Issue>>map(s -> new ArrayList<>(s.snapshot())).orElseGet(List::of);
    }

    /**
     * Registers a listener called once for every push any store applies.
     */
    public Runnable subscribe(Runnable listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Routes a push to the store registered under its subscription id.
     */
    public void applyPush(PushEnvelope envelope) {
        if (envelope == null || envelope.id() == null) return;
        Registration registration = registrations.get(envelope.id());
        if (registration == null) {
            log.debug("Dropping {} for unregistered subscription {}", envelope.type(), envelope.id());
            return;
        }
        registration.store().applyPush(envelope);
    }

    private Registration newRegistration(String clientId, String key, Comparator<Issue> order) {
        SubscriptionIssueStore store = new SubscriptionIssueStore(clientId, order);
        Runnable detach = store.subscribe(this::notifyListeners);
        return new Registration(store, key, detach);
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Store registry listener failed", e);
            }
        }
    }
}
