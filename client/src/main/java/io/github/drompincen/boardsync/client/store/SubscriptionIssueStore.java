package io.github.drompincen.boardsync.client.store;

import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.api.IssueComparators;
import io.github.drompincen.boardsync.protocol.subscription.PushEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local replica of one subscription. Applies pushes in revision order, drops stale or
 * duplicate ones, and keeps one {@link Issue} instance per id for its whole lifetime.
 */
public class SubscriptionIssueStore {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionIssueStore.class);

    private final String id;
    private final Comparator<Issue> order;
    private final Map<String, Issue> itemsById = new LinkedHashMap<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private List<Issue> ordered = List.of();
    private long lastRevision;
    private boolean disposed;

    public SubscriptionIssueStore(String id) {
        this(id, IssueComparators.PRIORITY_THEN_CREATED);
    }

    public SubscriptionIssueStore(String id, Comparator<Issue> order) {
        this.id = id;
        this.order = order != null ? order : IssueComparators.PRIORITY_THEN_CREATED;
    }

    public String id() {
        return id;
    }

    /**
     * Registers a change listener, called once per applied push. Returns a handle that removes it.
     */
    public Runnable subscribe(Runnable listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void applyPush(PushEnvelope envelope) {
        synchronized (this) {
            if (disposed || envelope == null || !id.equals(envelope.id())) {
                return;
            }
            long rev = envelope.revision();
            if (rev <= lastRevision) {
                log.debug("Store {} ignoring stale {} rev {} (last {})", id, envelope.type(), rev, lastRevision);
                return;
            }
            switch (envelope.type()) {
                case SNAPSHOT:
                    applySnapshot(envelope.issues());
                    break;
                case UPSERT:
                    applyUpsert(envelope.issue());
                    break;
                case DELETE:
                    if (envelope.issueId() != null && !envelope.issueId().isEmpty()) {
                        itemsById.remove(envelope.issueId());
                    }
                    break;
                default:
                    return;
            }
            rebuildOrdered();
            lastRevision = rev;
        }
        notifyListeners();
    }

    /**
     * Current items in display order. The list is unmodifiable; the issues are the live instances.
     */
    public synchronized List<Issue> snapshot() {
        return ordered;
    }

    public synchronized Optional<Issue> getById(String issueId) {
        return Optional.ofNullable(itemsById.get(issueId));
    }

    public synchronized int size() {
        return itemsById.size();
    }

    public synchronized long lastRevision() {
        return lastRevision;
    }

    public void dispose() {
        synchronized (this) {
            disposed = true;
            itemsById.clear();
            ordered = List.of();
            lastRevision = 0;
        }
        listeners.clear();
    }

    private void applySnapshot(List<Issue> issues) {
        itemsById.clear();
        if (issues == null) return;
        for (Issue issue : issues) {
            if (issue != null && issue.id() != null && !issue.id().isEmpty()) {
                itemsById.put(issue.id(), issue);
            }
        }
    }

    private void applyUpsert(Issue incoming) {
        if (incoming == null || incoming.id() == null || incoming.id().isEmpty()) {
            return;
        }
        Issue existing = itemsById.get(incoming.id());
        if (existing == null) {
            itemsById.put(incoming.id(), incoming);
        } else if (existing.updatedAt() <= incoming.updatedAt()) {
            existing.mergeFrom(incoming);
        } else {
            log.debug("Store {} keeping newer {} (updated_at {} > {})", id, incoming.id(),
                    existing.updatedAt(), incoming.updatedAt());
        }
    }

    private void rebuildOrdered() {
        List<Issue> sorted = new ArrayList<>(itemsById.values());
        sorted.sort(order);
        ordered = Collections.unmodifiableList(sorted);
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Listener error in store {}", id, e);
            }
        }
    }
}
