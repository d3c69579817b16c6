package io.github.drompincen.boardsync.runtime.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.subscription.PushEnvelope;
import io.github.drompincen.boardsync.protocol.ws.MessageType;
import io.github.drompincen.boardsync.protocol.ws.ReplyEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Turns registry changes into push frames. Every envelope for a (connection, key) pair
 * takes the next revision of that pair, so per-subscription order is the send order.
 */
@Component
public class PushEmitter {

    private static final Logger log = LoggerFactory.getLogger(PushEmitter.class);

    private final ObjectMapper objectMapper;
    private final ConnectionTable connections;

    public PushEmitter(ObjectMapper objectMapper, ConnectionTable connections) {
        this.objectMapper = objectMapper;
        this.connections = connections;
    }

    /**
     * Sends a full snapshot to one client subscription id. Returns false when the frame
     * could not be delivered.
     */
    public boolean snapshot(PushConnection connection, String clientId, String key, List<Issue> issues) {
        ConnectionSubscriptionState state = connections.register(connection);
        long revision = state.nextRevision(key);
        return send(connection, PushEnvelope.snapshot(clientId, revision, issues));
    }

    /**
     * Sends a snapshot to every client id the connection bound to {@code key}.
     */
    public void snapshotAll(PushConnection connection, String key, List<Issue> issues) {
        ConnectionSubscriptionState state = connections.state(connection).orElse(null);
        if (state == null) return;
        for (String clientId : state.clientIdsFor(key)) {
            send(connection, PushEnvelope.snapshot(clientId, state.nextRevision(key), issues));
        }
    }

    /**
     * Upserts for added and updated ids, then deletes for removed ids, for every
     * client id the connection bound to {@code key}.
     */
    public void delta(PushConnection connection, String key, Delta delta, Map<String, Issue> itemsById) {
        delta(connection, key, delta, itemsById, null);
    }

    /**
     * As {@link #delta(PushConnection, String, Delta, Map)}, skipping {@code skipClientId}.
     */
    public void delta(PushConnection connection, String key, Delta delta, Map<String, Issue> itemsById,
                      String skipClientId) {
        ConnectionSubscriptionState state = connections.state(connection).orElse(null);
        if (state == null) return;
        for (String clientId : state.clientIdsFor(key)) {
            if (clientId.equals(skipClientId)) continue;
            for (String id : delta.added()) {
                upsert(connection, state, clientId, key, itemsById.get(id));
            }
            for (String id : delta.updated()) {
                upsert(connection, state, clientId, key, itemsById.get(id));
            }
            for (String id : delta.removed()) {
                send(connection, PushEnvelope.delete(clientId, state.nextRevision(key), id));
            }
        }
    }

    /**
     * Sends an event frame to every open connection.
     */
    public void broadcast(MessageType type, Object payload) {
        String text;
        try {
            text = objectMapper.writeValueAsString(ReplyEnvelope.event(type, payload));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event: {}", type.wireName(), e.getMessage());
            return;
        }
        for (PushConnection connection : connections.connections()) {
            if (!connection.isOpen()) continue;
            try {
                connection.send(text);
            } catch (IOException e) {
                log.warn("Failed to broadcast {} to {}: {}", type.wireName(), connection.id(), e.getMessage());
            }
        }
    }

    private void upsert(PushConnection connection, ConnectionSubscriptionState state,
                        String clientId, String key, Issue issue) {
        if (issue == null) return;
        send(connection, PushEnvelope.upsert(clientId, state.nextRevision(key), issue));
    }

    private boolean send(PushConnection connection, PushEnvelope envelope) {
        if (!connection.isOpen()) {
            log.debug("Skipping {} for closed connection {}", envelope.type().wireName(), connection.id());
            return false;
        }
        try {
            connection.send(objectMapper.writeValueAsString(ReplyEnvelope.event(envelope.type(), envelope)));
            return true;
        } catch (IOException e) {
            log.warn("Failed to send {} rev {} for {} to {}: {}", envelope.type().wireName(),
                    envelope.revision(), envelope.id(), connection.id(), e.getMessage());
            return false;
        }
    }
}
