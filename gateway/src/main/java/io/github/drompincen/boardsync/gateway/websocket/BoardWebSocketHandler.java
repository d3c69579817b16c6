package io.github.drompincen.boardsync.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardsync.protocol.ws.ErrorObject;
import io.github.drompincen.boardsync.protocol.ws.MessageType;
import io.github.drompincen.boardsync.protocol.ws.ReplyEnvelope;
import io.github.drompincen.boardsync.protocol.ws.RequestEnvelope;
import io.github.drompincen.boardsync.runtime.ProtocolException;
import io.github.drompincen.boardsync.runtime.mutation.IssueMutationService;
import io.github.drompincen.boardsync.runtime.subscription.SubscriptionPublisher;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class BoardWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(BoardWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final SubscriptionPublisher publisher;
    private final IssueMutationService mutations;
    private final WorkspaceService workspaces;
    private final Map<String, WebSocketPushConnection> connections = new ConcurrentHashMap<>();

    public BoardWebSocketHandler(ObjectMapper objectMapper, SubscriptionPublisher publisher,
                                 IssueMutationService mutations, WorkspaceService workspaces) {
        this.objectMapper = objectMapper;
        this.publisher = publisher;
        this.mutations = mutations;
        this.workspaces = workspaces;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.put(session.getId(), new WebSocketPushConnection(session));
        log.info("WebSocket connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketPushConnection connection = connections.remove(session.getId());
        if (connection != null) {
            publisher.disconnect(connection);
        }
        log.info("WebSocket closed: {} ({})", session.getId(), status);
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        WebSocketPushConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.markAlive();
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        WebSocketPushConnection connection = connections.computeIfAbsent(session.getId(),
                id -> new WebSocketPushConnection(session));
        connection.markAlive();

        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON from {}: {}", session.getId(), e.getOriginalMessage());
            reply(connection, new ReplyEnvelope("unknown", false, MessageType.BAD_JSON.wireName(), null,
                    ErrorObject.of(ErrorObject.BAD_JSON, "Invalid JSON")));
            return;
        }
        if (!RequestEnvelope.isRequest(node)) {
            reply(connection, new ReplyEnvelope("unknown", false, MessageType.BAD_REQUEST.wireName(), null,
                    ErrorObject.of(ErrorObject.BAD_REQUEST, "Invalid request envelope")));
            return;
        }

        RequestEnvelope req = new RequestEnvelope(node.get("id").asText(), node.get("type").asText(), node.get("payload"));
        try {
            Object payload = dispatch(connection, req);
            reply(connection, ReplyEnvelope.ok(req, payload));
        } catch (ProtocolException e) {
            log.debug("{} rejected for {}: {}", req.type(), session.getId(), e.getMessage());
            reply(connection, ReplyEnvelope.error(req, e.error()));
        } catch (RuntimeException e) {
            log.error("Error handling {} from {}", req.type(), session.getId(), e);
            reply(connection, ReplyEnvelope.error(req, ErrorObject.of(ErrorObject.BD_ERROR,
                    e.getMessage() != null ? e.getMessage() : "Request failed")));
        }
    }

    private Object dispatch(WebSocketPushConnection connection, RequestEnvelope req) {
        MessageType type = MessageType.fromWire(req.type())
                .orElseThrow(() -> unknownType(req.type()));
        switch (type) {
            case PING:
                return Map.of("ts", System.currentTimeMillis());
            case SUBSCRIBE_LIST:
                return publisher.subscribe(connection, req.payload());
            case UNSUBSCRIBE_LIST:
                return publisher.unsubscribe(connection, req.payload());
            case LIST_WORKSPACES:
                return workspaces.listWorkspaces();
            case GET_WORKSPACE:
                return workspaces.current();
            case SET_WORKSPACE:
                return workspaces.setWorkspace(req.payload());
            default:
                if (mutations.handles(type)) {
                    return mutations.apply(type, req.payload());
                }
                throw unknownType(req.type());
        }
    }

    /**
     * Pings every connection and closes those that did not answer the previous ping.
     */
    @Scheduled(fixedDelayString = "${boardsync.ws.heartbeat-ms:30000}",
            initialDelayString = "${boardsync.ws.heartbeat-ms:30000}")
    public void heartbeat() {
        for (WebSocketPushConnection connection : connections.values()) {
            try {
                if (!connection.ping()) {
                    log.info("Closing unresponsive connection {}", connection.id());
                    connection.close(CloseStatus.GOING_AWAY);
                }
            } catch (IOException e) {
                log.warn("Heartbeat failed for {}: {}", connection.id(), e.getMessage());
            }
        }
    }

    int connectionCount() {
        return connections.size();
    }

    private void reply(WebSocketPushConnection connection, ReplyEnvelope envelope) {
        try {
            connection.send(objectMapper.writeValueAsString(envelope));
        } catch (IOException e) {
            log.warn("Failed to reply {} to {}: {}", envelope.type(), connection.id(), e.getMessage());
        }
    }

    private static ProtocolException unknownType(String type) {
        return new ProtocolException(ErrorObject.UNKNOWN_TYPE, "Unknown message type: " + type);
    }
}
