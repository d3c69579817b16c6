package io.github.drompincen.boardsync.client.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardsync.client.store.SubscriptionIssueStores;
import io.github.drompincen.boardsync.protocol.subscription.PushEnvelope;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import io.github.drompincen.boardsync.protocol.ws.ErrorObject;
import io.github.drompincen.boardsync.protocol.ws.MessageType;
import io.github.drompincen.boardsync.protocol.ws.RequestEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * WebSocket client for the board server. Correlates replies with requests by id and routes
 * pushed snapshot, upsert and delete envelopes into {@link SubscriptionIssueStores}.
 */
public class BoardClient extends TextWebSocketHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoardClient.class);

    /**
     * An open list subscription. Closing it unsubscribes on the server and drops the local store.
     */
    public interface Subscription extends AutoCloseable {

        String id();

        String key();

        @Override
        void close();
    }

    private final ObjectMapper objectMapper;
    private final SubscriptionIssueStores stores;
    private final WebSocketClient webSocketClient;
    private final Map<String, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final List<Consumer<JsonNode>> workspaceListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong requestSeq = new AtomicLong();
    private volatile WebSocketSession session;

    public BoardClient(SubscriptionIssueStores stores) {
        this(defaultMapper(), stores, new StandardWebSocketClient());
    }

    public BoardClient(ObjectMapper objectMapper, SubscriptionIssueStores stores, WebSocketClient webSocketClient) {
        this.objectMapper = objectMapper;
        this.stores = stores;
        this.webSocketClient = webSocketClient;
    }

    private static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public CompletableFuture<Void> connect(URI uri) {
        return webSocketClient.execute(this, new WebSocketHttpHeaders(), uri)
                .thenAccept(s -> log.info("Connected to {}", uri));
    }

    public boolean isConnected() {
        WebSocketSession s = session;
        return s != null && s.isOpen();
    }

    public SubscriptionIssueStores stores() {
        return stores;
    }

    public void onWorkspaceChanged(Consumer<JsonNode> listener) {
        workspaceListeners.add(listener);
    }

    /**
     * Sends a request and completes with the reply payload, or exceptionally with a
     * {@link BoardClientException} carrying the server error.
     */
    public CompletableFuture<JsonNode> request(MessageType type, Object payload) {
        WebSocketSession s = session;
        if (s == null || !s.isOpen()) {
            return CompletableFuture.failedFuture(new BoardClientException("Not connected", null));
        }
        String id = "r-" + requestSeq.incrementAndGet();
        CompletableFuture<JsonNode> reply = new CompletableFuture<>();
        pending.put(id, reply);
        try {
            JsonNode body = payload != null ? objectMapper.valueToTree(payload) : null;
            s.sendMessage(new TextMessage(objectMapper.writeValueAsString(RequestEnvelope.of(id, type, body))));
        } catch (IOException | IllegalArgumentException e) {
            pending.remove(id);
            reply.completeExceptionally(new BoardClientException("Failed to send " + type.wireName(), e));
        }
        return reply;
    }

    /**
     * Subscribes {@code clientId} to a list. The local store is registered before the request
     * goes out so the initial snapshot, which may arrive ahead of the reply, is not lost.
     */
    public CompletableFuture<Subscription> subscribeList(String clientId, SubscriptionSpec spec) {
        stores.register(clientId, spec);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", clientId);
        payload.put("type", spec.type());
        if (!spec.params().isEmpty()) {
            payload.put("params", spec.params());
        }
        return request(MessageType.SUBSCRIBE_LIST, payload)
                .whenComplete((reply, error) -> {
                    if (error != null) {
                        log.warn("Subscribe {} failed: {}", clientId, error.getMessage());
                        stores.unregister(clientId);
                    }
                })
                .thenApply(reply -> subscriptionHandle(clientId, reply.path("key").asText(spec.key())));
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession raw) {
        this.session = new ConcurrentWebSocketSessionDecorator(raw, 10_000, 512 * 1024);
    }

    @Override
    protected void handleTextMessage(WebSocketSession raw, TextMessage message) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring invalid frame: {}", e.getOriginalMessage());
            return;
        }
        String id = frame.path("id").asText("");
        String type = frame.path("type").asText("");
        CompletableFuture<JsonNode> waiting = pending.remove(id);
        if (waiting != null) {
            complete(waiting, frame);
            return;
        }
        MessageType messageType = MessageType.fromWire(type).orElse(null);
        if (messageType == null) {
            log.debug("Ignoring frame of unknown type {}", type);
        } else if (PushEnvelope.isPushType(messageType)) {
            applyPush(frame.path("payload"));
        } else if (messageType == MessageType.WORKSPACE_CHANGED) {
            for (Consumer<JsonNode> listener : workspaceListeners) {
                try {
                    listener.accept(frame.path("payload"));
                } catch (RuntimeException e) {
                    log.error("Workspace listener failed", e);
                }
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession raw, CloseStatus status) {
        log.info("Disconnected: {}", status);
        session = null;
        BoardClientException closed = new BoardClientException("Connection closed: " + status, null);
        pending.values().forEach(f -> f.completeExceptionally(closed));
        pending.clear();
    }

    @Override
    public void close() {
        WebSocketSession s = session;
        if (s != null && s.isOpen()) {
            try {
                s.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Error closing connection: {}", e.getMessage());
            }
        }
    }

    private void complete(CompletableFuture<JsonNode> waiting, JsonNode frame) {
        if (frame.path("ok").asBoolean(false)) {
            waiting.complete(frame.path("payload"));
            return;
        }
        JsonNode err = frame.path("error");
        ErrorObject error = ErrorObject.of(err.path("code").asText("unknown"), err.path("message").asText(""));
        waiting.completeExceptionally(new BoardClientException(error));
    }

    private void applyPush(JsonNode payload) {
        try {
            stores.applyPush(objectMapper.treeToValue(payload, PushEnvelope.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring malformed push: {}", e.getMessage());
        }
    }

    private Subscription subscriptionHandle(String clientId, String key) {
        return new Subscription() {
            @Override
            public String id() {
                return clientId;
            }

            @Override
            public String key() {
                return key;
            }

            @Override
            public void close() {
                stores.unregister(clientId);
                request(MessageType.UNSUBSCRIBE_LIST, Map.of("id", clientId))
                        .exceptionally(e -> {
                            log.debug("Unsubscribe {} failed: {}", clientId, e.getMessage());
                            return null;
                        });
            }
        };
    }
}
