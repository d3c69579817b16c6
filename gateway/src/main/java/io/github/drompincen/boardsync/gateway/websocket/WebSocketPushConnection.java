package io.github.drompincen.boardsync.gateway.websocket;

import io.github.drompincen.boardsync.runtime.subscription.PushConnection;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A WebSocket session made safe for sends from refresh threads.
 */
public class WebSocketPushConnection implements PushConnection {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final AtomicBoolean alive = new AtomicBoolean(true);

    public WebSocketPushConnection(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    void markAlive() {
        alive.set(true);
    }

    /**
     * Clears the alive flag and sends a ping. Returns false when the previous ping went unanswered.
     */
    boolean ping() throws IOException {
        if (!alive.getAndSet(false)) {
            return false;
        }
        session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
        return true;
    }

    void close(CloseStatus status) throws IOException {
        session.close(status);
    }
}
