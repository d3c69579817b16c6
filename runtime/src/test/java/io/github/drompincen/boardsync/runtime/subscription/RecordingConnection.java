package io.github.drompincen.boardsync.runtime.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory connection that keeps every frame it was asked to send.
 */
class RecordingConnection implements PushConnection {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;

    RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String text) throws IOException {
        if (failSends) {
            throw new IOException("socket closed");
        }
        sent.add(text);
    }

    void close() {
        open = false;
    }

    void failSends() {
        failSends = true;
    }

    void clear() {
        sent.clear();
    }

    /**
     * Push envelopes sent so far, i.e. the {@code payload} of each frame.
     */
    List<JsonNode> pushes() {
        List<JsonNode> out = new ArrayList<>();
        for (String frame : sent) {
            try {
                out.add(MAPPER.readTree(frame).path("payload"));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return out;
    }
}
