package io.github.drompincen.boardsync.runtime.subscription;

import java.io.IOException;

/**
 * One live client connection as seen by the subscription runtime.
 * Implementations must make {@link #send(String)} safe to call from several threads.
 */
public interface PushConnection {

    String id();

    boolean isOpen();

    void send(String text) throws IOException;
}
