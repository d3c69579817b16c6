package io.github.drompincen.boardsync.client.ws;

import io.github.drompincen.boardsync.protocol.ws.ErrorObject;

/**
 * A request the server answered with {@code ok: false}, or one that never got an answer.
 */
public class BoardClientException extends RuntimeException {

    private final transient ErrorObject error;

    public BoardClientException(ErrorObject error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public BoardClientException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    public ErrorObject error() {
        return error;
    }
}
