package io.github.drompincen.boardsync.runtime;

import io.github.drompincen.boardsync.protocol.ws.ErrorObject;

import java.util.Map;

/**
 * A request that cannot be served. Carries the structured error returned to the caller;
 * nothing has been mutated when this is thrown.
 */
public class ProtocolException extends RuntimeException {

    private final transient ErrorObject error;

    public ProtocolException(ErrorObject error) {
        super(error.message());
        this.error = error;
    }

    public ProtocolException(String code, String message) {
        this(ErrorObject.of(code, message));
    }

    public ProtocolException(String code, String message, Map<String, Object> details) {
        this(new ErrorObject(code, message, details));
    }

    public static ProtocolException badRequest(String message) {
        return new ProtocolException(ErrorObject.BAD_REQUEST, message);
    }

    public ErrorObject error() {
        return error;
    }
}
