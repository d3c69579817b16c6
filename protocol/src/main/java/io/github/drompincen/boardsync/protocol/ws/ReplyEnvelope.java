package io.github.drompincen.boardsync.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Server to client frame. Used both for replies and for unsolicited events,
 * which carry a generated {@code evt-} id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplyEnvelope(
        String id,
        boolean ok,
        String type,
        Object payload,
        ErrorObject error
) {
    public static ReplyEnvelope ok(RequestEnvelope req, Object payload) {
        return new ReplyEnvelope(req.id(), true, req.type(), payload, null);
    }

    public static ReplyEnvelope error(RequestEnvelope req, ErrorObject error) {
        return new ReplyEnvelope(req.id(), false, req.type(), null, error);
    }

    public static ReplyEnvelope event(MessageType type, Object payload) {
        return new ReplyEnvelope("evt-" + System.currentTimeMillis(), true, type.wireName(), payload, null);
    }
}
