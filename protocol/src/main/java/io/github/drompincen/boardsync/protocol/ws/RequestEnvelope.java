package io.github.drompincen.boardsync.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client to server frame. Replies are correlated by {@code id}.
 * The type is kept as the raw wire string so unknown types can still be answered.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestEnvelope(
        String id,
        String type,
        JsonNode payload
) {
    public static RequestEnvelope of(String id, MessageType type, JsonNode payload) {
        return new RequestEnvelope(id, type.wireName(), payload);
    }

    /**
     * True when the frame carries a non-empty string id and type.
     */
    public static boolean isRequest(JsonNode node) {
        return node != null && node.isObject()
                && node.path("id").isTextual() && !node.path("id").asText().isEmpty()
                && node.path("type").isTextual() && !node.path("type").asText().isEmpty();
    }
}
