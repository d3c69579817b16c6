package io.github.drompincen.boardsync.runtime.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionType;
import io.github.drompincen.boardsync.runtime.ProtocolException;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks a {@code subscribe-list} payload and normalizes its parameters per list type.
 */
public final class SubscriptionRequestValidator {

    public record SubscribeRequest(String clientId, SubscriptionSpec spec) {}

    private static final String KNOWN_TYPES = Arrays.stream(SubscriptionType.values())
            .map(SubscriptionType::wireName)
            .collect(Collectors.joining(", "));

    private SubscriptionRequestValidator() {
    }

    public static SubscribeRequest validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw ProtocolException.badRequest("payload must be an object");
        }
        String clientId = payload.path("id").isTextual() ? payload.path("id").asText() : "";
        if (clientId.isEmpty()) {
            throw ProtocolException.badRequest("payload.id must be a non-empty string");
        }
        String typeName = payload.path("type").isTextual() ? payload.path("type").asText() : "";
        SubscriptionType type = SubscriptionType.fromWire(typeName)
                .orElseThrow(() -> ProtocolException.badRequest("payload.type must be one of: " + KNOWN_TYPES));

        JsonNode params = payload.get("params");
        if (params != null && !params.isObject()) {
            throw ProtocolException.badRequest("payload.params must be an object when provided");
        }

        switch (type) {
            case ISSUE_DETAIL: {
                JsonNode idNode = params != null ? params.get("id") : null;
                String issueId = idNode == null || idNode.isNull() ? "" : idNode.asText().trim();
                if (issueId.isEmpty()) {
                    throw ProtocolException.badRequest("params.id must be a non-empty string");
                }
                return new SubscribeRequest(clientId, SubscriptionSpec.of(typeName, Map.of("id", issueId)));
            }
            case CLOSED_ISSUES: {
                if (params == null || !params.has("since")) {
                    return new SubscribeRequest(clientId, SubscriptionSpec.of(typeName));
                }
                JsonNode since = params.get("since");
                if (!since.isNumber() || !Double.isFinite(since.doubleValue()) || since.doubleValue() < 0) {
                    throw ProtocolException.badRequest("params.since must be a non-negative number (epoch ms)");
                }
                Object value = since.isIntegralNumber() ? (Object) since.longValue() : (Object) since.doubleValue();
                return new SubscribeRequest(clientId, SubscriptionSpec.of(typeName, Map.of("since", value)));
            }
            default:
                if (params != null && params.size() > 0) {
                    throw ProtocolException.badRequest("type " + typeName + " does not accept params");
                }
                return new SubscribeRequest(clientId, SubscriptionSpec.of(typeName));
        }
    }
}
