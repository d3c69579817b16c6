package io.github.drompincen.boardsync.protocol.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a subscription wants: a list type plus its parameters. Values are strings,
 * numbers or booleans; null-valued parameters are dropped.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SubscriptionSpec(
        String type,
        Map<String, Object> params
) {
    public SubscriptionSpec {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        params = Collections.unmodifiableMap(copy);
    }

    public static SubscriptionSpec of(String type) {
        return new SubscriptionSpec(type, Map.of());
    }

    public static SubscriptionSpec of(String type, Map<String, Object> params) {
        return new SubscriptionSpec(type, params);
    }

    public String key() {
        return SubscriptionKeys.keyOf(this);
    }
}
