package io.github.drompincen.boardsync.protocol.subscription;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Canonical subscription keys. Two specs with the same type and the same parameter
 * set, in any order, map to the same key; server and client both derive keys here.
 * <p>
 * Format: {@code type?name=value&name=value} with the type trimmed and lower-cased,
 * names sorted and both sides form-urlencoded. A spec without parameters is just its type.
 */
public final class SubscriptionKeys {

    private SubscriptionKeys() {
    }

    public static String keyOf(SubscriptionSpec spec) {
        String type = spec.type() != null ? spec.type().trim().toLowerCase(java.util.Locale.ROOT) : "";
        Map<String, Object> sorted = new TreeMap<>(spec.params());
        if (sorted.isEmpty()) {
            return type;
        }
        StringJoiner query = new StringJoiner("&");
        sorted.forEach((name, value) -> query.add(encode(name) + "=" + encode(stringify(value))));
        return type + "?" + query;
    }

    /**
     * Stable string form of a parameter value. Integral numbers lose any fractional
     * zero ({@code 5.0} and {@code 5} encode alike).
     */
    static String stringify(Object value) {
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            BigDecimal d = new BigDecimal(value.toString()).stripTrailingZeros();
            return d.scale() <= 0 ? d.toBigInteger().toString() : d.toPlainString();
        }
        return String.valueOf(value);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
