package io.github.drompincen.boardsync.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorObject(
        String code,
        String message,
        Map<String, Object> details
) {
    public static final String BAD_REQUEST = "bad_request";
    public static final String BAD_JSON = "bad_json";
    public static final String UNKNOWN_TYPE = "unknown_type";
    public static final String BD_ERROR = "bd_error";

    public static ErrorObject of(String code, String message) {
        return new ErrorObject(code, message, null);
    }

    public ErrorObject withDetail(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (details != null) merged.putAll(details);
        merged.put(name, value);
        return new ErrorObject(code, message, merged);
    }
}
