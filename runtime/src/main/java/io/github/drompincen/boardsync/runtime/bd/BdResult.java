package io.github.drompincen.boardsync.runtime.bd;

import com.fasterxml.jackson.databind.JsonNode;

public record BdResult(
        int code,
        String stdout,
        String stderr,
        JsonNode json
) {
    public static final int SPAWN_FAILURE = 127;
    public static final int TIMED_OUT = 124;

    public static BdResult of(int code, String stdout, String stderr) {
        return new BdResult(code, stdout, stderr, null);
    }

    public static BdResult failure(int code, String stderr) {
        return new BdResult(code, "", stderr, null);
    }

    public boolean ok() {
        return code == 0;
    }

    public BdResult withJson(JsonNode parsed) {
        return new BdResult(code, stdout, stderr, parsed);
    }

    /**
     * Error text for a failed run; falls back to a generic message when bd printed nothing.
     */
    public String errorMessage(String fallback) {
        return stderr != null && !stderr.isBlank() ? stderr : fallback;
    }
}
