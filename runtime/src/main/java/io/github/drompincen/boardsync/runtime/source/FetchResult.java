package io.github.drompincen.boardsync.runtime.source;

import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.ws.ErrorObject;

import java.util.List;

public record FetchResult(
        boolean ok,
        List<Issue> items,
        ErrorObject error
) {
    public static FetchResult success(List<Issue> items) {
        return new FetchResult(true, List.copyOf(items), null);
    }

    public static FetchResult failure(String code, String message) {
        return new FetchResult(false, List.of(), ErrorObject.of(code, message));
    }
}
