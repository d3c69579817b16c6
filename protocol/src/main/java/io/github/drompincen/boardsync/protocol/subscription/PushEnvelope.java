package io.github.drompincen.boardsync.protocol.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.ws.MessageType;

import java.util.List;

/**
 * One push message addressed to a client subscription id. Exactly one of
 * {@code issues}, {@code issue} or {@code issueId} is set, depending on the type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushEnvelope(
        MessageType type,
        String id,
        long revision,
        List<Issue> issues,
        Issue issue,
        @JsonProperty("issue_id") String issueId
) {
    public static PushEnvelope snapshot(String id, long revision, List<Issue> issues) {
        return new PushEnvelope(MessageType.SNAPSHOT, id, revision, List.copyOf(issues), null, null);
    }

    public static PushEnvelope upsert(String id, long revision, Issue issue) {
        return new PushEnvelope(MessageType.UPSERT, id, revision, null, issue, null);
    }

    public static PushEnvelope delete(String id, long revision, String issueId) {
        return new PushEnvelope(MessageType.DELETE, id, revision, null, null, issueId);
    }

    public static boolean isPushType(MessageType type) {
        return type == MessageType.SNAPSHOT || type == MessageType.UPSERT || type == MessageType.DELETE;
    }
}
