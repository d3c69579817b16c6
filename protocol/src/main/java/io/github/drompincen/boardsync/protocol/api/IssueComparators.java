package io.github.drompincen.boardsync.protocol.api;

import java.util.Comparator;

/**
 * Shared orderings for issue lists, so server snapshots and client stores sort alike.
 */
public final class IssueComparators {

    /** Priority ascending (missing counts as 2), then created_at ascending, then id. */
    public static final Comparator<Issue> PRIORITY_THEN_CREATED = Comparator
            .comparingInt(Issue::priority)
            .thenComparingLong(Issue::createdAt)
            .thenComparing(IssueComparators::idOf);

    /** Most recently closed first, then id. */
    public static final Comparator<Issue> CLOSED_DESCENDING = Comparator
            .comparingLong((Issue i) -> i.closedAt() != null ? i.closedAt() : 0L).reversed()
            .thenComparing(IssueComparators::idOf);

    private IssueComparators() {
    }

    private static String idOf(Issue issue) {
        return issue.id() != null ? issue.id() : "";
    }
}
