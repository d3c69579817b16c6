package io.github.drompincen.boardsync.protocol.subscription;

import java.util.Arrays;
import java.util.Optional;

public enum SubscriptionType {
    ALL_ISSUES("all-issues"),
    EPICS("epics"),
    BLOCKED_ISSUES("blocked-issues"),
    READY_ISSUES("ready-issues"),
    IN_PROGRESS_ISSUES("in-progress-issues"),
    CLOSED_ISSUES("closed-issues"),
    ISSUE_DETAIL("issue-detail");

    private final String wireName;

    SubscriptionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SubscriptionType> fromWire(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
