package io.github.drompincen.boardsync.protocol.ws;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum MessageType {
    // Client -> Server
    PING("ping"),
    SUBSCRIBE_LIST("subscribe-list"),
    UNSUBSCRIBE_LIST("unsubscribe-list"),
    UPDATE_STATUS("update-status"),
    UPDATE_PRIORITY("update-priority"),
    UPDATE_ASSIGNEE("update-assignee"),
    EDIT_TEXT("edit-text"),
    CREATE_ISSUE("create-issue"),
    DELETE_ISSUE("delete-issue"),
    DEP_ADD("dep-add"),
    DEP_REMOVE("dep-remove"),
    LABEL_ADD("label-add"),
    LABEL_REMOVE("label-remove"),
    GET_COMMENTS("get-comments"),
    ADD_COMMENT("add-comment"),
    LIST_WORKSPACES("list-workspaces"),
    GET_WORKSPACE("get-workspace"),
    SET_WORKSPACE("set-workspace"),

    // Server -> Client
    SNAPSHOT("snapshot"),
    UPSERT("upsert"),
    DELETE("delete"),
    WORKSPACE_CHANGED("workspace-changed"),
    BAD_JSON("bad-json"),
    BAD_REQUEST("bad-request");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }

    @JsonCreator
    static MessageType fromJson(String name) {
        return fromWire(name).orElseThrow(() -> new IllegalArgumentException("Unknown message type: " + name));
    }
}
