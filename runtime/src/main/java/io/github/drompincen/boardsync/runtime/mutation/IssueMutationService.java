package io.github.drompincen.boardsync.runtime.mutation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.drompincen.boardsync.protocol.ws.ErrorObject;
import io.github.drompincen.boardsync.protocol.ws.MessageType;
import io.github.drompincen.boardsync.runtime.ProtocolException;
import io.github.drompincen.boardsync.runtime.bd.BdResult;
import io.github.drompincen.boardsync.runtime.bd.BdRunner;
import io.github.drompincen.boardsync.runtime.refresh.RefreshScheduler;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes issues through bd. Every write opens the refresh gate so subscribers see the
 * result; comment operations do not touch subscribed lists and leave the gate alone.
 */
@Service
public class IssueMutationService {

    private static final Logger log = LoggerFactory.getLogger(IssueMutationService.class);

    public static final Set<MessageType> MUTATIONS = EnumSet.of(
            MessageType.UPDATE_STATUS, MessageType.UPDATE_PRIORITY, MessageType.UPDATE_ASSIGNEE,
            MessageType.EDIT_TEXT, MessageType.CREATE_ISSUE, MessageType.DELETE_ISSUE,
            MessageType.DEP_ADD, MessageType.DEP_REMOVE, MessageType.LABEL_ADD, MessageType.LABEL_REMOVE,
            MessageType.GET_COMMENTS, MessageType.ADD_COMMENT);

    private static final Set<String> STATUSES = Set.of("open", "in_progress", "closed");
    private static final Set<String> ISSUE_TYPES = Set.of("bug", "feature", "task", "epic", "chore");
    private static final Map<String, String> TEXT_FLAGS = Map.of(
            "title", "--title",
            "description", "--description",
            "acceptance", "--acceptance-criteria",
            "notes", "--notes",
            "design", "--design");

    private final BdRunner bd;
    private final WorkspaceContext workspace;
    private final RefreshScheduler scheduler;

    public IssueMutationService(BdRunner bd, WorkspaceContext workspace, RefreshScheduler scheduler) {
        this.bd = bd;
        this.workspace = workspace;
        this.scheduler = scheduler;
    }

    public boolean handles(MessageType type) {
        return MUTATIONS.contains(type);
    }

    /**
     * Runs the operation and returns the reply payload.
     *
     * @throws ProtocolException with {@code bad_request} for an invalid payload, {@code bd_error} when bd fails
     */
    public Object apply(MessageType type, JsonNode payload) {
        JsonNode p = payload != null ? payload : MissingNode.getInstance();
        log.debug("Applying {}", type.wireName());
        switch (type) {
            case UPDATE_STATUS: {
                String id = requireId(p, "payload requires { id: string, status: 'open'|'in_progress'|'closed' }");
                String status = text(p, "status");
                if (status == null || !STATUSES.contains(status)) {
                    throw ProtocolException.badRequest("payload requires { id: string, status: 'open'|'in_progress'|'closed' }");
                }
                return updateAndShow(id, List.of("update", id, "--status", status));
            }
            case UPDATE_PRIORITY: {
                String id = requireId(p, "payload requires { id: string, priority: 0..4 }");
                JsonNode priority = p.path("priority");
                if (!priority.isNumber() || priority.doubleValue() < 0 || priority.doubleValue() > 4) {
                    throw ProtocolException.badRequest("payload requires { id: string, priority: 0..4 }");
                }
                return updateAndShow(id, List.of("update", id, "--priority", String.valueOf(priority.intValue())));
            }
            case UPDATE_ASSIGNEE: {
                String id = requireId(p, "payload requires { id: string, assignee: string }");
                String assignee = text(p, "assignee");
                if (assignee == null) {
                    throw ProtocolException.badRequest("payload requires { id: string, assignee: string }");
                }
                return updateAndShow(id, List.of("update", id, "--assignee", assignee));
            }
            case EDIT_TEXT: {
                String message = "payload requires { id: string, field: 'title'|'description'|'acceptance'|'notes'|'design', value: string }";
                String id = requireId(p, message);
                String field = text(p, "field");
                String value = text(p, "value");
                if (field == null || !TEXT_FLAGS.containsKey(field) || value == null) {
                    throw ProtocolException.badRequest(message);
                }
                return updateAndShow(id, List.of("update", id, TEXT_FLAGS.get(field), value));
            }
            case CREATE_ISSUE:
                return createIssue(p);
            case DELETE_ISSUE: {
                String id = requireId(p, "payload requires { id: string }");
                runOrThrow(List.of("delete", id, "--force"), "bd delete failed");
                scheduler.triggerMutationRefresh();
                Map<String, Object> reply = new LinkedHashMap<>();
                reply.put("deleted", true);
                reply.put("id", id);
                return reply;
            }
            case DEP_ADD:
            case DEP_REMOVE: {
                String a = text(p, "a");
                String b = text(p, "b");
                if (a == null || a.isEmpty() || b == null || b.isEmpty()) {
                    throw ProtocolException.badRequest("payload requires { a: string, b: string }");
                }
                String viewId = text(p, "view_id");
                String shown = viewId != null && !viewId.isEmpty() ? viewId : a;
                String verb = type == MessageType.DEP_ADD ? "add" : "remove";
                return updateAndShow(shown, List.of("dep", verb, a, b));
            }
            case LABEL_ADD:
            case LABEL_REMOVE: {
                String message = "payload requires { id: string, label: non-empty string }";
                String id = requireId(p, message);
                String label = text(p, "label");
                if (label == null || label.trim().isEmpty()) {
                    throw ProtocolException.badRequest(message);
                }
                String verb = type == MessageType.LABEL_ADD ? "add" : "remove";
                return updateAndShow(id, List.of("label", verb, id, label.trim()));
            }
            case GET_COMMENTS: {
                String id = requireId(p, "payload requires { id: string }");
                return comments(id);
            }
            case ADD_COMMENT:
                return addComment(p);
            default:
                throw new ProtocolException(ErrorObject.UNKNOWN_TYPE, "Unknown message type: " + type.wireName());
        }
    }

    private Object createIssue(JsonNode p) {
        String title = text(p, "title");
        if (title == null || title.isEmpty()) {
            throw ProtocolException.badRequest("payload requires { title: string, ... }");
        }
        List<String> args = new ArrayList<>(List.of("create", title));
        String type = text(p, "type");
        if (type != null && ISSUE_TYPES.contains(type)) {
            args.add("-t");
            args.add(type);
        }
        JsonNode priority = p.path("priority");
        if (priority.isNumber() && priority.doubleValue() >= 0 && priority.doubleValue() <= 4) {
            args.add("-p");
            args.add(String.valueOf(priority.intValue()));
        }
        String description = text(p, "description");
        if (description != null && !description.isEmpty()) {
            args.add("-d");
            args.add(description);
        }
        runOrThrow(args, "bd failed");
        scheduler.triggerMutationRefresh();
        return Map.of("created", true);
    }

    private Object addComment(JsonNode p) {
        String message = "payload requires { id: string, text: non-empty string }";
        String id = requireId(p, message);
        String text = text(p, "text");
        if (text == null || text.trim().isEmpty()) {
            throw ProtocolException.badRequest(message);
        }
        List<String> args = new ArrayList<>(List.of("comment", id, text.trim()));
        String author = bd.gitUserName(Path.of(workspace.current().rootDir()));
        if (!author.isEmpty()) {
            args.add("--author");
            args.add(author);
        }
        runOrThrow(args, "bd failed");
        return comments(id);
    }

    private Object comments(String id) {
        BdResult result = bd.runJson(List.of("comments", id, "--json"), workspace.current());
        if (!result.ok()) {
            throw new ProtocolException(ErrorObject.BD_ERROR, result.errorMessage("bd failed"));
        }
        return result.json() == null || result.json().isNull() ? List.of() : result.json();
    }

    private Object updateAndShow(String showId, List<String> args) {
        runOrThrow(args, "bd failed");
        BdResult shown = bd.runJson(List.of("show", showId, "--json"), workspace.current());
        if (!shown.ok()) {
            throw new ProtocolException(ErrorObject.BD_ERROR, shown.errorMessage("bd failed"));
        }
        scheduler.triggerMutationRefresh();
        return shown.json();
    }

    private void runOrThrow(List<String> args, String fallback) {
        WorkspaceConfig ws = workspace.current();
        BdResult result = bd.run(args, ws);
        if (!result.ok()) {
            log.warn("bd {} failed with code {}: {}", args.get(0), result.code(), result.stderr());
            throw new ProtocolException(ErrorObject.BD_ERROR, result.errorMessage(fallback));
        }
    }

    private static String requireId(JsonNode p, String message) {
        String id = text(p, "id");
        if (id == null || id.isEmpty()) {
            throw ProtocolException.badRequest(message);
        }
        return id;
    }

    private static String text(JsonNode p, String field) {
        JsonNode node = p.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
