package io.github.drompincen.boardsync.runtime.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionType;
import io.github.drompincen.boardsync.protocol.ws.ErrorObject;
import io.github.drompincen.boardsync.runtime.bd.BdResult;
import io.github.drompincen.boardsync.runtime.bd.BdRunner;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists issues by running the bd CLI and normalizing its JSON output.
 */
@Component
public class BdItemSource implements ItemSource {

    private static final Logger log = LoggerFactory.getLogger(BdItemSource.class);

    private static final String[] TIMESTAMP_FIELDS = {Issue.CREATED_AT, Issue.UPDATED_AT};

    private final BdRunner bd;
    private final ObjectMapper objectMapper;

    public BdItemSource(BdRunner bd, ObjectMapper objectMapper) {
        this.bd = bd;
        this.objectMapper = objectMapper;
    }

    @Override
    public FetchResult fetch(SubscriptionSpec spec, WorkspaceConfig workspace) {
        SubscriptionType type = SubscriptionType.fromWire(spec.type()).orElse(null);
        if (type == null) {
            return FetchResult.failure(ErrorObject.BAD_REQUEST, "Unknown subscription type: " + spec.type());
        }
        List<String> args;
        try {
            args = argsFor(type, spec.params());
        } catch (IllegalArgumentException e) {
            return FetchResult.failure(ErrorObject.BAD_REQUEST, e.getMessage());
        }

        BdResult result = bd.runJson(args, workspace);
        if (!result.ok()) {
            return FetchResult.failure(ErrorObject.BD_ERROR, result.errorMessage("bd failed"));
        }

        List<Issue> items = normalize(result.json(), type == SubscriptionType.EPICS);
        if (type == SubscriptionType.CLOSED_ISSUES) {
            applySinceFilter(items, spec.params().get("since"));
        }
        log.debug("Fetched {} items for {}", items.size(), spec.type());
        return FetchResult.success(items);
    }

    /**
     * Keeps closed issues with {@code closed_at >= since}; a missing or zero cutoff keeps everything.
     */
    static void applySinceFilter(List<Issue> items, Object since) {
        if (!(since instanceof Number n) || n.doubleValue() <= 0) {
            return;
        }
        double cutoff = n.doubleValue();
        items.removeIf(issue -> issue.closedAt() == null || issue.closedAt() < cutoff);
    }

    static List<String> argsFor(SubscriptionType type, Map<String, Object> params) {
        switch (type) {
            case ALL_ISSUES:
                return List.of("list", "--json");
            case EPICS:
                return List.of("epic", "status", "--json");
            case BLOCKED_ISSUES:
                return List.of("blocked", "--json");
            case READY_ISSUES:
                return List.of("ready", "--limit", "1000", "--json");
            case IN_PROGRESS_ISSUES:
                return List.of("list", "--json", "--status", "in_progress");
            case CLOSED_ISSUES:
                return List.of("list", "--json", "--status", "closed");
            case ISSUE_DETAIL:
                Object id = params.get("id");
                if (id == null || id.toString().isBlank()) {
                    throw new IllegalArgumentException("issue-detail requires params.id");
                }
                return List.of("show", id.toString().trim(), "--json");
            default:
                throw new IllegalArgumentException("Unsupported subscription type: " + type.wireName());
        }
    }

    List<Issue> normalize(JsonNode json, boolean flattenEpics) {
        List<Issue> out = new ArrayList<>();
        if (json == null || json.isNull() || json.isMissingNode()) {
            return out;
        }
        List<JsonNode> entries = new ArrayList<>();
        if (json.isArray()) {
            json.forEach(entries::add);
        } else if (json.isObject()) {
            entries.add(json);
        }
        for (JsonNode entry : entries) {
            JsonNode node = flattenEpics ? flattenEpic(entry) : entry;
            if (node == null || !node.isObject()) continue;
            JsonNode id = node.get(Issue.ID);
            if (id == null || !id.isTextual() || id.asText().isEmpty()) continue;
            out.add(toIssue(node));
        }
        return out;
    }

    /**
     * {@code epic status} wraps each epic with its child counters.
     */
    private JsonNode flattenEpic(JsonNode entry) {
        JsonNode epic = entry.get("epic");
        if (epic == null || !epic.isObject()) {
            return entry;
        }
        ObjectNode flat = ((ObjectNode) epic).deepCopy();
        flat.put("total_children", entry.path("total_children").asInt(0));
        flat.put("closed_children", entry.path("closed_children").asInt(0));
        flat.put("eligible_for_close", entry.path("eligible_for_close").asBoolean(false));
        return flat;
    }

    @SuppressWarnings("unchecked")
    private Issue toIssue(JsonNode node) {
        Map<String, Object> fields = objectMapper.convertValue(node, LinkedHashMap.class);
        for (String field : TIMESTAMP_FIELDS) {
            fields.put(field, parseEpochMs(fields.get(field), 0L));
        }
        fields.put(Issue.CLOSED_AT, parseEpochMs(fields.get(Issue.CLOSED_AT), null));
        return Issue.of(fields);
    }

    static Long parseEpochMs(Object value, Long fallback) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return OffsetDateTime.parse(s).toInstant().toEpochMilli();
            } catch (DateTimeParseException e) {
                try {
                    return Instant.parse(s).toEpochMilli();
                } catch (DateTimeParseException e2) {
                    log.debug("Unparseable timestamp '{}'", s);
                }
            }
        }
        return fallback;
    }
}
