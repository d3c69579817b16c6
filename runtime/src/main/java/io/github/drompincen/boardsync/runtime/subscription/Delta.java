package io.github.drompincen.boardsync.runtime.subscription;

import io.github.drompincen.boardsync.protocol.api.Issue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ids that entered, changed or left a list between two fetches.
 */
public record Delta(
        List<String> added,
        List<String> updated,
        List<String> removed
) {
    public static final Delta EMPTY = new Delta(List.of(), List.of(), List.of());

    public static Delta compute(Map<String, Issue> previous, Map<String, Issue> next) {
        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        next.forEach((id, issue) -> {
            Issue before = previous.get(id);
            if (before == null) {
                added.add(id);
            } else if (!before.equals(issue)) {
                updated.add(id);
            }
        });
        for (String id : previous.keySet()) {
            if (!next.containsKey(id)) {
                removed.add(id);
            }
        }
        return new Delta(List.copyOf(added), List.copyOf(updated), List.copyOf(removed));
    }

    public boolean isEmpty() {
        return added.isEmpty() && updated.isEmpty() && removed.isEmpty();
    }
}
