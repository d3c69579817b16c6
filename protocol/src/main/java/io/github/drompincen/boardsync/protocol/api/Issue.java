package io.github.drompincen.boardsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An issue as produced by the record store: an open set of fields with a stable
 * {@code id}, an {@code updated_at} write timestamp and an optional {@code closed_at}.
 * <p>
 * Instances are mutable on purpose. A client replica keeps one instance per id and
 * folds newer versions into it with {@link #mergeFrom(Issue)}, so anyone holding a
 * reference to the "current" issue observes merged updates through that same reference.
 */
public class Issue {

    public static final String ID = "id";
    public static final String TITLE = "title";
    public static final String STATUS = "status";
    public static final String PRIORITY = "priority";
    public static final String ISSUE_TYPE = "issue_type";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String CLOSED_AT = "closed_at";

    static final int DEFAULT_PRIORITY = 2;

    @JsonIgnore
    private final Map<String, Object> fieldValues = new LinkedHashMap<>();

    public Issue() {
    }

    public static Issue of(Map<String, ?> fields) {
        Issue issue = new Issue();
        fields.forEach(issue::put);
        return issue;
    }

    public static Issue of(String id, long updatedAt) {
        Issue issue = new Issue();
        issue.put(ID, id);
        issue.put(UPDATED_AT, updatedAt);
        issue.put(CLOSED_AT, null);
        return issue;
    }

    public Issue put(String name, Object value) {
        fieldValues.put(name, value);
        return this;
    }

    @JsonAnySetter
    void set(String name, Object value) {
        fieldValues.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fieldValues);
    }

    public Object get(String name) {
        return fieldValues.get(name);
    }

    public String id() {
        Object id = fieldValues.get(ID);
        return id != null ? id.toString() : null;
    }

    public long updatedAt() {
        return asLong(fieldValues.get(UPDATED_AT), 0L);
    }

    public long createdAt() {
        return asLong(fieldValues.get(CREATED_AT), 0L);
    }

    public Long closedAt() {
        Object v = fieldValues.get(CLOSED_AT);
        return v instanceof Number n ? n.longValue() : null;
    }

    public int priority() {
        Object v = fieldValues.get(PRIORITY);
        return v instanceof Number n ? n.intValue() : DEFAULT_PRIORITY;
    }

    /**
     * Rewrites this instance in place so that it holds exactly the fields of {@code source}:
     * fields absent from the source are removed, the rest are overwritten or added.
     */
    public void mergeFrom(Issue source) {
        fieldValues.keySet().retainAll(source.fieldValues.keySet());
        fieldValues.putAll(source.fieldValues);
    }

    public Issue copy() {
        Issue copy = new Issue();
        copy.fieldValues.putAll(fieldValues);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Issue other)) return false;
        return fieldValues.equals(other.fieldValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldValues);
    }

    @Override
    public String toString() {
        return "Issue" + fieldValues;
    }

    private static long asLong(Object v, long fallback) {
        return v instanceof Number n ? n.longValue() : fallback;
    }
}
