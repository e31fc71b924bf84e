package io.rota4j.recurrence;

public record SchemaDriftIssue(String field, String issue) {

    public static final String FIELD_REMOVED = "Field no longer exists in entity schema";
    public static final String REQUIRED_MISSING = "Required field missing from template";
    public static final String TYPE_CHANGED = "Field type no longer matches template value";
    public static final String TABLE_MISSING = "Entity table does not exist";

    @Override
    public String toString() {
        return field + ": " + issue;
    }
}
