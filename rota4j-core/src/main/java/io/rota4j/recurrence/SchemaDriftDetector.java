package io.rota4j.recurrence;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compares a series' entity template against the live entity schema.
 *
 * <p>Reported issues:
 * <ul>
 *   <li>the table is gone</li>
 *   <li>a template field is not a column any more (strict schemas only)</li>
 *   <li>a required column without default is missing from the template</li>
 *   <li>a template value no longer matches the column's declared type</li>
 * </ul>
 * Id and audit columns, and the time-range column filled in by expansion, are never
 * expected in the template.
 */
public class SchemaDriftDetector {

    public static final Set<String> SYSTEM_FIELDS = Set.of(
            "_id", "id", "created_at", "created_by", "updated_at", "updated_by",
            "createdAt", "createdBy", "updatedAt", "updatedBy"
    );

    private final EntitySchemaInspector inspector;

    public SchemaDriftDetector(EntitySchemaInspector inspector) {
        this.inspector = Objects.requireNonNull(inspector, "inspector must not be null");
    }

    public List<SchemaDriftIssue> detect(SeriesDefinition series) {
        Objects.requireNonNull(series, "series must not be null");

        Optional<EntitySchema> described = inspector.describe(series.entityTable());
        if (described.isEmpty()) {
            return List.of(new SchemaDriftIssue(series.entityTable(), SchemaDriftIssue.TABLE_MISSING));
        }
        EntitySchema schema = described.get();
        Map<String, Object> template = series.entityTemplate();
        Map<String, EntityColumn> columns = schema.columns();
        List<SchemaDriftIssue> issues = new ArrayList<>();

        for (Map.Entry<String, Object> field : template.entrySet()) {
            EntityColumn column = columns.get(field.getKey());
            if (column == null) {
                if (schema.strict()) {
                    issues.add(new SchemaDriftIssue(field.getKey(), SchemaDriftIssue.FIELD_REMOVED));
                }
                continue;
            }
            if (!typeMatches(column.types(), field.getValue())) {
                issues.add(new SchemaDriftIssue(field.getKey(), SchemaDriftIssue.TYPE_CHANGED + " " + column.types()));
            }
        }

        if (series.timeRangeColumn() != null && schema.strict() && !columns.containsKey(series.timeRangeColumn())) {
            issues.add(new SchemaDriftIssue(series.timeRangeColumn(), SchemaDriftIssue.FIELD_REMOVED));
        }

        for (EntityColumn column : columns.values()) {
            if (!column.required() || column.hasDefault()) {
                continue;
            }
            String name = column.name();
            if (SYSTEM_FIELDS.contains(name) || name.equals(series.timeRangeColumn())) {
                continue;
            }
            if (!template.containsKey(name)) {
                issues.add(new SchemaDriftIssue(name, SchemaDriftIssue.REQUIRED_MISSING));
            }
        }
        return issues;
    }

    public static String summarize(List<SchemaDriftIssue> issues) {
        StringBuilder sb = new StringBuilder();
        for (SchemaDriftIssue issue : issues) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(issue);
        }
        return sb.toString();
    }

    // type names follow BSON $jsonSchema / bsonType vocabulary
    static boolean typeMatches(Set<String> types, Object value) {
        if (types.isEmpty() || value == null) {
            return true;
        }
        for (String raw : types) {
            String type = raw.toLowerCase(Locale.ROOT);
            boolean ok = switch (type) {
                case "string", "text", "objectid" -> value instanceof CharSequence;
                case "int", "long", "integer" -> value instanceof Integer || value instanceof Long || value instanceof Short;
                case "double", "decimal", "number" -> value instanceof Number;
                case "bool", "boolean" -> value instanceof Boolean;
                case "date", "timestamp" -> value instanceof Date || value instanceof Temporal || value instanceof CharSequence;
                case "object" -> value instanceof Map;
                case "array" -> value instanceof Collection || value.getClass().isArray();
                case "null" -> false;
                default -> true;
            };
            if (ok) {
                return true;
            }
        }
        return false;
    }
}
