package io.rota4j.recurrence;

import java.util.Map;

/**
 * Live shape of an entity table.
 *
 * @param strict true when {@code columns} is authoritative; a schemaless table reports false
 *               and only explicitly declared columns are checked
 */
public record EntitySchema(
        String table,
        Map<String, EntityColumn> columns,
        boolean strict
) {
    public EntitySchema {
        columns = columns == null ? Map.of() : Map.copyOf(columns);
    }
}
