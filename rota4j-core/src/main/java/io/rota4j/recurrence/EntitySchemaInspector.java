package io.rota4j.recurrence;

import java.util.Optional;

public interface EntitySchemaInspector {

    /**
     * @return the table's current schema, or empty if the table does not exist
     */
    Optional<EntitySchema> describe(String entityTable);
}
