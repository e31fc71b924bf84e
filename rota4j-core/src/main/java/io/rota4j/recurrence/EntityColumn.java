package io.rota4j.recurrence;

import java.util.Set;

/**
 * @param types    accepted value types as reported by the store (e.g. "string", "int", "date"); empty means any
 * @param required the store rejects records without this field
 */
public record EntityColumn(
        String name,
        Set<String> types,
        boolean required,
        boolean hasDefault
) {
    public EntityColumn {
        types = types == null ? Set.of() : Set.copyOf(types);
    }
}
