package io.rota4j.internal.mongo;

import io.rota4j.recurrence.EntityColumn;
import io.rota4j.recurrence.EntitySchema;
import io.rota4j.recurrence.EntitySchemaInspector;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads an entity collection's shape from its {@code $jsonSchema} validator.
 *
 * <p>Property types come from {@code bsonType} (a string or a list), falling back to {@code type}.
 * The schema is strict only when the validator sets {@code additionalProperties: false}.
 * A collection without a validator is reported as schemaless.</p>
 *
 * <pre>
 * db.createCollection("bookings", {
 *   validator: { $jsonSchema: {
 *     required: ["room_id"],
 *     properties: { room_id: { bsonType: "string" }, capacity: { bsonType: ["int", "long"] } }
 *   } }
 * })
 * </pre>
 */
public class MongoEntitySchemaInspector implements EntitySchemaInspector {

    private final MongoTemplate mongoTemplate;

    public MongoEntitySchemaInspector(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<EntitySchema> describe(String entityTable) {
        Objects.requireNonNull(entityTable, "entityTable must not be null");

        Document info = mongoTemplate.getDb()
                .listCollections()
                .filter(new Document("name", entityTable))
                .first();
        if (info == null) {
            return Optional.empty();
        }

        Document options = info.get("options", Document.class);
        Document validator = options == null ? null : options.get("validator", Document.class);
        Document jsonSchema = validator == null ? null : validator.get("$jsonSchema", Document.class);
        if (jsonSchema == null) {
            return Optional.of(new EntitySchema(entityTable, Map.of(), false));
        }
        return Optional.of(parse(entityTable, jsonSchema));
    }

    static EntitySchema parse(String entityTable, Document jsonSchema) {
        Set<String> required = new HashSet<>();
        Object req = jsonSchema.get("required");
        if (req instanceof Collection<?> names) {
            names.forEach(n -> required.add(String.valueOf(n)));
        }

        Map<String, EntityColumn> columns = new HashMap<>();
        Document properties = jsonSchema.get("properties", Document.class);
        if (properties != null) {
            for (Map.Entry<String, Object> e : properties.entrySet()) {
                Set<String> types = e.getValue() instanceof Document prop ? typesOf(prop) : Set.of();
                columns.put(e.getKey(), new EntityColumn(e.getKey(), types, required.contains(e.getKey()), false));
            }
        }
        // required without a declared property
        for (String name : required) {
            columns.putIfAbsent(name, new EntityColumn(name, Set.of(), true, false));
        }

        boolean strict = Boolean.FALSE.equals(jsonSchema.get("additionalProperties"));
        return new EntitySchema(entityTable, columns, strict);
    }

    private static Set<String> typesOf(Document prop) {
        Object raw = prop.containsKey("bsonType") ? prop.get("bsonType") : prop.get("type");
        Set<String> types = new LinkedHashSet<>();
        if (raw instanceof String s) {
            types.add(s);
        } else if (raw instanceof List<?> list) {
            list.forEach(t -> types.add(String.valueOf(t)));
        }
        return types;
    }
}
