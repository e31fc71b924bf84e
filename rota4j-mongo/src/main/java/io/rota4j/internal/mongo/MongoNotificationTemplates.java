package io.rota4j.internal.mongo;

import io.rota4j.notification.NotificationTemplate;
import io.rota4j.notification.NotificationTemplates;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Objects;
import java.util.Optional;

/**
 * Templates in {@code rota_notification_templates}, looked up by {@code name}.
 */
public class MongoNotificationTemplates implements NotificationTemplates {

    static final String COLLECTION = "rota_notification_templates";

    private final MongoTemplate mongoTemplate;

    public MongoNotificationTemplates(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<NotificationTemplate> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        Document doc = mongoTemplate.findOne(new Query(Criteria.where("name").is(name)), Document.class, COLLECTION);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new NotificationTemplate(name, doc.getString("subject"), doc.getString("body")));
    }

    public void save(NotificationTemplate template) {
        Objects.requireNonNull(template, "template must not be null");
        Document doc = new Document("name", template.name())
                .append("subject", template.subject())
                .append("body", template.body());
        mongoTemplate.remove(new Query(Criteria.where("name").is(template.name())), COLLECTION);
        mongoTemplate.insert(doc, COLLECTION);
    }
}
