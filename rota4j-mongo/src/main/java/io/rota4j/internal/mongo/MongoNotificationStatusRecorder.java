package io.rota4j.internal.mongo;

import io.rota4j.notification.NotificationStatusRecorder;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Delivery status in {@code rota_notifications}, upserted by notification id.
 */
public class MongoNotificationStatusRecorder implements NotificationStatusRecorder {

    static final String COLLECTION = "rota_notifications";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoNotificationStatusRecorder(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoNotificationStatusRecorder(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void markSent(String notificationId, List<String> sent, Map<String, String> failed) {
        if (notificationId == null) {
            return;
        }
        Update u = new Update()
                .set("status", "sent")
                .set("channelsSent", sent == null ? List.of() : sent)
                .set("failedChannels", new Document(failed == null ? Map.of() : failed))
                .set("sentAt", Date.from(clock.instant()))
                .unset("error");
        mongoTemplate.upsert(byId(notificationId), u, COLLECTION);
    }

    @Override
    public void markFailed(String notificationId, String error) {
        if (notificationId == null) {
            return;
        }
        Update u = new Update()
                .set("status", "failed")
                .set("error", error)
                .set("failedAt", Date.from(clock.instant()));
        mongoTemplate.upsert(byId(notificationId), u, COLLECTION);
    }

    private static Query byId(String notificationId) {
        return new Query(Criteria.where("_id").is(notificationId));
    }
}
