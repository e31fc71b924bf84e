package io.rota4j.internal.mongo;

import io.rota4j.notification.Recipient;
import io.rota4j.notification.RecipientDirectory;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads preferences from {@code rota_notification_preferences} ({@code {_id: userId, email, phone, channels}}).
 * A user with no preferences is reached by the {@code email} of their document in the users collection,
 * over the email channel only.
 */
public class MongoRecipientDirectory implements RecipientDirectory {

    static final String PREFERENCES = "rota_notification_preferences";

    private final MongoTemplate mongoTemplate;
    private final String usersCollection;

    public MongoRecipientDirectory(MongoTemplate mongoTemplate, String usersCollection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection must not be null");
    }

    @Override
    public Optional<Recipient> find(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }

        Document prefs = mongoTemplate.findOne(byId(userId), Document.class, PREFERENCES);
        if (prefs != null) {
            return Optional.of(new Recipient(
                    userId,
                    prefs.getString("email"),
                    prefs.getString("phone"),
                    channels(prefs.get("channels"))
            ));
        }

        Document user = mongoTemplate.findOne(byId(userId), Document.class, usersCollection);
        if (user == null || user.getString("email") == null) {
            return Optional.empty();
        }
        return Optional.of(new Recipient(userId, user.getString("email"), user.getString("phone"), Set.of("email")));
    }

    private static Query byId(String userId) {
        return new Query(Criteria.where("_id").is(userId));
    }

    private static Set<String> channels(Object raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw instanceof List<?> list) {
            list.forEach(c -> out.add(String.valueOf(c)));
        }
        return out;
    }
}
