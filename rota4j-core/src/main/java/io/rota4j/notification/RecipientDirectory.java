package io.rota4j.notification;

import java.util.Optional;

/**
 * Looks up a recipient. Implementations fall back to the user's primary email
 * with the email channel enabled when no preferences are stored.
 */
public interface RecipientDirectory {

    Optional<Recipient> find(String userId);
}
