package io.rota4j.notification;

import java.util.Set;

/**
 * Delivery addresses and channel preferences of a user.
 *
 * @param enabledChannels channels the user accepts
 */
public record Recipient(
        String userId,
        String email,
        String phone,
        Set<String> enabledChannels
) {
    public Recipient {
        enabledChannels = enabledChannels == null ? Set.of() : Set.copyOf(enabledChannels);
    }
}
