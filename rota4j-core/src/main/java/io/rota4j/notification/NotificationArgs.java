package io.rota4j.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Payload of a {@code send_notification} job.
 *
 * @param channels requested channels; null or empty means the recipient's enabled channels
 */
public record NotificationArgs(
        @JsonProperty("notification_id") String notificationId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("template_name") String templateName,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("entity_data") Map<String, Object> entityData,
        @JsonProperty("channels") List<String> channels
) {
}
