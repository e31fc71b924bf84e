package io.rota4j.notification;

public record NotificationTemplate(
        String name,
        String subject,
        String body
) {
}
