package io.rota4j.notification;

public record RenderedNotification(
        String subject,
        String body
) {
}
