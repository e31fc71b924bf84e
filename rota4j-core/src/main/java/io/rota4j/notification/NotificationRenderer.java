package io.rota4j.notification;

import java.util.Map;

@FunctionalInterface
public interface NotificationRenderer {

    RenderedNotification render(NotificationTemplate template, Map<String, Object> data) throws Exception;
}
