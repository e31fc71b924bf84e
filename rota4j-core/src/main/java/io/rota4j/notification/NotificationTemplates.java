package io.rota4j.notification;

import java.util.Optional;

public interface NotificationTemplates {

    Optional<NotificationTemplate> find(String name);
}
