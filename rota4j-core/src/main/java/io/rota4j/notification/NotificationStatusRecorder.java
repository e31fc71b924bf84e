package io.rota4j.notification;

import java.util.List;
import java.util.Map;

public interface NotificationStatusRecorder {

    /**
     * At least one channel delivered.
     *
     * @param failed channel name to error message
     */
    void markSent(String notificationId, List<String> sent, Map<String, String> failed);

    void markFailed(String notificationId, String error);
}
