package io.rota4j.notification;

/**
 * One delivery transport, e.g. email or sms.
 */
public interface NotificationChannel {

    String name();

    void send(Recipient recipient, RenderedNotification message) throws Exception;
}
