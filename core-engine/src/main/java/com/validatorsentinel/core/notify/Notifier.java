package com.validatorsentinel.core.notify;

import com.validatorsentinel.core.model.Notification;

/**
 * Delivers a notification to one audience.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Notifier {

    /**
     * @param notification the notification to deliver
     * @throws RuntimeException if delivery failed; callers log and continue
     */
    void send(Notification notification);
}
