package com.example.jobscheduler.service.notification;

import com.example.jobscheduler.domain.entity.Notification;

/**
 * Transport that delivers a notification, e.g. by email.
 */
public interface NotificationSender {

    /**
     * @throws Exception if the notification could not be delivered
     */
    void send(Notification notification) throws Exception;
}
