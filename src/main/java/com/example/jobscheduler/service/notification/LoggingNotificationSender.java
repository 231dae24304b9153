package com.example.jobscheduler.service.notification;

import com.example.jobscheduler.domain.entity.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sender used when no transport is deployed. A transport replaces it by
 * declaring its own {@code @Primary} bean.
 */
@Slf4j
@Component
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void send(Notification notification) {
        log.info("Sending notification {} to {}", notification.getId(), notification.getDestination());
    }
}
