package com.example.jobscheduler.service.notification;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.Notification;
import com.example.jobscheduler.domain.repository.NotificationRepository;
import com.example.jobscheduler.service.store.KeysetPager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Stores notifications and sends the ones whose time has come.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final NotificationSender notificationSender;
    private final JobSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Store a notification to be sent at or after the given time.
     */
    public Notification scheduleNotification(String destination, String content, Instant scheduledAt) {
        var notification = notificationRepository.save(Notification.builder()
                .destination(destination)
                .content(content)
                .scheduledAt(scheduledAt)
                .build());

        log.debug("Scheduled notification {} for {}", notification.getId(), scheduledAt);
        return notification;
    }

    /**
     * Send up to {@code limit} notifications that are due, oldest first. Each sent
     * notification is removed. A notification that fails to send is logged and kept for
     * the next run.
     *
     * @return number of notifications sent
     */
    public int sendPendingNotifications(int limit) {
        if (limit <= 0) {
            return 0;
        }

        var now = clock.instant();
        var pageSize = Math.min(properties.getNotificationsPageSize(), limit);
        var page = PageRequest.of(0, pageSize);

        var pending = KeysetPager.<Notification>stream(cursor -> cursor == null
                ? notificationRepository.findDue(now, page)
                : notificationRepository.findDueAfter(now, cursor.getScheduledAt(), cursor.getId(), page), pageSize)
                .iterator();

        var sent = 0;
        while (sent < limit && pending.hasNext()) {
            var notification = pending.next();
            try {
                notificationSender.send(notification);
            } catch (Exception e) {
                log.error("Failed to send notification {}: {}", notification.getId(), e.getMessage(), e);
                continue;
            }

            notificationRepository.deleteById(notification.getId());
            sent++;
        }

        if (sent > 0) {
            metricsConfig.recordNotificationsSent(sent);
        }
        return sent;
    }
}
