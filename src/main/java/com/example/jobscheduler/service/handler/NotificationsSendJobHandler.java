package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.service.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Sends pending notifications, at most a configured number per run so a single run
 * stays bounded in time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationsSendJobHandler implements JobHandler {

    private final NotificationService notificationService;
    private final JobSchedulerProperties properties;

    @Override
    public SchedulerJobType getJobType() {
        return SchedulerJobType.NOTIFICATIONS_SEND;
    }

    @Override
    public void execute(JobContext context) {
        var sent = notificationService.sendPendingNotifications(properties.getMaxNotificationsToSend());
        if (sent > 0) {
            log.info("Sent {} pending notifications (job {})", sent, context.getJobId());
        } else {
            log.debug("No pending notifications to send (job {})", context.getJobId());
        }
    }

    @Override
    public Optional<String> getSchedule() {
        return Optional.of(properties.getNotificationsSendSchedule());
    }
}
