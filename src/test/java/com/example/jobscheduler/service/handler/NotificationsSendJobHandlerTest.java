package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.service.notification.NotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationsSendJobHandler Tests")
class NotificationsSendJobHandlerTest {

    @Mock
    private NotificationService notificationService;

    @Mock
    private SchedulerHandle scheduler;

    private JobSchedulerProperties properties;
    private NotificationsSendJobHandler handler;

    @BeforeEach
    void setUp() {
        properties = new JobSchedulerProperties();
        handler = new NotificationsSendJobHandler(notificationService, properties);
    }

    @Test
    @DisplayName("Should send at most the configured number of notifications per run")
    void shouldSendBoundedBatch() {
        // Given
        properties.setMaxNotificationsToSend(25);
        when(notificationService.sendPendingNotifications(25)).thenReturn(25);
        var context = new JobContext(UUID.randomUUID(), JobMetadata.of(SchedulerJobType.NOTIFICATIONS_SEND), scheduler);

        // When
        handler.execute(context);

        // Then
        verify(notificationService).sendPendingNotifications(25);
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("Should be a unique job on the configured schedule without retries")
    void shouldDescribeJob() {
        assertThat(handler.getJobType()).isEqualTo(SchedulerJobType.NOTIFICATIONS_SEND);
        assertThat(handler.getJobType().isUnique()).isTrue();
        assertThat(handler.getSchedule()).contains("0/30 * * * * *");
        assertThat(handler.getRetryStrategy()).isEmpty();
    }
}
