package com.example.jobscheduler.service.lifecycle;

import com.example.jobscheduler.codec.JobMetadataCodec;
import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.entity.SchedulerJob;
import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.handler.JobHandlerRegistry;
import com.example.jobscheduler.service.handler.RecordingJobHandler;
import com.example.jobscheduler.service.schedule.ScheduleAnalyzer;
import com.example.jobscheduler.service.store.SchedulerJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerJobBootstrap Tests")
class SchedulerJobBootstrapTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final String EVERY_30_SECONDS = "0/30 * * * * *";
    private static final String DAILY = "0 0 0 * * *";

    @Mock
    private SchedulerJobStore jobStore;

    @Mock
    private JobLifecycleService lifecycleService;

    private final JobMetadataCodec codec = new JobMetadataCodec();
    private final JobSchedulerProperties properties = new JobSchedulerProperties();
    private final ScheduleAnalyzer scheduleAnalyzer = new ScheduleAnalyzer(Clock.fixed(NOW, ZoneOffset.UTC), properties);

    @BeforeEach
    void setUp() {
        lenient().when(jobStore.decodeMetadata(any())).thenAnswer(invocation -> {
            SchedulerJob job = invocation.getArgument(0);
            return codec.decode(job.getExtra());
        });
    }

    private SchedulerJobBootstrap bootstrapWith(JobHandler... handlers) {
        var registry = new JobHandlerRegistry(List.of(handlers));
        registry.initialize();
        return new SchedulerJobBootstrap(jobStore, registry, lifecycleService, scheduleAnalyzer, properties);
    }

    private SchedulerJob storedJob(SchedulerJobType type, String schedule) {
        return SchedulerJob.builder()
                .id(UUID.randomUUID())
                .schedule(schedule)
                .nextTick(NOW.getEpochSecond())
                .extra(codec.encode(JobMetadata.of(type)))
                .lastUpdated(NOW.getEpochSecond())
                .build();
    }

    private void givenStoredJobs(SchedulerJob... jobs) {
        when(jobStore.all(anyInt())).thenReturn(Stream.of(jobs));
    }

    @Test
    @DisplayName("Should create configured unique jobs on a fresh store")
    void shouldCreateUniqueJobsOnFreshStore() {
        // Given
        givenStoredJobs();
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS, null));

        // When
        bootstrap.start();

        // Then
        verify(lifecycleService).create(new SchedulerJobDefinition(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS));
        assertThat(bootstrap.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should resume a stored unique job instead of creating another one")
    void shouldResumeStoredUniqueJob() {
        // Given
        var stored = storedJob(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS);
        givenStoredJobs(stored);
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS, null));

        // When
        bootstrap.start();

        // Then
        verify(lifecycleService).resumeOrReplace(stored, JobMetadata.of(SchedulerJobType.NOTIFICATIONS_SEND),
                new SchedulerJobDefinition(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS));
        verify(lifecycleService, never()).create(any());
    }

    @Test
    @DisplayName("Should remove duplicates of a unique job type")
    void shouldRemoveDuplicateUniqueJobs() {
        var first = storedJob(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS);
        var duplicate = storedJob(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS);
        givenStoredJobs(first, duplicate);
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS, null));

        bootstrap.start();

        verify(lifecycleService).resumeOrReplace(eq(first), any(), any());
        verify(jobStore).remove(duplicate.getId());
        verify(jobStore, never()).remove(first.getId());
    }

    @Test
    @DisplayName("Should remove jobs whose type has no handler")
    void shouldRemoveJobsWithoutHandler() {
        var orphan = storedJob(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, DAILY);
        givenStoredJobs(orphan);
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS, null));

        bootstrap.start();

        verify(jobStore).remove(orphan.getId());
        verify(lifecycleService, never()).resumeOrReplace(eq(orphan), any(), any());
    }

    @Test
    @DisplayName("Should stop a job with unreadable metadata and keep going")
    void shouldStopJobWithCorruptMetadata() {
        var corrupt = storedJob(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS);
        corrupt.setExtra(new byte[]{0, 7});
        givenStoredJobs(corrupt);
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS, null));

        bootstrap.start();

        verify(jobStore).stop(corrupt.getId());
        verify(lifecycleService).create(new SchedulerJobDefinition(SchedulerJobType.NOTIFICATIONS_SEND, EVERY_30_SECONDS));
        assertThat(bootstrap.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should resume on-demand jobs with their own schedule")
    void shouldResumeOnDemandJobs() {
        var tracker = storedJob(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, DAILY);
        givenStoredJobs(tracker);
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, null, null));

        bootstrap.start();

        verify(lifecycleService).resumeOrReplace(tracker, JobMetadata.of(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER),
                new SchedulerJobDefinition(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, DAILY));
        verify(lifecycleService, never()).create(any());
    }

    @Test
    @DisplayName("Should stop on-demand jobs with an invalid schedule")
    void shouldStopOnDemandJobWithInvalidSchedule() {
        var tracker = storedJob(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, "not a cron");
        givenStoredJobs(tracker);
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, null, null));

        bootstrap.start();

        verify(jobStore).stop(tracker.getId());
        verify(lifecycleService, never()).resumeOrReplace(any(), any(), any());
    }

    @Test
    @DisplayName("Should leave stopped jobs untouched")
    void shouldLeaveStoppedJobsUntouched() {
        var stopped = storedJob(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, DAILY);
        stopped.setStopped(true);
        givenStoredJobs(stopped);
        var bootstrap = bootstrapWith(new RecordingJobHandler(SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER, null, null));

        bootstrap.start();

        verify(jobStore, never()).stop(any());
        verify(jobStore, never()).remove(any());
        verifyNoInteractions(lifecycleService);
    }

    @Test
    @DisplayName("Should run after every other lifecycle bean")
    void shouldRunInLastPhase() {
        assertThat(bootstrapWith().getPhase()).isEqualTo(Integer.MAX_VALUE);
    }
}
