package com.example.jobscheduler.service.store;

import com.example.jobscheduler.codec.JobMetadataCodec;
import com.example.jobscheduler.domain.entity.SchedulerJob;
import com.example.jobscheduler.domain.repository.SchedulerJobRepository;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.exception.SchedulerStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerJobStore Tests")
class SchedulerJobStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private SchedulerJobRepository jobRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    private SchedulerJobStore jobStore;

    @BeforeEach
    void setUp() {
        jobStore = new SchedulerJobStore(jobRepository, new JobMetadataCodec(), transactionTemplate,
                Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(transactionTemplate.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(null);
        });
    }

    @Nested
    @DisplayName("Tick Rounding Tests")
    class TickRoundingTests {

        @Test
        @DisplayName("Should round a next tick with a fraction of a second up")
        void shouldRoundFractionalNextTickUp() {
            // Given
            var jobId = UUID.randomUUID();
            when(jobRepository.recordTick(eq(jobId), anyLong(), anyLong(), anyLong())).thenReturn(1);

            // When
            jobStore.recordTick(jobId, Instant.parse("2024-01-01T00:00:00.500Z"), Instant.parse("2024-01-01T00:00:01.900Z"));

            // Then
            verify(jobRepository).recordTick(jobId, NOW.getEpochSecond(), NOW.getEpochSecond() + 2, NOW.getEpochSecond());
        }

        @Test
        @DisplayName("Should keep a whole-second next tick as is")
        void shouldKeepWholeSecondNextTick() {
            var jobId = UUID.randomUUID();
            when(jobRepository.updateNextTick(eq(jobId), anyLong(), anyLong())).thenReturn(1);

            jobStore.updateNextTick(jobId, NOW.plusSeconds(60));

            verify(jobRepository).updateNextTick(jobId, NOW.getEpochSecond() + 60, NOW.getEpochSecond());
        }

        @Test
        @DisplayName("Should never make a sub-second retry due immediately")
        void shouldNotMakeSubSecondRetryDueImmediately() {
            assertThat(SchedulerJobStore.toTickSeconds(NOW.plusMillis(500))).isEqualTo(NOW.getEpochSecond() + 1);
            assertThat(SchedulerJobStore.toTickSeconds(NOW)).isEqualTo(NOW.getEpochSecond());
        }
    }

    @Nested
    @DisplayName("Write Tests")
    class WriteTests {

        @Test
        @DisplayName("Should upsert atomically and stamp the update time")
        void shouldUpsertAtomically() {
            var job = SchedulerJob.builder().id(UUID.randomUUID()).schedule("0 0 * * * *").build();

            jobStore.upsert(job);

            verify(jobRepository).upsert(job);
            verify(jobRepository, never()).save(any());
            assertThat(job.getLastUpdated()).isEqualTo(NOW.getEpochSecond());
        }

        @Test
        @DisplayName("Should report a missing job when recording a tick")
        void shouldReportMissingJobOnRecordTick() {
            var jobId = UUID.randomUUID();
            when(jobRepository.recordTick(eq(jobId), anyLong(), anyLong(), anyLong())).thenReturn(0);

            assertThatThrownBy(() -> jobStore.recordTick(jobId, NOW, NOW.plusSeconds(60)))
                    .isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("Should wrap persistence failures")
        void shouldWrapPersistenceFailures() {
            var job = SchedulerJob.builder().id(UUID.randomUUID()).build();
            doThrow(new DataIntegrityViolationException("constraint")).when(jobRepository).upsert(job);

            assertThatThrownBy(() -> jobStore.upsert(job))
                    .isInstanceOf(SchedulerStoreException.class)
                    .hasFieldOrPropertyWithValue("operation", "upsert");
        }
    }
}
