package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.exception.SchedulerStoreException;
import com.example.jobscheduler.service.lifecycle.ExecutionOutcome;
import com.example.jobscheduler.service.lifecycle.JobLifecycleService;
import com.example.jobscheduler.service.store.SchedulerJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerTickService Tests")
class SchedulerTickServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private SchedulerJobStore jobStore;

    @Mock
    private JobLifecycleService lifecycleService;

    private ExecutorService executor;
    private SchedulerTickService tickService;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        tickService = new SchedulerTickService(jobStore, lifecycleService, new JobSchedulerProperties(), executor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Tick Tests")
    class TickTests {

        @Test
        @DisplayName("Should execute every due job")
        void shouldExecuteDueJobs() {
            // Given
            var first = UUID.randomUUID();
            var second = UUID.randomUUID();
            when(jobStore.dueBefore(eq(NOW), anyInt())).thenReturn(Stream.of(first, second));
            when(lifecycleService.execute(any())).thenReturn(ExecutionOutcome.SUCCEEDED);

            // When
            tickService.tick();

            // Then
            verify(lifecycleService, timeout(1000)).execute(first);
            verify(lifecycleService, timeout(1000)).execute(second);
        }

        @Test
        @DisplayName("Should do nothing when no job is due")
        void shouldDoNothingWhenNothingDue() {
            when(jobStore.dueBefore(eq(NOW), anyInt())).thenReturn(Stream.empty());

            tickService.tick();

            verifyNoInteractions(lifecycleService);
            assertThat(tickService.getInFlightCount()).isZero();
        }

        @Test
        @DisplayName("Should survive a store failure and tick again later")
        void shouldSurviveStoreFailure() {
            // Given
            var jobId = UUID.randomUUID();
            when(jobStore.dueBefore(eq(NOW), anyInt()))
                    .thenThrow(new SchedulerStoreException("dueBefore", new QueryTimeoutException("timeout")))
                    .thenReturn(Stream.of(jobId));
            when(lifecycleService.execute(jobId)).thenReturn(ExecutionOutcome.SUCCEEDED);

            // When
            assertThatCode(() -> tickService.tick()).doesNotThrowAnyException();
            tickService.tick();

            // Then
            verify(lifecycleService, timeout(1000)).execute(jobId);
        }
    }

    @Nested
    @DisplayName("Dispatch Tests")
    class DispatchTests {

        @Test
        @DisplayName("Should not dispatch a job that is still running")
        void shouldSkipJobStillRunning() throws Exception {
            // Given
            var jobId = UUID.randomUUID();
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            when(lifecycleService.execute(jobId)).thenAnswer(invocation -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return ExecutionOutcome.SUCCEEDED;
            });

            // When
            assertThat(tickService.dispatch(jobId)).isTrue();
            assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
            var secondDispatch = tickService.dispatch(jobId);
            release.countDown();

            // Then
            assertThat(secondDispatch).isFalse();
            verify(lifecycleService, timeout(1000).times(1)).execute(jobId);
        }

        @Test
        @DisplayName("Should free the slot of a job once it finished, even when it threw")
        void shouldFreeSlotAfterFailure() {
            var jobId = UUID.randomUUID();
            when(lifecycleService.execute(jobId))
                    .thenThrow(new SchedulerStoreException("recordTick", new QueryTimeoutException("timeout")))
                    .thenReturn(ExecutionOutcome.SUCCEEDED);

            assertThat(tickService.dispatch(jobId)).isTrue();
            verify(lifecycleService, timeout(1000)).execute(jobId);
            await(() -> tickService.getInFlightCount() == 0);

            assertThat(tickService.dispatch(jobId)).isTrue();
            verify(lifecycleService, timeout(1000).times(2)).execute(jobId);
        }

        @Test
        @DisplayName("Should free the slot of a job whose execution threw an error")
        void shouldFreeSlotAfterError() {
            var jobId = UUID.randomUUID();
            when(lifecycleService.execute(jobId))
                    .thenThrow(new AssertionError("broken library"))
                    .thenReturn(ExecutionOutcome.SUCCEEDED);

            assertThat(tickService.dispatch(jobId)).isTrue();
            verify(lifecycleService, timeout(1000)).execute(jobId);
            await(() -> tickService.getInFlightCount() == 0);

            assertThat(tickService.dispatch(jobId)).isTrue();
            verify(lifecycleService, timeout(1000).times(2)).execute(jobId);
        }

        @Test
        @DisplayName("Should leave a job due when the executor rejects it")
        void shouldHandleRejectedJob() {
            executor.shutdown();

            assertThat(tickService.dispatch(UUID.randomUUID())).isFalse();
            assertThat(tickService.getInFlightCount()).isZero();
        }
    }

    private static void await(java.util.function.BooleanSupplier condition) {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }
}
