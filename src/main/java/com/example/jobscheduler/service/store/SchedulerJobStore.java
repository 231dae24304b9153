package com.example.jobscheduler.service.store;

import com.example.jobscheduler.codec.JobMetadataCodec;
import com.example.jobscheduler.domain.entity.SchedulerJob;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.domain.repository.SchedulerJobRepository;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.exception.MetadataDeserializationException;
import com.example.jobscheduler.exception.SchedulerStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Durable store of scheduler jobs.
 * <p>
 * Each operation runs in its own short transaction. Persistence failures are wrapped in
 * {@link SchedulerStoreException} and propagate to the caller. Metadata is only ever read
 * and written through {@link JobMetadataCodec}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerJobStore {

    private final SchedulerJobRepository jobRepository;
    private final JobMetadataCodec metadataCodec;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Insert the job, or atomically replace all stored fields of the job with the same id.
     */
    public void upsert(SchedulerJob job) {
        job.setLastUpdated(clock.instant().getEpochSecond());
        inTransaction("upsert", () -> {
            jobRepository.upsert(job);
            return null;
        });
        log.debug("Upserted scheduler job {}", job.getId());
    }

    public Optional<SchedulerJob> get(UUID jobId) {
        return execute("get", () -> jobRepository.findById(jobId));
    }

    /**
     * Decoded metadata of the job, empty if the job does not exist or carries none.
     *
     * @throws MetadataDeserializationException if the stored blob is corrupt
     */
    public Optional<JobMetadata> getMetadata(UUID jobId) {
        return get(jobId)
                .map(SchedulerJob::getExtra)
                .map(metadataCodec::decode);
    }

    /**
     * Persist new metadata without touching the schedule fields.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public void updateMetadata(UUID jobId, JobMetadata metadata) {
        var extra = metadataCodec.encode(metadata);
        var updated = inTransaction("updateMetadata",
                () -> jobRepository.updateExtra(jobId, extra, clock.instant().getEpochSecond()));
        if (updated == 0) {
            throw new JobNotFoundException(jobId);
        }
    }

    /**
     * Read-modify-write of the job metadata while holding a row lock, so concurrent
     * modifications of the same job are serialized.
     *
     * @return the metadata that was persisted
     * @throws JobNotFoundException if the job does not exist or has no metadata
     */
    public JobMetadata modifyMetadata(UUID jobId, UnaryOperator<JobMetadata> modifier) {
        return inTransaction("modifyMetadata", () -> {
            var job = jobRepository.findByIdForUpdate(jobId)
                    .filter(found -> found.getExtra() != null)
                    .orElseThrow(() -> new JobNotFoundException(jobId));

            var updated = modifier.apply(metadataCodec.decode(job.getExtra()));
            job.setExtra(metadataCodec.encode(updated));
            job.setLastUpdated(clock.instant().getEpochSecond());
            return updated;
        });
    }

    /**
     * Record a run: set both ticks and increment the run count. A next tick with a fraction
     * of a second is rounded up, so the job never becomes due before that instant.
     */
    public void recordTick(UUID jobId, Instant lastTick, Instant nextTick) {
        var updated = inTransaction("recordTick", () -> jobRepository.recordTick(
                jobId, lastTick.getEpochSecond(), toTickSeconds(nextTick), clock.instant().getEpochSecond()));
        if (updated == 0) {
            throw new JobNotFoundException(jobId);
        }
    }

    public void updateNextTick(UUID jobId, Instant nextTick) {
        var updated = inTransaction("updateNextTick",
                () -> jobRepository.updateNextTick(jobId, toTickSeconds(nextTick), clock.instant().getEpochSecond()));
        if (updated == 0) {
            throw new JobNotFoundException(jobId);
        }
    }

    /**
     * Keep the job in storage but never dispatch it again.
     */
    public void stop(UUID jobId) {
        var updated = inTransaction("stop", () -> jobRepository.markStopped(jobId, clock.instant().getEpochSecond()));
        if (updated == 0) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Stopped scheduler job {}", jobId);
    }

    /**
     * @return true if a job was removed
     */
    public boolean remove(UUID jobId) {
        var removed = inTransaction("remove", () -> jobRepository.deleteJob(jobId)) > 0;
        if (removed) {
            log.info("Removed scheduler job {}", jobId);
        }
        return removed;
    }

    /**
     * Lazy cursor over ids of non-stopped jobs with {@code next_tick <= timestamp}, ordered by
     * (next tick, id). Each page is fetched in its own query, keyed by the last row seen.
     */
    public Stream<UUID> dueBefore(Instant timestamp, int pageSize) {
        var epochSecond = timestamp.getEpochSecond();
        var page = PageRequest.of(0, pageSize);

        return KeysetPager.<Object[]>stream(cursor -> execute("dueBefore", () -> cursor == null
                        ? jobRepository.findDue(epochSecond, page)
                        : jobRepository.findDueAfter(epochSecond, (Long) cursor[1], (UUID) cursor[0], page)), pageSize)
                .map(row -> (UUID) row[0]);
    }

    /**
     * Lazy cursor over every stored job ordered by id.
     */
    public Stream<SchedulerJob> all(int pageSize) {
        var page = PageRequest.of(0, pageSize);

        return KeysetPager.<SchedulerJob>stream(cursor -> execute("all", () -> cursor == null
                ? jobRepository.findFirstPage(page)
                : jobRepository.findPageAfter(cursor.getId(), page)), pageSize);
    }

    /**
     * @throws MetadataDeserializationException if the job carries no metadata or the blob is corrupt
     */
    public JobMetadata decodeMetadata(SchedulerJob job) {
        if (job.getExtra() == null) {
            throw new MetadataDeserializationException("job " + job.getId() + " has no metadata");
        }
        return metadataCodec.decode(job.getExtra());
    }

    public byte[] encodeMetadata(JobMetadata metadata) {
        return metadataCodec.encode(metadata);
    }

    static long toTickSeconds(Instant instant) {
        return instant.getNano() > 0 ? instant.getEpochSecond() + 1 : instant.getEpochSecond();
    }

    private <T> T inTransaction(String operation, Supplier<T> action) {
        return execute(operation, () -> transactionTemplate.execute(status -> action.get()));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Job store operation '{}' failed: {}", operation, e.getMessage());
            throw new SchedulerStoreException(operation, e);
        }
    }
}
