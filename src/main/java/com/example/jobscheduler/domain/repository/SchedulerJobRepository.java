package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.SchedulerJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for SchedulerJob entity.
 * <p>
 * Every query that walks over many jobs uses keyset pagination, so concurrent inserts
 * never shift or duplicate rows between pages. Upserts come from {@link SchedulerJobUpsertRepository}.
 */
@Repository
public interface SchedulerJobRepository extends JpaRepository<SchedulerJob, UUID>, SchedulerJobUpsertRepository {

    /**
     * Load a job and hold a row lock until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM SchedulerJob j WHERE j.id = :id")
    Optional<SchedulerJob> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Replace the metadata blob only, leaving schedule fields untouched.
     *
     * @return number of rows updated (0 if the job does not exist)
     */
    @Modifying
    @Query("UPDATE SchedulerJob j SET j.extra = :extra, j.lastUpdated = :now WHERE j.id = :id")
    int updateExtra(@Param("id") UUID id, @Param("extra") byte[] extra, @Param("now") long now);

    /**
     * Record a run of the job.
     */
    @Modifying
    @Query("""
            UPDATE SchedulerJob j
            SET j.lastTick = :lastTick,
                j.nextTick = :nextTick,
                j.runCount = j.runCount + 1,
                j.lastUpdated = :now
            WHERE j.id = :id
            """)
    int recordTick(@Param("id") UUID id, @Param("lastTick") long lastTick, @Param("nextTick") long nextTick, @Param("now") long now);

    @Modifying
    @Query("UPDATE SchedulerJob j SET j.nextTick = :nextTick, j.lastUpdated = :now WHERE j.id = :id")
    int updateNextTick(@Param("id") UUID id, @Param("nextTick") long nextTick, @Param("now") long now);

    @Modifying
    @Query("UPDATE SchedulerJob j SET j.stopped = true, j.lastUpdated = :now WHERE j.id = :id")
    int markStopped(@Param("id") UUID id, @Param("now") long now);

    @Modifying
    @Query("DELETE FROM SchedulerJob j WHERE j.id = :id")
    int deleteJob(@Param("id") UUID id);

    /**
     * First page of due jobs, ordered by (next tick, id).
     */
    @Query("""
            SELECT j.id, j.nextTick FROM SchedulerJob j
            WHERE j.stopped = false
              AND j.nextTick <= :timestamp
            ORDER BY j.nextTick ASC, j.id ASC
            """)
    List<Object[]> findDue(@Param("timestamp") long timestamp, Pageable pageable);

    /**
     * Next page of due jobs, strictly after the (next tick, id) cursor.
     */
    @Query("""
            SELECT j.id, j.nextTick FROM SchedulerJob j
            WHERE j.stopped = false
              AND j.nextTick <= :timestamp
              AND (j.nextTick > :lastNextTick OR (j.nextTick = :lastNextTick AND j.id > :lastId))
            ORDER BY j.nextTick ASC, j.id ASC
            """)
    List<Object[]> findDueAfter(@Param("timestamp") long timestamp,
                                @Param("lastNextTick") long lastNextTick,
                                @Param("lastId") UUID lastId,
                                Pageable pageable);

    @Query("SELECT j FROM SchedulerJob j ORDER BY j.id ASC")
    List<SchedulerJob> findFirstPage(Pageable pageable);

    @Query("SELECT j FROM SchedulerJob j WHERE j.id > :lastId ORDER BY j.id ASC")
    List<SchedulerJob> findPageAfter(@Param("lastId") UUID lastId, Pageable pageable);

    long countByStoppedTrue();
}
