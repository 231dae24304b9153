package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.SchedulerJob;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Types;

/**
 * PostgreSQL implementation of {@link SchedulerJobUpsertRepository}. Runs on the connection
 * of the surrounding transaction.
 */
@RequiredArgsConstructor
public class SchedulerJobUpsertRepositoryImpl implements SchedulerJobUpsertRepository {

    private static final String UPSERT_SQL = """
            INSERT INTO scheduler_jobs (id, schedule, last_tick, next_tick, run_count, stopped, extra, last_updated)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id) DO UPDATE SET
                schedule = EXCLUDED.schedule,
                last_tick = EXCLUDED.last_tick,
                next_tick = EXCLUDED.next_tick,
                run_count = EXCLUDED.run_count,
                stopped = EXCLUDED.stopped,
                extra = EXCLUDED.extra,
                last_updated = EXCLUDED.last_updated
            """;

    private static final int[] UPSERT_TYPES = {
            Types.OTHER, Types.VARCHAR, Types.BIGINT, Types.BIGINT, Types.INTEGER, Types.BOOLEAN, Types.BINARY, Types.BIGINT
    };

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void upsert(SchedulerJob job) {
        jdbcTemplate.update(UPSERT_SQL, new Object[]{
                job.getId(),
                job.getSchedule(),
                job.getLastTick(),
                job.getNextTick(),
                job.getRunCount(),
                job.isStopped(),
                job.getExtra(),
                job.getLastUpdated()
        }, UPSERT_TYPES);
    }
}
