package com.example.jobscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored state of a scheduler job.
 * <p>
 * The scheduling fields are generic. What the job does and its retry bookkeeping live in
 * {@link #extra}, written and read only through the job metadata codec.
 * Ticks are stored as epoch seconds.
 */
@Entity
@Table(name = "scheduler_jobs", indexes = {
        @Index(name = "idx_scheduler_jobs_next_tick", columnList = "next_tick, id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchedulerJob {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Six-field cron expression
     */
    @Column(name = "schedule", columnDefinition = "TEXT")
    private String schedule;

    /**
     * Last time the job fired, null until it ran once
     */
    @Column(name = "last_tick")
    private Long lastTick;

    /**
     * Next time the job is due, null until computed
     */
    @Column(name = "next_tick")
    private Long nextTick;

    @Column(name = "run_count", nullable = false)
    @Builder.Default
    private int runCount = 0;

    /**
     * Stopped jobs stay in storage but are never dispatched
     */
    @Column(name = "stopped", nullable = false)
    @Builder.Default
    private boolean stopped = false;

    /**
     * Encoded job metadata
     */
    @Column(name = "extra")
    private byte[] extra;

    @Column(name = "last_updated", nullable = false)
    private Long lastUpdated;

    // === Helper Methods ===

    public Instant getLastTickInstant() {
        return lastTick != null ? Instant.ofEpochSecond(lastTick) : null;
    }

    public Instant getNextTickInstant() {
        return nextTick != null ? Instant.ofEpochSecond(nextTick) : null;
    }
}
