package com.example.jobscheduler.service.schedule;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.model.ScheduleInfo;
import com.example.jobscheduler.exception.PolicyViolationException;
import com.example.jobscheduler.exception.ScheduleParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Analyzes six-field cron expressions (seconds first, UTC).
 * <p>
 * Day-of-month and day-of-week must both match for a date to fire. Macros such as
 * {@code @hourly} or {@code @weekly} are accepted.
 * <p>
 * The minimum interval is computed empirically from the next {@value #MIN_INTERVAL_SAMPLES}
 * occurrences. For sparse, irregular schedules this can overestimate the true minimum.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleAnalyzer {

    static final int MIN_INTERVAL_SAMPLES = 100;

    private final Clock clock;
    private final JobSchedulerProperties properties;

    /**
     * Parse a cron expression.
     *
     * @throws ScheduleParseException if the expression is malformed
     */
    public CronExpression parse(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new ScheduleParseException(String.valueOf(schedule), "schedule must not be blank");
        }

        try {
            return CronExpression.parse(schedule.trim());
        } catch (IllegalArgumentException e) {
            throw new ScheduleParseException(schedule, e);
        }
    }

    /**
     * Smallest delta between consecutive occurrences among the next 100 occurrences from now.
     *
     * @throws ScheduleParseException if the expression is malformed or fires fewer than twice
     */
    public Duration minInterval(String schedule) {
        var occurrences = upcoming(schedule, MIN_INTERVAL_SAMPLES).toList();
        if (occurrences.size() < 2) {
            throw new ScheduleParseException(schedule, "schedule does not have enough upcoming occurrences");
        }

        Duration minInterval = null;
        for (var i = 1; i < occurrences.size(); i++) {
            var delta = Duration.between(occurrences.get(i - 1), occurrences.get(i));
            if (minInterval == null || delta.compareTo(minInterval) < 0) {
                minInterval = delta;
            }
        }
        return minInterval;
    }

    /**
     * Lazy sequence of at most {@code count} upcoming fire times, starting from the current time.
     */
    public Stream<Instant> upcoming(String schedule, int count) {
        var cron = parse(schedule);
        var now = ZonedDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        return Stream.iterate(cron.next(now), Objects::nonNull, cron::next)
                .limit(count)
                .map(ZonedDateTime::toInstant);
    }

    /**
     * Next fire time strictly after the given instant.
     */
    public Optional<Instant> next(String schedule, Instant after) {
        var next = parse(schedule).next(ZonedDateTime.ofInstant(after, ZoneOffset.UTC));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    /**
     * Minimum interval and the configured number of upcoming occurrences.
     */
    public ScheduleInfo parseSchedule(String schedule) {
        var minInterval = minInterval(schedule);
        var nextOccurrences = upcoming(schedule, properties.getUpcomingOccurrences()).toList();

        log.debug("Parsed schedule '{}': min interval {}, next occurrences {}", schedule, minInterval, nextOccurrences);

        return new ScheduleInfo(minInterval, nextOccurrences);
    }

    /**
     * Parse a user supplied schedule and check it against the configured minimum interval.
     *
     * @throws PolicyViolationException if the schedule fires more often than allowed
     */
    public ScheduleInfo validateSchedule(String schedule) {
        var info = parseSchedule(schedule);
        var minAllowed = properties.getMinScheduleInterval();
        if (info.getMinInterval().compareTo(minAllowed) < 0) {
            throw new PolicyViolationException(String.format(
                    "The minimum interval between occurrences should be greater than %s, but got %s",
                    formatDuration(minAllowed), formatDuration(info.getMinInterval())));
        }
        return info;
    }

    private static String formatDuration(Duration duration) {
        return duration.toString().substring(2).toLowerCase();
    }
}
