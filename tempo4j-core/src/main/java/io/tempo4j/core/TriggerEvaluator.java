package io.tempo4j.core;

import io.tempo4j.utils.ScheduleParser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Decides when a job is due.
 *
 * <p>Due-ness is recomputed from {@code lastExecution} and the schedule on every call, so a stale
 * {@code nextExecution} left behind by a previous process can only ever make a job run earlier (a manual
 * trigger) but never hold it back. The one exception is a pending retry, whose {@code nextExecution} is
 * honoured as-is until it fires.
 */
public class TriggerEvaluator {

    private final ZoneId defaultZone;

    public TriggerEvaluator(ZoneId defaultZone) {
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    public TriggerEvaluator(String defaultTimezone) {
        this(ZoneId.of(Objects.requireNonNull(defaultTimezone, "defaultTimezone must not be null")));
    }

    public boolean isDue(Job job, Instant now) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (!job.isActive()) {
            return false;
        }
        return !now.isBefore(nextDueAt(job));
    }

    /**
     * The instant from which the job counts as due.
     */
    public Instant nextDueAt(Job job) {
        Objects.requireNonNull(job, "job must not be null");

        if (job.lastExecution() == null) {
            // Never ran: due right away unless the first run was deferred at creation.
            return job.nextExecution() != null ? job.nextExecution() : Instant.EPOCH;
        }

        if (job.retryAttempt() > 0 && job.nextExecution() != null) {
            return job.nextExecution();
        }

        Instant natural = computeNext(job, job.lastExecution());
        Instant cached = job.nextExecution();
        return (cached != null && cached.isBefore(natural)) ? cached : natural;
    }

    /**
     * Next natural fire time strictly after {@code reference}. Pure: same inputs, same output.
     */
    public Instant computeNext(Job job, Instant reference) {
        Objects.requireNonNull(job, "job must not be null");
        return computeNext(job.schedule(), reference);
    }

    public Instant computeNext(Schedule schedule, Instant reference) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(reference, "reference must not be null");

        if (schedule.isCron()) {
            return ScheduleParser.nextCronFire(schedule.cronExpression(), zoneOf(schedule), reference);
        }
        if (schedule.interval() == null) {
            throw new JobConfigurationException("Schedule defines neither a cron expression nor an interval");
        }
        return reference.plus(schedule.interval());
    }

    private ZoneId zoneOf(Schedule schedule) {
        if (schedule.timezone() == null) {
            return defaultZone;
        }
        try {
            return ZoneId.of(schedule.timezone());
        } catch (DateTimeException e) {
            throw new JobConfigurationException("Unknown timezone: " + schedule.timezone(), e);
        }
    }
}
