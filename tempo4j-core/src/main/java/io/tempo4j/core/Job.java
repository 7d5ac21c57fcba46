package io.tempo4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * A persisted, scheduled unit of work.
 *
 * <p>{@code lastExecution}, {@code nextExecution}, {@code retryAttempt} and {@code retryOf} are owned by the
 * scheduler (see {@link ScheduleState}); everything else is owned by whoever defines the job.
 */
public record Job(

        // identity
        String id,
        String name,
        String description,
        String jobType,

        // scheduling
        Schedule schedule,
        JobStatus status,

        // execution policy
        Duration timeout,
        int retryCount,
        Duration retryDelay,

        // payload
        Map<String, Object> config,

        // scheduler-maintained
        Instant lastExecution,
        Instant nextExecution,
        int retryAttempt,
        String retryOf,

        Instant createdAt,
        Instant updatedAt
) {

    public boolean isActive() {
        return status == JobStatus.ACTIVE;
    }

    public ScheduleState scheduleState() {
        return new ScheduleState(lastExecution, nextExecution, retryAttempt, retryOf);
    }

    public Job withStatus(JobStatus newStatus, Instant at) {
        return new Job(id, name, description, jobType, schedule, newStatus, timeout, retryCount, retryDelay, config,
                lastExecution, nextExecution, retryAttempt, retryOf, createdAt, at);
    }

    public Job withNextExecution(Instant newNextExecution, Instant at) {
        return new Job(id, name, description, jobType, schedule, status, timeout, retryCount, retryDelay, config,
                lastExecution, newNextExecution, retryAttempt, retryOf, createdAt, at);
    }

    public Job withScheduleState(ScheduleState state, Instant at) {
        return new Job(id, name, description, jobType, schedule, status, timeout, retryCount, retryDelay, config,
                state.lastExecution(), state.nextExecution(), state.retryAttempt(), state.retryOf(), createdAt, at);
    }
}
