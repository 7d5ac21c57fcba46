package io.tempo4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One attempt to run a {@link Job}. Retries are separate executions linked through {@code retryAttempt}
 * and {@code triggeredBy}.
 *
 * @param retryAttempt 0 for the first attempt of a trigger, incremented per retry
 * @param triggeredBy  id of the failed execution this one retries, or null
 * @param result       handler result, present only on {@link ExecutionStatus#SUCCESS}
 * @param errorMessage present only on {@link ExecutionStatus#FAILED}
 */
public record JobExecution(
        String id,
        String jobId,
        ExecutionStatus status,
        int retryAttempt,
        String triggeredBy,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Map<String, Object> result,
        String errorMessage
) {

    public static JobExecution pending(String id, Job job, Instant createdAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(job, "job must not be null");
        return new JobExecution(id, job.id(), ExecutionStatus.PENDING, job.retryAttempt(), job.retryOf(),
                createdAt, null, null, null, null);
    }

    /**
     * Returns a copy moved to {@code next}.
     *
     * @param at           transition time; becomes {@code startedAt} for RUNNING, {@code completedAt} otherwise
     * @param result       stored only for SUCCESS
     * @param errorMessage stored only for FAILED
     * @throws IllegalStateException if the status machine does not allow the move
     */
    public JobExecution transitionTo(ExecutionStatus next, Instant at, Map<String, Object> result, String errorMessage) {
        Objects.requireNonNull(next, "next must not be null");
        Objects.requireNonNull(at, "at must not be null");
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal execution transition " + status + " -> " + next + " for " + id);
        }

        return switch (next) {
            case RUNNING -> new JobExecution(id, jobId, next, retryAttempt, triggeredBy, createdAt,
                    at, null, null, null);
            case SUCCESS -> new JobExecution(id, jobId, next, retryAttempt, triggeredBy, createdAt,
                    startedAt, at, result, null);
            case FAILED -> new JobExecution(id, jobId, next, retryAttempt, triggeredBy, createdAt,
                    startedAt, at, null, errorMessage);
            case PENDING -> throw new IllegalStateException("Cannot transition back to PENDING: " + id);
        };
    }

    /**
     * Wall time between start and completion, or null while still in flight.
     */
    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }
}
