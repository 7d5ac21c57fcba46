package io.tempo4j.internal;

import io.tempo4j.core.ExecutionStatus;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Persists {@link JobExecution} lifecycle transitions.
 *
 * <p>Durability is best-effort: a store failure is logged and the in-memory record is still returned, so the
 * executor keeps going. Retry policy is not decided here.
 */
public class RunTracker {
    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    private final JobStore jobStore;

    public RunTracker(JobStore jobStore) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
    }

    /**
     * Details attached to a transition.
     *
     * @param at           transition time
     * @param result       success payload, or null
     * @param errorMessage failure description, or null
     */
    public record TransitionMetadata(Instant at, Map<String, Object> result, String errorMessage) {

        public static TransitionMetadata at(Instant at) {
            return new TransitionMetadata(at, null, null);
        }

        public static TransitionMetadata succeeded(Instant at, Map<String, Object> result) {
            return new TransitionMetadata(at, result, null);
        }

        public static TransitionMetadata failed(Instant at, String errorMessage) {
            return new TransitionMetadata(at, null, errorMessage);
        }
    }

    /**
     * Persist a newly created (PENDING) execution.
     */
    public JobExecution open(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        if (execution.status() != ExecutionStatus.PENDING) {
            throw new IllegalArgumentException("new executions must be PENDING: " + execution.id());
        }

        try {
            jobStore.createExecution(execution);
        } catch (RuntimeException e) {
            log.error("tempo createExecution failed jobId={} executionId={} msg={}",
                    execution.jobId(), execution.id(), e.getMessage(), e);
        }
        return execution;
    }

    /**
     * Apply and persist a status transition.
     *
     * @throws IllegalStateException if the transition is not allowed; persistence failures are never thrown
     */
    public JobExecution recordTransition(JobExecution execution, ExecutionStatus newStatus, TransitionMetadata metadata) {
        Objects.requireNonNull(execution, "execution must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");

        JobExecution next = execution.transitionTo(newStatus, metadata.at(), metadata.result(), metadata.errorMessage());
        try {
            if (!jobStore.updateExecution(next)) {
                log.warn("tempo execution update not applied jobId={} executionId={} status={}",
                        next.jobId(), next.id(), newStatus);
            }
        } catch (RuntimeException e) {
            log.error("tempo updateExecution failed jobId={} executionId={} status={} msg={}",
                    next.jobId(), next.id(), newStatus, e.getMessage(), e);
        }

        log.debug("tempo execution transition jobId={} executionId={} {} -> {}",
                next.jobId(), next.id(), execution.status(), newStatus);
        return next;
    }

    /**
     * Fail an execution found in flight that no live worker owns (left over from a previous process).
     */
    public JobExecution abandon(JobExecution execution, Instant at, String reason) {
        return recordTransition(execution, ExecutionStatus.FAILED, TransitionMetadata.failed(at, reason));
    }
}
