package io.tempo4j.core;

import java.time.Instant;

/**
 * Scheduler-maintained fields of a {@link Job}, written back as one unit after each attempt.
 *
 * @param lastExecution start time of the latest attempt
 * @param nextExecution when the job is next due
 * @param retryAttempt  attempt number the next execution will carry; 0 when no retry is pending
 * @param retryOf       id of the failed execution the pending retry follows, or null
 */
public record ScheduleState(
        Instant lastExecution,
        Instant nextExecution,
        int retryAttempt,
        String retryOf
) {

    public static ScheduleState advanced(Instant lastExecution, Instant nextExecution) {
        return new ScheduleState(lastExecution, nextExecution, 0, null);
    }

    public static ScheduleState retry(Instant lastExecution, Instant retryAt, int retryAttempt, String failedExecutionId) {
        return new ScheduleState(lastExecution, retryAt, retryAttempt, failedExecutionId);
    }

    public boolean retryPending() {
        return retryAttempt > 0;
    }
}
