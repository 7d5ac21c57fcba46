package io.tempo4j.internal;

import io.tempo4j.core.ExecutionStatus;
import io.tempo4j.core.Job;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobStatus;
import io.tempo4j.core.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionCleanupHandlerTest {

    private static final Instant NOW = Instant.parse("2024-06-30T00:00:00Z");

    private final InMemoryJobStore store = new InMemoryJobStore();
    private final ExecutionCleanupHandler handler = new ExecutionCleanupHandler(store, new MutableClock(NOW));
    private final Job job = new Job("job-m", "cleanup", null, ExecutionCleanupHandler.JOB_TYPE,
            Schedule.cron("0 3 * * *"), JobStatus.ACTIVE, Duration.ofMinutes(5), 0, Duration.ZERO, Map.of(),
            null, null, 0, null, NOW, NOW);

    @Test
    void removesTerminalExecutionsOlderThanCutoff() {
        store.putExecution(completed("old-success", ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(40))));
        store.putExecution(completed("old-failure", ExecutionStatus.FAILED, NOW.minus(Duration.ofDays(31))));
        store.putExecution(completed("recent", ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(2))));
        store.putExecution(new JobExecution("old-running", "job-x", ExecutionStatus.RUNNING, 0, null,
                NOW.minus(Duration.ofDays(60)), NOW.minus(Duration.ofDays(60)), null, null, null));

        Object result = handler.execute(job, new ExecutionCleanupHandler.CleanupConfig(null));

        assertThat(result).isEqualTo(Map.of(
                "deletedExecutions", 2L,
                "cutoff", NOW.minus(Duration.ofDays(30)).toString()));
        assertThat(store.executionsOf("job-x"))
                .extracting(JobExecution::id)
                .containsExactlyInAnyOrder("recent", "old-running");
    }

    @Test
    void honoursConfiguredRetention() {
        store.putExecution(completed("three-days", ExecutionStatus.SUCCESS, NOW.minus(Duration.ofDays(3))));

        handler.execute(job, new ExecutionCleanupHandler.CleanupConfig(1));

        assertThat(store.executionsOf("job-x")).isEmpty();
    }

    @Test
    void rejectsNegativeRetention() {
        assertThatThrownBy(() -> handler.execute(job, new ExecutionCleanupHandler.CleanupConfig(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static JobExecution completed(String id, ExecutionStatus status, Instant completedAt) {
        return new JobExecution(id, "job-x", status, 0, null, completedAt.minusSeconds(5), completedAt.minusSeconds(5),
                completedAt, null, status == ExecutionStatus.FAILED ? "boom" : null);
    }
}
