package io.tempo4j.internal;

import io.tempo4j.JobHandler;
import io.tempo4j.core.Job;
import io.tempo4j.core.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in {@code maintenance} job type: prunes execution history older than {@code cleanupDays}.
 */
public class ExecutionCleanupHandler implements JobHandler<ExecutionCleanupHandler.CleanupConfig> {
    private static final Logger log = LoggerFactory.getLogger(ExecutionCleanupHandler.class);

    public static final String JOB_TYPE = "maintenance";
    public static final int DEFAULT_CLEANUP_DAYS = 30;

    private final JobStore jobStore;
    private final Clock clock;

    /**
     * @param cleanupDays keep executions completed within this many days; null means 30
     */
    public record CleanupConfig(Integer cleanupDays) {

        int effectiveDays() {
            return cleanupDays == null ? DEFAULT_CLEANUP_DAYS : cleanupDays;
        }
    }

    public ExecutionCleanupHandler(JobStore jobStore) {
        this(jobStore, Clock.systemUTC());
    }

    public ExecutionCleanupHandler(JobStore jobStore, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String jobType() {
        return JOB_TYPE;
    }

    @Override
    public Class<CleanupConfig> configClass() {
        return CleanupConfig.class;
    }

    @Override
    public Object execute(Job job, CleanupConfig config) {
        int days = config == null ? DEFAULT_CLEANUP_DAYS : config.effectiveDays();
        if (days < 0) {
            throw new IllegalArgumentException("cleanupDays must not be negative: " + days);
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        long deleted = jobStore.deleteExecutionsCompletedBefore(cutoff);
        log.info("Tempo cleanup removed {} execution(s) completed before {} job={}", deleted, cutoff, job.name());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deletedExecutions", deleted);
        result.put("cutoff", cutoff.toString());
        return result;
    }
}
