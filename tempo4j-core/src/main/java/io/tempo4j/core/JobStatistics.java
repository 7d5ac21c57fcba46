package io.tempo4j.core;

/**
 * Counters over the whole store, as reported by {@link JobStore#statistics()}.
 */
public record JobStatistics(
        long totalJobs,
        long activeJobs,
        long pausedJobs,
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        long inFlightExecutions
) {

    public static JobStatistics empty() {
        return new JobStatistics(0, 0, 0, 0, 0, 0, 0);
    }
}
