package io.tempo4j.core;

/**
 * Scheduling status of a job definition. Only {@link #ACTIVE} jobs are ever considered due.
 */
public enum JobStatus {
    ACTIVE,
    PAUSED
}
