package io.tempo4j.core;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobSpec(

        // identity
        String name,
        String description,
        String jobType,

        // scheduling
        Schedule schedule,
        JobStatus initialStatus,
        boolean skipImmediate,

        // execution policy
        Duration timeout,
        int retryCount,
        Duration retryDelay,

        // payload
        Map<String, Object> config
) {

    /**
     * Checks every field a scheduler needs before accepting the definition.
     *
     * @throws JobConfigurationException describing the first problem found
     */
    public JobSpec validate() {
        if (name == null || name.isBlank()) {
            throw new JobConfigurationException("Job name must not be blank");
        }
        if (jobType == null || jobType.isBlank()) {
            throw new JobConfigurationException("Job type must not be blank for job: " + name);
        }
        if (schedule == null) {
            throw new JobConfigurationException("Job schedule must not be null for job: " + name);
        }
        schedule.validate();

        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new JobConfigurationException("Job timeout must be a positive duration for job: " + name);
        }
        if (retryCount < 0) {
            throw new JobConfigurationException("Job retryCount must not be negative for job: " + name);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new JobConfigurationException("Job retryDelay must not be negative for job: " + name);
        }
        return this;
    }
}
