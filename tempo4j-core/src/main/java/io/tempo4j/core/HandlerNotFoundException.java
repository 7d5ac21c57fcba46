package io.tempo4j.core;

/**
 * Thrown when no {@link io.tempo4j.JobHandler} is registered for a job type.
 */
public class HandlerNotFoundException extends IllegalStateException {

    private final String jobType;

    public HandlerNotFoundException(String jobType) {
        super("No JobHandler registered for job type: " + jobType);
        this.jobType = jobType;
    }

    public String jobType() {
        return jobType;
    }
}
