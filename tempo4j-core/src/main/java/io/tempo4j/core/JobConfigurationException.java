package io.tempo4j.core;

/**
 * A job definition that can never run as written: bad schedule, bad timezone, duplicate name,
 * config that does not fit the handler, and the like. Never retried.
 */
public class JobConfigurationException extends IllegalArgumentException {

    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
