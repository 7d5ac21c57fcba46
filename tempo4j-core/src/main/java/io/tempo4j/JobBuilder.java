package io.tempo4j;

import io.tempo4j.core.JobSpec;

import java.time.Duration;
import java.util.Map;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + validate + insert, returning the new job id</li>
 * </ul>
 *
 * <p>Exactly one of {@code cron(...)} or {@code every(...)} must be called.
 */
public interface JobBuilder {

    JobBuilder description(String description);

    /**
     * Cron schedule, 5-field ("0 *&#47;2 * * *") or 6-field with leading seconds.
     */
    JobBuilder cron(String expression);

    /**
     * Set timezone used by cron evaluation (IANA id, e.g. "Asia/Taipei"). Null means the scheduler default.
     */
    JobBuilder timezone(String timezone);

    JobBuilder every(Duration interval);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours") or plain seconds.
     */
    JobBuilder every(String interval);

    JobBuilder everyHours(long hours);

    /**
     * Replace the config payload handed to the handler.
     */
    JobBuilder config(Map<String, Object> config);

    JobBuilder config(String key, Object value);

    JobBuilder timeout(Duration timeout);

    /**
     * @param retryCount maximum retries after a failed attempt (0 disables retries)
     * @param retryDelay delay before a retry becomes due
     */
    JobBuilder retries(int retryCount, Duration retryDelay);

    /**
     * Do not run as soon as the job is created; wait for the first natural tick of the schedule.
     */
    JobBuilder skipImmediate();

    /**
     * Create the job in PAUSED state.
     */
    JobBuilder paused();

    /**
     * Build an immutable job spec (not persisted, not validated).
     */
    JobSpec build();

    /**
     * Build + persist.
     *
     * @return id of the created job
     * @throws io.tempo4j.core.JobConfigurationException if the definition is invalid or the name is taken
     */
    String save();
}
