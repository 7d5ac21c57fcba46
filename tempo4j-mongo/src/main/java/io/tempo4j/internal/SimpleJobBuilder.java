package io.tempo4j.internal;

import io.tempo4j.JobBuilder;
import io.tempo4j.config.SchedulerProperties;
import io.tempo4j.core.JobSpec;
import io.tempo4j.core.JobStatus;
import io.tempo4j.core.Schedule;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by the polling scheduler.
 *
 * <p>Execution policy fields start from the scheduler defaults in {@link SchedulerProperties}.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String name;
    private final String jobType;
    private final Function<JobSpec, String> persister;

    private String description;

    private String cronExpression;
    private Duration interval;
    private String timezone;

    private Duration timeout;
    private int retryCount;
    private Duration retryDelay;

    private final Map<String, Object> config = new LinkedHashMap<>();

    private boolean skipImmediate;
    private JobStatus initialStatus = JobStatus.ACTIVE;

    public SimpleJobBuilder(String name, String jobType, SchedulerProperties defaults, Function<JobSpec, String> persister) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.jobType = Objects.requireNonNull(jobType, "jobType must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        Objects.requireNonNull(defaults, "defaults must not be null");

        this.timeout = defaults.getDefaultTimeout();
        this.retryCount = defaults.getDefaultRetryCount();
        this.retryDelay = defaults.getDefaultRetryDelay();
    }

    @Override
    public JobBuilder description(String description) {
        this.description = description;
        return this;
    }

    @Override
    public JobBuilder cron(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (expression.isBlank()) throw new IllegalArgumentException("cron expression must not be blank");

        this.cronExpression = expression.trim();
        return this;
    }

    @Override
    public JobBuilder timezone(String timezone) {
        this.timezone = timezone;
        return this;
    }

    @Override
    public JobBuilder every(Duration interval) {
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        return this;
    }

    @Override
    public JobBuilder every(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        this.interval = Schedule.every(interval).interval();
        return this;
    }

    @Override
    public JobBuilder everyHours(long hours) {
        return every(Duration.ofHours(hours));
    }

    @Override
    public JobBuilder config(Map<String, Object> config) {
        Objects.requireNonNull(config, "config must not be null");
        this.config.clear();
        this.config.putAll(config);
        return this;
    }

    @Override
    public JobBuilder config(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) throw new IllegalArgumentException("config key must not be blank");

        this.config.put(key, value);
        return this;
    }

    @Override
    public JobBuilder timeout(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        return this;
    }

    @Override
    public JobBuilder retries(int retryCount, Duration retryDelay) {
        this.retryCount = retryCount;
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        return this;
    }

    @Override
    public JobBuilder skipImmediate() {
        this.skipImmediate = true;
        return this;
    }

    @Override
    public JobBuilder paused() {
        this.initialStatus = JobStatus.PAUSED;
        return this;
    }

    @Override
    public JobSpec build() {
        return new JobSpec(
                name,
                description,
                jobType,
                new Schedule(cronExpression, interval, timezone),
                initialStatus,
                skipImmediate,
                timeout,
                retryCount,
                retryDelay,
                new LinkedHashMap<>(config)
        );
    }

    @Override
    public String save() {
        JobSpec spec = this.build();
        return persister.apply(spec);
    }
}
