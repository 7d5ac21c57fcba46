package io.tempo4j.core;

import io.tempo4j.utils.ScheduleParser;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * When a job fires: either a cron expression or a fixed interval, never both.
 *
 * <p>The canonical constructor does not validate, so that definitions read back from a store can always be
 * materialized. Call {@link #validate()} before persisting a new or edited definition.
 *
 * @param cronExpression 5-field (minute first) or 6-field (seconds first) cron expression, or null
 * @param interval       fixed interval between runs, or null
 * @param timezone       IANA zone id for cron evaluation; null means the scheduler default
 */
public record Schedule(
        String cronExpression,
        Duration interval,
        String timezone
) {

    public static Schedule cron(String expression) {
        return new Schedule(expression, null, null);
    }

    public static Schedule cron(String expression, String timezone) {
        return new Schedule(expression, null, timezone);
    }

    public static Schedule every(Duration interval) {
        return new Schedule(null, interval, null);
    }

    public static Schedule everyHours(long hours) {
        return every(Duration.ofHours(hours));
    }

    /**
     * Human-readable interval such as "2 hours", "90m" or a number of seconds.
     */
    public static Schedule every(String humanInterval) {
        Objects.requireNonNull(humanInterval, "humanInterval must not be null");
        try {
            return every(ScheduleParser.parseHumanDuration(humanInterval));
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException(e.getMessage(), e);
        }
    }

    public boolean isCron() {
        return cronExpression != null;
    }

    /**
     * Checks that the schedule is usable.
     *
     * @throws JobConfigurationException if both or neither of cron/interval are set, the cron expression does not
     *                                   parse, the interval is not positive or the timezone is unknown
     */
    public Schedule validate() {
        boolean hasCron = cronExpression != null && !cronExpression.isBlank();
        boolean hasInterval = interval != null;

        if (hasCron && hasInterval) {
            throw new JobConfigurationException("Schedule must define either a cron expression or an interval, not both");
        }
        if (!hasCron && !hasInterval) {
            throw new JobConfigurationException("Schedule must define a cron expression or an interval");
        }

        if (hasInterval && (interval.isZero() || interval.isNegative())) {
            throw new JobConfigurationException("Schedule interval must be a positive duration: " + interval);
        }

        if (hasCron) {
            try {
                ScheduleParser.validateCron(cronExpression);
            } catch (IllegalArgumentException e) {
                throw new JobConfigurationException(e.getMessage(), e);
            }
        }

        if (timezone != null) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                throw new JobConfigurationException("Unknown timezone: " + timezone, e);
            }
        }
        return this;
    }

    @Override
    public String toString() {
        if (isCron()) {
            return timezone == null ? "cron(" + cronExpression + ")" : "cron(" + cronExpression + ", " + timezone + ")";
        }
        return "every(" + interval + ")";
    }
}
