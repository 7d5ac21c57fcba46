package io.tempo4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses schedule specs.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Cron expressions in standard 5-field form ("0 *&#47;2 * * *") or 6-field form with a leading seconds
 *   field ("0 0 *&#47;2 * * *"); both are translated to Quartz syntax</li>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day 3 hours", "90m", or plain seconds</li>
 * </ul>
 * <p>
 * Day-of-week values follow standard cron numbering (0 or 7 = Sunday) or names (SUN..SAT). Expressions that
 * already contain Quartz's "?" are passed through untouched. When both day fields are restricted the expression
 * fires on days matching either one.
 */
public final class ScheduleParser {
    private static final List<String> DAY_NAMES = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    private static final Pattern BARE_SECONDS = Pattern.compile("\\d+");
    private static final Pattern INTERVAL_TERM = Pattern.compile("\\s*(\\d+)\\s*([a-z]+)\\s*");
    private static final Map<String, ChronoUnit> INTERVAL_UNITS = Map.ofEntries(
            Map.entry("s", ChronoUnit.SECONDS), Map.entry("sec", ChronoUnit.SECONDS),
            Map.entry("second", ChronoUnit.SECONDS), Map.entry("seconds", ChronoUnit.SECONDS),
            Map.entry("m", ChronoUnit.MINUTES), Map.entry("min", ChronoUnit.MINUTES),
            Map.entry("minute", ChronoUnit.MINUTES), Map.entry("minutes", ChronoUnit.MINUTES),
            Map.entry("h", ChronoUnit.HOURS), Map.entry("hour", ChronoUnit.HOURS), Map.entry("hours", ChronoUnit.HOURS),
            Map.entry("d", ChronoUnit.DAYS), Map.entry("day", ChronoUnit.DAYS), Map.entry("days", ChronoUnit.DAYS),
            Map.entry("w", ChronoUnit.WEEKS), Map.entry("week", ChronoUnit.WEEKS), Map.entry("weeks", ChronoUnit.WEEKS)
    );

    private ScheduleParser() {
    }

    /**
     * First cron fire time strictly after {@code after}.
     *
     * @throws IllegalArgumentException if the expression is invalid or never fires again
     */
    public static Instant nextCronFire(String spec, ZoneId zone, Instant after) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(after, "after must not be null");

        TimeZone timeZone = TimeZone.getTimeZone(zone);
        Date from = Date.from(after);
        Date nextDate = null;
        for (CronExpression exp : toCronExpressions(spec)) {
            exp.setTimeZone(timeZone);
            Date candidate = exp.getNextValidTimeAfter(from);
            if (candidate != null && (nextDate == null || candidate.before(nextDate))) {
                nextDate = candidate;
            }
        }
        if (nextDate == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + spec);
        }
        return nextDate.toInstant();
    }

    /**
     * @throws IllegalArgumentException with a readable message if {@code spec} is not a usable cron expression
     */
    public static void validateCron(String spec) {
        toCronExpressions(spec);
    }

    /**
     * Returns true if the string can be parsed as a cron expression.
     */
    public static boolean isValidCron(String spec) {
        try {
            return normalizeCron(spec).stream().allMatch(CronExpression::isValidExpression);
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    private static List<CronExpression> toCronExpressions(String spec) {
        List<CronExpression> expressions = new ArrayList<>(2);
        for (String quartz : normalizeCron(spec)) {
            try {
                expressions.add(new CronExpression(quartz));
            } catch (ParseException ex) {
                throw new IllegalArgumentException("Invalid cron expression: " + spec + " (" + ex.getMessage() + ")", ex);
            }
        }
        return expressions;
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 5-field cron by prepending seconds "0".
     * - Accepts 6-field cron (seconds first).
     * - Accepts 7-field Quartz cron (trailing year).
     * <p>
     * Standard cron fires when either day field matches if both are restricted. Quartz allows only one of them
     * per expression, so such input yields two expressions (day-of-month first) whose fire times are merged.
     */
    public static List<String> normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("cron expression must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        return switch (parts.length) {
            case 5 -> toQuartzCron(spec, "0", parts[0], parts[1], parts[2], parts[3], parts[4], null);
            case 6 -> toQuartzCron(spec, parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], null);
            case 7 -> toQuartzCron(spec, parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6]);
            default -> throw new IllegalArgumentException(
                    "Cron expression must have 5, 6 or 7 fields, got " + parts.length + ": " + spec);
        };
    }

    private static List<String> toQuartzCron(String spec, String sec, String min, String hour, String dayOfMonth,
                                             String month, String dayOfWeek, String year) {
        if ("?".equals(dayOfMonth) || "?".equals(dayOfWeek)) {
            return List.of(quartz(sec, min, hour, dayOfMonth, month, dayOfWeek, year));
        }

        String dow = translateDayOfWeek(dayOfWeek, spec);
        if ("*".equals(dow)) {
            return List.of(quartz(sec, min, hour, dayOfMonth, month, "?", year));
        }
        if ("*".equals(dayOfMonth)) {
            return List.of(quartz(sec, min, hour, "?", month, dow, year));
        }
        return List.of(
                quartz(sec, min, hour, dayOfMonth, month, "?", year),
                quartz(sec, min, hour, "?", month, dow, year));
    }

    private static String quartz(String sec, String min, String hour, String dom, String month, String dow,
                                 String year) {
        String expression = String.join(" ", sec, min, hour, dom, month, dow);
        return year == null ? expression : expression + " " + year;
    }

    /**
     * Rewrites a standard cron day-of-week field as an explicit Quartz day list (1 = Sunday).
     */
    static String translateDayOfWeek(String field, String spec) {
        if ("*".equals(field)) {
            return field;
        }
        // Quartz-only syntax (last weekday, nth weekday) keeps Quartz numbering.
        if (field.contains("L") || field.contains("#")) {
            return field;
        }

        TreeSet<Integer> days = new TreeSet<>();
        for (String item : field.split(",")) {
            String range = item;
            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                range = item.substring(0, slash);
                step = parseStep(item.substring(slash + 1), spec);
            }

            int start;
            int end;
            if ("*".equals(range)) {
                start = 0;
                end = 6;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                start = dayNumber(bounds[0], spec);
                end = dayNumber(bounds[1], spec);
            } else {
                start = dayNumber(range, spec);
                end = slash >= 0 ? 6 : start;
            }

            if (end < start) {
                throw new IllegalArgumentException("Invalid day-of-week range '" + range + "' in cron expression: " + spec);
            }
            for (int d = start; d <= end; d += step) {
                days.add(d % 7);
            }
        }

        return days.stream()
                .map(d -> String.valueOf(d + 1))
                .collect(Collectors.joining(","));
    }

    private static int dayNumber(String token, String spec) {
        String t = token.trim().toUpperCase(Locale.ROOT);
        int named = DAY_NAMES.indexOf(t);
        if (named >= 0) {
            return named;
        }
        try {
            int n = Integer.parseInt(t);
            if (n < 0 || n > 7) {
                throw new IllegalArgumentException("Day-of-week out of range (0-7) '" + token + "' in cron expression: " + spec);
            }
            return n;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid day-of-week '" + token + "' in cron expression: " + spec);
        }
    }

    private static int parseStep(String token, String spec) {
        try {
            int step = Integer.parseInt(token.trim());
            if (step <= 0) {
                throw new IllegalArgumentException("Cron step must be positive in: " + spec);
            }
            return step;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid cron step '" + token + "' in: " + spec);
        }
    }

    /**
     * Parses "45" (seconds), "90m", "2 hours" or combinations such as "1 day 3 hours" / "1h 30m".
     * Each unit may appear once and the total must be positive.
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }
        if (BARE_SECONDS.matcher(s).matches()) {
            return positive(Duration.ofSeconds(parseAmount(s, input)), input);
        }

        Matcher m = INTERVAL_TERM.matcher(s);
        EnumSet<ChronoUnit> seen = EnumSet.noneOf(ChronoUnit.class);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (m.find()) {
            if (m.start() != consumed) {
                break;
            }
            ChronoUnit unit = INTERVAL_UNITS.get(m.group(2));
            if (unit == null) {
                throw new IllegalArgumentException("Unsupported interval unit '" + m.group(2) + "' in: " + input);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate interval unit '" + m.group(2) + "' in: " + input);
            }
            total = total.plus(unit.getDuration().multipliedBy(parseAmount(m.group(1), input)));
            consumed = m.end();
        }
        if (consumed != s.length()) {
            throw new IllegalArgumentException(
                    "Invalid interval format, expected terms like '3 minutes' or '90m': " + input);
        }
        return positive(total, input);
    }

    private static long parseAmount(String digits, String input) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Interval value out of range: " + input, ex);
        }
    }

    private static Duration positive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }
}
