package io.recur4j.utils;

import io.recur4j.core.Job;
import io.recur4j.exception.InvalidRecurrenceException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes due times from a recurrence (cron or fixed interval) and retry times from a
 * failure count.
 * <p>
 * Supported recurrences:
 * <ul>
 *   <li>5-field cron expressions: "minute hour day-of-month month day-of-week"</li>
 *   <li>Fixed intervals in seconds</li>
 * </ul>
 * <p>
 * Cron expressions are evaluated with Quartz. Quartz numbers days of the week 1-7 starting
 * on Sunday and cannot restrict both day fields at once, so 5-field input is translated
 * first (see {@link #normalizeCron(String)}).
 */
public final class TriggerCalculator {

    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    static final long MAX_RETRY_DELAY_MINUTES = 60;

    // n, n-m, n/step, n-m/step
    private static final Pattern DOW_NUMERIC = Pattern.compile("^(\\d+)(?:-(\\d+))?(?:/(\\d+))?$");

    private static final Pattern PLAIN_SECONDS = Pattern.compile("^\\d+$");
    private static final Pattern DURATION_TERM = Pattern.compile("\\s*(\\d+)\\s*([a-z]+)\\s*");

    private static final Map<String, ChronoUnit> DURATION_UNITS = Map.ofEntries(
            Map.entry("s", ChronoUnit.SECONDS), Map.entry("sec", ChronoUnit.SECONDS),
            Map.entry("secs", ChronoUnit.SECONDS), Map.entry("second", ChronoUnit.SECONDS),
            Map.entry("seconds", ChronoUnit.SECONDS),
            Map.entry("m", ChronoUnit.MINUTES), Map.entry("min", ChronoUnit.MINUTES),
            Map.entry("mins", ChronoUnit.MINUTES), Map.entry("minute", ChronoUnit.MINUTES),
            Map.entry("minutes", ChronoUnit.MINUTES),
            Map.entry("h", ChronoUnit.HOURS), Map.entry("hr", ChronoUnit.HOURS),
            Map.entry("hrs", ChronoUnit.HOURS), Map.entry("hour", ChronoUnit.HOURS),
            Map.entry("hours", ChronoUnit.HOURS),
            Map.entry("d", ChronoUnit.DAYS), Map.entry("day", ChronoUnit.DAYS),
            Map.entry("days", ChronoUnit.DAYS),
            Map.entry("w", ChronoUnit.WEEKS), Map.entry("week", ChronoUnit.WEEKS),
            Map.entry("weeks", ChronoUnit.WEEKS));

    private TriggerCalculator() {
    }

    /* ================= recurrence ================= */

    /**
     * Earliest instant strictly after {@code from} matching the cron expression, in UTC.
     */
    public static Instant nextFromCron(String cronExpression, Instant from) {
        return nextFromCron(cronExpression, from, DEFAULT_ZONE);
    }

    /**
     * Earliest instant strictly after {@code from} matching the cron expression in {@code zone}.
     * When both day fields are restricted, a day matching either of them qualifies.
     *
     * @throws InvalidRecurrenceException if the expression is not a valid 5-field cron
     */
    public static Instant nextFromCron(String cronExpression, Instant from, ZoneId zone) {
        Objects.requireNonNull(from, "from must not be null");
        TimeZone tz = TimeZone.getTimeZone(zone != null ? zone : DEFAULT_ZONE);
        Date after = Date.from(from);

        Date next = null;
        for (CronExpression exp : parseCron(cronExpression)) {
            exp.setTimeZone(tz);
            Date candidate = exp.getNextValidTimeAfter(after);
            if (candidate != null && (next == null || candidate.before(next))) {
                next = candidate;
            }
        }
        if (next == null) {
            throw new InvalidRecurrenceException("cronExpression",
                    "Cron expression produced no next execution time: " + cronExpression);
        }
        return next.toInstant();
    }

    public static Instant nextFromInterval(long seconds, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        if (seconds <= 0) {
            throw new InvalidRecurrenceException("intervalSeconds", "Interval must be positive: " + seconds);
        }
        return from.plusSeconds(seconds);
    }

    /**
     * Next due time for a job's recurrence, anchored at {@code from}. Cron wins when the
     * job (incorrectly) carries both fields; validation rejects that earlier.
     *
     * @return next due time, or {@code null} if the job has no recurrence
     */
    public static Instant nextRunTime(Job job, Instant from, ZoneId zone) {
        Objects.requireNonNull(job, "job must not be null");
        return nextRunTime(job.getCronExpression(), job.getIntervalSeconds(), from, zone);
    }

    public static Instant nextRunTime(String cronExpression, Long intervalSeconds, Instant from, ZoneId zone) {
        if (cronExpression != null && !cronExpression.isBlank()) {
            return nextFromCron(cronExpression, from, zone);
        }
        if (intervalSeconds != null) {
            return nextFromInterval(intervalSeconds, from);
        }
        return null;
    }

    /* ================= retry backoff ================= */

    /**
     * Exponential backoff: {@code now + min(2^retryCount, 60)} minutes.
     */
    public static Instant nextRetryTime(int retryCount, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return now.plus(retryDelay(retryCount));
    }

    public static Duration retryDelay(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative: " + retryCount);
        }
        // 2^6 already exceeds the cap
        long minutes = retryCount >= 6 ? MAX_RETRY_DELAY_MINUTES : Math.min(1L << retryCount, MAX_RETRY_DELAY_MINUTES);
        return Duration.ofMinutes(minutes);
    }

    /* ================= cron helpers ================= */

    /**
     * Returns true if the string is a 5-field cron expression Quartz can evaluate.
     */
    public static boolean isValidCron(String cron) {
        if (cron == null || cron.isBlank() || cron.trim().split("\\s+").length != 5) {
            return false;
        }
        try {
            for (String quartz : normalizeCron(cron)) {
                if (!CronExpression.isValidExpression(quartz)) {
                    return false;
                }
            }
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Translate a 5-field cron into Quartz expressions:
     * <ul>
     *   <li>a seconds field "0" is prepended</li>
     *   <li>numeric day-of-week values 0-7 (0 and 7 = Sunday) become Quartz 1-7</li>
     *   <li>an unrestricted day field becomes "?"</li>
     * </ul>
     * Quartz cannot restrict both day fields in one expression, so a cron restricting both
     * yields two expressions, one per day field. The cron matches when either one does.
     *
     * @throws IllegalArgumentException if the input does not have 5 fields or has a day-of-week
     *                                  value outside 0-7
     */
    public static List<String> normalizeCron(String cron) {
        if (cron == null) {
            throw new IllegalArgumentException("cron must not be null");
        }
        String s = cron.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException("Expected 5 cron fields but got " + parts.length + ": " + cron);
        }

        String minute = parts[0];
        String hour = parts[1];
        String dom = parts[2];
        String month = parts[3];
        String dow = toQuartzDayOfWeek(parts[4]);

        boolean domOpen = "*".equals(dom) || "?".equals(dom);
        boolean dowOpen = "*".equals(dow) || "?".equals(dow);
        if (domOpen && dowOpen) {
            return List.of(String.join(" ", "0", minute, hour, "*", month, "?"));
        }
        if (domOpen) {
            return List.of(String.join(" ", "0", minute, hour, "?", month, dow));
        }
        if (dowOpen) {
            return List.of(String.join(" ", "0", minute, hour, dom, month, "?"));
        }
        return List.of(
                String.join(" ", "0", minute, hour, dom, month, "?"),
                String.join(" ", "0", minute, hour, "?", month, dow));
    }

    // numeric items are expanded to explicit Quartz day lists; names and "*" pass through
    private static String toQuartzDayOfWeek(String field) {
        StringJoiner out = new StringJoiner(",");
        for (String item : field.split(",")) {
            Matcher m = DOW_NUMERIC.matcher(item);
            if (!m.matches()) {
                out.add(item);
                continue;
            }
            int lo = dayNumber(m.group(1));
            int hi = m.group(2) != null ? dayNumber(m.group(2)) : (m.group(3) != null ? 7 : lo);
            int step = m.group(3) != null ? Integer.parseInt(m.group(3)) : 1;
            if (lo > hi || step <= 0) {
                throw new IllegalArgumentException("Invalid day-of-week item: " + item);
            }

            TreeSet<Integer> days = new TreeSet<>();
            for (int d = lo; d <= hi; d += step) {
                days.add(d % 7 + 1);
            }
            days.forEach(d -> out.add(Integer.toString(d)));
        }
        return out.toString();
    }

    private static int dayNumber(String value) {
        int d = Integer.parseInt(value);
        if (d > 7) {
            throw new IllegalArgumentException("Day-of-week out of range: " + value);
        }
        return d;
    }

    private static List<CronExpression> parseCron(String cronExpression) {
        if (!isValidCron(cronExpression)) {
            throw new InvalidRecurrenceException("cronExpression", "Invalid cron expression: " + cronExpression);
        }
        List<CronExpression> expressions = new ArrayList<>(2);
        for (String quartz : normalizeCron(cronExpression)) {
            try {
                expressions.add(new CronExpression(quartz));
            } catch (ParseException ex) {
                throw new InvalidRecurrenceException("cronExpression",
                        "Invalid cron expression: " + cronExpression + " (" + ex.getMessage() + ")");
            }
        }
        return expressions;
    }

    /* ================= human intervals ================= */

    /**
     * Parse a human interval into a duration. Accepts plain seconds ("90") or one or more
     * amount/unit terms, written apart or together ("5 minutes", "2h", "1 day 3 hours",
     * "1h30m"). Each unit may appear once.
     *
     * @throws IllegalArgumentException if the text is not an interval or sums to zero
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        try {
            if (PLAIN_SECONDS.matcher(s).matches()) {
                return positive(Duration.ofSeconds(Long.parseLong(s)), input);
            }

            Matcher m = DURATION_TERM.matcher(s);
            Set<ChronoUnit> seen = EnumSet.noneOf(ChronoUnit.class);
            Duration total = Duration.ZERO;
            int end = 0;
            while (end < s.length() && m.find() && m.start() == end) {
                ChronoUnit unit = DURATION_UNITS.get(m.group(2));
                if (unit == null) {
                    throw new IllegalArgumentException("Unsupported interval unit: " + m.group(2));
                }
                if (!seen.add(unit)) {
                    throw new IllegalArgumentException("Duplicate interval unit: " + m.group(2));
                }
                total = total.plus(unit.getDuration().multipliedBy(Long.parseLong(m.group(1))));
                end = m.end();
            }
            if (end != s.length()) {
                throw new IllegalArgumentException("Invalid interval: " + input);
            }
            return positive(total, input);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException("Interval out of range: " + input, ex);
        }
    }

    private static Duration positive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }
}
