package io.rota4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Cron evaluation on top of Quartz {@link CronExpression}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Standard 5-field cron: "minute hour day-of-month month day-of-week" (Sunday is 0 or 7)</li>
 *   <li>6-field cron with a leading seconds field</li>
 * </ul>
 * <p>
 * Note: evaluation is calendar-based in the given zone, so "0 14 * * *" stays at 14:00 local
 * across daylight-saving transitions.
 * <p>
 * When both day-of-month and day-of-week are restricted, a day matching either one fires
 * ("0 9 1 * 1" runs on the 1st and on every Monday). Quartz cannot express that in one
 * expression, so each field is compiled separately and the earlier fire time wins.
 */
public final class CronSupport {
    private CronSupport() {
    }

    /**
     * Returns the first fire time strictly after {@code after}, evaluated in {@code zone}.
     *
     * @return next fire time, or {@code null} if the expression never fires again
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static Instant nextAfter(String spec, ZoneId zone, Instant after) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(after, "after must not be null");

        Date base = Date.from(after);
        Date earliest = null;
        for (CronExpression exp : compile(spec)) {
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            Date next = exp.getNextValidTimeAfter(base);
            if (next != null && (earliest == null || next.before(earliest))) {
                earliest = next;
            }
        }
        return earliest == null ? null : earliest.toInstant();
    }

    /**
     * Returns true if the spec can be compiled into Quartz {@link CronExpression}s.
     */
    public static boolean isValid(String spec) {
        try {
            for (String cron : normalizeCron(spec)) {
                if (!CronExpression.isValidExpression(cron)) {
                    return false;
                }
            }
            return true;
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Normalize cron expressions into Quartz syntax:
     * - Accepts 6-field cron (seconds first).
     * - Accepts 5-field cron by prepending seconds "0".
     * - Translates numeric day-of-week (0-7, Sunday = 0 or 7) into Quartz numbering (1-7, Sunday = 1).
     * - Inserts "?" into day-of-month or day-of-week where Quartz requires it.
     *
     * @return one expression, or two (day-of-month first) when both day fields are restricted
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
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("Invalid cron expression, expected 5 or 6 fields: " + spec);
    }

    private static List<CronExpression> compile(String spec) {
        List<CronExpression> out = new ArrayList<>();
        for (String cron : normalizeCron(spec)) {
            try {
                out.add(new CronExpression(cron));
            } catch (ParseException ex) {
                throw new IllegalArgumentException("Invalid cron expression: " + spec + " (" + ex.getMessage() + ")", ex);
            }
        }
        return out;
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = translateDayOfWeek(dayOfWeek);

        if ("?".equals(dom) || "?".equals(dow)) {
            return List.of(String.join(" ", sec, min, hour, dom, month, dow));
        }
        if ("*".equals(dow)) {
            return List.of(String.join(" ", sec, min, hour, dom, month, "?"));
        }
        if ("*".equals(dom)) {
            return List.of(String.join(" ", sec, min, hour, "?", month, dow));
        }
        return List.of(
                String.join(" ", sec, min, hour, dom, month, "?"),
                String.join(" ", sec, min, hour, "?", month, dow));
    }

    // 0-7 (Sun=0/7) -> 1-7 (Sun=1); step values after "/" are left alone
    private static String translateDayOfWeek(String dow) {
        if ("*".equals(dow) || "?".equals(dow)) {
            return dow;
        }
        StringBuilder out = new StringBuilder();
        String[] items = dow.split(",");
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            String item = items[i];
            String step = null;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                step = item.substring(slash + 1);
                item = item.substring(0, slash);
            }
            String[] range = item.split("-");
            for (int j = 0; j < range.length; j++) {
                if (j > 0) {
                    out.append('-');
                }
                out.append(translateDayNumber(range[j]));
            }
            if (step != null) {
                out.append('/').append(step);
            }
        }
        return out.toString();
    }

    private static String translateDayNumber(String token) {
        int hash = token.indexOf('#');
        if (hash > 0) {
            return translateDayNumber(token.substring(0, hash)) + token.substring(hash);
        }
        if (!token.matches("\\d+")) {
            return token;
        }
        int n = Integer.parseInt(token);
        if (n < 0 || n > 7) {
            throw new IllegalArgumentException("day-of-week out of range (0-7): " + token);
        }
        return String.valueOf((n % 7) + 1);
    }
}
