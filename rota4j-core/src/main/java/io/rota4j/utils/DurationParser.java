package io.rota4j.utils;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings used for occurrence lengths.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Clock intervals: "01:30:00", optionally prefixed by days: "1 day 02:00:00"</li>
 *   <li>ISO-8601: "PT90M", "P1DT2H"</li>
 *   <li>Compact: "90m", "2h", "1d"</li>
 *   <li>Human-readable: "2 hours", "1 hour 30 minutes"</li>
 * </ul>
 * <p>
 * Anything else is rejected with {@link IllegalArgumentException}; there is no silent default.
 */
public final class DurationParser {

    private static final Pattern CLOCK = Pattern.compile(
            "^(?:(\\d+)\\s+days?\\s+)?(\\d{1,3}):([0-5]\\d):([0-5]\\d)(?:\\.\\d+)?$");
    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhdw])$");

    private DurationParser() {
    }

    public static Duration parse(String input) {
        if (input == null) {
            throw new IllegalArgumentException("duration must not be null");
        }
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("duration must not be empty");
        }
        try {
            return parseNormalized(s, input);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("duration out of range: " + input, ex);
        }
    }

    private static Duration parseNormalized(String s, String input) {
        Matcher clock = CLOCK.matcher(s);
        if (clock.matches()) {
            long days = clock.group(1) == null ? 0 : Long.parseLong(clock.group(1));
            Duration d = Duration.ofDays(days)
                    .plusHours(Long.parseLong(clock.group(2)))
                    .plusMinutes(Long.parseLong(clock.group(3)))
                    .plusSeconds(Long.parseLong(clock.group(4)));
            return requirePositive(d, input);
        }

        if (s.startsWith("p")) {
            try {
                return requirePositive(Duration.parse(s.toUpperCase(Locale.ROOT)), input);
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid ISO-8601 duration: " + input, ex);
            }
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            long n = Long.parseLong(compact.group(1));
            Duration d = switch (compact.group(2).charAt(0)) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + input);
            };
            return requirePositive(d, input);
        }

        return requirePositive(parseHuman(s, input), input);
    }

    private static Duration parseHuman(String s, String original) {
        Objects.requireNonNull(s, "s must not be null");
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid duration format. Expected pairs like '3 minutes' or HH:MM:SS: " + original);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        Duration total = Duration.ZERO;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in duration: " + parts[i] + " (" + original + ")");
            }
            if (n < 0) {
                throw new IllegalArgumentException("Duration values must be non-negative: " + original);
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    total = total.plusDays(7L * n);
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    total = total.plusDays(n);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    total = total.plusHours(n);
                }
                case "minute", "min" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    total = total.plusMinutes(n);
                }
                case "second", "sec" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    total = total.plusSeconds(n);
                }
                default -> throw new IllegalArgumentException("Unsupported duration unit: " + parts[i + 1] + " (" + original + ")");
            }
        }
        return total;
    }

    private static Duration requirePositive(Duration d, String original) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("duration must be positive: " + original);
        }
        return d;
    }
}
