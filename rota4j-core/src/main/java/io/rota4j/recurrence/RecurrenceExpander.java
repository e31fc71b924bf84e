package io.rota4j.recurrence;

import org.dmfs.rfc5545.DateTime;
import org.dmfs.rfc5545.recur.Freq;
import org.dmfs.rfc5545.recur.InvalidRecurrenceRuleException;
import org.dmfs.rfc5545.recur.RecurrenceRule;
import org.dmfs.rfc5545.recur.RecurrenceRuleIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Evaluates RRULEs with lib-recur in local wall-clock time.
 *
 * <p>The start is converted into the series zone, the rule is iterated on local fields, and each
 * result is turned back into an instant by resolving the same wall-clock fields in that zone.
 * "Every Monday at 14:00" therefore stays at 14:00 local across daylight-saving changes.
 * Wall-clock times that fall into a gap are shifted forward by the gap length.
 */
public class RecurrenceExpander {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceExpander.class);

    public static final int DEFAULT_MAX_OCCURRENCES = 10_000;

    private final int maxOccurrences;

    /**
     * @param occurrences local occurrence times, ascending, all within {@code [dtstart, until]}
     * @param exhausted   true if the rule has no occurrences after the returned ones
     */
    public record Expansion(List<ZonedDateTime> occurrences, boolean exhausted) {
        public Expansion {
            occurrences = List.copyOf(occurrences);
        }
    }

    public RecurrenceExpander() {
        this(DEFAULT_MAX_OCCURRENCES);
    }

    public RecurrenceExpander(int maxOccurrences) {
        if (maxOccurrences < 1) {
            throw new IllegalArgumentException("maxOccurrences must be >= 1");
        }
        this.maxOccurrences = maxOccurrences;
    }

    public Expansion expand(String rrule, Instant dtstart, ZoneId zone, Instant until) {
        Objects.requireNonNull(dtstart, "dtstart must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(until, "until must not be null");

        RecurrenceRule rule = parse(rrule);
        if (until.isBefore(dtstart)) {
            return new Expansion(List.of(), false);
        }

        ZonedDateTime localStart = dtstart.atZone(zone);
        DateTime start = new DateTime(
                TimeZone.getTimeZone(zone),
                localStart.getYear(),
                localStart.getMonthValue() - 1,
                localStart.getDayOfMonth(),
                localStart.getHour(),
                localStart.getMinute(),
                localStart.getSecond()
        );

        RecurrenceRuleIterator it = rule.iterator(start);
        List<ZonedDateTime> out = new ArrayList<>();
        while (it.hasNext()) {
            if (out.size() >= maxOccurrences) {
                log.warn("rota recurrence expansion capped rule={} cap={} until={}", rrule, maxOccurrences, until);
                return new Expansion(out, false);
            }

            ZonedDateTime occurrence = toZoned(it.nextDateTime(), zone);
            if (occurrence.toInstant().isAfter(until)) {
                return new Expansion(out, false);
            }
            if (!occurrence.toInstant().isBefore(dtstart)) {
                out.add(occurrence);
            }
        }
        return new Expansion(out, true);
    }

    /**
     * Parses and checks a rule without expanding it.
     *
     * @throws RecurrenceRuleException if the rule is malformed or uses an unsupported frequency
     */
    public RecurrenceRule parse(String rrule) {
        if (rrule == null || rrule.isBlank()) {
            throw new RecurrenceRuleException("recurrence rule must not be empty");
        }
        String body = rrule.trim();
        if (body.regionMatches(true, 0, "RRULE:", 0, 6)) {
            body = body.substring(6);
        }

        RecurrenceRule rule;
        try {
            rule = new RecurrenceRule(body);
        } catch (InvalidRecurrenceRuleException | IllegalArgumentException e) {
            throw new RecurrenceRuleException("invalid recurrence rule: " + rrule + " (" + e.getMessage() + ")", e);
        }

        Freq freq = rule.getFreq();
        if (freq == Freq.SECONDLY || freq == Freq.MINUTELY) {
            throw new RecurrenceRuleException("invalid recurrence rule: frequency " + freq + " is not supported");
        }
        return rule;
    }

    private static ZonedDateTime toZoned(DateTime dt, ZoneId zone) {
        try {
            LocalDateTime local = LocalDateTime.of(
                    dt.getYear(),
                    dt.getMonth() + 1,
                    dt.getDayOfMonth(),
                    dt.getHours(),
                    dt.getMinutes(),
                    dt.getSeconds()
            );
            return ZonedDateTime.ofLocal(local, zone, null);
        } catch (DateTimeException e) {
            throw new RecurrenceRuleException("recurrence rule produced an invalid date: " + dt, e);
        }
    }
}
