package io.rota4j.recurrence;

import io.rota4j.failure.PermanentJobException;
import io.rota4j.utils.DurationParser;
import io.rota4j.utils.Zones;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Materializes the occurrences of a {@link SeriesDefinition} up to a horizon.
 *
 * <p>Steps for {@link #expand(String, Instant)}:
 * <ol>
 *   <li>inactive series are left alone</li>
 *   <li>schema drift sets the series to needs_attention, notifies the owner, and stops</li>
 *   <li>the rule is evaluated in the series zone (UTC when the zone is invalid)</li>
 *   <li>dates already materialized are skipped; new ones are reserved, then the entity is inserted and linked</li>
 *   <li>an overlap conflict turns the reservation into a {@code conflict_skipped} exception instance</li>
 *   <li>the watermark moves forward to the horizon</li>
 * </ol>
 * Safe to run repeatedly and concurrently for the same series: the (series, date) uniqueness of
 * instance rows decides which run materializes a date.
 */
public class RecurrenceEngine {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceEngine.class);
    private static final int LINK_ATTEMPTS = 3;

    private final SeriesRepository seriesRepository;
    private final SeriesInstanceRepository instanceRepository;
    private final EntityRecordWriter recordWriter;
    private final SchemaDriftDetector driftDetector;
    private final SeriesOwnerNotifier ownerNotifier;
    private final RecurrenceExpander expander;

    public RecurrenceEngine(SeriesRepository seriesRepository,
                            SeriesInstanceRepository instanceRepository,
                            EntityRecordWriter recordWriter,
                            SchemaDriftDetector driftDetector,
                            SeriesOwnerNotifier ownerNotifier,
                            RecurrenceExpander expander) {
        this.seriesRepository = Objects.requireNonNull(seriesRepository, "seriesRepository must not be null");
        this.instanceRepository = Objects.requireNonNull(instanceRepository, "instanceRepository must not be null");
        this.recordWriter = Objects.requireNonNull(recordWriter, "recordWriter must not be null");
        this.driftDetector = Objects.requireNonNull(driftDetector, "driftDetector must not be null");
        this.ownerNotifier = Objects.requireNonNull(ownerNotifier, "ownerNotifier must not be null");
        this.expander = Objects.requireNonNull(expander, "expander must not be null");
    }

    public ExpansionResult expand(String seriesId, Instant expandUntil) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(expandUntil, "expandUntil must not be null");

        SeriesDefinition series = seriesRepository.findById(seriesId)
                .orElseThrow(() -> new PermanentJobException("recurring series not found: " + seriesId));

        if (!series.isActive()) {
            log.debug("rota recurrence series not active seriesId={} status={}", seriesId, series.status());
            return ExpansionResult.inactive();
        }

        List<SchemaDriftIssue> drift = driftDetector.detect(series);
        if (!drift.isEmpty()) {
            return haltOnDrift(series, drift);
        }

        ZoneId zone = Zones.resolveOrUtc(series.timezone());
        Duration length;
        try {
            length = DurationParser.parse(series.duration());
        } catch (IllegalArgumentException e) {
            throw new PermanentJobException("invalid series duration seriesId=" + seriesId + ": " + e.getMessage(), e);
        }

        RecurrenceExpander.Expansion expansion = expander.expand(series.recurrenceRule(), series.dtstart(), zone, expandUntil);
        Set<LocalDate> existing = instanceRepository.findOccurrenceDates(seriesId);

        int created = 0, skipped = 0, conflicts = 0;
        for (ZonedDateTime occurrence : expansion.occurrences()) {
            LocalDate date = occurrence.toLocalDate();
            if (existing.contains(date)) {
                skipped++;
                continue;
            }
            if (!instanceRepository.reserve(seriesId, date, occurrence.toInstant(), series.entityTable())) {
                skipped++;
                continue;
            }

            TimeRange range = new TimeRange(occurrence.toInstant(), occurrence.toInstant().plus(length));
            Map<String, Object> record = new LinkedHashMap<>(series.entityTemplate());
            record.put(series.timeRangeColumn(), range);

            String entityId;
            try {
                entityId = recordWriter.insert(series.entityTable(), record);
            } catch (OverlapConflictException e) {
                instanceRepository.markException(seriesId, date, InstanceExceptionType.CONFLICT_SKIPPED);
                conflicts++;
                log.info("rota recurrence occurrence skipped on conflict seriesId={} date={} range={} msg={}",
                        seriesId, date, range, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                instanceRepository.release(seriesId, date);
                throw e;
            }
            // the entity exists from here on; the reservation must never be released
            linkWithRetry(seriesId, date, entityId);
            created++;
        }

        seriesRepository.advanceWatermark(seriesId, expandUntil);
        log.info("rota recurrence expanded seriesId={} until={} created={} skipped={} conflicts={} exhausted={}",
                seriesId, expandUntil, created, skipped, conflicts, expansion.exhausted());
        return ExpansionResult.expanded(created, skipped, conflicts, expansion.exhausted());
    }

    private void linkWithRetry(String seriesId, LocalDate date, String entityId) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= LINK_ATTEMPTS; attempt++) {
            try {
                instanceRepository.linkEntity(seriesId, date, entityId);
                return;
            } catch (RuntimeException e) {
                last = e;
                log.warn("rota recurrence link failed seriesId={} date={} entityId={} attempt={} msg={}",
                        seriesId, date, entityId, attempt, e.getMessage());
            }
        }
        log.error("rota recurrence entity left unlinked seriesId={} date={} entityId={}", seriesId, date, entityId);
        throw last;
    }

    private ExpansionResult haltOnDrift(SeriesDefinition series, List<SchemaDriftIssue> drift) {
        String summary = SchemaDriftDetector.summarize(drift);
        log.warn("rota recurrence schema drift, series needs attention seriesId={} table={} issues={}",
                series.id(), series.entityTable(), summary);
        seriesRepository.markNeedsAttention(series.id(), "Schema drift detected: " + summary);
        try {
            ownerNotifier.notifySchemaDrift(series, drift);
        } catch (RuntimeException e) {
            log.warn("rota recurrence drift notification failed seriesId={} owner={} msg={}",
                    series.id(), series.createdBy(), e.getMessage());
        }
        return ExpansionResult.drift(drift);
    }
}
