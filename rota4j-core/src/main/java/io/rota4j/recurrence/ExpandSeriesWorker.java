package io.rota4j.recurrence;

import io.rota4j.Rota;
import io.rota4j.Worker;
import io.rota4j.core.EnqueueResult;
import io.rota4j.core.JobContext;
import io.rota4j.core.JobOptions;
import io.rota4j.core.Priority;
import io.rota4j.failure.PermanentJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs {@link RecurrenceEngine#expand(String, Instant)} and keeps the horizon rolling.
 *
 * <p>After a successful expansion of an active series whose rule is not exhausted, the next
 * expansion is enqueued {@code rollForwardInterval} later with horizon {@code that time + horizon}.
 * The dedup key {@code expand_series:<id>:<date>} keeps one pending roll-forward per series per day.
 */
public class ExpandSeriesWorker implements Worker<ExpandSeriesArgs> {
    private static final Logger log = LoggerFactory.getLogger(ExpandSeriesWorker.class);

    public static final String KIND = "expand_recurring_series";
    public static final String QUEUE = "recurring";
    public static final JobOptions OPTIONS = JobOptions.of(QUEUE, Priority.NORMAL, 10);

    public static final Duration DEFAULT_HORIZON = Duration.ofDays(90);
    public static final Duration DEFAULT_ROLL_FORWARD_INTERVAL = Duration.ofDays(1);

    private final RecurrenceEngine engine;
    private final Supplier<Rota> rota;
    private final Duration horizon;
    private final Duration rollForwardInterval;
    private final Clock clock;

    public ExpandSeriesWorker(RecurrenceEngine engine, Supplier<Rota> rota) {
        this(engine, rota, DEFAULT_HORIZON, DEFAULT_ROLL_FORWARD_INTERVAL, Clock.systemUTC());
    }

    public ExpandSeriesWorker(RecurrenceEngine engine,
                              Supplier<Rota> rota,
                              Duration horizon,
                              Duration rollForwardInterval,
                              Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.rota = Objects.requireNonNull(rota, "rota must not be null");
        this.horizon = Objects.requireNonNull(horizon, "horizon must not be null");
        this.rollForwardInterval = Objects.requireNonNull(rollForwardInterval, "rollForwardInterval must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (horizon.isZero() || horizon.isNegative()) {
            throw new IllegalArgumentException("horizon must be a positive duration");
        }
        if (rollForwardInterval.isZero() || rollForwardInterval.isNegative()) {
            throw new IllegalArgumentException("rollForwardInterval must be a positive duration");
        }
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Class<ExpandSeriesArgs> argsClass() {
        return ExpandSeriesArgs.class;
    }

    @Override
    public JobOptions options() {
        return OPTIONS;
    }

    @Override
    public void work(JobContext context, ExpandSeriesArgs args) {
        if (args == null || args.seriesId() == null || args.seriesId().isBlank()) {
            throw new PermanentJobException("invalid expansion args: series_id is missing");
        }

        Instant now = clock.instant();
        Instant until;
        try {
            until = args.expandUntilInstant();
        } catch (DateTimeParseException e) {
            throw new PermanentJobException("invalid expansion args: expand_until=" + args.expandUntil(), e);
        }
        if (until == null) {
            until = now.plus(horizon);
        }

        ExpansionResult result = engine.expand(args.seriesId(), until);
        if (result.outcome() != ExpansionResult.Outcome.EXPANDED || result.exhausted()) {
            log.debug("rota recurrence roll-forward not needed seriesId={} outcome={} exhausted={}",
                    args.seriesId(), result.outcome(), result.exhausted());
            return;
        }

        Instant nextRun = now.plus(rollForwardInterval);
        EnqueueResult next = enqueueExpansion(rota.get(), args.seriesId(), nextRun, nextRun.plus(horizon));
        log.debug("rota recurrence roll-forward seriesId={} nextRun={} created={}", args.seriesId(), nextRun, next.created());
    }

    /**
     * Enqueues an immediate expansion without a dedup key, e.g. right after a series is created
     * or re-activated. The worker takes over the roll-forward from there.
     */
    public static EnqueueResult expandNow(Rota rota, String seriesId) {
        return rota.now(KIND, ExpandSeriesArgs.of(seriesId, null));
    }

    /**
     * Enqueues an expansion of {@code seriesId} to run at {@code runAt}, deduplicated per series and day.
     */
    public static EnqueueResult enqueueExpansion(Rota rota, String seriesId, Instant runAt, Instant expandUntil) {
        return rota.create(KIND, ExpandSeriesArgs.of(seriesId, expandUntil))
                .uniqueKey(dedupKey(seriesId, runAt))
                .schedule(runAt)
                .save();
    }

    public static String dedupKey(String seriesId, Instant runAt) {
        return "expand_series:" + seriesId + ":" + runAt.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
