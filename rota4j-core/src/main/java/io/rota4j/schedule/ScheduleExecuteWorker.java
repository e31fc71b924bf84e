package io.rota4j.schedule;

import io.rota4j.Worker;
import io.rota4j.core.JobContext;
import io.rota4j.core.JobOptions;
import io.rota4j.core.Priority;
import io.rota4j.failure.PermanentJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes one occurrence of a {@link ScheduleDefinition}.
 *
 * <p>Each attempt appends a {@link ScheduleRun}. A task that reports failure through its
 * {@link TaskOutcome} is recorded and the job still completes; a task that throws fails the
 * attempt and is retried by the runner. lastRunAt moves forward to the occurrence time after
 * every non-manual attempt, whatever its outcome.
 */
public class ScheduleExecuteWorker implements Worker<ScheduleExecuteArgs> {
    private static final Logger log = LoggerFactory.getLogger(ScheduleExecuteWorker.class);

    public static final String KIND = "scheduled_job_execute";
    public static final String QUEUE = "scheduled_jobs";
    public static final JobOptions OPTIONS = JobOptions.of(QUEUE, Priority.NORMAL, 3);

    private final ScheduleRepository scheduleRepository;
    private final ScheduleRunRepository runRepository;
    private final ScheduledTaskRegistry taskRegistry;
    private final Clock clock;

    public ScheduleExecuteWorker(ScheduleRepository scheduleRepository,
                                 ScheduleRunRepository runRepository,
                                 ScheduledTaskRegistry taskRegistry) {
        this(scheduleRepository, runRepository, taskRegistry, Clock.systemUTC());
    }

    public ScheduleExecuteWorker(ScheduleRepository scheduleRepository,
                                 ScheduleRunRepository runRepository,
                                 ScheduledTaskRegistry taskRegistry,
                                 Clock clock) {
        this.scheduleRepository = Objects.requireNonNull(scheduleRepository, "scheduleRepository must not be null");
        this.runRepository = Objects.requireNonNull(runRepository, "runRepository must not be null");
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Class<ScheduleExecuteArgs> argsClass() {
        return ScheduleExecuteArgs.class;
    }

    @Override
    public JobOptions options() {
        return OPTIONS;
    }

    @Override
    public void work(JobContext context, ScheduleExecuteArgs args) throws Exception {
        if (args == null || args.scheduleId() == null) {
            throw new PermanentJobException("invalid scheduled job args: schedule id is missing");
        }

        ScheduleDefinition schedule = scheduleRepository.findById(args.scheduleId())
                .orElseThrow(() -> new PermanentJobException("schedule not found: " + args.scheduleId()));

        Instant scheduledFor = args.scheduledForInstant();
        TriggerReason trigger = args.trigger();
        Instant startedAt = clock.instant();
        String runId = runRepository.start(ScheduleRun.started(schedule.id(), startedAt, scheduledFor, trigger));

        log.debug("rota scheduled job started id={} name={} target={} scheduledFor={} attempt={}",
                schedule.id(), schedule.name(), schedule.target(), scheduledFor, context.attempt());

        Optional<ScheduledTask> task = taskRegistry.find(schedule.target());
        if (task.isEmpty()) {
            String message = "unknown scheduled task target: " + schedule.target();
            finish(runId, startedAt, false, message);
            advance(schedule, scheduledFor, trigger);
            throw new PermanentJobException(message);
        }

        TaskOutcome outcome;
        try {
            outcome = task.get().run(schedule, scheduledFor);
        } catch (Exception e) {
            finish(runId, startedAt, false, "execution failed: " + e.getMessage());
            advance(schedule, scheduledFor, trigger);
            throw e;
        }

        if (outcome == null) {
            outcome = TaskOutcome.success("completed");
        }
        finish(runId, startedAt, outcome.success(), outcome.message());
        advance(schedule, scheduledFor, trigger);

        if (outcome.success()) {
            log.info("rota scheduled job completed id={} name={} scheduledFor={}", schedule.id(), schedule.name(), scheduledFor);
        } else {
            log.warn("rota scheduled job reported failure id={} name={} scheduledFor={} msg={}",
                    schedule.id(), schedule.name(), scheduledFor, outcome.message());
        }
    }

    private void finish(String runId, Instant startedAt, boolean success, String message) {
        Instant completedAt = clock.instant();
        long durationMs = Duration.between(startedAt, completedAt).toMillis();
        runRepository.complete(runId, completedAt, durationMs, success, message);
    }

    private void advance(ScheduleDefinition schedule, Instant scheduledFor, TriggerReason trigger) {
        if (trigger == TriggerReason.MANUAL || scheduledFor == null) {
            return;
        }
        scheduleRepository.advanceLastRunAt(schedule.id(), scheduledFor);
    }
}
