package io.rota4j.config;

import io.rota4j.Rota;
import io.rota4j.schedule.CronScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the job runner and, when enabled, the cron tick loop for as long as the container is running.
 * The runner comes up first so the first tick already has pollers to hand jobs to; on shutdown the
 * scheduler stops enqueueing before the runner drains.
 */
public class RotaLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RotaLifecycle.class);

    private final Rota rota;
    private final CronScheduler scheduler;
    private volatile boolean running = false;

    /**
     * @param scheduler may be null when {@code rota.scheduler.enabled=false}
     */
    public RotaLifecycle(Rota rota, CronScheduler scheduler) {
        this.rota = rota;
        this.scheduler = scheduler;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        rota.start();
        if (scheduler != null) {
            scheduler.start();
        }
        running = true;
        log.debug("rota lifecycle started scheduler={}", scheduler != null);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            if (scheduler != null) {
                scheduler.stop();
            }
        } finally {
            rota.stop();
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    boolean schedulerEnabled() {
        return scheduler != null;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
