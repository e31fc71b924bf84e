package io.rota4j.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the queue runner, the cron scheduler and recurrence expansion.
 */
@ConfigurationProperties(prefix = "rota")
public class RotaProperties {
    private boolean enabled = true;
    private String workerId;
    private Duration pollInterval = Duration.ofSeconds(1);
    private int batchSize = 10;
    private Duration leaseDuration = Duration.ofMinutes(10);
    private Duration defaultJobTimeout = Duration.ofMinutes(5);
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private int defaultConcurrency = 5; // per queue without an explicit entry
    private Map<String, Queue> queues = defaultQueues();
    private Retry retry = new Retry();
    private Scheduler scheduler = new Scheduler();
    private Recurrence recurrence = new Recurrence();
    private Notification notification = new Notification();
    private boolean ensureIndexesOnStartup = false;

    private static Map<String, Queue> defaultQueues() {
        Map<String, Queue> queues = new LinkedHashMap<>();
        queues.put("notifications", new Queue(30));
        queues.put("recurring", new Queue(5));
        queues.put("scheduled_jobs", new Queue(5));
        return queues;
    }

    /**
     * Max concurrent jobs for {@code queue}.
     */
    public int maxWorkersFor(String queue) {
        Queue q = queues.get(queue);
        if (q == null || q.getMaxWorkers() <= 0) {
            return defaultConcurrency;
        }
        return q.getMaxWorkers();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    public Duration getDefaultJobTimeout() {
        return defaultJobTimeout;
    }

    public void setDefaultJobTimeout(Duration defaultJobTimeout) {
        this.defaultJobTimeout = defaultJobTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public void setDefaultConcurrency(int defaultConcurrency) {
        this.defaultConcurrency = defaultConcurrency;
    }

    public Map<String, Queue> getQueues() {
        return queues;
    }

    public void setQueues(Map<String, Queue> queues) {
        this.queues = queues;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Recurrence recurrence) {
        this.recurrence = recurrence;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public static class Queue {
        private int maxWorkers;

        public Queue() {
        }

        public Queue(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }
    }

    /**
     * Backoff between attempts: baseDelay * 2^(attempt-1), capped at maxDelay, jittered.
     */
    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(10);
        private Duration maxDelay = Duration.ofMinutes(10);

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofMinutes(1);
        private Duration catchUpWindow = Duration.ofHours(24);
        private Duration catchUpThreshold = Duration.ofHours(1);
        private int maxEnqueuesPerSchedule = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getCatchUpWindow() {
            return catchUpWindow;
        }

        public void setCatchUpWindow(Duration catchUpWindow) {
            this.catchUpWindow = catchUpWindow;
        }

        public Duration getCatchUpThreshold() {
            return catchUpThreshold;
        }

        public void setCatchUpThreshold(Duration catchUpThreshold) {
            this.catchUpThreshold = catchUpThreshold;
        }

        public int getMaxEnqueuesPerSchedule() {
            return maxEnqueuesPerSchedule;
        }

        public void setMaxEnqueuesPerSchedule(int maxEnqueuesPerSchedule) {
            this.maxEnqueuesPerSchedule = maxEnqueuesPerSchedule;
        }
    }

    public static class Recurrence {
        private Duration horizon = Duration.ofDays(90);
        private Duration rollForwardInterval = Duration.ofDays(1);
        // collection -> fields that must match for two time ranges to conflict
        private Map<String, List<String>> exclusionKeys = new LinkedHashMap<>();

        public Duration getHorizon() {
            return horizon;
        }

        public void setHorizon(Duration horizon) {
            this.horizon = horizon;
        }

        public Duration getRollForwardInterval() {
            return rollForwardInterval;
        }

        public void setRollForwardInterval(Duration rollForwardInterval) {
            this.rollForwardInterval = rollForwardInterval;
        }

        public Map<String, List<String>> getExclusionKeys() {
            return exclusionKeys;
        }

        public void setExclusionKeys(Map<String, List<String>> exclusionKeys) {
            this.exclusionKeys = exclusionKeys == null ? new LinkedHashMap<>() : exclusionKeys;
        }
    }

    public static class Notification {
        // fallback lookup of a user's primary email when no preferences are stored
        private String usersCollection = "users";
        private boolean skipTestEmails = false;

        public String getUsersCollection() {
            return usersCollection;
        }

        public void setUsersCollection(String usersCollection) {
            this.usersCollection = usersCollection;
        }

        public boolean isSkipTestEmails() {
            return skipTestEmails;
        }

        public void setSkipTestEmails(boolean skipTestEmails) {
            this.skipTestEmails = skipTestEmails;
        }
    }
}
