package io.rota4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rota4j.Rota;
import io.rota4j.Worker;
import io.rota4j.core.WorkerRegistry;
import io.rota4j.failure.ExponentialBackoffRetryPolicy;
import io.rota4j.failure.FailureClassifier;
import io.rota4j.failure.KeywordFailureClassifier;
import io.rota4j.failure.RetryPolicy;
import io.rota4j.internal.mongo.MongoEntityRecordWriter;
import io.rota4j.internal.mongo.MongoEntitySchemaInspector;
import io.rota4j.internal.mongo.MongoJobStore;
import io.rota4j.internal.mongo.MongoNotificationStatusRecorder;
import io.rota4j.internal.mongo.MongoNotificationTemplates;
import io.rota4j.internal.mongo.MongoRecipientDirectory;
import io.rota4j.internal.mongo.MongoRota;
import io.rota4j.internal.mongo.MongoScheduleRepository;
import io.rota4j.internal.mongo.MongoScheduleRunRepository;
import io.rota4j.internal.mongo.MongoSeriesInstanceRepository;
import io.rota4j.internal.mongo.MongoSeriesRepository;
import io.rota4j.notification.NotificationChannel;
import io.rota4j.notification.NotificationRenderer;
import io.rota4j.notification.NotificationStatusRecorder;
import io.rota4j.notification.NotificationTemplates;
import io.rota4j.notification.NotificationWorker;
import io.rota4j.notification.PlaceholderNotificationRenderer;
import io.rota4j.notification.RecipientDirectory;
import io.rota4j.recurrence.EntityRecordWriter;
import io.rota4j.recurrence.EntitySchemaInspector;
import io.rota4j.recurrence.ExpandSeriesWorker;
import io.rota4j.recurrence.NotificationSeriesOwnerNotifier;
import io.rota4j.recurrence.RecurrenceEngine;
import io.rota4j.recurrence.RecurrenceExpander;
import io.rota4j.recurrence.SchemaDriftDetector;
import io.rota4j.recurrence.SeriesInstanceRepository;
import io.rota4j.recurrence.SeriesOwnerNotifier;
import io.rota4j.recurrence.SeriesRepository;
import io.rota4j.schedule.CronScheduler;
import io.rota4j.schedule.ScheduleExecuteWorker;
import io.rota4j.schedule.ScheduleRepository;
import io.rota4j.schedule.ScheduleRunRepository;
import io.rota4j.schedule.ScheduledTask;
import io.rota4j.schedule.ScheduledTaskRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for Rota components.
 *
 * <p>Workers reach the runner through {@code ObjectProvider<Rota>}, since the runner itself
 * depends on the registry of all workers.
 */
@AutoConfiguration
@ConditionalOnClass({Rota.class, MongoTemplate.class})
@EnableConfigurationProperties(RotaProperties.class)
@ConditionalOnProperty(prefix = "rota", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RotaConfig {

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected RotaMongoIndexConfig rotaMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new RotaMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureClassifier rotaFailureClassifier() {
        return new KeywordFailureClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy rotaRetryPolicy(RotaProperties props) {
        return new ExponentialBackoffRetryPolicy(
                props.getRetry().getBaseDelay().toMillis(),
                props.getRetry().getMaxDelay().toMillis());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerRegistry workerRegistry(ObjectProvider<List<Worker<?>>> workersProvider) {
        List<Worker<?>> workers = workersProvider.getIfAvailable(List::of);
        return new WorkerRegistry(workers);
    }

    @Bean
    @ConditionalOnMissingBean
    public Rota rota(RotaProperties props,
                     MongoJobStore jobStore,
                     WorkerRegistry registry,
                     ObjectMapper om,
                     FailureClassifier classifier,
                     RetryPolicy retryPolicy) {
        return new MongoRota(props, jobStore, registry, om, classifier, retryPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public RotaLifecycle rotaLifecycle(Rota rota, ObjectProvider<CronScheduler> scheduler) {
        return new RotaLifecycle(rota, scheduler.getIfAvailable());
    }

    @Bean
    public SmartInitializingSingleton rotaIndexesInitializer(RotaMongoIndexConfig indexConfig, RotaProperties props) {
        return () -> {
            if (props.isEnsureIndexesOnStartup()) {
                indexConfig.ensureIndexes();
            } else {
                indexConfig.ensureRequiredIndexes();
            }
        };
    }

    // cron schedules

    @Bean
    @ConditionalOnMissingBean(ScheduleRepository.class)
    public MongoScheduleRepository scheduleRepository(MongoTemplate mongoTemplate) {
        return new MongoScheduleRepository(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleRunRepository.class)
    public MongoScheduleRunRepository scheduleRunRepository(MongoTemplate mongoTemplate) {
        return new MongoScheduleRunRepository(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduledTaskRegistry scheduledTaskRegistry(ObjectProvider<List<ScheduledTask>> tasksProvider) {
        return new ScheduledTaskRegistry(tasksProvider.getIfAvailable(List::of));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleExecuteWorker scheduleExecuteWorker(ScheduleRepository scheduleRepository,
                                                       ScheduleRunRepository runRepository,
                                                       ScheduledTaskRegistry taskRegistry) {
        return new ScheduleExecuteWorker(scheduleRepository, runRepository, taskRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rota.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CronScheduler cronScheduler(ScheduleRepository scheduleRepository, Rota rota, RotaProperties props) {
        RotaProperties.Scheduler s = props.getScheduler();
        CronScheduler.Settings settings = new CronScheduler.Settings(
                s.getTickInterval(),
                s.getCatchUpWindow(),
                s.getCatchUpThreshold(),
                s.getMaxEnqueuesPerSchedule());
        return new CronScheduler(scheduleRepository, rota, settings);
    }

    // recurring series

    @Bean
    @ConditionalOnMissingBean(SeriesRepository.class)
    public MongoSeriesRepository seriesRepository(MongoTemplate mongoTemplate) {
        return new MongoSeriesRepository(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(SeriesInstanceRepository.class)
    public MongoSeriesInstanceRepository seriesInstanceRepository(MongoTemplate mongoTemplate, RotaProperties props) {
        return new MongoSeriesInstanceRepository(mongoTemplate, props.getLeaseDuration());
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityRecordWriter entityRecordWriter(MongoTemplate mongoTemplate, RotaProperties props) {
        return new MongoEntityRecordWriter(mongoTemplate, props.getRecurrence().getExclusionKeys());
    }

    @Bean
    @ConditionalOnMissingBean
    public EntitySchemaInspector entitySchemaInspector(MongoTemplate mongoTemplate) {
        return new MongoEntitySchemaInspector(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public SeriesOwnerNotifier seriesOwnerNotifier(ObjectProvider<Rota> rota) {
        return new NotificationSeriesOwnerNotifier(rota::getObject);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceEngine recurrenceEngine(SeriesRepository seriesRepository,
                                             SeriesInstanceRepository instanceRepository,
                                             EntityRecordWriter recordWriter,
                                             EntitySchemaInspector schemaInspector,
                                             SeriesOwnerNotifier ownerNotifier) {
        return new RecurrenceEngine(seriesRepository, instanceRepository, recordWriter,
                new SchemaDriftDetector(schemaInspector), ownerNotifier, new RecurrenceExpander());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpandSeriesWorker expandSeriesWorker(RecurrenceEngine engine, ObjectProvider<Rota> rota, RotaProperties props) {
        RotaProperties.Recurrence r = props.getRecurrence();
        return new ExpandSeriesWorker(engine, rota::getObject, r.getHorizon(), r.getRollForwardInterval(), Clock.systemUTC());
    }

    // notifications

    @Bean
    @ConditionalOnMissingBean
    public NotificationTemplates notificationTemplates(MongoTemplate mongoTemplate) {
        return new MongoNotificationTemplates(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecipientDirectory recipientDirectory(MongoTemplate mongoTemplate, RotaProperties props) {
        return new MongoRecipientDirectory(mongoTemplate, props.getNotification().getUsersCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationStatusRecorder notificationStatusRecorder(MongoTemplate mongoTemplate) {
        return new MongoNotificationStatusRecorder(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationRenderer notificationRenderer() {
        return new PlaceholderNotificationRenderer();
    }

    @Bean
    @ConditionalOnBean(NotificationChannel.class)
    @ConditionalOnMissingBean
    public NotificationWorker notificationWorker(RecipientDirectory recipients,
                                                 NotificationTemplates templates,
                                                 NotificationRenderer renderer,
                                                 List<NotificationChannel> channels,
                                                 NotificationStatusRecorder statusRecorder,
                                                 FailureClassifier classifier,
                                                 RotaProperties props) {
        return new NotificationWorker(recipients, templates, renderer, channels, statusRecorder, classifier,
                props.getNotification().isSkipTestEmails());
    }
}
