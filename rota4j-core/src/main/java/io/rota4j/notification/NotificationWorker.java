package io.rota4j.notification;

import io.rota4j.Worker;
import io.rota4j.core.JobContext;
import io.rota4j.core.JobOptions;
import io.rota4j.core.Priority;
import io.rota4j.failure.FailureClassifier;
import io.rota4j.failure.FailureKind;
import io.rota4j.failure.PermanentJobException;
import io.rota4j.failure.TransientJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delivers one notification over every requested channel the recipient accepts.
 *
 * <p>Missing recipients, missing templates and render errors are permanent. Delivery is judged
 * per channel: one successful channel completes the job and the failed ones are recorded next to
 * it. Only when every channel fails is the last error classified, and the job retried or discarded.
 */
public class NotificationWorker implements Worker<NotificationArgs> {
    private static final Logger log = LoggerFactory.getLogger(NotificationWorker.class);

    public static final String KIND = "send_notification";
    public static final String QUEUE = "notifications";
    public static final JobOptions OPTIONS = JobOptions.of(QUEUE, Priority.HIGH, 5);

    public static final String EMAIL = "email";

    private static final Set<String> TEST_EMAIL_DOMAINS = Set.of("@example.com", "@example.org", "@example.net");

    private final RecipientDirectory recipients;
    private final NotificationTemplates templates;
    private final NotificationRenderer renderer;
    private final Map<String, NotificationChannel> channelsByName;
    private final NotificationStatusRecorder statusRecorder;
    private final FailureClassifier classifier;
    private final boolean skipTestEmails;

    public NotificationWorker(RecipientDirectory recipients,
                              NotificationTemplates templates,
                              NotificationRenderer renderer,
                              List<NotificationChannel> channels,
                              NotificationStatusRecorder statusRecorder,
                              FailureClassifier classifier,
                              boolean skipTestEmails) {
        this.recipients = Objects.requireNonNull(recipients, "recipients must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.statusRecorder = Objects.requireNonNull(statusRecorder, "statusRecorder must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.channelsByName = Objects.requireNonNull(channels, "channels must not be null").stream()
                .collect(Collectors.toUnmodifiableMap(
                        NotificationChannel::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate NotificationChannel name: " + a.name());
                        }
                ));
        this.skipTestEmails = skipTestEmails;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Class<NotificationArgs> argsClass() {
        return NotificationArgs.class;
    }

    @Override
    public JobOptions options() {
        return OPTIONS;
    }

    @Override
    public void work(JobContext context, NotificationArgs args) {
        if (args == null || args.userId() == null || args.templateName() == null) {
            throw new PermanentJobException("invalid notification args: user_id and template_name are required");
        }

        Recipient recipient = recipients.find(args.userId())
                .orElseThrow(() -> new PermanentJobException("recipient not found: " + args.userId()));

        NotificationTemplate template = templates.find(args.templateName())
                .orElseThrow(() -> new PermanentJobException("notification template not found: " + args.templateName()));

        RenderedNotification message;
        try {
            message = renderer.render(template, args.entityData());
        } catch (Exception e) {
            throw new PermanentJobException("template render failed: " + args.templateName() + ": " + e.getMessage(), e);
        }

        List<String> requested = resolveChannels(args, recipient);
        if (requested.isEmpty()) {
            log.info("rota notification has no enabled channel notificationId={} userId={}", args.notificationId(), args.userId());
            statusRecorder.markSent(args.notificationId(), List.of(), Map.of());
            return;
        }

        List<String> sent = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        Exception lastError = null;

        for (String channelName : requested) {
            NotificationChannel channel = channelsByName.get(channelName);
            if (channel == null) {
                failed.put(channelName, "channel not configured");
                continue;
            }
            if (EMAIL.equals(channelName) && skipTestEmails && isTestAddress(recipient.email())) {
                log.debug("rota notification skipped test address notificationId={} email={}", args.notificationId(), recipient.email());
                sent.add(channelName);
                continue;
            }
            try {
                channel.send(recipient, message);
                sent.add(channelName);
            } catch (Exception e) {
                lastError = e;
                failed.put(channelName, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                log.warn("rota notification channel failed notificationId={} channel={} attempt={} msg={}",
                        args.notificationId(), channelName, context.attempt(), e.getMessage());
            }
        }

        if (!sent.isEmpty()) {
            statusRecorder.markSent(args.notificationId(), sent, failed);
            if (!failed.isEmpty()) {
                log.info("rota notification partially delivered notificationId={} sent={} failed={}",
                        args.notificationId(), sent, failed.keySet());
            }
            return;
        }

        String summary = "all channels failed: " + failed;
        statusRecorder.markFailed(args.notificationId(), summary);

        if (lastError == null || classifier.classify(lastError) == FailureKind.PERMANENT) {
            throw new PermanentJobException(summary, lastError);
        }
        throw new TransientJobException(summary, lastError);
    }

    private static List<String> resolveChannels(NotificationArgs args, Recipient recipient) {
        List<String> requested = (args.channels() == null || args.channels().isEmpty())
                ? recipient.enabledChannels().stream().sorted().toList()
                : args.channels();
        List<String> out = new ArrayList<>();
        for (String c : requested) {
            String name = c.toLowerCase(Locale.ROOT);
            if (recipient.enabledChannels().contains(name) && !out.contains(name)) {
                out.add(name);
            }
        }
        return out;
    }

    static boolean isTestAddress(String email) {
        if (email == null) {
            return false;
        }
        String lower = email.toLowerCase(Locale.ROOT);
        return TEST_EMAIL_DOMAINS.stream().anyMatch(lower::endsWith);
    }
}
