package io.rota4j.recurrence;

import io.rota4j.Rota;
import io.rota4j.notification.NotificationArgs;
import io.rota4j.notification.NotificationWorker;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Tells the series creator about schema drift through a {@code send_notification} job.
 */
public class NotificationSeriesOwnerNotifier implements SeriesOwnerNotifier {

    public static final String DRIFT_TEMPLATE = "series_schema_drift";

    private final Supplier<Rota> rota;

    public NotificationSeriesOwnerNotifier(Supplier<Rota> rota) {
        this.rota = Objects.requireNonNull(rota, "rota must not be null");
    }

    @Override
    public void notifySchemaDrift(SeriesDefinition series, List<SchemaDriftIssue> issues) {
        if (series.createdBy() == null) {
            return;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("series_id", series.id());
        data.put("entity_table", series.entityTable());
        data.put("drift_issues", issues.stream()
                .map(i -> Map.of("field", i.field(), "issue", i.issue()))
                .toList());
        data.put("drift_summary", SchemaDriftDetector.summarize(issues));

        NotificationArgs args = new NotificationArgs(
                UUID.randomUUID().toString(),
                series.createdBy(),
                DRIFT_TEMPLATE,
                "recurring_series",
                series.id(),
                data,
                List.of(NotificationWorker.EMAIL)
        );
        rota.get().now(NotificationWorker.KIND, args);
    }
}
