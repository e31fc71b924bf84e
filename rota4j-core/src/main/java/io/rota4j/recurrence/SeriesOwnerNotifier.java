package io.rota4j.recurrence;

import java.util.List;

@FunctionalInterface
public interface SeriesOwnerNotifier {

    void notifySchemaDrift(SeriesDefinition series, List<SchemaDriftIssue> issues);
}
