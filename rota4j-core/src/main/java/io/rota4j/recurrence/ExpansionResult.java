package io.rota4j.recurrence;

import java.util.List;

/**
 * @param created    instances linked to a newly inserted entity
 * @param skipped    occurrences already materialized (by an earlier or concurrent expansion)
 * @param conflicts  occurrences recorded as {@link InstanceExceptionType#CONFLICT_SKIPPED}
 * @param exhausted  the rule has no occurrences after the horizon
 */
public record ExpansionResult(
        Outcome outcome,
        int created,
        int skipped,
        int conflicts,
        boolean exhausted,
        List<SchemaDriftIssue> driftIssues
) {
    public enum Outcome {
        EXPANDED,
        INACTIVE,
        SCHEMA_DRIFT
    }

    public ExpansionResult {
        driftIssues = driftIssues == null ? List.of() : List.copyOf(driftIssues);
    }

    public static ExpansionResult inactive() {
        return new ExpansionResult(Outcome.INACTIVE, 0, 0, 0, false, List.of());
    }

    public static ExpansionResult drift(List<SchemaDriftIssue> issues) {
        return new ExpansionResult(Outcome.SCHEMA_DRIFT, 0, 0, 0, false, issues);
    }

    public static ExpansionResult expanded(int created, int skipped, int conflicts, boolean exhausted) {
        return new ExpansionResult(Outcome.EXPANDED, created, skipped, conflicts, exhausted, List.of());
    }
}
