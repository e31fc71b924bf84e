package io.rota4j.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {

    List<ScheduleDefinition> findEnabled();

    Optional<ScheduleDefinition> findById(String id);

    /**
     * Sets lastRunAt to {@code runAt} unless it is already at or after it.
     *
     * @return true if the value moved forward
     */
    boolean advanceLastRunAt(String id, Instant runAt);
}
