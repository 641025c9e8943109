package io.scheduler4j.store;

import io.scheduler4j.core.TaskRecord;

import java.time.Instant;
import java.util.List;

/**
 * Durable snapshot of the pending task set.
 *
 * <p>Every save replaces the previous snapshot entirely. There is no append log and no
 * cross-process coordination: one scheduler instance per snapshot.
 */
public interface TaskStore {

    /**
     * Read the last snapshot, dropping tasks whose due time is not after {@code now}.
     *
     * @throws TaskPersistenceException when the snapshot exists but cannot be read
     */
    List<TaskRecord> load(Instant now);

    /**
     * Overwrite the snapshot with {@code pending}.
     *
     * @throws TaskPersistenceException when the snapshot cannot be written
     */
    void save(List<TaskRecord> pending);
}
