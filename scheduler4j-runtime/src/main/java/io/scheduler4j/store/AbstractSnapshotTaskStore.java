package io.scheduler4j.store;

import io.scheduler4j.core.TaskRecord;
import io.scheduler4j.core.TaskValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared load/save contract for snapshot stores: subclasses read and write raw entries,
 * this class converts them and drops tasks that expired while the process was down.
 */
public abstract class AbstractSnapshotTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractSnapshotTaskStore.class);

    @Override
    public List<TaskRecord> load(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        List<TaskSnapshotEntry> entries = readSnapshot();

        List<TaskRecord> live = new ArrayList<>(entries.size());
        int expired = 0;
        for (TaskSnapshotEntry entry : entries) {
            TaskRecord record;
            try {
                record = entry.toRecord(now);
            } catch (TaskValidationException e) {
                log.warn("Skipping invalid task in snapshot id={} msg={}", entry.taskId(), e.getMessage());
                continue;
            }
            if (record.dueTime().isAfter(now)) {
                live.add(record);
            } else {
                expired++;
                log.debug("Dropping expired task on load id={} dueTime={}", record.id(), record.dueTime());
            }
        }

        log.info("Task snapshot loaded from {} pending={} expired={}", describe(), live.size(), expired);
        return live;
    }

    @Override
    public void save(List<TaskRecord> pending) {
        Objects.requireNonNull(pending, "pending must not be null");
        List<TaskSnapshotEntry> entries = new ArrayList<>(pending.size());
        for (TaskRecord record : pending) {
            entries.add(TaskSnapshotEntry.of(record));
        }
        writeSnapshot(entries);
        log.debug("Task snapshot written to {} pending={}", describe(), entries.size());
    }

    /**
     * @return the stored entries, empty when no snapshot exists yet
     */
    protected abstract List<TaskSnapshotEntry> readSnapshot();

    protected abstract void writeSnapshot(List<TaskSnapshotEntry> entries);

    /**
     * Human readable location for log lines.
     */
    protected abstract String describe();
}
