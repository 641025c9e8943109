package io.scheduler4j.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.scheduler4j.core.EpochSeconds;
import io.scheduler4j.core.TaskRecord;
import io.scheduler4j.core.TaskValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Persisted form of a {@link TaskRecord}.
 *
 * @param timestamp          due time as fractional epoch seconds, required
 * @param priority           required
 * @param recurrenceInterval whole seconds, null for one-time tasks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskSnapshotEntry(
        @JsonProperty("timestamp") Double timestamp,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_data") Map<String, Object> taskData,
        @JsonProperty("recurring") boolean recurring,
        @JsonProperty("recurrence_interval") Long recurrenceInterval
) {

    public static TaskSnapshotEntry of(TaskRecord record) {
        return new TaskSnapshotEntry(
                EpochSeconds.of(record.dueTime()),
                record.priority(),
                record.id(),
                record.payload(),
                record.recurring(),
                record.interval() == null ? null : record.interval().toSeconds()
        );
    }

    /**
     * @param loadedAt stands in for the creation time, which the snapshot does not keep
     */
    public TaskRecord toRecord(Instant loadedAt) {
        if (timestamp == null) {
            throw new TaskValidationException("snapshot entry " + taskId + " has no timestamp");
        }
        if (priority == null) {
            throw new TaskValidationException("snapshot entry " + taskId + " has no priority");
        }
        return new TaskRecord(
                taskId,
                EpochSeconds.toInstant(timestamp),
                priority,
                taskData == null ? Map.of() : taskData,
                recurring,
                recurrenceInterval == null ? null : Duration.ofSeconds(recurrenceInterval),
                loadedAt
        );
    }
}
