package io.scheduler4j.internal;

import io.scheduler4j.TaskBuilder;
import io.scheduler4j.core.DueTime;
import io.scheduler4j.core.Priority;
import io.scheduler4j.core.ScheduleRequest;
import io.scheduler4j.core.ScheduleResult;
import io.scheduler4j.core.TaskRecord;
import io.scheduler4j.core.TaskValidationException;
import io.scheduler4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link TaskBuilder} implementation.
 *
 * <p>Parse errors from {@code repeatEvery(String)} and friends are held back until
 * {@link #build()} (thrown) or {@link #save()} (reported as an error result).
 */
public class SimpleTaskBuilder implements TaskBuilder {

    private final Map<String, Object> payload;
    private final Function<ScheduleRequest, ScheduleResult> submitter;

    private String taskId;
    private int priority = TaskRecord.DEFAULT_PRIORITY;
    private DueTime executionTime;
    private boolean recurring;
    private Duration interval;

    private TaskValidationException deferredError;

    public SimpleTaskBuilder(Map<String, Object> payload, Function<ScheduleRequest, ScheduleResult> submitter) {
        this.payload = payload == null ? Map.of() : payload;
        this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
    }

    @Override
    public TaskBuilder taskId(String taskId) {
        this.taskId = taskId;
        return this;
    }

    @Override
    public TaskBuilder priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    @Override
    public TaskBuilder priority(int priority) {
        this.priority = priority;
        return this;
    }

    @Override
    public TaskBuilder at(Instant time) {
        this.executionTime = time == null ? null : DueTime.at(time);
        return this;
    }

    @Override
    public TaskBuilder at(String time) {
        this.executionTime = time == null ? null : DueTime.parse(time);
        return this;
    }

    @Override
    public TaskBuilder in(Duration offset) {
        this.executionTime = offset == null ? null : DueTime.after(offset);
        return this;
    }

    @Override
    public TaskBuilder repeatEvery(Duration interval) {
        this.recurring = true;
        this.interval = interval;
        return this;
    }

    @Override
    public TaskBuilder repeatEvery(String interval) {
        this.recurring = true;
        try {
            this.interval = IntervalParser.parsePositive(interval);
        } catch (TaskValidationException e) {
            this.interval = null;
            this.deferredError = e;
        }
        return this;
    }

    @Override
    public TaskBuilder repeatEvery(Number seconds) {
        this.recurring = true;
        this.interval = null;
        if (seconds == null) {
            this.deferredError = new TaskValidationException("interval must not be null");
            return this;
        }
        try {
            this.interval = IntervalParser.ofSeconds(seconds);
        } catch (TaskValidationException e) {
            this.deferredError = e;
        }
        return this;
    }

    @Override
    public ScheduleRequest build() {
        if (deferredError != null) {
            throw deferredError;
        }
        return new ScheduleRequest(payload, executionTime, priority, taskId, recurring, interval);
    }

    @Override
    public ScheduleResult save() {
        if (deferredError != null) {
            return ScheduleResult.error(deferredError.getMessage());
        }
        return submitter.apply(build());
    }
}
