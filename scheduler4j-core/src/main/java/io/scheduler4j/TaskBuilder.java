package io.scheduler4j;

import io.scheduler4j.core.Priority;
import io.scheduler4j.core.ScheduleRequest;
import io.scheduler4j.core.ScheduleResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Fluent builder for configuring a task before scheduling it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory request, throwing on invalid input</li>
 *   <li>save(): build() + schedule, reporting invalid input as an error result</li>
 * </ul>
 */
public interface TaskBuilder {

    /**
     * Use a caller-chosen id instead of a generated one. Must not collide with a pending task.
     */
    TaskBuilder taskId(String taskId);

    TaskBuilder priority(Priority priority);

    /**
     * Set raw priority value. Lower runs first.
     */
    TaskBuilder priority(int priority);

    /**
     * Run at an absolute instant.
     */
    TaskBuilder at(Instant time);

    /**
     * Run at a textual time: ISO-8601 instant or date-time, epoch seconds, or "+5 minutes".
     */
    TaskBuilder at(String time);

    /**
     * Run after the given offset from now.
     */
    TaskBuilder in(Duration offset);

    TaskBuilder repeatEvery(Duration interval);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours", "30s") or digits (seconds).
     */
    TaskBuilder repeatEvery(String interval);

    TaskBuilder repeatEvery(Number seconds);

    ScheduleRequest build();

    ScheduleResult save();
}
