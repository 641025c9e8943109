package io.scheduler4j.core;

import java.time.Instant;

/**
 * Read-only counters.
 *
 * totalScheduled : tasks accepted by schedule (recurring follow-ups not included)
 * totalExecuted  : dispatches, successful or not
 * totalFailed    : dispatches that threw or reported failure
 * tasksInQueue   : live pending tasks
 * lastExecution  : time of the latest dispatch, null before the first one
 */
public record SchedulerStats(
        long totalScheduled,
        long totalExecuted,
        long totalFailed,
        int tasksInQueue,
        Instant lastExecution
) {
}
