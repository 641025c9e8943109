package io.scheduler4j;

import io.scheduler4j.core.CancelResult;
import io.scheduler4j.core.ControlResult;
import io.scheduler4j.core.PendingTasksResult;
import io.scheduler4j.core.ScheduleRequest;
import io.scheduler4j.core.ScheduleResult;
import io.scheduler4j.core.SchedulerStats;

import java.util.Map;

/**
 * Main scheduler API.
 *
 * <p>Every operation reports its outcome through a result record carrying a
 * {@link io.scheduler4j.core.ResultStatus}; none of them throws for invalid input,
 * unknown ids or persistence trouble.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.create(Map.of("agent", "messaging", "action", "send_message"))
 *          .in(Duration.ofMinutes(5))
 *          .priority(Priority.HIGH)
 *          .save();
 *
 * scheduler.create(Map.of("agent", "scraper"))
 *          .at("2026-01-20T09:30:00Z")
 *          .repeatEvery("1 hour")
 *          .save();
 * scheduler.stop();
 * }</pre>
 */
public interface TaskScheduler {

    /**
     * Spawn the background worker. Calling it while running is a no-op reported as {@code info}.
     */
    ControlResult start();

    /**
     * Ask the worker to finish and wait a bounded time for it to exit.
     */
    ControlResult stop();

    boolean isRunning();

    /**
     * Create a task builder. Nothing is scheduled until {@link TaskBuilder#save()}.
     */
    TaskBuilder create(Map<String, Object> payload);

    ScheduleResult schedule(ScheduleRequest request);

    CancelResult cancel(String taskId);

    /**
     * Snapshot of live tasks in dispatch order. Does not mutate scheduler state.
     */
    PendingTasksResult listPending();

    SchedulerStats getStats();
}
