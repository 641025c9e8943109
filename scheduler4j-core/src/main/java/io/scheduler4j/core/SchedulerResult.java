package io.scheduler4j.core;

/**
 * Common shape of every public scheduler answer.
 */
public sealed interface SchedulerResult
        permits ScheduleResult, CancelResult, PendingTasksResult, ControlResult, StatsResult {

    ResultStatus status();

    String message();

    default boolean isSuccess() {
        return status() == ResultStatus.SUCCESS;
    }
}
