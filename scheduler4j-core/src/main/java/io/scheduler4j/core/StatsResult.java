package io.scheduler4j.core;

public record StatsResult(
        ResultStatus status,
        String message,
        SchedulerStats stats
) implements SchedulerResult {

    public static StatsResult of(SchedulerStats stats) {
        return new StatsResult(ResultStatus.SUCCESS, "ok", stats);
    }
}
