package io.scheduler4j.config;

import io.scheduler4j.TaskScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final TaskScheduler scheduler;

    public SchedulerLifecycle(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
