package io.scheduler4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduler behavior.
 */
@ConfigurationProperties(prefix = "scheduler4j")
public class SchedulerProperties {

    public enum StoreType {
        FILE,
        MONGO
    }

    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration errorBackoff = Duration.ofSeconds(5); // sleep after a failed scan
    private Duration stopTimeout = Duration.ofSeconds(5);
    private int compactionThreshold = 64; // tombstones tolerated before the heap is rebuilt
    private String timezone; // for local date-time strings; null means system default
    private StoreType store = StoreType.FILE;
    private String tasksFile = "data/scheduled_tasks.json";
    private String mongoCollection = "scheduled_tasks";

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getErrorBackoff() {
        return errorBackoff;
    }

    public void setErrorBackoff(Duration errorBackoff) {
        this.errorBackoff = errorBackoff;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public int getCompactionThreshold() {
        return compactionThreshold;
    }

    public void setCompactionThreshold(int compactionThreshold) {
        this.compactionThreshold = compactionThreshold;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getTasksFile() {
        return tasksFile;
    }

    public void setTasksFile(String tasksFile) {
        this.tasksFile = tasksFile;
    }

    public String getMongoCollection() {
        return mongoCollection;
    }

    public void setMongoCollection(String mongoCollection) {
        this.mongoCollection = mongoCollection;
    }
}
