package io.scheduler4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.Map;

/**
 * Mongo document model for one snapshot entry. The collection name is chosen by
 * {@link MongoTaskStore}, so no {@code @Document} mapping is declared.
 */
public class ScheduledTaskDocument {

    @Id
    private String id;

    private double timestamp;

    private int priority;

    @Field("task_id")
    private String taskId;

    @Field("task_data")
    private Map<String, Object> taskData;

    private boolean recurring;

    @Field("recurrence_interval")
    private Long recurrenceInterval;

    public ScheduledTaskDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(double timestamp) {
        this.timestamp = timestamp;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public Map<String, Object> getTaskData() {
        return taskData;
    }

    public void setTaskData(Map<String, Object> taskData) {
        this.taskData = taskData;
    }

    public boolean isRecurring() {
        return recurring;
    }

    public void setRecurring(boolean recurring) {
        this.recurring = recurring;
    }

    public Long getRecurrenceInterval() {
        return recurrenceInterval;
    }

    public void setRecurrenceInterval(Long recurrenceInterval) {
        this.recurrenceInterval = recurrenceInterval;
    }
}
