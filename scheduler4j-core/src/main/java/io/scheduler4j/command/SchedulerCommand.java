package io.scheduler4j.command;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.scheduler4j.core.DueTime;
import io.scheduler4j.core.ScheduleRequest;
import io.scheduler4j.core.TaskRecord;
import io.scheduler4j.core.TaskValidationException;
import io.scheduler4j.utils.IntervalParser;

import java.time.Duration;
import java.util.Map;

/**
 * Requests accepted by {@link SchedulerCommandDispatcher}.
 *
 * <p>JSON form selects the variant with the {@code action} property:
 * <pre>
 * {"action": "schedule_task", "task_data": {"agent": "messaging"}, "execution_time": "+5 minutes",
 *  "priority": 1, "recurring": true, "recurrence_interval": 3600}
 * {"action": "cancel_task", "task_id": "task_1767225600_3"}
 * {"action": "get_pending_tasks"}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SchedulerCommand.ScheduleTask.class, name = "schedule_task"),
        @JsonSubTypes.Type(value = SchedulerCommand.CancelTask.class, name = "cancel_task"),
        @JsonSubTypes.Type(value = SchedulerCommand.GetPendingTasks.class, name = "get_pending_tasks"),
        @JsonSubTypes.Type(value = SchedulerCommand.StartScheduler.class, name = "start_scheduler"),
        @JsonSubTypes.Type(value = SchedulerCommand.StopScheduler.class, name = "stop_scheduler"),
        @JsonSubTypes.Type(value = SchedulerCommand.GetStats.class, name = "get_stats")
})
public sealed interface SchedulerCommand permits
        SchedulerCommand.ScheduleTask,
        SchedulerCommand.CancelTask,
        SchedulerCommand.GetPendingTasks,
        SchedulerCommand.StartScheduler,
        SchedulerCommand.StopScheduler,
        SchedulerCommand.GetStats {

    Type type();

    enum Type {
        SCHEDULE_TASK,
        CANCEL_TASK,
        GET_PENDING_TASKS,
        START_SCHEDULER,
        STOP_SCHEDULER,
        GET_STATS
    }

    /**
     * @param executionTime number (epoch seconds) or string (see DueTimeResolver)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScheduleTask(
            @JsonProperty("task_data") Map<String, Object> taskData,
            @JsonProperty("execution_time") Object executionTime,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("task_id") String taskId,
            @JsonProperty("recurring") Boolean recurring,
            @JsonProperty("recurrence_interval") Long recurrenceInterval
    ) implements SchedulerCommand {

        @Override
        public Type type() {
            return Type.SCHEDULE_TASK;
        }

        public ScheduleRequest toRequest() {
            boolean isRecurring = Boolean.TRUE.equals(recurring);
            Duration interval = null;
            if (recurrenceInterval != null) {
                interval = IntervalParser.ofSeconds(recurrenceInterval);
            }
            return new ScheduleRequest(
                    taskData == null ? Map.of() : taskData,
                    toDueTime(executionTime),
                    priority == null ? TaskRecord.DEFAULT_PRIORITY : priority,
                    taskId,
                    isRecurring,
                    interval
            );
        }

        private static DueTime toDueTime(Object raw) {
            if (raw == null) {
                return null;
            }
            if (raw instanceof Number n) {
                return DueTime.epochSeconds(n.doubleValue());
            }
            if (raw instanceof String s) {
                return DueTime.parse(s);
            }
            throw new TaskValidationException("execution_time must be a number or a string");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CancelTask(@JsonProperty("task_id") String taskId) implements SchedulerCommand {
        @Override
        public Type type() {
            return Type.CANCEL_TASK;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetPendingTasks() implements SchedulerCommand {
        @Override
        public Type type() {
            return Type.GET_PENDING_TASKS;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StartScheduler() implements SchedulerCommand {
        @Override
        public Type type() {
            return Type.START_SCHEDULER;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StopScheduler() implements SchedulerCommand {
        @Override
        public Type type() {
            return Type.STOP_SCHEDULER;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetStats() implements SchedulerCommand {
        @Override
        public Type type() {
            return Type.GET_STATS;
        }
    }
}
