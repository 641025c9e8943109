package io.scheduler4j.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.TaskScheduler;
import io.scheduler4j.core.ControlResult;
import io.scheduler4j.core.ScheduleResult;
import io.scheduler4j.core.SchedulerResult;
import io.scheduler4j.core.StatsResult;
import io.scheduler4j.core.TaskValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single entry point translating {@link SchedulerCommand}s into {@link TaskScheduler} calls.
 */
public class SchedulerCommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SchedulerCommandDispatcher.class);

    private final TaskScheduler scheduler;
    private final ObjectMapper objectMapper;

    public SchedulerCommandDispatcher(TaskScheduler scheduler, ObjectMapper objectMapper) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Parse a JSON command and dispatch it. Blank input, malformed JSON and unknown actions yield an error result.
     */
    public SchedulerResult dispatch(String json) {
        if (json == null || json.isBlank()) {
            return ControlResult.error("command must not be blank");
        }
        SchedulerCommand command;
        try {
            command = objectMapper.readValue(json, SchedulerCommand.class);
        } catch (JsonProcessingException e) {
            log.warn("Rejected scheduler command msg={}", e.getOriginalMessage());
            return ControlResult.error("Unrecognized command: " + e.getOriginalMessage());
        }
        return dispatch(command);
    }

    public SchedulerResult dispatch(SchedulerCommand command) {
        if (command == null) {
            return ControlResult.error("command must not be null");
        }
        return switch (command.type()) {
            case SCHEDULE_TASK -> schedule((SchedulerCommand.ScheduleTask) command);
            case CANCEL_TASK -> scheduler.cancel(((SchedulerCommand.CancelTask) command).taskId());
            case GET_PENDING_TASKS -> scheduler.listPending();
            case START_SCHEDULER -> scheduler.start();
            case STOP_SCHEDULER -> scheduler.stop();
            case GET_STATS -> StatsResult.of(scheduler.getStats());
        };
    }

    private SchedulerResult schedule(SchedulerCommand.ScheduleTask command) {
        try {
            return scheduler.schedule(command.toRequest());
        } catch (TaskValidationException e) {
            return ScheduleResult.error(e.getMessage());
        }
    }
}
