package io.scheduler4j.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.TaskExecutor;
import io.scheduler4j.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link TaskExecutor} that routes each payload to the {@link TaskHandler} named by its
 * {@code agent} value and converts the payload into the handler's data class.
 */
public class RegistryTaskExecutor implements TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(RegistryTaskExecutor.class);

    private final TaskHandlerRegistry registry;
    private final ObjectMapper objectMapper;

    public RegistryTaskExecutor(TaskHandlerRegistry registry, ObjectMapper objectMapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public ExecutionResult execute(ScheduledTaskEvent event) throws Exception {
        Object name = event.payload().get(TaskRecord.HANDLER_KEY);
        TaskHandler<?> handler = registry.getRequired(name == null ? null : name.toString());
        log.debug("Dispatching task id={} to handler={}", event.taskId(), handler.name());
        executeHandler(handler, event);
        return ExecutionResult.success();
    }

    @SuppressWarnings("unchecked")
    private <T> void executeHandler(TaskHandler<?> handler, ScheduledTaskEvent event) throws Exception {
        var h = (TaskHandler<T>) handler;
        T data = objectMapper.convertValue(event.payload(), h.dataClass());
        h.execute(data, event);
    }
}
