package io.scheduler4j.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.TaskHandler;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegistryTaskExecutorTest {

    record MessageData(String agent, String recipient) {
    }

    static class MessagingHandler implements TaskHandler<MessageData> {
        final List<String> recipients = new ArrayList<>();

        @Override
        public String name() {
            return "messaging";
        }

        @Override
        public Class<MessageData> dataClass() {
            return MessageData.class;
        }

        @Override
        public void execute(MessageData data, ScheduledTaskEvent event) {
            recipients.add(data.recipient());
        }
    }

    @Test
    void routesPayloadToNamedHandler() throws Exception {
        MessagingHandler handler = new MessagingHandler();
        RegistryTaskExecutor executor = new RegistryTaskExecutor(
                new TaskHandlerRegistry(List.of(handler)), new ObjectMapper());

        ExecutionResult result = executor.execute(new ScheduledTaskEvent(
                "t1",
                Map.of("agent", "messaging", "recipient", "lead@example.com"),
                Instant.EPOCH,
                Instant.EPOCH));

        assertTrue(result.successful());
        assertEquals(List.of("lead@example.com"), handler.recipients);
    }

    @Test
    void unknownHandlerFails() {
        RegistryTaskExecutor executor = new RegistryTaskExecutor(
                new TaskHandlerRegistry(List.of()), new ObjectMapper());

        assertThrows(IllegalStateException.class, () -> executor.execute(new ScheduledTaskEvent(
                "t1", Map.of("agent", "nobody"), Instant.EPOCH, Instant.EPOCH)));
    }

    @Test
    void duplicateHandlerNamesAreRejected() {
        assertThrows(IllegalStateException.class,
                () -> new TaskHandlerRegistry(List.of(new MessagingHandler(), new MessagingHandler())));
    }
}
