package io.scheduler4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.TaskHandler;
import io.scheduler4j.TaskScheduler;
import io.scheduler4j.command.SchedulerCommandDispatcher;
import io.scheduler4j.core.ResultStatus;
import io.scheduler4j.core.ScheduledTaskEvent;
import io.scheduler4j.core.SchedulerResult;
import io.scheduler4j.core.TaskHandlerRegistry;
import io.scheduler4j.internal.mongo.MongoTaskStore;
import io.scheduler4j.store.JsonFileTaskStore;
import io.scheduler4j.store.TaskStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class SchedulerAutoConfigurationTest {

    @TempDir
    Path dir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SchedulerConfig.class))
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .withBean(TaskHandler.class, DemoTaskHandler::new)
                .withPropertyValues(
                        "scheduler4j.poll-interval=500ms",
                        "scheduler4j.error-backoff=1s",
                        "scheduler4j.stop-timeout=2s",
                        "scheduler4j.tasks-file=" + dir.resolve("scheduled_tasks.json")
                );
    }

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(TaskScheduler.class);
            assertThat(context).hasSingleBean(SchedulerLifecycle.class);
            assertThat(context).hasSingleBean(SchedulerProperties.class);
            assertThat(context).hasSingleBean(SchedulerCommandDispatcher.class);
            assertThat(context).hasSingleBean(JsonFileTaskStore.class);
            assertThat(context.getBean(TaskHandlerRegistry.class).names()).containsExactly("demo");
            assertThat(context.getBean(SchedulerProperties.class).getPollInterval()).isEqualTo(Duration.ofMillis(500));
            assertThat(context.getBean(TaskScheduler.class).isRunning()).isTrue();
        });
    }

    @Test
    void commandsReachTheSchedulerAndSnapshotIsWritten() {
        contextRunner().run(context -> {
            SchedulerCommandDispatcher dispatcher = context.getBean(SchedulerCommandDispatcher.class);

            SchedulerResult result = dispatcher.dispatch("""
                    {"action": "schedule_task", "task_data": {"agent": "demo", "action": "ping"},
                     "execution_time": "+1 hour", "task_id": "ping-1"}
                    """);

            assertThat(result.status()).isEqualTo(ResultStatus.SUCCESS);
            assertThat(context.getBean(TaskScheduler.class).getStats().tasksInQueue()).isEqualTo(1);
            assertThat(dir.resolve("scheduled_tasks.json")).content().contains("\"task_id\" : \"ping-1\"");
        });
    }

    @Test
    void mongoStoreIsUsedWhenSelected() {
        contextRunner()
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withPropertyValues("scheduler4j.store=mongo", "scheduler4j.mongo-collection=tasks")
                .run(context -> {
                    assertThat(context).hasSingleBean(TaskStore.class);
                    assertThat(context).hasSingleBean(MongoTaskStore.class);
                    assertThat(context).doesNotHaveBean(JsonFileTaskStore.class);
                });
    }

    @Test
    void disabledSchedulerRegistersNothing() {
        contextRunner()
                .withPropertyValues("scheduler4j.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(TaskScheduler.class);
                    assertThat(context).doesNotHaveBean(SchedulerLifecycle.class);
                });
    }

    @Test
    void lifecycleStopsSchedulerOnClose() {
        contextRunner().run(context -> {
            TaskScheduler scheduler = context.getBean(TaskScheduler.class);
            context.close();
            assertThat(scheduler.isRunning()).isFalse();
        });
    }

    static class DemoTaskHandler implements TaskHandler<DemoTaskHandler.Ping> {

        record Ping(String agent, String action) {
        }

        @Override
        public String name() {
            return "demo";
        }

        @Override
        public Class<Ping> dataClass() {
            return Ping.class;
        }

        @Override
        public void execute(Ping data, ScheduledTaskEvent event) {
            // no-op for context bootstrap test
        }
    }
}
