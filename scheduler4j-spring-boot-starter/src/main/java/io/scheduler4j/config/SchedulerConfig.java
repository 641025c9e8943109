package io.scheduler4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.TaskExecutor;
import io.scheduler4j.TaskHandler;
import io.scheduler4j.TaskScheduler;
import io.scheduler4j.command.SchedulerCommandDispatcher;
import io.scheduler4j.core.RegistryTaskExecutor;
import io.scheduler4j.core.TaskHandlerRegistry;
import io.scheduler4j.internal.DefaultTaskScheduler;
import io.scheduler4j.internal.mongo.MongoTaskStore;
import io.scheduler4j.store.JsonFileTaskStore;
import io.scheduler4j.store.TaskStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for scheduler components.
 *
 * <p>The snapshot store is chosen by {@code scheduler4j.store}: {@code file} (default) or
 * {@code mongo}, the latter requiring a {@link MongoTemplate} bean.
 */
@AutoConfiguration
@ConditionalOnClass(TaskScheduler.class)
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "scheduler4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerConfig {

    @Bean
    @ConditionalOnMissingBean(TaskStore.class)
    @ConditionalOnProperty(prefix = "scheduler4j", name = "store", havingValue = "file", matchIfMissing = true)
    public JsonFileTaskStore jsonFileTaskStore(SchedulerProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonFileTaskStore(Path.of(props.getTasksFile()), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskHandlerRegistry taskHandlerRegistry(ObjectProvider<List<TaskHandler<?>>> handlersProvider) {
        List<TaskHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new TaskHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskExecutor taskExecutor(TaskHandlerRegistry registry, ObjectProvider<ObjectMapper> objectMapper) {
        return new RegistryTaskExecutor(registry, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskScheduler taskScheduler(SchedulerProperties props, TaskStore store, TaskExecutor executor) {
        return new DefaultTaskScheduler(props, store, executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(TaskScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerCommandDispatcher schedulerCommandDispatcher(TaskScheduler scheduler,
                                                                 ObjectProvider<ObjectMapper> objectMapper) {
        return new SchedulerCommandDispatcher(scheduler, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.data.mongodb.core.MongoTemplate")
    @ConditionalOnProperty(prefix = "scheduler4j", name = "store", havingValue = "mongo")
    static class MongoStoreConfig {

        @Bean
        @ConditionalOnMissingBean(TaskStore.class)
        public MongoTaskStore mongoTaskStore(SchedulerProperties props, MongoTemplate mongoTemplate) {
            return new MongoTaskStore(mongoTemplate, props.getMongoCollection());
        }
    }
}
