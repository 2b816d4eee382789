package org.task.queue.runner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.task.queue.runner.core.loop.TaskLoop;
import org.task.queue.runner.core.queue.FunctionQueue;

import java.time.Duration;

/**
 * Provides a shared {@link TaskLoop} and a {@link FunctionQueue} configured from
 * {@link TaskQueueConfig}, unless the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(TaskQueueConfig.class)
public class TaskQueueAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TaskQueueAutoConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TaskLoop taskLoop(TaskQueueConfig config) {
        return new TaskLoop(config.getLoopThreadName(), Duration.ofSeconds(config.getShutdownTimeoutSeconds()));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public FunctionQueue functionQueue(TaskQueueConfig config, TaskLoop taskLoop) {
        logger.info("Creating FunctionQueue - Max concurrent tasks: {}, Default timeout: {}ms",
                config.getMaxConcurrentTasks(), config.getDefaultTimeoutMillis());
        return new FunctionQueue(config.toQueueOptions(), taskLoop);
    }
}
