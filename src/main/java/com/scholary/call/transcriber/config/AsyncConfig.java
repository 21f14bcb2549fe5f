package com.scholary.call.transcriber.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for work-unit execution.
 *
 * <p>Every work unit runs on one thread of a bounded pool; its streaming tasks run on executors
 * owned by the work unit itself. The pool size caps how many calls one instance streams at once.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "workUnitExecutor")
  public Executor workUnitExecutor(TranscriberProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workUnitThreads());
    executor.setMaxPoolSize(properties.workUnitThreads());
    executor.setQueueCapacity(properties.workUnitQueueSize());
    executor.setThreadNamePrefix("work-unit-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
