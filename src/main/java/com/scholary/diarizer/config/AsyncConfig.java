package com.scholary.diarizer.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the job worker pool.
 *
 * <p>Jobs are pulled from the executor's FIFO queue by a fixed number of workers. Each queued job
 * runs exactly once on a single worker; the queue capacity bounds how many submissions may wait.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "workerExecutor")
  public Executor workerExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerQueueCapacity());
    executor.setThreadNamePrefix("diarizer-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
