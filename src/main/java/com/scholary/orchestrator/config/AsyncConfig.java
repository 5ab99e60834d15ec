package com.scholary.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for launching jobs in the background.
 *
 * <p>Each job occupies one launcher thread while its own worker pool runs the tasks. The queue
 * bounds how many submitted jobs may wait; beyond that a submitted job is marked FAILED.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobLauncher")
  public ThreadPoolTaskExecutor jobLauncher(OrchestratorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.jobs().launcherThreads());
    executor.setMaxPoolSize(properties.jobs().launcherThreads());
    executor.setQueueCapacity(properties.jobs().launcherQueueSize());
    executor.setThreadNamePrefix("job-launcher-");
    executor.initialize();
    return executor;
  }
}
