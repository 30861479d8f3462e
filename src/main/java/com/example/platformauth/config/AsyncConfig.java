package com.example.platformauth.config;

import java.time.Clock;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for background work: the scheduler that closes login windows and retries
 * pending bridge bundles, and the executor that launches login browsers.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class AsyncConfig {

  private static final int SCHEDULER_POOL_SIZE = 2;
  private static final int CAPTURE_POOL_SIZE = 4;

  @Bean(destroyMethod = "shutdown")
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(SCHEDULER_POOL_SIZE);
    scheduler.setThreadNamePrefix("scheduled-task-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    log.info("Task scheduler started with {} threads", SCHEDULER_POOL_SIZE);
    return scheduler;
  }

  /**
   * Executor Spring MVC hands async request processing to.
   */
  @Bean
  public AsyncTaskExecutor applicationTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(CAPTURE_POOL_SIZE);
    executor.setThreadNamePrefix("async-task-");
    executor.initialize();
    return executor;
  }

  /**
   * Opens login windows. Launching a browser blocks for seconds, so it never runs on a request
   * thread.
   */
  @Bean(name = "captureExecutor")
  public Executor captureExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(CAPTURE_POOL_SIZE);
    executor.setMaxPoolSize(CAPTURE_POOL_SIZE);
    executor.setThreadNamePrefix("login-capture-");
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
