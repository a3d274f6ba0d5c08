package com.flamingo.ai.recall.config;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the background worker pools. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /**
   * Worker pool consuming the memory write queue. The bounded queue is the backpressure point: a
   * full queue rejects new turns instead of growing without limit.
   */
  @Bean(name = "memoryWriteExecutor")
  public ThreadPoolTaskExecutor memoryWriteExecutor(MemoryConfig memoryConfig) {
    MemoryConfig.Worker worker = memoryConfig.getWorker();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(worker.getCorePoolSize());
    executor.setMaxPoolSize(worker.getMaxPoolSize());
    executor.setQueueCapacity(worker.getQueueCapacity());
    executor.setThreadNamePrefix("memory-write-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  /** Small pool for access-statistics updates issued after retrieval. */
  @Bean(name = "accessTrackingExecutor")
  public Executor accessTrackingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("memory-access-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
