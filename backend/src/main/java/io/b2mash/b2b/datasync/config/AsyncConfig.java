package io.b2mash.b2b.datasync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Bounded worker pool for sync jobs. Request threads only enqueue. */
@Configuration
public class AsyncConfig {

  private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

  @Bean(name = "syncTaskExecutor")
  public ThreadPoolTaskExecutor syncTaskExecutor(SyncProperties syncProperties) {
    var sizing = syncProperties.executor();
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(sizing.corePoolSize());
    executor.setMaxPoolSize(sizing.maxPoolSize());
    executor.setQueueCapacity(sizing.queueCapacity());
    executor.setThreadNamePrefix("sync-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();

    log.info(
        "Initialized sync executor - Core: {}, Max: {}, Queue: {}",
        sizing.corePoolSize(),
        sizing.maxPoolSize(),
        sizing.queueCapacity());
    return executor;
  }
}
