package com.scholary.sorter.config;

import com.scholary.sorter.worker.WatchdogProperties;
import com.scholary.sorter.worker.WorkerProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the worker threads.
 *
 * <p>Polling loops, the watchdog and the event broadcaster share one scheduler sized for all of
 * them. Analyzer calls and cross-device folder copies run on separate bounded pools so a hung call
 * or copy can be abandoned on timeout.
 */
@Configuration
@EnableConfigurationProperties({WorkerProperties.class, WatchdogProperties.class})
public class WorkerConfig {

  /** Threads for watchdog, revision poll, heartbeat and coalesced broadcasts. */
  private static final int HOUSEKEEPING_THREADS = 4;

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "workerScheduler")
  public ThreadPoolTaskScheduler workerScheduler(WorkerProperties properties) {
    int loops = 1 + properties.analyze().instances() + properties.move().instances();

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(loops + HOUSEKEEPING_THREADS);
    scheduler.setThreadNamePrefix("worker-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }

  @Bean(name = "analysisExecutor")
  public ThreadPoolTaskExecutor analysisExecutor(WorkerProperties properties) {
    int threads = Math.max(1, properties.analyze().instances());

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads);
    executor.setThreadNamePrefix("analysis-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "relocationExecutor")
  public ThreadPoolTaskExecutor relocationExecutor(WorkerProperties properties) {
    int threads = Math.max(1, properties.move().instances());

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads);
    executor.setThreadNamePrefix("relocation-");
    executor.initialize();
    return executor;
  }
}
