package com.cario.qr.app.config;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
@EnableScheduling
public class ExecutorConfig {

  @Value("${scheduled.threadpool.size:2}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Dedicated scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("qr-health-scheduler-");

    // Log any uncaught exception thrown by @Scheduled methods
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in scheduled task", t));

    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);
    scheduler.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

    scheduler.initialize();
    log.info(
        "ThreadPoolTaskScheduler initialized poolSize={} awaitTerminationSeconds={}",
        poolSize,
        awaitTerminationSeconds);
    return scheduler;
  }

  /**
   * Fixed pool for encode + render. A full queue rejects new work so that image construction never
   * runs on a request thread; the generation service reports the rejection as a busy service.
   */
  @Bean
  public ThreadPoolTaskExecutor qrRenderExecutor(QrServiceProperties props) {
    QrServiceProperties.Render cfg = props.getRender();
    ThreadPoolTaskExecutor executor =
        fixedPool(
            "qr-render-",
            cfg.getWorkers(),
            cfg.getQueueCapacity(),
            cfg.getAwaitTerminationSeconds(),
            new ThreadPoolExecutor.AbortPolicy());
    log.info(
        "qrRenderExecutor initialized workers={} queueCapacity={}",
        cfg.getWorkers(),
        cfg.getQueueCapacity());
    return executor;
  }

  /** Background uploads. Saturation drops the task with a warning; replication is best effort. */
  @Bean
  public ThreadPoolTaskExecutor storageReplicationExecutor(QrServiceProperties props) {
    QrServiceProperties.Replication cfg = props.getReplication();
    RejectedExecutionHandler logAndDrop =
        (task, pool) ->
            log.warn(
                "storage.replicate dropped: queue full active={} queued={}",
                pool.getActiveCount(),
                pool.getQueue().size());
    ThreadPoolTaskExecutor executor =
        fixedPool(
            "storage-replication-",
            cfg.getThreads(),
            cfg.getQueueCapacity(),
            cfg.getAwaitTerminationSeconds(),
            logAndDrop);
    log.info(
        "storageReplicationExecutor initialized threads={} queueCapacity={}",
        cfg.getThreads(),
        cfg.getQueueCapacity());
    return executor;
  }

  private static ThreadPoolTaskExecutor fixedPool(
      String prefix,
      int threads,
      int queueCapacity,
      int awaitSeconds,
      RejectedExecutionHandler rejectionHandler) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix(prefix);
    executor.setRejectedExecutionHandler(rejectionHandler);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitSeconds);
    executor.initialize();
    return executor;
  }
}
