package dev.founderfinder.pipeline;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Bounded worker pool shared by all pipeline runs for per-candidate fetches. */
@Configuration
public class FetchExecutorConfig {

  @Bean(name = "fetchTaskExecutor")
  public ThreadPoolTaskExecutor fetchTaskExecutor(AggregationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.fetchConcurrency());
    executor.setMaxPoolSize(properties.fetchConcurrency());
    executor.setThreadNamePrefix("profile-fetch-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
