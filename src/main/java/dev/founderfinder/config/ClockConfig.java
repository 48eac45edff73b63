package dev.founderfinder.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Provides injectable time and waiting primitives.
 *
 * <p>Every rate-limit wait, Retry-After pause and exponential back off goes through the {@link
 * Sleeper} bean, and every window or age computation reads the {@link Clock} bean, so both can be
 * replaced in tests.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return new ThreadWaitSleeper();
  }
}
