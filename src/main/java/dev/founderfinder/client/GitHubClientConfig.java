package dev.founderfinder.client;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used for GitHub API calls and the shared {@link RateLimiter}.
 *
 * <p>Timeouts are externalized via {@code founders.github.*} properties. Default request headers
 * (User-Agent, Accept, Authorization) are applied per request by {@link GitHubRequestExecutor}.
 */
@Configuration
public class GitHubClientConfig {

  /**
   * Creates the REST client bean for GitHub calls.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties GitHub connection settings
   * @return a named REST client bean for injection into {@link GitHubRequestExecutor}
   */
  @Bean
  public RestClient gitHubRestClient(RestClient.Builder builder, GitHubProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    return builder.requestFactory(requestFactory).build();
  }

  /**
   * Creates the process-wide rate limiter with the GitHub window registered.
   *
   * @param clock time source for window bookkeeping
   * @param sleeper waiting primitive used when the budget is exhausted
   * @param properties source of the hourly limit
   * @return the shared limiter used by every request attempt
   */
  @Bean
  public RateLimiter rateLimiter(Clock clock, Sleeper sleeper, GitHubProperties properties) {
    RateLimiter rateLimiter = new RateLimiter(clock, sleeper);
    rateLimiter.register(GitHubRequestExecutor.SOURCE_ID, properties.hourlyLimit());
    return rateLimiter;
  }
}
