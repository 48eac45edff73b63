package dev.founderfinder.client;

import java.time.Duration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Waits {@code Retry-After} after a 429 and {@code 2^n} seconds after the n-th (0-based) hard
 * failure. Must be paired with {@link UpstreamRetryPolicy}, whose context it reads.
 */
class UpstreamBackOffPolicy implements BackOffPolicy {

  private final Sleeper sleeper;

  UpstreamBackOffPolicy(Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new UpstreamBackOffContext((UpstreamRetryPolicy.UpstreamRetryContext) context);
  }

  @Override
  public void backOff(BackOffContext backOffContext) {
    UpstreamRetryPolicy.UpstreamRetryContext context =
        ((UpstreamBackOffContext) backOffContext).retryContext();
    Duration wait = waitFor(context);
    try {
      sleeper.sleep(wait.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Interrupted during upstream back off", e);
    }
  }

  static Duration waitFor(UpstreamRetryPolicy.UpstreamRetryContext context) {
    if (context.getLastThrowable() instanceof RemoteRateLimitedException rateLimited) {
      return rateLimited.getRetryAfter();
    }
    int failures = Math.max(1, context.hardFailures());
    return Duration.ofSeconds(1L << (failures - 1));
  }

  private record UpstreamBackOffContext(UpstreamRetryPolicy.UpstreamRetryContext retryContext)
      implements BackOffContext {}
}
