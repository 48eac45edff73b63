package dev.founderfinder.client;

import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * Retry policy with two independent budgets.
 *
 * <p>{@link TransientUpstreamException}s count as hard failures and stop retries after {@code
 * maxAttempts} of them. {@link RemoteRateLimitedException}s do not consume that budget but are
 * capped at {@code maxAttempts} waits of their own. Anything else, authorization failures
 * included, is never retried.
 */
class UpstreamRetryPolicy implements RetryPolicy {

  private final int maxAttempts;

  UpstreamRetryPolicy(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  @Override
  public boolean canRetry(RetryContext context) {
    Throwable last = context.getLastThrowable();
    if (last == null) {
      return true;
    }
    UpstreamRetryContext upstream = (UpstreamRetryContext) context;
    if (last instanceof RemoteRateLimitedException) {
      return upstream.rateLimitedWaits <= maxAttempts;
    }
    if (last instanceof TransientUpstreamException) {
      return upstream.hardFailures < maxAttempts;
    }
    return false;
  }

  @Override
  public RetryContext open(RetryContext parent) {
    return new UpstreamRetryContext(parent);
  }

  @Override
  public void close(RetryContext context) {}

  @Override
  public void registerThrowable(RetryContext context, Throwable throwable) {
    UpstreamRetryContext upstream = (UpstreamRetryContext) context;
    upstream.registerThrowable(throwable);
    if (throwable instanceof RemoteRateLimitedException) {
      upstream.rateLimitedWaits++;
    } else if (throwable instanceof TransientUpstreamException) {
      upstream.hardFailures++;
    }
  }

  @Override
  public int getMaxAttempts() {
    return maxAttempts;
  }

  static final class UpstreamRetryContext extends RetryContextSupport {

    private int hardFailures;
    private int rateLimitedWaits;

    UpstreamRetryContext(RetryContext parent) {
      super(parent);
    }

    int hardFailures() {
      return hardFailures;
    }
  }
}
