package dev.founderfinder.client;

import java.time.Duration;

/** HTTP 429 from the upstream, carrying how long to wait before the next attempt. */
public class RemoteRateLimitedException extends UpstreamException {

  private final Duration retryAfter;

  public RemoteRateLimitedException(String message, Duration retryAfter) {
    super(message);
    this.retryAfter = retryAfter;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
