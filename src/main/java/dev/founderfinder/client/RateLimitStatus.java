package dev.founderfinder.client;

import java.time.Instant;

/**
 * Immutable snapshot of a source's rate-limit window.
 *
 * @param sourceId the external source the window belongs to
 * @param callCount attempts made in the current window
 * @param windowStart when the current window began
 * @param limit attempts allowed per window
 */
public record RateLimitStatus(String sourceId, int callCount, Instant windowStart, int limit) {

  public int remainingCalls() {
    return Math.max(0, limit - callCount);
  }
}
