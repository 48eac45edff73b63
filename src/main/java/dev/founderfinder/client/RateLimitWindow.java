package dev.founderfinder.client;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable request budget of one source for a rolling one-hour window.
 *
 * <p>Not thread-safe on its own; {@link RateLimiter} guards every access with the window's monitor.
 */
final class RateLimitWindow {

  static final Duration LENGTH = Duration.ofHours(1);

  private final String sourceId;
  private final int limit;
  private int callCount;
  private Instant windowStart;
  private long generation;

  RateLimitWindow(String sourceId, int limit, Instant windowStart) {
    this.sourceId = sourceId;
    this.limit = limit;
    this.windowStart = windowStart;
  }

  boolean hasExpired(Instant now) {
    return !now.isBefore(windowStart.plus(LENGTH));
  }

  boolean isExhausted() {
    return callCount >= limit;
  }

  /** Time left until the current window ends, measured from {@code now}. */
  Duration remaining(Instant now) {
    return Duration.between(now, windowStart.plus(LENGTH));
  }

  void reset(Instant now) {
    callCount = 0;
    windowStart = now;
    generation++;
  }

  void recordCall() {
    callCount++;
  }

  /** Incremented on every reset; lets a waiting caller tell whether someone else reset first. */
  long generation() {
    return generation;
  }

  RateLimitStatus snapshot() {
    return new RateLimitStatus(sourceId, callCount, windowStart, limit);
  }
}
