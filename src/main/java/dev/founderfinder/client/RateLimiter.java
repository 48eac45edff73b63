package dev.founderfinder.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;

/**
 * Thread-safe rolling one-hour request budget, one window per external source.
 *
 * <p>{@link #acquire(String)} is called before every outbound attempt, retries included. Counter
 * updates are serialized on the window's monitor; the wait itself happens outside the monitor, so
 * a caller sleeping out an exhausted window never blocks callers of other sources.
 *
 * <p>Sources that were never registered are not throttled.
 */
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final ConcurrentHashMap<String, RateLimitWindow> windows = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Sleeper sleeper;

  public RateLimiter(Clock clock, Sleeper sleeper) {
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Start tracking a source with a fresh window.
   *
   * @param sourceId the source identifier passed to {@link #acquire(String)}
   * @param limit attempts allowed per hour
   */
  public void register(String sourceId, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("Rate limit for " + sourceId + " must be positive");
    }
    windows.put(sourceId, new RateLimitWindow(sourceId, limit, clock.instant()));
    log.info("Rate limit for {} set to {} requests/hour", sourceId, limit);
  }

  /**
   * Block until a call slot is available for the source, then consume it.
   *
   * @param sourceId the source about to be called
   * @throws FetchCancelledException if the calling thread is interrupted while waiting
   */
  public void acquire(String sourceId) {
    RateLimitWindow window = windows.get(sourceId);
    if (window == null) {
      return;
    }

    long waitedOnGeneration = -1;
    while (true) {
      Duration wait;
      synchronized (window) {
        Instant now = clock.instant();
        if (window.hasExpired(now) || window.generation() == waitedOnGeneration) {
          window.reset(now);
        }
        if (!window.isExhausted()) {
          window.recordCall();
          return;
        }
        wait = window.remaining(now);
        waitedOnGeneration = window.generation();
      }
      log.info("Rate limit hit for {}, waiting {} seconds", sourceId, wait.toSeconds());
      sleep(wait);
    }
  }

  /**
   * Current window state for a source.
   *
   * @param sourceId the source to inspect
   * @return snapshot of the window, or empty if the source is not registered
   */
  public Optional<RateLimitStatus> status(String sourceId) {
    RateLimitWindow window = windows.get(sourceId);
    if (window == null) {
      return Optional.empty();
    }
    synchronized (window) {
      return Optional.of(window.snapshot());
    }
  }

  private void sleep(Duration wait) {
    try {
      sleeper.sleep(wait.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchCancelledException("Interrupted while waiting for the rate-limit window", e);
    }
  }
}
