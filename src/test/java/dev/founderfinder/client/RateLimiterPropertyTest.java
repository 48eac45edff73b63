package dev.founderfinder.client;

import static org.assertj.core.api.Assertions.assertThat;

import dev.founderfinder.fixture.MutableClock;
import dev.founderfinder.fixture.RecordingSleeper;
import java.time.Duration;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

/** Budget invariants of {@link RateLimiter} for arbitrary limits and call counts. */
class RateLimiterPropertyTest {

  @Property
  void callCountNeverExceedsLimit(
      @ForAll @IntRange(min = 1, max = 20) int limit,
      @ForAll @IntRange(min = 1, max = 120) int calls) {
    MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");
    RecordingSleeper sleeper = new RecordingSleeper(clock);
    RateLimiter rateLimiter = new RateLimiter(clock, sleeper);
    rateLimiter.register("github", limit);

    for (int i = 0; i < calls; i++) {
      rateLimiter.acquire("github");
      assertThat(rateLimiter.status("github").orElseThrow().callCount())
          .isBetween(1, limit);
    }

    assertThat(sleeper.sleeps()).hasSize((calls - 1) / limit);
    assertThat(sleeper.sleeps()).allMatch(millis -> millis == Duration.ofHours(1).toMillis());
    assertThat(rateLimiter.status("github").orElseThrow().callCount())
        .isEqualTo((calls - 1) % limit + 1);
  }
}
