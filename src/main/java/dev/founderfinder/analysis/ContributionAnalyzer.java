package dev.founderfinder.analysis;

import dev.founderfinder.github.GitHubEvent;
import dev.founderfinder.github.GitHubTimestamps;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies a user's public activity by counting events from the last {@value #LOOKBACK_DAYS}
 * whole days.
 */
@Component
public class ContributionAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(ContributionAnalyzer.class);

  static final long LOOKBACK_DAYS = 90;

  private final Clock clock;

  public ContributionAnalyzer(Clock clock) {
    this.clock = clock;
  }

  public ActivityProfile classify(List<GitHubEvent> events) {
    if (events.isEmpty()) {
      return ActivityProfile.none();
    }
    Instant now = clock.instant();
    int recent = 0;
    for (GitHubEvent event : events) {
      Optional<Instant> createdAt = GitHubTimestamps.parse(event.createdAt());
      if (createdAt.isEmpty()) {
        log.debug("Skipping event with unparseable timestamp '{}'", event.createdAt());
        continue;
      }
      if (GitHubTimestamps.wholeDaysBetween(createdAt.get(), now) <= LOOKBACK_DAYS) {
        recent++;
      }
    }
    return new ActivityProfile(ActivityFrequency.fromRecentEventCount(recent), recent);
  }
}
