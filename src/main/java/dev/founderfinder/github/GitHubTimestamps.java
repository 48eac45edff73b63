package dev.founderfinder.github;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Parsing and day arithmetic for GitHub's ISO-8601 timestamps. */
public final class GitHubTimestamps {

  private static final long SECONDS_PER_DAY = 86_400L;

  private GitHubTimestamps() {}

  public static Optional<Instant> parse(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(value.strip()).toInstant());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /** Whole days from {@code from} to {@code to}, floored; negative when {@code to} is earlier. */
  public static long wholeDaysBetween(Instant from, Instant to) {
    return Math.floorDiv(Duration.between(from, to).getSeconds(), SECONDS_PER_DAY);
  }
}
