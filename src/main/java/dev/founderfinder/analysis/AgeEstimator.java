package dev.founderfinder.analysis;

import dev.founderfinder.github.GitHubRepository;
import dev.founderfinder.github.GitHubTimestamps;
import dev.founderfinder.github.GitHubUser;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Estimates account age, personal age and early achievements from a user and their repositories.
 *
 * <p>A "class of 20XX" mention in the bio is read as a graduation year at age 22. Otherwise the
 * user is assumed to have been 16 when the account was created. Never throws: an unreadable
 * account creation date yields {@link AgeProfile#unknown()}.
 */
@Component
public class AgeEstimator {

  private static final Logger log = LoggerFactory.getLogger(AgeEstimator.class);

  public static final double DAYS_PER_YEAR = 365.25;
  static final int MIN_ACCOUNT_CREATION_AGE = 16;
  static final int GRADUATION_AGE = 22;
  static final int ACHIEVEMENT_CANDIDATES = 3;
  static final double ACHIEVEMENT_MAX_YEARS = 2.0;
  static final int ACHIEVEMENT_MIN_STARS = 50;

  private static final Pattern CLASS_OF = Pattern.compile("class of (20\\d{2})");

  private final Clock clock;

  public AgeEstimator(Clock clock) {
    this.clock = clock;
  }

  public AgeProfile estimate(GitHubUser user, List<GitHubRepository> repos) {
    Optional<Instant> accountCreated = GitHubTimestamps.parse(user.createdAt());
    if (accountCreated.isEmpty()) {
      log.debug("Cannot estimate age for {}: creation date '{}'", user.login(), user.createdAt());
      return AgeProfile.unknown();
    }
    Instant now = clock.instant();
    double accountYears = yearsBetween(accountCreated.get(), now);

    return new AgeProfile(
        accountYears,
        estimatedAge(user.bio(), accountYears, now),
        earlyAchievements(accountCreated.get(), repos));
  }

  private List<EarlyAchievement> earlyAchievements(
      Instant accountCreated, List<GitHubRepository> repos) {
    List<GitHubRepository> top =
        repos.stream()
            .sorted(Comparator.comparingInt(GitHubRepository::stars).reversed())
            .limit(ACHIEVEMENT_CANDIDATES)
            .toList();

    List<EarlyAchievement> achievements = new ArrayList<>();
    for (GitHubRepository repo : top) {
      Optional<Instant> repoCreated = GitHubTimestamps.parse(repo.createdAt());
      if (repoCreated.isEmpty()) {
        log.debug("Skipping repository {} with unparseable creation date", repo.name());
        continue;
      }
      double repoAge = yearsBetween(accountCreated, repoCreated.get());
      if (repoAge <= ACHIEVEMENT_MAX_YEARS && repo.stars() >= ACHIEVEMENT_MIN_STARS) {
        achievements.add(
            new EarlyAchievement(
                repo.name() == null ? "" : repo.name(), repo.stars(), roundToTenth(repoAge)));
      }
    }
    return achievements;
  }

  private int estimatedAge(@Nullable String bio, double accountYears, Instant now) {
    if (bio != null) {
      Matcher matcher = CLASS_OF.matcher(bio.toLowerCase(Locale.ROOT));
      if (matcher.find()) {
        int graduationYear = Integer.parseInt(matcher.group(1));
        int currentYear = now.atZone(ZoneOffset.UTC).getYear();
        return currentYear - graduationYear + GRADUATION_AGE;
      }
    }
    // whole years of the tenth-rounded account age shown in the label
    return (int)
        Math.max(MIN_ACCOUNT_CREATION_AGE + roundToTenth(accountYears), MIN_ACCOUNT_CREATION_AGE);
  }

  static double yearsBetween(Instant from, Instant to) {
    return GitHubTimestamps.wholeDaysBetween(from, to) / DAYS_PER_YEAR;
  }

  private static double roundToTenth(double value) {
    return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
  }
}
