package dev.founderfinder.scoring;

import dev.founderfinder.analysis.ActivityProfile;
import dev.founderfinder.analysis.AgeEstimator;
import dev.founderfinder.github.GitHubRepository;
import dev.founderfinder.github.GitHubTimestamps;
import dev.founderfinder.github.GitHubUser;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Computes the bounded score set of a profile.
 *
 * <p>Component scores are first computed on [0, 1] and capped there, then scaled by 10. Founder
 * potential blends the capped components, so it is bounded by the same range. All components are
 * 0 for a user without repositories; the age score does not depend on repositories.
 *
 * <p>Sums are evaluated term by term in a fixed order, so results are reproducible to the last
 * bit for identical inputs.
 */
@Component
public class ScoreCalculator {

  static final double SCALE = 10.0;
  static final double UNKNOWN_AGE_SCORE = 5.0;

  private final ScoringWeights weights;
  private final Clock clock;

  public ScoreCalculator(ScoringWeights weights, Clock clock) {
    this.weights = weights;
    this.clock = clock;
  }

  public ScoreSet score(GitHubUser user, List<GitHubRepository> repos, ActivityProfile activity) {
    double technical = 0.0;
    double innovation = 0.0;
    double collaboration = 0.0;

    if (!repos.isEmpty()) {
      long stars = 0;
      long forks = 0;
      for (GitHubRepository repo : repos) {
        stars += repo.stars();
        forks += repo.forks();
      }
      long languages =
          repos.stream()
              .map(GitHubRepository::language)
              .filter(language -> language != null && !language.isEmpty())
              .distinct()
              .count();
      boolean active = activity.isActive();

      technical =
          Math.min(
              1.0,
              weights.technicalStars().apply(stars)
                  + weights.technicalForks().apply(forks)
                  + weights.technicalLanguages().apply(languages)
                  + weights.technicalRepositories().apply(repos.size()));
      innovation =
          Math.min(
              1.0,
              weights.innovationStars().apply(stars)
                  + weights.innovationForks().apply(forks)
                  + weights.innovationActivity().apply(active));
      collaboration =
          Math.min(
              1.0,
              weights.collaborationFollowers().apply(user.followers())
                  + weights.collaborationFollowing().apply(user.following())
                  + weights.collaborationActivity().apply(active));
    }

    double founder =
        technical * weights.technicalShare()
            + innovation * weights.innovationShare()
            + collaboration * weights.collaborationShare();

    return new ScoreSet(
        scale(technical), scale(innovation), scale(collaboration), ageScore(user), scale(founder));
  }

  /**
   * Age score from the account creation date, assuming the account was opened at 16.
   *
   * @return the score on [0, 10], or {@value #UNKNOWN_AGE_SCORE} when the date is unreadable
   */
  public double ageScore(GitHubUser user) {
    Optional<Instant> created = GitHubTimestamps.parse(user.createdAt());
    if (created.isEmpty()) {
      return UNKNOWN_AGE_SCORE;
    }
    double accountYears =
        GitHubTimestamps.wholeDaysBetween(created.get(), clock.instant())
            / AgeEstimator.DAYS_PER_YEAR;
    return ageScore(weights.ageCurve().startAge() + accountYears);
  }

  /** Age score for an already estimated age, on [0, 10]. */
  public double ageScore(double estimatedAge) {
    return scale(weights.ageCurve().apply(estimatedAge));
  }

  private static double scale(double unitScore) {
    return Math.max(0.0, Math.min(unitScore * SCALE, SCALE));
  }
}
