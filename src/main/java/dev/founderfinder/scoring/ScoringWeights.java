package dev.founderfinder.scoring;

/**
 * Immutable weights and normalizers for every score component.
 *
 * <p>Each raw signal contributes {@code (value * weight) / normalizer} to its component score
 * before the component is capped at 1. {@link #defaults()} holds the production values.
 */
public record ScoringWeights(
    Term technicalStars,
    Term technicalForks,
    Term technicalLanguages,
    Term technicalRepositories,
    Term innovationStars,
    Term innovationForks,
    ActivityBonus innovationActivity,
    Term collaborationFollowers,
    Term collaborationFollowing,
    ActivityBonus collaborationActivity,
    double technicalShare,
    double innovationShare,
    double collaborationShare,
    AgeCurve ageCurve) {

  public ScoringWeights {
    if (technicalShare < 0 || innovationShare < 0 || collaborationShare < 0) {
      throw new IllegalArgumentException("Founder potential shares must not be negative");
    }
  }

  public static ScoringWeights defaults() {
    return new ScoringWeights(
        new Term(0.3, 100),
        new Term(0.2, 50),
        new Term(0.2, 5),
        new Term(0.3, 20),
        new Term(0.4, 100),
        new Term(0.3, 50),
        new ActivityBonus(0.3, 0.1),
        new Term(0.4, 500),
        new Term(0.2, 200),
        new ActivityBonus(0.4, 0.2),
        0.4,
        0.3,
        0.3,
        AgeCurve.defaults());
  }

  /** One weighted, normalized signal. */
  public record Term(double weight, double normalizer) {

    public Term {
      if (normalizer <= 0) {
        throw new IllegalArgumentException("normalizer must be positive, got: " + normalizer);
      }
    }

    public double apply(double value) {
      return (value * weight) / normalizer;
    }
  }

  /** Flat bonus chosen by whether the user's recent activity is high. */
  public record ActivityBonus(double active, double inactive) {

    public double apply(boolean isActive) {
      return isActive ? active : inactive;
    }
  }

  /**
   * Piecewise linear age preference: rising from {@code startAge} to a peak at {@code peakAge},
   * falling until {@code declineAge}, then falling more slowly.
   */
  public record AgeCurve(
      double startAge,
      double startScore,
      double risingSlope,
      double peakAge,
      double peakScore,
      double fallingSlope,
      double declineAge,
      double declineScore,
      double lateSlope) {

    public static AgeCurve defaults() {
      return new AgeCurve(16, 0.7, 0.03, 25, 1.0, 0.03, 35, 0.7, 0.02);
    }

    public double apply(double estimatedAge) {
      if (estimatedAge < peakAge) {
        return startScore + (estimatedAge - startAge) * risingSlope;
      }
      if (estimatedAge <= declineAge) {
        return peakScore - (estimatedAge - peakAge) * fallingSlope;
      }
      return declineScore - (estimatedAge - declineAge) * lateSlope;
    }
  }
}
