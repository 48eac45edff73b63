package dev.founderfinder.scoring;

import dev.founderfinder.scoring.CandidateProfile.Education;
import dev.founderfinder.scoring.CandidateProfile.Position;
import dev.founderfinder.scoring.ProfileAnalysisWeights.AgeBands;
import dev.founderfinder.scoring.ProfileAnalysisWeights.ComponentWeights;
import dev.founderfinder.scoring.ProfileAnalysisWeights.EducationTiers;
import dev.founderfinder.scoring.ProfileAnalysisWeights.TitleLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Scores career-level candidate profiles for future founder potential.
 *
 * <p>Six component scores on [0, 1] (age, career progression, technical expertise, innovation,
 * leadership and education) are blended with {@link ComponentWeights} into a score rounded to three
 * decimals. Missing data yields a neutral component rather than an error.
 */
@Component
public class FounderProfileAnalyzer {

  static final double NEUTRAL = 0.5;

  static final int GRADUATION_AGE = 22;
  static final int CAREER_START_AGE = 22;
  static final int MIN_PLAUSIBLE_AGE = 18;
  static final int MAX_PLAUSIBLE_AGE = 100;

  private static final Pattern YEAR = Pattern.compile("\\b(?:19|20)\\d{2}\\b");

  private final ProfileAnalysisWeights weights;
  private final Clock clock;

  public FounderProfileAnalyzer(ProfileAnalysisWeights weights, Clock clock) {
    this.weights = weights;
    this.clock = clock;
  }

  public double futureFounderScore(CandidateProfile profile) {
    ComponentWeights shares = weights.components();
    double score = 0.0;
    score += ageScore(profile.hasKnownAge() ? profile.age() : null) * shares.age();
    score += careerProgressionScore(profile) * shares.careerProgression();
    score += technicalExpertiseScore(profile) * shares.technicalExpertise();
    score += innovationScore(profile) * shares.innovation();
    score += leadershipScore(profile) * shares.leadership();
    score += educationScore(profile.education()) * shares.education();
    return BigDecimal.valueOf(score).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
  }

  public double technicalExpertiseScore(CandidateProfile profile) {
    ProfileSource source = profile.source();
    double score = 0.0;
    if (source == ProfileSource.GITHUB) {
      score += Math.min(profile.publicRepos() / 20.0, 1.0) * 0.3
          + Math.min(profile.followers() / 500.0, 1.0) * 0.2;
    } else if (source == ProfileSource.PATENTS) {
      score += 1.0;
    } else if (source.isTechnicalWriting()) {
      score += 0.7;
    } else if (source == ProfileSource.RESEARCH_PAPERS) {
      score += 0.8;
    }
    return Math.min(score, 1.0);
  }

  public double innovationScore(CandidateProfile profile) {
    ProfileSource source = profile.source();
    double score = 0.0;
    if (source == ProfileSource.PATENTS) {
      score += 0.8;
    } else if (source == ProfileSource.GITHUB && profile.publicRepos() > 0) {
      score += Math.min(profile.publicRepos() / 20.0, 0.5);
    } else if (source.isTechnicalWriting()) {
      score += 0.3;
    } else if (source == ProfileSource.CONFERENCE) {
      score += 0.4;
    }
    return Math.min(score, 1.0);
  }

  public double leadershipScore(CandidateProfile profile) {
    double score = titleLevel(profile.title()) / 10.0;
    ProfileSource source = profile.source();
    if (source == ProfileSource.CONFERENCE) {
      score += 0.3;
    } else if (source == ProfileSource.GITHUB) {
      score += Math.min(profile.followers() / 1000.0, 0.3);
    } else if (source.isTechnicalWriting()) {
      score += 0.2;
    }
    return Math.min(score, 1.0);
  }

  /** Band score for a stated age; {@code null} is neutral. */
  public double ageScore(@Nullable Integer age) {
    if (age == null || age == 0) {
      return NEUTRAL;
    }
    AgeBands bands = weights.ageBands();
    if (age >= bands.idealMin() && age <= bands.idealMax()) {
      return 1.0;
    }
    if (age >= bands.targetMin() && age <= bands.targetMax()) {
      return 0.7;
    }
    return age < bands.targetMin() ? 0.3 : 0.1;
  }

  /**
   * Rewards a title-level increase: two or more levels within three years of experience scores
   * highest. Needs experience and at least two positions, otherwise neutral.
   */
  public double careerProgressionScore(CandidateProfile profile) {
    List<Position> positions = profile.careerProgression();
    if (positions.size() < 2 || profile.experienceYears() == 0) {
      return NEUTRAL;
    }
    int highest = Integer.MIN_VALUE;
    int lowest = Integer.MAX_VALUE;
    for (Position position : positions) {
      int level = titleLevel(position.title());
      highest = Math.max(highest, level);
      lowest = Math.min(lowest, level);
    }
    int increase = highest - lowest;
    int years = profile.experienceYears();
    if (years >= 3 && increase >= 2) {
      return 1.0;
    }
    if (years >= 2 && increase >= 1) {
      return 0.8;
    }
    return increase > 0 ? 0.6 : 0.3;
  }

  /** Best score over all degrees; neutral when there are none or none match a tier. */
  public double educationScore(List<Education> education) {
    EducationTiers tiers = weights.education();
    double best = 0.0;
    for (Education entry : education) {
      String school = lower(entry.school());
      String field = lower(entry.field());
      String degree = lower(entry.degree());

      double score = 0.0;
      if (containsAny(school, tiers.topSchools())) {
        score = 1.0;
      }
      if (containsAny(school, tiers.goodSchools())) {
        score = Math.max(score, 0.9);
      }
      if (containsAny(field, tiers.technicalFields())) {
        score = Math.max(score, 0.8);
      }
      if (containsAny(field, tiers.businessFields()) || degree.contains("mba")) {
        score = Math.max(score, 0.7);
      }
      if (tiers.advancedDegrees().contains(degree)) {
        score = Math.min(score + 0.1, 1.0);
      }
      best = Math.max(best, score);
    }
    return best > 0 ? best : NEUTRAL;
  }

  public int titleLevel(@Nullable String title) {
    String lowered = lower(title);
    for (TitleLevel entry : weights.titleLevels()) {
      if (lowered.contains(entry.keyword())) {
        return entry.level();
      }
    }
    return weights.defaultTitleLevel();
  }

  /**
   * Stated age, else the age implied by the latest year in the education summary, else the age
   * implied by years of experience. Estimates are clamped to a plausible range.
   */
  public OptionalInt extractAge(CandidateProfile profile) {
    if (profile.hasKnownAge()) {
      return OptionalInt.of(profile.age());
    }
    OptionalInt graduationYear = latestYear(profile.educationSummary());
    if (graduationYear.isPresent()) {
      int currentYear = LocalDate.now(clock).getYear();
      return OptionalInt.of(plausible(currentYear - graduationYear.getAsInt() + GRADUATION_AGE));
    }
    if (profile.experienceYears() > 0) {
      return OptionalInt.of(plausible(CAREER_START_AGE + profile.experienceYears()));
    }
    return OptionalInt.empty();
  }

  public CareerProgression analyzeCareerProgression(List<Position> positions) {
    if (positions.size() < 2) {
      return CareerProgression.stable();
    }
    List<Position> ordered = new ArrayList<>(positions);
    ordered.sort(Comparator.comparing(position -> lower(position.startDate())));

    List<Integer> levels = new ArrayList<>();
    int promotions = 0;
    for (Position position : ordered) {
      int level = titleLevel(position.title());
      if (!levels.isEmpty() && level > levels.get(levels.size() - 1)) {
        promotions++;
      }
      levels.add(level);
    }
    int span = levels.stream().mapToInt(Integer::intValue).max().orElse(0)
        - levels.stream().mapToInt(Integer::intValue).min().orElse(0);
    double rate = (double) span / levels.size();

    return new CareerProgression(
        BigDecimal.valueOf(rate).setScale(2, RoundingMode.HALF_EVEN).doubleValue(),
        promotions,
        CareerProgression.Trajectory.fromRate(rate),
        levels);
  }

  private static OptionalInt latestYear(@Nullable String text) {
    if (text == null) {
      return OptionalInt.empty();
    }
    Matcher matcher = YEAR.matcher(text);
    int latest = -1;
    while (matcher.find()) {
      latest = Math.max(latest, Integer.parseInt(matcher.group()));
    }
    return latest < 0 ? OptionalInt.empty() : OptionalInt.of(latest);
  }

  private static int plausible(int age) {
    return Math.max(MIN_PLAUSIBLE_AGE, Math.min(MAX_PLAUSIBLE_AGE, age));
  }

  private static boolean containsAny(String value, List<String> keywords) {
    return keywords.stream().anyMatch(value::contains);
  }

  private static String lower(@Nullable String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
