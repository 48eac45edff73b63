package dev.founderfinder.scoring;

import java.util.List;

/**
 * Immutable lookup tables and weights for {@link FounderProfileAnalyzer}.
 *
 * <p>Title keywords are matched as substrings in list order, so the first matching keyword decides
 * the level. {@link #defaults()} holds the production tables.
 */
public record ProfileAnalysisWeights(
    List<TitleLevel> titleLevels,
    int defaultTitleLevel,
    EducationTiers education,
    AgeBands ageBands,
    ComponentWeights components) {

  public ProfileAnalysisWeights {
    titleLevels = List.copyOf(titleLevels);
    if (defaultTitleLevel < 0) {
      throw new IllegalArgumentException("defaultTitleLevel must not be negative");
    }
  }

  public static ProfileAnalysisWeights defaults() {
    return new ProfileAnalysisWeights(
        List.of(
            new TitleLevel("intern", 1),
            new TitleLevel("associate", 2),
            new TitleLevel("analyst", 2),
            new TitleLevel("specialist", 2),
            new TitleLevel("coordinator", 2),
            new TitleLevel("manager", 3),
            new TitleLevel("senior", 4),
            new TitleLevel("lead", 4),
            new TitleLevel("principal", 5),
            new TitleLevel("director", 6),
            new TitleLevel("head", 6),
            new TitleLevel("vp", 7),
            new TitleLevel("vice president", 7),
            new TitleLevel("c-level", 8),
            new TitleLevel("ceo", 8),
            new TitleLevel("cto", 8),
            new TitleLevel("cfo", 8),
            new TitleLevel("founder", 10),
            new TitleLevel("co-founder", 10),
            new TitleLevel("entrepreneur", 10)),
        2,
        EducationTiers.defaults(),
        AgeBands.defaults(),
        ComponentWeights.defaults());
  }

  public record TitleLevel(String keyword, int level) {}

  /** School and field keyword tiers; keywords match as lowercase substrings. */
  public record EducationTiers(
      List<String> topSchools,
      List<String> goodSchools,
      List<String> technicalFields,
      List<String> businessFields,
      List<String> advancedDegrees) {

    public EducationTiers {
      topSchools = List.copyOf(topSchools);
      goodSchools = List.copyOf(goodSchools);
      technicalFields = List.copyOf(technicalFields);
      businessFields = List.copyOf(businessFields);
      advancedDegrees = List.copyOf(advancedDegrees);
    }

    public static EducationTiers defaults() {
      return new EducationTiers(
          List.of("stanford", "harvard", "mit", "berkeley", "princeton", "yale"),
          List.of("columbia", "upenn", "cornell", "dartmouth", "brown", "duke"),
          List.of("computer science", "engineering", "mathematics", "physics"),
          List.of("business", "economics", "finance", "mba"),
          List.of("phd", "doctorate", "ms", "master"));
    }
  }

  /** Inclusive age bands; the ideal band sits inside the target band. */
  public record AgeBands(int idealMin, int idealMax, int targetMin, int targetMax) {

    public AgeBands {
      if (idealMin > idealMax || targetMin > targetMax) {
        throw new IllegalArgumentException("Age band bounds are inverted");
      }
    }

    public static AgeBands defaults() {
      return new AgeBands(27, 32, 25, 35);
    }
  }

  /** Share of each component in the future founder score. */
  public record ComponentWeights(
      double age,
      double careerProgression,
      double technicalExpertise,
      double innovation,
      double leadership,
      double education) {

    public ComponentWeights {
      if (age < 0
          || careerProgression < 0
          || technicalExpertise < 0
          || innovation < 0
          || leadership < 0
          || education < 0) {
        throw new IllegalArgumentException("Component weights must not be negative");
      }
    }

    public static ComponentWeights defaults() {
      return new ComponentWeights(0.15, 0.25, 0.15, 0.15, 0.15, 0.15);
    }
  }
}
