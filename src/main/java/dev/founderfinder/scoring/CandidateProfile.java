package dev.founderfinder.scoring;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Career-level facts about a candidate, independent of where they were collected.
 *
 * @param source where the profile was found
 * @param title current job title, if known
 * @param age stated age; {@code null} or 0 means unknown
 * @param experienceYears years of professional experience, 0 when unknown
 * @param publicRepos public repository count, used for GitHub profiles
 * @param followers follower count, used for GitHub profiles
 * @param careerProgression positions held, in any order
 * @param education degrees held
 * @param educationSummary free-text education line, searched for a graduation year
 */
public record CandidateProfile(
    ProfileSource source,
    @Nullable String title,
    @Nullable Integer age,
    int experienceYears,
    int publicRepos,
    int followers,
    List<Position> careerProgression,
    List<Education> education,
    @Nullable String educationSummary) {

  public CandidateProfile {
    source = source == null ? ProfileSource.OTHER : source;
    experienceYears = Math.max(0, experienceYears);
    publicRepos = Math.max(0, publicRepos);
    followers = Math.max(0, followers);
    careerProgression = careerProgression == null ? List.of() : List.copyOf(careerProgression);
    education = education == null ? List.of() : List.copyOf(education);
  }

  public boolean hasKnownAge() {
    return age != null && age != 0;
  }

  /** One position; {@code startDate} sorts lexicographically (e.g. "2020-01"). */
  public record Position(@Nullable String title, @Nullable String startDate) {}

  public record Education(
      @Nullable String school, @Nullable String field, @Nullable String degree) {}
}
