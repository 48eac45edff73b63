package dev.founderfinder.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.founderfinder.fixture.GitHubRepositoryBuilder;
import dev.founderfinder.fixture.GitHubUserBuilder;
import dev.founderfinder.github.GitHubRepository;
import dev.founderfinder.github.GitHubUser;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class AgeEstimatorTest {

  private static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");
  private static final String ACCOUNT_CREATED = "2016-06-15T12:00:00Z";

  private final AgeEstimator estimator = new AgeEstimator(Clock.fixed(NOW, ZoneOffset.UTC));

  private static GitHubUser user(String bio) {
    return new GitHubUserBuilder().bio(bio).createdAt(ACCOUNT_CREATED).build();
  }

  private static GitHubRepository repo(String name, int stars, String createdAt) {
    return new GitHubRepositoryBuilder().name(name).stars(stars).createdAt(createdAt).build();
  }

  @Test
  void tenYearOldAccountEstimatesTwentySix() {
    AgeProfile profile = estimator.estimate(user(null), List.of());

    assertThat(profile.accountAgeYears()).isCloseTo(10.0, within(0.01));
    assertThat(profile.estimatedAge()).isEqualTo(26);
    assertThat(profile.accountAgeLabel()).isEqualTo("10.0 years");
    assertThat(profile.earlyAchievements()).isEmpty();
  }

  @Test
  void fractionalAccountAgeIsTruncatedToWholeYears() {
    GitHubUser user = new GitHubUserBuilder().createdAt("2020-10-01T12:00:00Z").build();

    AgeProfile profile = estimator.estimate(user, List.of());

    assertThat(profile.accountAgeLabel()).isEqualTo("5.7 years");
    assertThat(profile.estimatedAge()).isEqualTo(21);
  }

  @Test
  void accountAgeIsRoundedToTheLabelBeforeTruncating() {
    GitHubUser user = new GitHubUserBuilder().createdAt("2016-06-20T12:00:00Z").build();

    AgeProfile profile = estimator.estimate(user, List.of());

    assertThat(profile.accountAgeYears()).isLessThan(10.0);
    assertThat(profile.accountAgeLabel()).isEqualTo("10.0 years");
    assertThat(profile.estimatedAge()).isEqualTo(26);
  }

  @Test
  void brandNewAccountEstimatesSixteen() {
    GitHubUser user = new GitHubUserBuilder().createdAt(NOW.toString()).build();

    AgeProfile profile = estimator.estimate(user, List.of());

    assertThat(profile.estimatedAge()).isEqualTo(16);
    assertThat(profile.accountAgeLabel()).isEqualTo("0.0 years");
  }

  @Test
  void graduationYearInBioTakesPrecedence() {
    assertThat(estimator.estimate(user("Engineer. Class of 2020 at MIT"), List.of()).estimatedAge())
        .isEqualTo(28);
    assertThat(estimator.estimate(user("CLASS OF 2010"), List.of()).estimatedAge()).isEqualTo(38);
  }

  @Test
  void bioWithoutGraduationYearFallsBackToAccountAge() {
    assertThat(estimator.estimate(user("class of 1999"), List.of()).estimatedAge()).isEqualTo(26);
  }

  @Test
  void earlyAchievementsComeFromTopThreeReposWithinTwoYears() {
    List<GitHubRepository> repos =
        List.of(
            repo("rocket", 500, "2017-06-15T12:00:00Z"),
            repo("late", 100, "2020-01-01T00:00:00Z"),
            repo("early", 60, "2016-12-15T12:00:00Z"),
            repo("fourth", 55, "2016-07-01T00:00:00Z"));

    AgeProfile profile = estimator.estimate(user(null), repos);

    assertThat(profile.earlyAchievements())
        .containsExactly(
            new EarlyAchievement("rocket", 500, 1.0), new EarlyAchievement("early", 60, 0.5));
  }

  @Test
  void earlyRepoBelowStarThresholdIsNotAnAchievement() {
    List<GitHubRepository> repos =
        List.of(new GitHubRepositoryBuilder().stars(49).createdAt("2016-07-01T00:00:00Z").build());

    assertThat(estimator.estimate(user(null), repos).earlyAchievements()).isEmpty();
  }

  @Test
  void repoWithUnparseableDateIsSkipped() {
    List<GitHubRepository> repos =
        List.of(
            repo("broken", 900, "garbage"),
            repo("fine", 80, "2017-01-01T00:00:00Z"));

    AgeProfile profile = estimator.estimate(user(null), repos);

    assertThat(profile.earlyAchievements())
        .extracting(EarlyAchievement::name)
        .containsExactly("fine");
    assertThat(profile.estimatedAge()).isEqualTo(26);
  }

  @Test
  void unparseableAccountDateIsUnknown() {
    GitHubUser user = new GitHubUserBuilder().createdAt(null).build();

    AgeProfile profile = estimator.estimate(user, List.of());

    assertThat(profile).isEqualTo(AgeProfile.unknown());
    assertThat(profile.accountAgeLabel()).isEqualTo("N/A");
    assertThat(profile.estimatedAge()).isNull();
  }
}
