package dev.founderfinder.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import dev.founderfinder.analysis.ActivityFrequency;
import dev.founderfinder.analysis.ActivityProfile;
import dev.founderfinder.github.GitHubRepository;
import dev.founderfinder.github.GitHubUser;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.From;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/** Every reported score stays within [0, 10] whatever the upstream counts are. */
class ScoreCalculatorPropertyTest {

  private static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");

  private final ScoreCalculator calculator =
      new ScoreCalculator(ScoringWeights.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

  @Provide
  Arbitrary<GitHubRepository> repositories() {
    return Combinators.combine(
            Arbitraries.integers().between(0, 1_000_000),
            Arbitraries.integers().between(0, 100_000),
            Arbitraries.of("Java", "Go", "Rust", "C", "Kotlin", ""),
            Arbitraries.integers().between(0, 20 * 365))
        .as(
            (stars, forks, language, daysAgo) ->
                new GitHubRepository(
                    "repo",
                    null,
                    stars,
                    forks,
                    language,
                    NOW.minusSeconds(daysAgo * 86_400L).toString()));
  }

  @Property
  void allScoresAreBounded(
      @ForAll @Size(max = 40) List<@From("repositories") GitHubRepository> repos,
      @ForAll @IntRange(min = 0, max = 1_000_000) int followers,
      @ForAll @IntRange(min = 0, max = 100_000) int following,
      @ForAll @IntRange(min = 0, max = 30 * 365) int accountDays,
      @ForAll ActivityFrequency frequency) {
    GitHubUser user =
        new GitHubUser(
            "u",
            null,
            null,
            null,
            null,
            null,
            repos.size(),
            followers,
            following,
            NOW.minusSeconds(accountDays * 86_400L).toString());

    ScoreSet scores = calculator.score(user, repos, new ActivityProfile(frequency, 0));

    assertThat(scores.technical()).isBetween(0.0, 10.0);
    assertThat(scores.innovation()).isBetween(0.0, 10.0);
    assertThat(scores.collaboration()).isBetween(0.0, 10.0);
    assertThat(scores.age()).isBetween(0.0, 10.0);
    assertThat(scores.founderPotential()).isBetween(0.0, 10.0);
  }

  @Property
  void ageScoreIsBoundedForAnyEstimatedAge(@ForAll @DoubleRange(min = -50, max = 200) double age) {
    assertThat(calculator.ageScore(age)).isBetween(0.0, 10.0);
  }
}
