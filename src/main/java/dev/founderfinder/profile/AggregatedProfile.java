package dev.founderfinder.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.founderfinder.analysis.ActivityFrequency;
import dev.founderfinder.analysis.AgeProfile;
import dev.founderfinder.github.GitHubRepository;
import dev.founderfinder.scoring.ScoreSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A scored candidate: GitHub user fields, activity, age estimate, scores, top repositories and a
 * language histogram. Fields GitHub did not provide are {@code null}.
 *
 * @param topRepositories up to three repositories, most starred first
 * @param languages repository count per language, in first-seen order
 * @param source the upstream the record came from
 */
public record AggregatedProfile(
    @Nullable String login,
    @Nullable String name,
    @Nullable String company,
    @Nullable String location,
    @Nullable String bio,
    @Nullable String profileUrl,
    int publicRepos,
    int followers,
    int following,
    ActivityFrequency contributionFrequency,
    AgeProfile age,
    ScoreSet scores,
    List<GitHubRepository> topRepositories,
    Map<String, Integer> languages,
    String source) {

  public static final String GITHUB_SOURCE = "github";

  public AggregatedProfile {
    topRepositories = List.copyOf(topRepositories);
    languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));
  }

  @JsonIgnore
  public double founderPotential() {
    return scores.founderPotential();
  }
}
