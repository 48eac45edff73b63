package dev.founderfinder.profile;

import com.fasterxml.jackson.databind.JsonNode;
import dev.founderfinder.analysis.ActivityProfile;
import dev.founderfinder.analysis.AgeEstimator;
import dev.founderfinder.analysis.AgeProfile;
import dev.founderfinder.analysis.ContributionAnalyzer;
import dev.founderfinder.client.GitHubRequestExecutor;
import dev.founderfinder.client.UpstreamAuthorizationException;
import dev.founderfinder.github.GitHubEvent;
import dev.founderfinder.github.GitHubRepository;
import dev.founderfinder.github.GitHubUser;
import dev.founderfinder.scoring.ScoreCalculator;
import dev.founderfinder.scoring.ScoreSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds one {@link AggregatedProfile} from a candidate's API URL.
 *
 * <p>Three requests per candidate: user detail, repositories and public events. The user detail is
 * mandatory; without it the candidate is dropped. Repositories and events degrade to empty lists on
 * any failure, authorization errors included. Cancellation is not caught.
 */
@Service
public class ProfileFetcher {

  private static final Logger log = LoggerFactory.getLogger(ProfileFetcher.class);

  static final int TOP_REPOSITORY_COUNT = 3;

  private final GitHubRequestExecutor requestExecutor;
  private final ContributionAnalyzer contributionAnalyzer;
  private final AgeEstimator ageEstimator;
  private final ScoreCalculator scoreCalculator;

  public ProfileFetcher(
      GitHubRequestExecutor requestExecutor,
      ContributionAnalyzer contributionAnalyzer,
      AgeEstimator ageEstimator,
      ScoreCalculator scoreCalculator) {
    this.requestExecutor = requestExecutor;
    this.contributionAnalyzer = contributionAnalyzer;
    this.ageEstimator = ageEstimator;
    this.scoreCalculator = scoreCalculator;
  }

  /**
   * Fetch, analyse and score one candidate.
   *
   * @param candidateUrl the user's API URL, as returned by user search
   * @return the scored profile, or empty when the user detail could not be fetched
   */
  public Optional<AggregatedProfile> fetch(String candidateUrl) {
    String userUrl =
        candidateUrl.endsWith("/")
            ? candidateUrl.substring(0, candidateUrl.length() - 1)
            : candidateUrl;

    Optional<GitHubUser> maybeUser = fetchUser(userUrl);
    if (maybeUser.isEmpty()) {
      return Optional.empty();
    }
    GitHubUser user = maybeUser.get();

    List<GitHubRepository> repos =
        fetchList(userUrl + "/repos", "repositories", GitHubRepository::from);
    List<GitHubEvent> events = fetchList(userUrl + "/events/public", "events", GitHubEvent::from);

    ActivityProfile activity = contributionAnalyzer.classify(events);
    AgeProfile age = ageEstimator.estimate(user, repos);
    ScoreSet scores = scoreCalculator.score(user, repos, activity);

    log.debug(
        "Scored {}: founder potential {}, {} repositories, {} recent events",
        user.login(),
        scores.founderPotential(),
        repos.size(),
        activity.recentEvents());

    return Optional.of(
        new AggregatedProfile(
            user.login(),
            user.name(),
            user.company(),
            user.location(),
            user.bio(),
            user.htmlUrl(),
            user.publicRepos(),
            user.followers(),
            user.following(),
            activity.frequency(),
            age,
            scores,
            topRepositories(repos),
            languageHistogram(repos),
            AggregatedProfile.GITHUB_SOURCE));
  }

  private Optional<GitHubUser> fetchUser(String userUrl) {
    Optional<JsonNode> body;
    try {
      body = requestExecutor.execute(userUrl);
    } catch (UpstreamAuthorizationException e) {
      log.warn("Dropping candidate {}: HTTP {}", userUrl, e.getStatus());
      return Optional.empty();
    }
    if (body.isEmpty()) {
      log.warn("Dropping candidate {}: user detail unavailable", userUrl);
      return Optional.empty();
    }
    if (!body.get().isObject()) {
      log.warn("Dropping candidate {}: user detail is not an object", userUrl);
      return Optional.empty();
    }
    return Optional.of(GitHubUser.from(body.get()));
  }

  private <T> List<T> fetchList(String url, String what, Function<JsonNode, T> mapper) {
    Optional<JsonNode> body;
    try {
      body = requestExecutor.execute(url);
    } catch (UpstreamAuthorizationException e) {
      log.warn("No {} for {}: HTTP {}", what, url, e.getStatus());
      return List.of();
    }
    if (body.isEmpty()) {
      log.warn("No {} for {}: request failed", what, url);
      return List.of();
    }
    if (!body.get().isArray()) {
      log.warn("No {} for {}: payload is not an array", what, url);
      return List.of();
    }
    List<T> items = new ArrayList<>();
    for (JsonNode element : body.get()) {
      if (element.isObject()) {
        items.add(mapper.apply(element));
      }
    }
    return items;
  }

  /** Most starred first, ties in input order. */
  static List<GitHubRepository> topRepositories(List<GitHubRepository> repos) {
    return repos.stream()
        .sorted(Comparator.comparingInt(GitHubRepository::stars).reversed())
        .limit(TOP_REPOSITORY_COUNT)
        .toList();
  }

  static Map<String, Integer> languageHistogram(List<GitHubRepository> repos) {
    Map<String, Integer> histogram = new LinkedHashMap<>();
    for (GitHubRepository repo : repos) {
      String language = repo.language();
      if (language != null && !language.isEmpty()) {
        histogram.merge(language, 1, Integer::sum);
      }
    }
    return histogram;
  }
}
