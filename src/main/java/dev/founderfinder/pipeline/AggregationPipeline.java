package dev.founderfinder.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import dev.founderfinder.client.FetchCancelledException;
import dev.founderfinder.client.GitHubProperties;
import dev.founderfinder.client.GitHubRequestExecutor;
import dev.founderfinder.profile.AggregatedProfile;
import dev.founderfinder.profile.ProfileDeduplicator;
import dev.founderfinder.profile.ProfileFetcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Search-then-enrich orchestrator: one user search, then a parallel profile fetch per hit.
 *
 * <p>Candidates are fetched on the shared {@code fetchTaskExecutor} pool and collected in search
 * order, so the result never depends on completion order. Failed candidates are dropped; the rest
 * are deduplicated and sorted by founder potential, highest first, ties kept in search order.
 */
@Service
public class AggregationPipeline {

  private static final Logger log = LoggerFactory.getLogger(AggregationPipeline.class);

  private final GitHubRequestExecutor requestExecutor;
  private final ProfileFetcher profileFetcher;
  private final AsyncTaskExecutor fetchTaskExecutor;
  private final GitHubProperties gitHubProperties;
  private final AggregationProperties properties;

  public AggregationPipeline(
      GitHubRequestExecutor requestExecutor,
      ProfileFetcher profileFetcher,
      @Qualifier("fetchTaskExecutor") AsyncTaskExecutor fetchTaskExecutor,
      GitHubProperties gitHubProperties,
      AggregationProperties properties) {
    this.requestExecutor = requestExecutor;
    this.profileFetcher = profileFetcher;
    this.fetchTaskExecutor = fetchTaskExecutor;
    this.gitHubProperties = gitHubProperties;
    this.properties = properties;
  }

  public List<AggregatedProfile> run(String query) {
    return run(new ProfileSearchRequest(query));
  }

  /**
   * Search GitHub users and return scored, deduplicated profiles.
   *
   * @param request the search query
   * @return unmodifiable list sorted by founder potential descending
   * @throws IllegalStateException if a credential is required but none is configured
   * @throws SearchFailedException if the search request failed after retries
   * @throws dev.founderfinder.client.UpstreamAuthorizationException if the search was rejected
   * @throws FetchCancelledException if the calling thread is interrupted
   */
  public List<AggregatedProfile> run(ProfileSearchRequest request) {
    if (properties.requireCredential() && !requestExecutor.hasCredential()) {
      throw new IllegalStateException(
          "founders.pipeline.require-credential is set but no valid GitHub token is configured");
    }
    log.info("Starting profile aggregation for query '{}'", request.query());

    List<String> candidateUrls = searchCandidates(request.query());
    List<AggregatedProfile> fetched = fetchAll(candidateUrls);

    List<AggregatedProfile> profiles = ProfileDeduplicator.dedupe(fetched);
    profiles.sort(Comparator.comparingDouble(AggregatedProfile::founderPotential).reversed());

    log.info(
        "Aggregation complete for '{}': {} candidates, {} profiles",
        request.query(),
        candidateUrls.size(),
        profiles.size());
    return List.copyOf(profiles);
  }

  private List<String> searchCandidates(String query) {
    Optional<JsonNode> body =
        requestExecutor.execute(gitHubProperties.searchUsersUrl(), Map.of("q", query));
    if (body.isEmpty()) {
      throw new SearchFailedException("User search failed for query '" + query + "'");
    }

    List<String> urls = new ArrayList<>();
    for (JsonNode item : body.get().path("items")) {
      if (urls.size() >= properties.maxCandidates()) {
        break;
      }
      JsonNode url = item.path("url");
      if (url.isTextual() && !url.asText().isBlank()) {
        urls.add(url.asText());
      } else {
        log.debug("Skipping search hit without url: {}", item);
      }
    }
    return urls;
  }

  private List<AggregatedProfile> fetchAll(List<String> candidateUrls) {
    List<Future<Optional<AggregatedProfile>>> futures = new ArrayList<>(candidateUrls.size());
    for (String url : candidateUrls) {
      futures.add(fetchTaskExecutor.submit(() -> profileFetcher.fetch(url)));
    }

    List<AggregatedProfile> profiles = new ArrayList<>();
    try {
      for (int i = 0; i < futures.size(); i++) {
        try {
          futures.get(i).get().ifPresent(profiles::add);
        } catch (ExecutionException e) {
          log.warn(
              "Dropping candidate {}: {}", candidateUrls.get(i), e.getCause().getMessage());
        }
      }
    } catch (InterruptedException e) {
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new FetchCancelledException("Interrupted while fetching candidate profiles", e);
    }
    return profiles;
  }
}
