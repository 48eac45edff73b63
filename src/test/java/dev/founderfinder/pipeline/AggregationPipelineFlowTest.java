package dev.founderfinder.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.founderfinder.analysis.AgeEstimator;
import dev.founderfinder.analysis.ContributionAnalyzer;
import dev.founderfinder.client.GitHubProperties;
import dev.founderfinder.client.GitHubRequestExecutor;
import dev.founderfinder.client.RateLimiter;
import dev.founderfinder.fixture.RecordingSleeper;
import dev.founderfinder.fixture.TestGitHubProperties;
import dev.founderfinder.profile.AggregatedProfile;
import dev.founderfinder.profile.ProfileFetcher;
import dev.founderfinder.scoring.ScoreCalculator;
import dev.founderfinder.scoring.ScoringWeights;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/** Search, fetch, score and rank against a mocked GitHub API with real collaborators. */
class AggregationPipelineFlowTest {

  private static final String API = TestGitHubProperties.API;
  private static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");

  private MockRestServiceServer server;
  private ThreadPoolTaskExecutor taskExecutor;
  private RecordingSleeper sleeper;
  private RateLimiter rateLimiter;
  private AggregationPipeline pipeline;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).ignoreExpectOrder(true).build();

    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    sleeper = new RecordingSleeper();
    rateLimiter = new RateLimiter(clock, sleeper);
    rateLimiter.register(GitHubRequestExecutor.SOURCE_ID, 4500);

    GitHubProperties properties = TestGitHubProperties.defaults();
    GitHubRequestExecutor executor =
        new GitHubRequestExecutor(
            builder.build(), rateLimiter, sleeper, properties, new ObjectMapper());
    ProfileFetcher fetcher =
        new ProfileFetcher(
            executor,
            new ContributionAnalyzer(clock),
            new AgeEstimator(clock),
            new ScoreCalculator(ScoringWeights.defaults(), clock));

    taskExecutor = new ThreadPoolTaskExecutor();
    taskExecutor.setCorePoolSize(1);
    taskExecutor.setMaxPoolSize(1);
    taskExecutor.initialize();

    pipeline =
        new AggregationPipeline(
            executor, fetcher, taskExecutor, properties, new AggregationProperties(1, 30, false));
  }

  @AfterEach
  void tearDown() {
    taskExecutor.shutdown();
  }

  private void respond(String url, String json) {
    server.expect(requestTo(url)).andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
  }

  @Test
  void ranksRichProfileFirstAndDropsUnreachableCandidate() {
    respond(
        API + "/search/users?q=ada",
        """
        {"total_count": 3, "items": [
          {"login": "quiet", "url": "%1$s/users/quiet"},
          {"login": "gone", "url": "%1$s/users/gone"},
          {"login": "rich", "url": "%1$s/users/rich"}
        ]}
        """
            .formatted(API));

    respond(
        API + "/users/quiet",
        """
        {"login": "quiet", "name": "Quiet Coder", "followers": 3, "following": 1,
         "created_at": "2020-06-15T12:00:00Z"}
        """);
    respond(API + "/users/quiet/repos", "[]");
    respond(API + "/users/quiet/events/public", "[]");

    server
        .expect(times(3), requestTo(API + "/users/gone"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    respond(
        API + "/users/rich",
        """
        {"login": "rich", "name": "Rich Builder", "company": "Acme", "followers": 800,
         "following": 100, "public_repos": 2, "created_at": "2015-01-10T00:00:00Z"}
        """);
    respond(
        API + "/users/rich/repos",
        """
        [
          {"name": "engine", "stargazers_count": 250, "forks_count": 30, "language": "Rust",
           "created_at": "2015-06-01T00:00:00Z"},
          {"name": "site", "stargazers_count": 4, "forks_count": 0, "language": "TypeScript",
           "created_at": "2019-03-01T00:00:00Z"}
        ]
        """);
    respond(
        API + "/users/rich/events/public",
        """
        [{"type": "PushEvent", "created_at": "2026-06-10T09:00:00Z"}]
        """);

    List<AggregatedProfile> profiles = pipeline.run("ada");

    assertThat(profiles).extracting(AggregatedProfile::login).containsExactly("rich", "quiet");
    AggregatedProfile rich = profiles.get(0);
    assertThat(rich.founderPotential()).isGreaterThan(5.0);
    assertThat(rich.languages()).containsOnlyKeys("Rust", "TypeScript");
    assertThat(rich.age().earlyAchievements()).hasSize(1);
    assertThat(profiles.get(1).founderPotential()).isZero();
    assertThat(sleeper.sleeps()).containsExactly(1_000L, 2_000L);
    assertThat(rateLimiter.status(GitHubRequestExecutor.SOURCE_ID).orElseThrow().callCount())
        .isEqualTo(10);
    server.verify();
  }
}
