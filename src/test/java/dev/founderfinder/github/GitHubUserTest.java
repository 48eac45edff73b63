package dev.founderfinder.github;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class GitHubUserTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void mapsAllFields() throws Exception {
    JsonNode node =
        objectMapper.readTree(
            """
            {
              "login": "octocat",
              "name": "The Octocat",
              "company": "@github",
              "location": "San Francisco",
              "bio": "Class of 2015",
              "html_url": "https://github.com/octocat",
              "public_repos": 8,
              "followers": 3938,
              "following": 9,
              "created_at": "2011-01-25T18:44:36Z"
            }
            """);

    GitHubUser user = GitHubUser.from(node);

    assertThat(user.login()).isEqualTo("octocat");
    assertThat(user.company()).isEqualTo("@github");
    assertThat(user.htmlUrl()).isEqualTo("https://github.com/octocat");
    assertThat(user.publicRepos()).isEqualTo(8);
    assertThat(user.followers()).isEqualTo(3938);
    assertThat(user.following()).isEqualTo(9);
    assertThat(user.createdAt()).isEqualTo("2011-01-25T18:44:36Z");
  }

  @Test
  void missingAndMistypedFieldsFallBackToDefaults() throws Exception {
    JsonNode node =
        objectMapper.readTree(
            "{\"login\":\"ghost\",\"name\":null,\"bio\":{\"x\":1},\"followers\":\"many\","
                + "\"following\":-4}");

    GitHubUser user = GitHubUser.from(node);

    assertThat(user.login()).isEqualTo("ghost");
    assertThat(user.name()).isNull();
    assertThat(user.bio()).isNull();
    assertThat(user.company()).isNull();
    assertThat(user.followers()).isZero();
    assertThat(user.following()).isZero();
    assertThat(user.createdAt()).isNull();
  }

  @Test
  void repositoryUsesStargazerAndForkCounts() throws Exception {
    JsonNode node =
        objectMapper.readTree(
            "{\"name\":\"hello\",\"stargazers_count\":80,\"forks_count\":5,\"language\":null}");

    GitHubRepository repo = GitHubRepository.from(node);

    assertThat(repo.stars()).isEqualTo(80);
    assertThat(repo.forks()).isEqualTo(5);
    assertThat(repo.language()).isNull();
    assertThat(repo.description()).isNull();
  }
}
