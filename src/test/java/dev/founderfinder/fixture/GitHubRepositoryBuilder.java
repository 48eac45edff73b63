package dev.founderfinder.fixture;

import dev.founderfinder.github.GitHubRepository;
import org.jspecify.annotations.Nullable;

/** Test builder for {@link GitHubRepository}. */
public final class GitHubRepositoryBuilder {

  private @Nullable String name = "repo";
  private @Nullable String description;
  private int stars;
  private int forks;
  private @Nullable String language = "Java";
  private @Nullable String createdAt = "2017-01-01T00:00:00Z";

  public GitHubRepositoryBuilder name(@Nullable String name) {
    this.name = name;
    return this;
  }

  public GitHubRepositoryBuilder stars(int stars) {
    this.stars = stars;
    return this;
  }

  public GitHubRepositoryBuilder forks(int forks) {
    this.forks = forks;
    return this;
  }

  public GitHubRepositoryBuilder language(@Nullable String language) {
    this.language = language;
    return this;
  }

  public GitHubRepositoryBuilder createdAt(@Nullable String createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  public GitHubRepository build() {
    return new GitHubRepository(name, description, stars, forks, language, createdAt);
  }
}
