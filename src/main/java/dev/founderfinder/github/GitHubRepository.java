package dev.founderfinder.github;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/** Repository entry from {@code GET /users/{login}/repos}. */
public record GitHubRepository(
    @Nullable String name,
    @Nullable String description,
    int stars,
    int forks,
    @Nullable String language,
    @Nullable String createdAt) {

  public static GitHubRepository from(JsonNode node) {
    return new GitHubRepository(
        JsonFields.text(node, "name"),
        JsonFields.text(node, "description"),
        JsonFields.count(node, "stargazers_count"),
        JsonFields.count(node, "forks_count"),
        JsonFields.text(node, "language"),
        JsonFields.text(node, "created_at"));
  }
}
