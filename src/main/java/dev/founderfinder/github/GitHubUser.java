package dev.founderfinder.github;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * User detail as returned by {@code GET /users/{login}}.
 *
 * <p>Counts default to 0 and text fields to {@code null} when GitHub omits them or sends the wrong
 * type. {@code createdAt} is kept as the raw ISO-8601 string; see {@link GitHubTimestamps}.
 */
public record GitHubUser(
    @Nullable String login,
    @Nullable String name,
    @Nullable String company,
    @Nullable String location,
    @Nullable String bio,
    @Nullable String htmlUrl,
    int publicRepos,
    int followers,
    int following,
    @Nullable String createdAt) {

  public static GitHubUser from(JsonNode node) {
    return new GitHubUser(
        JsonFields.text(node, "login"),
        JsonFields.text(node, "name"),
        JsonFields.text(node, "company"),
        JsonFields.text(node, "location"),
        JsonFields.text(node, "bio"),
        JsonFields.text(node, "html_url"),
        JsonFields.count(node, "public_repos"),
        JsonFields.count(node, "followers"),
        JsonFields.count(node, "following"),
        JsonFields.text(node, "created_at"));
  }
}
