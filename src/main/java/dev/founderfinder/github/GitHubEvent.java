package dev.founderfinder.github;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/** Public activity event; only the timestamp feeds activity classification. */
public record GitHubEvent(@Nullable String type, @Nullable String createdAt) {

  public static GitHubEvent from(JsonNode node) {
    return new GitHubEvent(JsonFields.text(node, "type"), JsonFields.text(node, "created_at"));
  }
}
