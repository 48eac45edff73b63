package dev.founderfinder.pipeline;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A GitHub user search query.
 *
 * @param query free-text query, stripped; must not be blank
 */
public record ProfileSearchRequest(String query) {

  public ProfileSearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    query = query.strip();
  }

  /** Joins the non-blank terms with single spaces, e.g. {@code of("Ada", "Acme", null)}. */
  public static ProfileSearchRequest of(
      @Nullable String name, @Nullable String company, @Nullable String role) {
    String query =
        Arrays.stream(new String[] {name, company, role})
            .filter(Objects::nonNull)
            .map(String::strip)
            .filter(term -> !term.isEmpty())
            .collect(Collectors.joining(" "));
    return new ProfileSearchRequest(query);
  }
}
