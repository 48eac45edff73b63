package dev.founderfinder.client;

import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shape check for GitHub personal access tokens.
 *
 * <p>Only classic tokens are accepted: {@code ghp_} prefix, 44 characters in total, no whitespace
 * and no {@code #}. The token value itself is never logged.
 */
public final class GitHubToken {

  private static final Logger log = LoggerFactory.getLogger(GitHubToken.class);

  static final String PREFIX = "ghp_";
  static final int LENGTH = 44;

  private GitHubToken() {}

  /**
   * Validate a configured token.
   *
   * @param raw the configured value, possibly blank or null
   * @return the stripped token when its shape is valid, otherwise empty
   */
  public static Optional<String> validate(@Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String token = raw.strip();
    if (!token.startsWith(PREFIX)) {
      log.error("GitHub token rejected: expected prefix '{}'", PREFIX);
      return Optional.empty();
    }
    if (token.length() != LENGTH) {
      log.error(
          "GitHub token rejected: expected {} characters, got {}", LENGTH, token.length());
      return Optional.empty();
    }
    if (token.chars().anyMatch(c -> Character.isWhitespace(c) || c == '#')) {
      log.error("GitHub token rejected: contains whitespace or a comment marker");
      return Optional.empty();
    }
    return Optional.of(token);
  }
}
