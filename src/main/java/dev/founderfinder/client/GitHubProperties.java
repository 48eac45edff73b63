package dev.founderfinder.client;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection, credential and quota settings for the GitHub REST API, bound from {@code
 * founders.github.*}.
 *
 * <p>The local hourly budget is {@code requestsPerHour - requestBuffer}.
 */
@ConfigurationProperties(prefix = "founders.github")
public record GitHubProperties(
    String apiBaseUrl,
    @Nullable String token,
    String userAgent,
    int connectTimeoutMs,
    int readTimeoutMs,
    int requestsPerHour,
    int requestBuffer,
    int maxRetries,
    long defaultRetryAfterSeconds) {

  public GitHubProperties {
    if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
      throw new IllegalStateException("founders.github.api-base-url must be set");
    }
    if (userAgent == null || userAgent.isBlank()) {
      throw new IllegalStateException("founders.github.user-agent must be set");
    }
    if (requestsPerHour < 1) {
      throw new IllegalStateException(
          "founders.github.requests-per-hour must be positive, got: " + requestsPerHour);
    }
    if (requestBuffer < 0 || requestBuffer >= requestsPerHour) {
      throw new IllegalStateException(
          "founders.github.request-buffer must be in [0, requests-per-hour), got: "
              + requestBuffer);
    }
    if (maxRetries < 1) {
      throw new IllegalStateException(
          "founders.github.max-retries must be at least 1, got: " + maxRetries);
    }
    if (defaultRetryAfterSeconds < 0) {
      throw new IllegalStateException(
          "founders.github.default-retry-after-seconds must not be negative");
    }
    apiBaseUrl =
        apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
  }

  /** Requests allowed per rolling hour after the safety buffer is taken off. */
  public int hourlyLimit() {
    return requestsPerHour - requestBuffer;
  }

  public String searchUsersUrl() {
    return apiBaseUrl + "/search/users";
  }
}
