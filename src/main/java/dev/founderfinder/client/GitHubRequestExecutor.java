package dev.founderfinder.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Issues rate-limited, retried GET requests against the GitHub REST API and returns parsed JSON.
 *
 * <p>Every attempt, retries included, first takes a slot from the {@link RateLimiter}. Outcomes:
 *
 * <ul>
 *   <li>200: the parsed body
 *   <li>429: wait {@code Retry-After} (or the configured default) and retry, on a budget separate
 *       from hard failures
 *   <li>401/403: {@link UpstreamAuthorizationException}, never retried
 *   <li>anything else, transport errors included: exponential back off, then {@link
 *       Optional#empty()} once {@code maxRetries} attempts have failed
 * </ul>
 */
@Service
public class GitHubRequestExecutor {

  private static final Logger log = LoggerFactory.getLogger(GitHubRequestExecutor.class);

  public static final String SOURCE_ID = "github";
  static final String ACCEPT = "application/vnd.github.v3+json";

  private final RestClient restClient;
  private final RateLimiter rateLimiter;
  private final Sleeper sleeper;
  private final GitHubProperties properties;
  private final ObjectMapper objectMapper;
  private final @Nullable String token;

  public GitHubRequestExecutor(
      @Qualifier("gitHubRestClient") RestClient restClient,
      RateLimiter rateLimiter,
      Sleeper sleeper,
      GitHubProperties properties,
      ObjectMapper objectMapper) {
    this.restClient = restClient;
    this.rateLimiter = rateLimiter;
    this.sleeper = sleeper;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.token = GitHubToken.validate(properties.token()).orElse(null);
    if (token == null) {
      log.warn(
          "No valid GitHub token configured; requests are unauthenticated and capped at 60/hour"
              + " by GitHub");
    }
  }

  /** Whether a valid credential is attached to outgoing requests. */
  public boolean hasCredential() {
    return token != null;
  }

  public Optional<JsonNode> execute(String url) {
    return execute(url, Map.of());
  }

  public Optional<JsonNode> execute(String url, Map<String, String> params) {
    return execute(SOURCE_ID, url, Map.of(), params, properties.maxRetries());
  }

  /**
   * Fetch and parse a JSON document.
   *
   * @param sourceId rate-limit window to charge
   * @param url absolute request URL
   * @param headers caller headers; the default headers take precedence on conflicts
   * @param params query parameters, URL-encoded onto {@code url}
   * @param maxRetries total hard attempts, and separately the number of 429 waits allowed
   * @return the parsed body, or empty when retries are exhausted
   * @throws UpstreamAuthorizationException on HTTP 401 or 403
   * @throws FetchCancelledException if interrupted while waiting
   */
  public Optional<JsonNode> execute(
      String sourceId,
      String url,
      Map<String, String> headers,
      Map<String, String> params,
      int maxRetries) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1, got: " + maxRetries);
    }
    URI uri = buildUri(url, params);
    HttpHeaders requestHeaders = buildHeaders(headers);

    RetryTemplate retryTemplate = new RetryTemplate();
    retryTemplate.setRetryPolicy(new UpstreamRetryPolicy(maxRetries));
    retryTemplate.setBackOffPolicy(new UpstreamBackOffPolicy(sleeper));

    try {
      return Optional.of(
          retryTemplate.execute(context -> attempt(sourceId, uri, requestHeaders)));
    } catch (UpstreamAuthorizationException e) {
      throw e;
    } catch (UpstreamException e) {
      log.warn("Giving up on {} after retries: {}", uri, e.getMessage());
      return Optional.empty();
    } catch (BackOffInterruptedException e) {
      throw new FetchCancelledException("Interrupted while backing off from " + uri, e);
    }
  }

  private JsonNode attempt(String sourceId, URI uri, HttpHeaders headers) {
    rateLimiter.acquire(sourceId);
    log.debug("GET {}", uri);

    UpstreamResponse response;
    try {
      response =
          restClient
              .get()
              .uri(uri)
              .headers(h -> h.addAll(headers))
              .exchange((request, clientResponse) -> UpstreamResponse.read(clientResponse));
    } catch (RestClientException e) {
      throw new TransientUpstreamException("Request to " + uri + " failed: " + e.getMessage(), e);
    }

    int status = response.status();
    if (status == 200) {
      return parse(uri, response.body());
    }
    if (status == 429) {
      Duration retryAfter = retryAfter(response.headers());
      log.info("Rate limited by GitHub on {}, retrying in {} seconds", uri, retryAfter.toSeconds());
      throw new RemoteRateLimitedException("HTTP 429 for " + uri, retryAfter);
    }
    if (status == 401 || status == 403) {
      log.error("GitHub rejected request to {} with HTTP {}", uri, status);
      throw new UpstreamAuthorizationException(status, uri);
    }
    throw new TransientUpstreamException("HTTP " + status + " for " + uri);
  }

  private JsonNode parse(URI uri, byte[] body) {
    try {
      JsonNode node = objectMapper.readTree(body);
      if (node == null || node.isMissingNode()) {
        throw new TransientUpstreamException("Empty body from " + uri);
      }
      return node;
    } catch (IOException e) {
      throw new TransientUpstreamException("Malformed JSON from " + uri, e);
    }
  }

  private Duration retryAfter(HttpHeaders headers) {
    String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (value != null) {
      try {
        return Duration.ofSeconds(Math.max(0L, Long.parseLong(value.strip())));
      } catch (NumberFormatException e) {
        log.debug("Ignoring non-numeric Retry-After header '{}'", value);
      }
    }
    return Duration.ofSeconds(properties.defaultRetryAfterSeconds());
  }

  private HttpHeaders buildHeaders(Map<String, String> callerHeaders) {
    HttpHeaders headers = new HttpHeaders();
    callerHeaders.forEach(headers::set);
    headers.set(HttpHeaders.USER_AGENT, properties.userAgent());
    headers.set(HttpHeaders.ACCEPT, ACCEPT);
    if (token != null) {
      headers.set(HttpHeaders.AUTHORIZATION, "token " + token);
    }
    return headers;
  }

  private static URI buildUri(String url, Map<String, String> params) {
    UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
    params.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
    // expanded variables are fully encoded, so a literal '+' is sent as %2B
    return builder.encode().buildAndExpand(params).toUri();
  }
}
