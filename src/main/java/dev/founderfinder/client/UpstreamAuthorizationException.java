package dev.founderfinder.client;

import java.net.URI;

/**
 * HTTP 401 or 403 from the upstream. Never retried: the credential is missing, invalid, or lacks
 * access to the resource.
 */
public class UpstreamAuthorizationException extends UpstreamException {

  private final int status;
  private final URI uri;

  public UpstreamAuthorizationException(int status, URI uri) {
    super("Authorization failed with HTTP " + status + " for " + uri);
    this.status = status;
    this.uri = uri;
  }

  public int getStatus() {
    return status;
  }

  public URI getUri() {
    return uri;
  }
}
