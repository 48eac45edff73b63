package dev.founderfinder.client;

/** Base type for failures reported by, or on the way to, an upstream API. */
public class UpstreamException extends RuntimeException {

  public UpstreamException(String message) {
    super(message);
  }

  public UpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
