package dev.founderfinder.client;

/** Transport failure or unexpected status; retried with exponential back off. */
public class TransientUpstreamException extends UpstreamException {

  public TransientUpstreamException(String message) {
    super(message);
  }

  public TransientUpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
