package dev.founderfinder.client;

/**
 * Raised when the calling thread is interrupted while waiting on the rate limiter, a back off, or
 * in-flight fetches. The thread's interrupt flag is restored before this is thrown.
 */
public class FetchCancelledException extends RuntimeException {

  public FetchCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
