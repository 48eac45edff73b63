package dev.founderfinder.pipeline;

/** The user search request could not be completed after retries. */
public class SearchFailedException extends RuntimeException {

  public SearchFailedException(String message) {
    super(message);
  }
}
