package dev.founderfinder.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pipeline settings bound from {@code founders.pipeline.*}.
 *
 * @param fetchConcurrency worker threads fetching candidates in parallel
 * @param maxCandidates search hits expanded into full profiles per run
 * @param requireCredential refuse to run without a valid GitHub token
 */
@ConfigurationProperties(prefix = "founders.pipeline")
public record AggregationProperties(
    int fetchConcurrency, int maxCandidates, boolean requireCredential) {

  public AggregationProperties {
    if (fetchConcurrency < 1) {
      throw new IllegalStateException(
          "founders.pipeline.fetch-concurrency must be at least 1, got: " + fetchConcurrency);
    }
    if (maxCandidates < 1) {
      throw new IllegalStateException(
          "founders.pipeline.max-candidates must be at least 1, got: " + maxCandidates);
    }
  }
}
