package dev.founderfinder.scoring;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScoringConfig {

  @Bean
  @ConditionalOnMissingBean
  public ScoringWeights scoringWeights() {
    return ScoringWeights.defaults();
  }

  @Bean
  @ConditionalOnMissingBean
  public ProfileAnalysisWeights profileAnalysisWeights() {
    return ProfileAnalysisWeights.defaults();
  }
}
