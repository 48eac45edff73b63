package dev.founderfinder.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Account age and estimated personal age. Both are {@code null} when the account creation date
 * could not be read.
 */
public record AgeProfile(
    @Nullable Double accountAgeYears,
    @Nullable Integer estimatedAge,
    List<EarlyAchievement> earlyAchievements) {

  public AgeProfile {
    earlyAchievements = List.copyOf(earlyAchievements);
  }

  public static AgeProfile unknown() {
    return new AgeProfile(null, null, List.of());
  }

  /** {@code "X.Y years"}, or {@code "N/A"} when unknown. */
  @JsonProperty("accountAge")
  public String accountAgeLabel() {
    if (accountAgeYears == null) {
      return "N/A";
    }
    return String.format(Locale.ROOT, "%.1f years", accountAgeYears);
  }
}
