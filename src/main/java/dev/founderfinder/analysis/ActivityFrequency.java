package dev.founderfinder.analysis;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Contribution frequency bucket derived from the number of recent public events. */
public enum ActivityFrequency {
  LOW,
  MEDIUM,
  HIGH,
  VERY_HIGH;

  public static ActivityFrequency fromRecentEventCount(int recentEvents) {
    if (recentEvents > 100) {
      return VERY_HIGH;
    }
    if (recentEvents > 50) {
      return HIGH;
    }
    if (recentEvents > 20) {
      return MEDIUM;
    }
    return LOW;
  }

  public boolean isHighOrAbove() {
    return this == HIGH || this == VERY_HIGH;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
