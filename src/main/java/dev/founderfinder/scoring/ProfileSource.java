package dev.founderfinder.scoring;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Where a candidate profile was found. Unrecognized values map to {@link #OTHER}. */
public enum ProfileSource {
  GITHUB,
  PATENTS,
  MEDIUM,
  DEVTO,
  RESEARCH_PAPERS,
  CONFERENCE,
  OTHER;

  public static ProfileSource fromValue(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return OTHER;
    }
    for (ProfileSource source : values()) {
      if (source.label().equals(value.strip().toLowerCase(Locale.ROOT))) {
        return source;
      }
    }
    return OTHER;
  }

  public boolean isTechnicalWriting() {
    return this == MEDIUM || this == DEVTO;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
