package dev.founderfinder.profile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Removes repeated candidates, keeping the first occurrence and the input order. */
public final class ProfileDeduplicator {

  private ProfileDeduplicator() {}

  /**
   * Deduplicates profiles by display name and company. Two distinct people with the same name at
   * the same company collapse into one.
   *
   * @param profiles candidates in priority order
   * @return a new list without repeated keys
   */
  public static List<AggregatedProfile> dedupe(List<AggregatedProfile> profiles) {
    Set<String> seen = new HashSet<>();
    List<AggregatedProfile> unique = new ArrayList<>(profiles.size());
    for (AggregatedProfile profile : profiles) {
      if (seen.add(key(profile))) {
        unique.add(profile);
      }
    }
    return unique;
  }

  static String key(AggregatedProfile profile) {
    return nullToEmpty(profile.name()) + "-" + nullToEmpty(profile.company());
  }

  private static String nullToEmpty(@Nullable String value) {
    return value == null ? "" : value;
  }
}
