package dev.founderfinder.analysis;

/**
 * Recent public activity of a user.
 *
 * @param frequency bucketed frequency
 * @param recentEvents events created within the lookback window
 */
public record ActivityProfile(ActivityFrequency frequency, int recentEvents) {

  public static ActivityProfile none() {
    return new ActivityProfile(ActivityFrequency.LOW, 0);
  }

  public boolean isActive() {
    return frequency.isHighOrAbove();
  }
}
