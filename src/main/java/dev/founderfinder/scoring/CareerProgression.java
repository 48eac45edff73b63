package dev.founderfinder.scoring;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Summary of a position history.
 *
 * @param progressionRate level span divided by the number of positions, two decimals
 * @param promotions count of positions whose level is above the one before
 * @param trajectory bucketed progression rate
 * @param titleLevels level of each position in start-date order
 */
public record CareerProgression(
    double progressionRate, int promotions, Trajectory trajectory, List<Integer> titleLevels) {

  public CareerProgression {
    titleLevels = List.copyOf(titleLevels);
  }

  public static CareerProgression stable() {
    return new CareerProgression(0.0, 0, Trajectory.STABLE, List.of());
  }

  public enum Trajectory {
    RAPID,
    STEADY,
    STABLE;

    public static Trajectory fromRate(double progressionRate) {
      if (progressionRate >= 1.5) {
        return RAPID;
      }
      if (progressionRate >= 0.5) {
        return STEADY;
      }
      return STABLE;
    }

    @JsonValue
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
