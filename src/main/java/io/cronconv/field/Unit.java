package io.cronconv.field;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** The five cron fields, in expression order, with their bounds and alternative names. */
public enum Unit {
  MINUTE("minute", 0, 59, List.of()),
  HOUR("hour", 0, 23, List.of()),
  DAY("day", 1, 31, List.of()),
  MONTH(
      "month",
      1,
      12,
      List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC")),
  WEEKDAY("weekday", 0, 6, List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"));

  private final String displayName;
  private final int min;
  private final int max;
  private final List<String> alternatives;

  Unit(String displayName, int min, int max, List<String> alternatives) {
    this.displayName = displayName;
    this.min = min;
    this.max = max;
    this.alternatives = alternatives;
  }

  /**
   * Returns the lowercase unit name used in error messages.
   *
   * @return the unit name
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Returns the smallest allowed value.
   *
   * @return the minimum value
   */
  public int min() {
    return min;
  }

  /**
   * Returns the largest allowed value.
   *
   * @return the maximum value
   */
  public int max() {
    return max;
  }

  /**
   * Returns the number of values between min and max, inclusive.
   *
   * @return the size of the unit's range
   */
  public int size() {
    return max - min + 1;
  }

  /**
   * Returns the upper-case alternative names aligned with {@code min..max}, or an empty list.
   *
   * @return the alternative names
   */
  public List<String> alternatives() {
    return alternatives;
  }

  public boolean hasAlternatives() {
    return !alternatives.isEmpty();
  }

  /**
   * Resolves an alternative name (case insensitive) to its numeric value.
   *
   * @param name the name to look up
   * @return the value if the name is known to this unit
   */
  public Optional<Integer> parseName(String name) {
    int index = alternatives.indexOf(name.toUpperCase(Locale.ROOT));
    return index < 0 ? Optional.empty() : Optional.of(min + index);
  }

  /**
   * Returns the alternative name for a value.
   *
   * @param value a value between min and max
   * @return the alternative name, or empty if this unit has none
   */
  public Optional<String> nameOf(int value) {
    if (alternatives.isEmpty() || value < min || value > max) {
      return Optional.empty();
    }
    return Optional.of(alternatives.get(value - min));
  }

  @Override
  public String toString() {
    return displayName;
  }
}
