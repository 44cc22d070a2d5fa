package io.cronconv.field;

/**
 * Represents a run of consecutive values within a field.
 *
 * @param from the first value (inclusive)
 * @param to the last value (inclusive)
 */
public record ValueRange(int from, int to) {
  /**
   * Returns true if this run holds a single value.
   *
   * @return true for a singleton
   */
  public boolean isSingle() {
    return from == to;
  }
}
