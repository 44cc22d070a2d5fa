package io.cronconv.field;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * The validated set of values accepted by one cron field.
 *
 * <p>Values are strictly ascending, unique, non-empty and within the bounds of the unit. Instances
 * are immutable and safe to share between threads.
 */
public final class FieldValueSet {
  private final Unit unit;
  private final int[] values;

  /**
   * Creates a value set from already validated values.
   *
   * @param unit the unit of the field
   * @param values strictly ascending values within the unit's bounds
   * @throws IllegalArgumentException if the values break the set's invariants
   */
  public FieldValueSet(Unit unit, List<Integer> values) {
    if (unit == null) {
      throw new IllegalArgumentException("unit is required");
    }
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("values must not be empty for " + unit);
    }
    int[] copy = new int[values.size()];
    for (int i = 0; i < copy.length; i++) {
      int value = values.get(i);
      if (value < unit.min() || value > unit.max()) {
        throw new IllegalArgumentException("value " + value + " out of range for " + unit);
      }
      if (i > 0 && value <= copy[i - 1]) {
        throw new IllegalArgumentException("values must be strictly ascending for " + unit);
      }
      copy[i] = value;
    }
    this.unit = unit;
    this.values = copy;
  }

  /**
   * Returns a set holding every value of the unit.
   *
   * @param unit the unit
   * @return the full set
   */
  public static FieldValueSet full(Unit unit) {
    List<Integer> all = new ArrayList<>(unit.size());
    for (int v = unit.min(); v <= unit.max(); v++) {
      all.add(v);
    }
    return new FieldValueSet(unit, all);
  }

  public Unit unit() {
    return unit;
  }

  /**
   * Returns the values in ascending order.
   *
   * @return an unmodifiable list of values
   */
  public List<Integer> values() {
    List<Integer> list = new ArrayList<>(values.length);
    for (int v : values) {
      list.add(v);
    }
    return Collections.unmodifiableList(list);
  }

  /**
   * Returns the values as a new array.
   *
   * @return a copy of the values
   */
  public int[] toArray() {
    return values.clone();
  }

  public int size() {
    return values.length;
  }

  /**
   * Checks if the set contains a value.
   *
   * @param value the value to look for
   * @return true if present
   */
  public boolean has(int value) {
    return Arrays.binarySearch(values, value) >= 0;
  }

  /**
   * Returns the smallest value.
   *
   * @return the first value
   */
  public int min() {
    return values[0];
  }

  /**
   * Returns the largest value.
   *
   * @return the last value
   */
  public int max() {
    return values[values.length - 1];
  }

  /**
   * Returns true if the set holds every value of its unit.
   *
   * @return true for a full set
   */
  public boolean isFull() {
    return values.length == unit.size();
  }

  /**
   * Returns the difference between the first two values when the set could be an interval.
   *
   * <p>Only sets of three or more values with a gap wider than one have a step.
   *
   * @return the step, or empty
   */
  public OptionalInt step() {
    if (values.length > 2) {
      int step = values[1] - values[0];
      if (step > 1) {
        return OptionalInt.of(step);
      }
    }
    return OptionalInt.empty();
  }

  /**
   * Returns true if every adjacent pair of values differs by {@code step}.
   *
   * @param step the expected difference
   * @return true if the set is an interval
   */
  public boolean isInterval(int step) {
    for (int i = 1; i < values.length; i++) {
      if (values[i] - values[i - 1] != step) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns true if the interval starts at the unit's minimum and cannot be extended past its
   * maximum.
   *
   * @param step the interval step
   * @return true if {@code *}/step describes this set
   */
  public boolean isFullInterval(int step) {
    boolean haveAllValues = values.length == (max() - min()) / step + 1;
    return min() == unit.min() && max() + step > unit.max() && haveAllValues;
  }

  /**
   * Collapses the values into maximal runs of consecutive integers.
   *
   * @return the runs, in ascending order
   */
  public List<ValueRange> toRanges() {
    List<ValueRange> ranges = new ArrayList<>();
    int start = values[0];
    for (int i = 1; i <= values.length; i++) {
      if (i == values.length || values[i] != values[i - 1] + 1) {
        ranges.add(new ValueRange(start, values[i - 1]));
        if (i < values.length) {
          start = values[i];
        }
      }
    }
    return ranges;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldValueSet other)) {
      return false;
    }
    return unit == other.unit && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * unit.hashCode() + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return unit + Arrays.toString(values);
  }
}
