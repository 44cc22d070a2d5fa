package io.cronconv.field;

import java.util.List;

/**
 * The five value sets of a cron schedule.
 *
 * @param minute the minute field
 * @param hour the hour field
 * @param day the day-of-month field
 * @param month the month field
 * @param weekday the day-of-week field (Sunday=0)
 */
public record CronFields(
    FieldValueSet minute,
    FieldValueSet hour,
    FieldValueSet day,
    FieldValueSet month,
    FieldValueSet weekday) {
  /** Checks that every slot holds a set of the matching unit. */
  public CronFields {
    requireUnit(minute, Unit.MINUTE);
    requireUnit(hour, Unit.HOUR);
    requireUnit(day, Unit.DAY);
    requireUnit(month, Unit.MONTH);
    requireUnit(weekday, Unit.WEEKDAY);
  }

  /**
   * Returns a schedule that fires every minute.
   *
   * @return the schedule {@code * * * * *}
   */
  public static CronFields everyMinute() {
    return new CronFields(
        FieldValueSet.full(Unit.MINUTE),
        FieldValueSet.full(Unit.HOUR),
        FieldValueSet.full(Unit.DAY),
        FieldValueSet.full(Unit.MONTH),
        FieldValueSet.full(Unit.WEEKDAY));
  }

  /**
   * Returns the field for a unit.
   *
   * @param unit the unit
   * @return the value set of that unit
   */
  public FieldValueSet get(Unit unit) {
    return switch (unit) {
      case MINUTE -> minute;
      case HOUR -> hour;
      case DAY -> day;
      case MONTH -> month;
      case WEEKDAY -> weekday;
    };
  }

  /**
   * Returns the fields in expression order.
   *
   * @return minute, hour, day, month and weekday
   */
  public List<FieldValueSet> all() {
    return List.of(minute, hour, day, month, weekday);
  }

  /**
   * Returns the values of every field.
   *
   * @return five arrays in expression order
   */
  public int[][] toArray() {
    return new int[][] {
      minute.toArray(), hour.toArray(), day.toArray(), month.toArray(), weekday.toArray()
    };
  }

  private static void requireUnit(FieldValueSet field, Unit unit) {
    if (field == null) {
      throw new IllegalArgumentException(unit + " field is required");
    }
    if (field.unit() != unit) {
      throw new IllegalArgumentException("expected " + unit + " field, got " + field.unit());
    }
  }
}
