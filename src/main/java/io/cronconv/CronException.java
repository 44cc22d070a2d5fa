package io.cronconv;

import io.cronconv.field.Unit;
import java.util.Optional;

/** Exception thrown for errors in cron parsing or schedule evaluation. */
public final class CronException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The unit whose field was rejected, if any. */
  private final Unit unit;

  /** The offending value or field text, if any. */
  private final String value;

  private CronException(ErrorKind kind, String message, Unit unit, String value) {
    super(unit == null ? message : message + " for " + unit.displayName());
    this.kind = kind;
    this.unit = unit;
    this.value = value;
  }

  /**
   * Creates an error for an expression that is not made of five fields.
   *
   * @param message the error message
   * @return a new CronException
   */
  public static CronException invalidCron(String message) {
    return new CronException(ErrorKind.INVALID_CRON, message, null, null);
  }

  /**
   * Creates an error for malformed field syntax.
   *
   * @param unit the unit being parsed
   * @param value the offending text
   * @return a new CronException
   */
  public static CronException invalidField(Unit unit, String value) {
    return new CronException(
        ErrorKind.INVALID_FIELD, "Invalid value \"" + value + "\"", unit, value);
  }

  /**
   * Creates an error for a range whose upper bound precedes its lower bound.
   *
   * @param unit the unit being parsed
   * @param range the offending range text
   * @return a new CronException
   */
  public static CronException invalidRange(Unit unit, String range) {
    return new CronException(
        ErrorKind.INVALID_RANGE, "Max range is less than min range in \"" + range + "\"", unit,
        range);
  }

  /**
   * Creates an error for a step that is not a positive integer.
   *
   * @param unit the unit being parsed
   * @param step the offending step text
   * @return a new CronException
   */
  public static CronException invalidStep(Unit unit, String step) {
    return new CronException(
        ErrorKind.INVALID_STEP, "Invalid interval step value \"" + step + "\"", unit, step);
  }

  /**
   * Creates an error for a value outside the bounds of its unit.
   *
   * @param unit the unit being parsed
   * @param value the offending value
   * @return a new CronException
   */
  public static CronException outOfRange(Unit unit, int value) {
    String text = String.valueOf(value);
    return new CronException(
        ErrorKind.OUT_OF_RANGE, "Value \"" + text + "\" out of range", unit, text);
  }

  /**
   * Creates an error for a field that has no values.
   *
   * @param unit the unit being parsed
   * @param field the field text, or null when parsing an array
   * @return a new CronException
   */
  public static CronException emptyInterval(Unit unit, String field) {
    String message = field == null ? "Empty interval value" : "Empty interval value \"" + field + "\"";
    return new CronException(ErrorKind.EMPTY_INTERVAL, message, unit, field);
  }

  /**
   * Creates an error for a seeker requested without a schedule.
   *
   * @return a new CronException
   */
  public static CronException noSchedule() {
    return new CronException(ErrorKind.NO_SCHEDULE, "No schedule found", null, null);
  }

  /**
   * Creates an error for a missing or unparsable reference date.
   *
   * @param value the offending text, or null when the date was missing
   * @return a new CronException
   */
  public static CronException invalidReferenceDate(String value) {
    String message = value == null ? "Invalid date provided" : "Invalid date provided \"" + value + "\"";
    return new CronException(ErrorKind.INVALID_REFERENCE_DATE, message, null, value);
  }

  /**
   * Creates an error for an unknown timezone id.
   *
   * @param zone the offending zone id
   * @return a new CronException
   */
  public static CronException invalidTimezone(String zone) {
    return new CronException(
        ErrorKind.INVALID_TIMEZONE, "Unknown timezone \"" + zone + "\"", null, zone);
  }

  /**
   * Creates an error for a search that found no matching instant.
   *
   * @return a new CronException
   */
  public static CronException unschedulable() {
    return new CronException(
        ErrorKind.UNSCHEDULABLE, "Unable to find execution time for schedule", null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the unit whose field was rejected, if available.
   *
   * @return the unit, or empty if the error is not tied to a field
   */
  public Optional<Unit> unit() {
    return Optional.ofNullable(unit);
  }

  /**
   * Returns the offending value or field text, if available.
   *
   * @return the value, or empty if not available
   */
  public Optional<String> value() {
    return Optional.ofNullable(value);
  }
}
