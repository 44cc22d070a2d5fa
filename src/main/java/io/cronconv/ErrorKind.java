package io.cronconv;

/** The type of error that occurred while parsing a cron expression or searching a schedule. */
public enum ErrorKind {
  /** The expression does not consist of five whitespace separated fields. */
  INVALID_CRON("invalid_cron"),
  /** Malformed field syntax: extra separators or non-numeric tokens. */
  INVALID_FIELD("invalid_field"),
  /** A range whose upper bound precedes its lower bound. */
  INVALID_RANGE("invalid_range"),
  /** A step that is empty, non-numeric, zero or negative. */
  INVALID_STEP("invalid_step"),
  /** A value outside the bounds of its unit. */
  OUT_OF_RANGE("out_of_range"),
  /** No values left after applying a step, or an empty array. */
  EMPTY_INTERVAL("empty_interval"),
  /** A seeker was requested without parsed fields. */
  NO_SCHEDULE("no_schedule"),
  /** The seeker's reference date is missing or cannot be parsed. */
  INVALID_REFERENCE_DATE("invalid_reference_date"),
  /** The configured timezone is not a known zone id. */
  INVALID_TIMEZONE("invalid_timezone"),
  /** The search gave up without finding a matching instant. */
  UNSCHEDULABLE("unschedulable");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
