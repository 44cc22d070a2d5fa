package io.cronconv;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Output and evaluation options for a cron schedule.
 *
 * @param outputHashes render {@code H} instead of {@code *}
 * @param outputWeekdayNames render weekdays as SUN..SAT
 * @param outputMonthNames render months as JAN..DEC
 * @param timezone the IANA timezone used for schedule queries (may be null)
 */
public record CronOptions(
    boolean outputHashes, boolean outputWeekdayNames, boolean outputMonthNames, String timezone) {

  private static final CronOptions DEFAULTS = new CronOptions(false, false, false, null);

  /**
   * Returns the default options: numeric output with {@code *} and no timezone.
   *
   * @return the default options
   */
  public static CronOptions defaults() {
    return DEFAULTS;
  }

  public CronOptions withOutputHashes(boolean outputHashes) {
    return new CronOptions(outputHashes, outputWeekdayNames, outputMonthNames, timezone);
  }

  public CronOptions withOutputWeekdayNames(boolean outputWeekdayNames) {
    return new CronOptions(outputHashes, outputWeekdayNames, outputMonthNames, timezone);
  }

  public CronOptions withOutputMonthNames(boolean outputMonthNames) {
    return new CronOptions(outputHashes, outputWeekdayNames, outputMonthNames, timezone);
  }

  /**
   * Returns a copy with the specified timezone.
   *
   * @param timezone the IANA timezone, or null to use the reference date's zone
   * @return a new CronOptions with the updated timezone
   */
  public CronOptions withTimezone(String timezone) {
    return new CronOptions(outputHashes, outputWeekdayNames, outputMonthNames, timezone);
  }

  /**
   * Resolves the configured timezone.
   *
   * @return the zone, or empty if none is configured
   * @throws CronException if the timezone is not a known zone id
   */
  public Optional<ZoneId> zone() throws CronException {
    if (timezone == null || timezone.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZoneId.of(timezone));
    } catch (DateTimeException e) {
      throw CronException.invalidTimezone(timezone);
    }
  }
}
