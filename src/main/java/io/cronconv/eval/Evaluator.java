package io.cronconv.eval;

import io.cronconv.CronException;
import io.cronconv.field.CronFields;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches for the instants at which a cron schedule fires.
 *
 * <h2>Search passes</h2>
 *
 * <p>A pass resolves the fields from the coarsest to the finest: month, then day (day-of-month and
 * weekday together), then hour, then minute. Moving a coarser field resets the finer ones to the
 * start (or end, when searching backward) of the new unit, so any phase that rolls its parent unit
 * over abandons the pass and starts a new one from the month.
 *
 * <p>MAX_PASSES (24): a pass restarts at most once per month transition, so a satisfiable schedule
 * settles well within this bound. Combinations that can never match, such as day 31 in February,
 * exhaust it and fail with {@link io.cronconv.ErrorKind#UNSCHEDULABLE}.
 */
public final class Evaluator {
  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  /** Maximum number of passes before a schedule is declared unschedulable. */
  private static final int MAX_PASSES = 24;

  private Evaluator() {}

  /**
   * Finds the first instant at or after {@code start} (forward), or strictly before {@code start}
   * (backward), matching every field.
   *
   * @param fields the schedule fields
   * @param start the instant to search from
   * @param direction the search direction
   * @return the matching instant with zero seconds and nanos
   * @throws CronException if no matching instant is found within the pass limit
   */
  public static ZonedDateTime find(CronFields fields, ZonedDateTime start, Direction direction)
      throws CronException {
    // Keeps a backward result distinct from a forward one found from the same point
    ZonedDateTime date = direction == Direction.BACKWARD ? start.minusMinutes(1) : start;

    for (int pass = 1; pass <= MAX_PASSES; pass++) {
      date = shiftMonth(fields, date, direction);

      Shift day = shiftDay(fields, date, direction);
      date = day.date();
      if (day.rolledOver()) {
        LOG.trace("pass {} restarted at {}: month changed", pass, date);
        continue;
      }

      Shift hour = shiftHour(fields, date, direction);
      date = hour.date();
      if (hour.rolledOver()) {
        LOG.trace("pass {} restarted at {}: day changed", pass, date);
        continue;
      }

      Shift minute = shiftMinute(fields, date, direction);
      date = minute.date();
      if (minute.rolledOver()) {
        LOG.trace("pass {} restarted at {}: hour changed", pass, date);
        continue;
      }

      return date.truncatedTo(ChronoUnit.MINUTES);
    }

    throw CronException.unschedulable();
  }

  /**
   * Checks if a datetime matches every field of a schedule, ignoring seconds.
   *
   * @param fields the schedule fields
   * @param dt the datetime to check
   * @return true if the datetime matches
   */
  public static boolean matches(CronFields fields, ZonedDateTime dt) {
    return fields.month().has(dt.getMonthValue())
        && fields.day().has(dt.getDayOfMonth())
        && fields.weekday().has(weekday(dt))
        && fields.hour().has(dt.getHour())
        && fields.minute().has(dt.getMinute());
  }

  private static ZonedDateTime shiftMonth(
      CronFields fields, ZonedDateTime date, Direction direction) {
    while (!fields.month().has(date.getMonthValue())) {
      date = step(date, ChronoUnit.MONTHS, direction);
    }
    return date;
  }

  private static Shift shiftDay(CronFields fields, ZonedDateTime date, Direction direction) {
    int month = date.getMonthValue();
    while (!fields.day().has(date.getDayOfMonth()) || !fields.weekday().has(weekday(date))) {
      date = step(date, ChronoUnit.DAYS, direction);
      if (date.getMonthValue() != month) {
        return new Shift(date, true);
      }
    }
    return new Shift(date, false);
  }

  private static Shift shiftHour(CronFields fields, ZonedDateTime date, Direction direction) {
    int day = date.getDayOfMonth();
    while (!fields.hour().has(date.getHour())) {
      date = step(date, ChronoUnit.HOURS, direction);
      if (date.getDayOfMonth() != day) {
        return new Shift(date, true);
      }
    }
    return new Shift(date, false);
  }

  private static Shift shiftMinute(CronFields fields, ZonedDateTime date, Direction direction) {
    int hour = date.getHour();
    while (!fields.minute().has(date.getMinute())) {
      date = step(date, ChronoUnit.MINUTES, direction);
      if (date.getHour() != hour) {
        return new Shift(date, true);
      }
    }
    return new Shift(date, false);
  }

  /** Move one unit in the search direction and snap to the boundary of the new unit. */
  private static ZonedDateTime step(ZonedDateTime date, ChronoUnit unit, Direction direction) {
    return switch (direction) {
      case FORWARD -> startOf(date.plus(1, unit), unit);
      case BACKWARD -> endOf(date.minus(1, unit), unit);
    };
  }

  private static ZonedDateTime startOf(ZonedDateTime date, ChronoUnit unit) {
    if (unit == ChronoUnit.MONTHS) {
      return date.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
    }
    return date.truncatedTo(unit);
  }

  private static ZonedDateTime endOf(ZonedDateTime date, ChronoUnit unit) {
    return switch (unit) {
      case MONTHS -> date.with(TemporalAdjusters.lastDayOfMonth()).with(LocalTime.MAX);
      case DAYS -> date.with(LocalTime.MAX);
      default -> date.truncatedTo(unit).plus(1, unit).minusNanos(1);
    };
  }

  /** Cron day of week: Sunday=0 through Saturday=6. */
  private static int weekday(ZonedDateTime dt) {
    return dt.getDayOfWeek().getValue() % 7;
  }

  /** The date reached by a phase and whether it rolled over into the next coarser unit. */
  private record Shift(ZonedDateTime date, boolean rolledOver) {}
}
