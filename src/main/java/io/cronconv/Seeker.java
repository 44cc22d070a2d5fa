package io.cronconv;

import io.cronconv.eval.Direction;
import io.cronconv.eval.Evaluator;
import io.cronconv.field.CronFields;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the execution times of a schedule forward and backward from a reference date.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Seeker seeker = Cron.parse("0,30 9-17 * * MON-FRI").schedule(ZonedDateTime.now());
 * ZonedDateTime next = seeker.next();
 * ZonedDateTime after = seeker.next();
 * }</pre>
 *
 * <p>A seeker keeps a mutable cursor and is not thread-safe. Seekers over the same schedule share
 * no state and can be used from different threads.
 */
public final class Seeker {
  private static final Logger LOG = LoggerFactory.getLogger(Seeker.class);

  private final CronFields fields;
  private final ZonedDateTime anchor;
  private ZonedDateTime cursor;
  private boolean pristine;

  /**
   * Creates a seeker over a schedule.
   *
   * @param fields the schedule fields
   * @param reference the reference date
   * @param zone the zone to search in, or null to keep the reference's zone
   * @throws CronException if the schedule or the reference date is missing
   */
  public Seeker(CronFields fields, ZonedDateTime reference, ZoneId zone) throws CronException {
    if (fields == null) {
      throw CronException.noSchedule();
    }
    if (reference == null) {
      throw CronException.invalidReferenceDate(null);
    }
    ZonedDateTime date = zone == null ? reference : reference.withZoneSameInstant(zone);
    if (date.getSecond() > 0 || date.getNano() > 0) {
      // Never return a time at or before a reference that is not minute aligned
      ZonedDateTime advanced = date.plusMinutes(1);
      LOG.debug("reference {} advanced to {}", date, advanced);
      date = advanced;
    }
    this.fields = fields;
    this.anchor = date;
    this.cursor = date;
    this.pristine = true;
  }

  /**
   * Returns the next execution time.
   *
   * <p>The first call after construction or {@link #reset()} may return the reference minute
   * itself; later calls return strictly increasing times.
   *
   * @return the next execution time, with zero seconds
   * @throws CronException if the schedule can never fire
   */
  public ZonedDateTime next() throws CronException {
    if (pristine) {
      pristine = false;
    } else {
      cursor = cursor.plusMinutes(1);
    }
    cursor = Evaluator.find(fields, cursor, Direction.FORWARD);
    return cursor;
  }

  /**
   * Returns the previous execution time, strictly before the current position.
   *
   * @return the previous execution time, with zero seconds
   * @throws CronException if the schedule can never fire
   */
  public ZonedDateTime prev() throws CronException {
    pristine = false;
    cursor = Evaluator.find(fields, cursor, Direction.BACKWARD);
    return cursor;
  }

  /** Moves the cursor back to the reference date. */
  public void reset() {
    cursor = anchor;
    pristine = true;
  }

  /**
   * Returns the reference date, normalized to the search zone and advanced to a whole minute.
   *
   * @return the anchor
   */
  public ZonedDateTime anchor() {
    return anchor;
  }

  /**
   * Returns the current search position.
   *
   * @return the cursor
   */
  public ZonedDateTime cursor() {
    return cursor;
  }

  @Override
  public String toString() {
    return "Seeker{anchor=" + anchor + ", cursor=" + cursor + "}";
  }
}
