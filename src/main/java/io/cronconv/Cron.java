package io.cronconv;

import io.cronconv.display.Display;
import io.cronconv.eval.Evaluator;
import io.cronconv.field.CronFields;
import io.cronconv.parser.Parser;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for parsing, rendering and evaluating 5-field cron expressions.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Cron cron = Cron.parse("0 9 * JAN-MAR MON-FRI");
 * ZonedDateTime next = cron.nextFrom(ZonedDateTime.now());
 * System.out.println(cron + " runs next at " + next);
 * }</pre>
 */
public final class Cron {
  private static final Logger LOG = LoggerFactory.getLogger(Cron.class);

  private final CronFields fields;
  private final CronOptions options;

  private Cron(CronFields fields, CronOptions options) {
    this.fields = fields;
    this.options = options;
  }

  /**
   * Parses a 5-field cron expression with default options.
   *
   * @param input the cron expression
   * @return the parsed schedule
   * @throws CronException if the input is invalid
   */
  public static Cron parse(String input) throws CronException {
    return parse(input, CronOptions.defaults());
  }

  /**
   * Parses a 5-field cron expression.
   *
   * @param input the cron expression
   * @param options the output and evaluation options
   * @return the parsed schedule
   * @throws CronException if the input is invalid
   */
  public static Cron parse(String input, CronOptions options) throws CronException {
    return new Cron(Parser.parse(input), orDefaults(options));
  }

  /**
   * Builds a schedule from the values of its five fields, with default options.
   *
   * @param rows the values of minute, hour, day, month and weekday
   * @return the schedule
   * @throws CronException if the array does not have five valid rows
   */
  public static Cron fromArray(int[][] rows) throws CronException {
    return fromArray(rows, CronOptions.defaults());
  }

  /**
   * Builds a schedule from the values of its five fields.
   *
   * @param rows the values of minute, hour, day, month and weekday
   * @param options the output and evaluation options
   * @return the schedule
   * @throws CronException if the array does not have five valid rows
   */
  public static Cron fromArray(int[][] rows, CronOptions options) throws CronException {
    return new Cron(Parser.fromArray(rows), orDefaults(options));
  }

  /**
   * Wraps already parsed fields.
   *
   * @param fields the schedule fields
   * @param options the output and evaluation options
   * @return the schedule
   */
  public static Cron of(CronFields fields, CronOptions options) {
    if (fields == null) {
      throw new IllegalArgumentException("fields are required");
    }
    return new Cron(fields, orDefaults(options));
  }

  /**
   * Validates a cron expression without throwing.
   *
   * @param input the cron expression
   * @return true if the expression is valid
   */
  public static boolean validate(String input) {
    try {
      Parser.parse(input);
      return true;
    } catch (CronException e) {
      return false;
    }
  }

  /**
   * Returns a copy of this schedule with other options.
   *
   * @param options the new options
   * @return a new Cron over the same fields
   */
  public Cron withOptions(CronOptions options) {
    return new Cron(fields, orDefaults(options));
  }

  /**
   * Returns a seeker starting at the current time.
   *
   * @return a new seeker
   * @throws CronException if the configured timezone is invalid
   */
  public Seeker schedule() throws CronException {
    ZoneId zone = options.zone().orElse(ZoneId.systemDefault());
    return new Seeker(fields, ZonedDateTime.now(zone), zone);
  }

  /**
   * Returns a seeker starting at a reference date.
   *
   * <p>The reference is converted to the configured timezone; without one it keeps its own zone.
   *
   * @param reference the reference date
   * @return a new seeker
   * @throws CronException if the reference is missing or the timezone is invalid
   */
  public Seeker schedule(ZonedDateTime reference) throws CronException {
    return new Seeker(fields, reference, options.zone().orElse(null));
  }

  /**
   * Returns a seeker starting at a reference instant, in the configured timezone or UTC.
   *
   * @param reference the reference instant
   * @return a new seeker
   * @throws CronException if the reference is missing or the timezone is invalid
   */
  public Seeker schedule(Instant reference) throws CronException {
    if (reference == null) {
      throw CronException.invalidReferenceDate(null);
    }
    ZoneId zone = options.zone().orElse(ZoneOffset.UTC);
    return new Seeker(fields, reference.atZone(zone), zone);
  }

  /**
   * Returns a seeker starting at an ISO-8601 date or datetime.
   *
   * <p>Text without an offset or zone is read in the configured timezone, or UTC.
   *
   * @param reference the reference, e.g. {@code 2026-10-18T09:30:00+02:00}
   * @return a new seeker
   * @throws CronException if the text cannot be parsed or the timezone is invalid
   */
  public Seeker schedule(String reference) throws CronException {
    if (reference == null) {
      throw CronException.invalidReferenceDate(null);
    }
    ZoneId zone = options.zone().orElse(ZoneOffset.UTC);
    return new Seeker(fields, parseReference(reference, zone), options.zone().orElse(null));
  }

  /**
   * Computes the first execution time at or after the given time.
   *
   * @param now the reference time
   * @return the next execution time
   * @throws CronException if the schedule can never fire
   */
  public ZonedDateTime nextFrom(ZonedDateTime now) throws CronException {
    return schedule(now).next();
  }

  /**
   * Computes the next n execution times.
   *
   * @param now the reference time
   * @param n the number of execution times to compute
   * @return the execution times in increasing order
   * @throws CronException if the schedule can never fire
   */
  public List<ZonedDateTime> nextNFrom(ZonedDateTime now, int n) throws CronException {
    Seeker seeker = schedule(now);
    List<ZonedDateTime> results = new ArrayList<>(Math.max(n, 0));
    for (int i = 0; i < n; i++) {
      results.add(seeker.next());
    }
    return results;
  }

  /**
   * Computes the most recent execution time strictly before the given time.
   *
   * @param now the reference time
   * @return the previous execution time
   * @throws CronException if the schedule can never fire
   */
  public ZonedDateTime previousFrom(ZonedDateTime now) throws CronException {
    return schedule(now).prev();
  }

  /**
   * Checks if a datetime falls in a minute this schedule fires in.
   *
   * @param datetime the datetime to check
   * @return true if the datetime matches
   * @throws CronException if the configured timezone is invalid
   */
  public boolean matches(ZonedDateTime datetime) throws CronException {
    ZonedDateTime dt = options.zone().map(datetime::withZoneSameInstant).orElse(datetime);
    return Evaluator.matches(fields, dt);
  }

  /**
   * Returns a lazy stream of execution times starting at the given time.
   *
   * <p>The stream ends if the search gives up on a schedule that can no longer fire.
   *
   * @param from the reference time
   * @return a stream of execution times
   * @throws CronException if the reference is missing or the timezone is invalid
   */
  public Stream<ZonedDateTime> occurrences(ZonedDateTime from) throws CronException {
    Seeker seeker = schedule(from);
    Iterator<ZonedDateTime> iterator =
        new Iterator<>() {
          private ZonedDateTime next = null;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              try {
                next = seeker.next();
              } catch (CronException e) {
                LOG.debug("occurrences of {} ended: {}", Cron.this, e.getMessage());
                next = null;
              }
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return next != null;
          }

          @Override
          public ZonedDateTime next() {
            computeNext();
            if (next == null) {
              throw new NoSuchElementException();
            }
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Returns the values of every field.
   *
   * @return five arrays of values in expression order
   */
  public int[][] toArray() {
    return fields.toArray();
  }

  /**
   * Returns the parsed fields.
   *
   * @return the fields
   */
  public CronFields fields() {
    return fields;
  }

  /**
   * Returns the options of this schedule.
   *
   * @return the options
   */
  public CronOptions options() {
    return options;
  }

  /**
   * Returns the canonical cron expression of this schedule.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(fields, options);
  }

  private static CronOptions orDefaults(CronOptions options) {
    return options == null ? CronOptions.defaults() : options;
  }

  private static ZonedDateTime parseReference(String text, ZoneId zone) throws CronException {
    String trimmed = text.trim();
    try {
      if (trimmed.indexOf('T') < 0) {
        return LocalDate.parse(trimmed).atStartOfDay(zone);
      }
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              trimmed, ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zdt) {
        return zdt;
      }
      return ((LocalDateTime) parsed).atZone(zone);
    } catch (DateTimeParseException e) {
      throw CronException.invalidReferenceDate(text);
    }
  }
}
