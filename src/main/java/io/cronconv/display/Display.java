package io.cronconv.display;

import io.cronconv.CronOptions;
import io.cronconv.field.CronFields;
import io.cronconv.field.FieldValueSet;
import io.cronconv.field.Unit;
import io.cronconv.field.ValueRange;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/** Renders cron fields as canonical strings. */
public final class Display {
  private Display() {}

  /**
   * Renders a schedule as a 5-field cron expression.
   *
   * @param fields the schedule fields
   * @param options the output options
   * @return the canonical cron expression
   */
  public static String render(CronFields fields, CronOptions options) {
    return fields.all().stream()
        .map(field -> renderField(field, options))
        .collect(Collectors.joining(" "));
  }

  /**
   * Renders one field in its most compact form.
   *
   * <p>A full field renders as {@code *}, an evenly spaced field as {@code *}/step or {@code
   * a-b/step}, and anything else as a comma separated list of runs.
   *
   * @param field the field to render
   * @param options the output options
   * @return the canonical field text
   */
  public static String renderField(FieldValueSet field, CronOptions options) {
    String wildcard = options.outputHashes() ? "H" : "*";
    if (field.isFull()) {
      return wildcard;
    }

    OptionalInt step = field.step();
    if (step.isPresent() && field.isInterval(step.getAsInt())) {
      int s = step.getAsInt();
      if (field.isFullInterval(s)) {
        return wildcard + "/" + s;
      }
      String min = formatValue(field.unit(), field.min(), options);
      String max = formatValue(field.unit(), field.max(), options);
      if (options.outputHashes()) {
        return String.format("H(%s-%s)/%d", min, max, s);
      }
      return String.format("%s-%s/%d", min, max, s);
    }

    return field.toRanges().stream()
        .map(range -> renderRange(field.unit(), range, options))
        .collect(Collectors.joining(","));
  }

  private static String renderRange(Unit unit, ValueRange range, CronOptions options) {
    if (range.isSingle()) {
      return formatValue(unit, range.from(), options);
    }
    return formatValue(unit, range.from(), options) + "-" + formatValue(unit, range.to(), options);
  }

  /** Substitute the three letter name when names are requested for the unit. */
  private static String formatValue(Unit unit, int value, CronOptions options) {
    boolean useNames =
        (options.outputWeekdayNames() && unit == Unit.WEEKDAY)
            || (options.outputMonthNames() && unit == Unit.MONTH);
    if (useNames) {
      return unit.nameOf(value).orElse(String.valueOf(value));
    }
    return String.valueOf(value);
  }
}
