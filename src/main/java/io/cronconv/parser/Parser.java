package io.cronconv.parser;

import io.cronconv.CronException;
import io.cronconv.field.CronFields;
import io.cronconv.field.FieldValueSet;
import io.cronconv.field.Unit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses cron expressions and single cron fields into value sets. */
public final class Parser {
  private static final Pattern WORD = Pattern.compile("[A-Za-z]+");
  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Unit[] UNITS = Unit.values();

  private Parser() {}

  /**
   * Parses a 5-field cron expression.
   *
   * @param input the cron expression
   * @return the parsed fields
   * @throws CronException if the expression is invalid
   */
  public static CronFields parse(String input) throws CronException {
    if (input == null) {
      throw CronException.invalidCron("Invalid cron string");
    }
    String trimmed = input.trim();
    String[] parts = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    if (parts.length != UNITS.length) {
      throw CronException.invalidCron("Invalid cron string format");
    }

    FieldValueSet[] fields = new FieldValueSet[UNITS.length];
    for (int i = 0; i < UNITS.length; i++) {
      fields[i] = parseField(UNITS[i], parts[i]);
    }
    return new CronFields(fields[0], fields[1], fields[2], fields[3], fields[4]);
  }

  /**
   * Builds a cron schedule from five arrays of values.
   *
   * @param rows the values of minute, hour, day, month and weekday
   * @return the parsed fields
   * @throws CronException if the array does not have five rows or any row is invalid
   */
  public static CronFields fromArray(int[][] rows) throws CronException {
    if (rows == null || rows.length != UNITS.length) {
      throw CronException.invalidCron("Invalid cron array");
    }

    FieldValueSet[] fields = new FieldValueSet[UNITS.length];
    for (int i = 0; i < UNITS.length; i++) {
      if (rows[i] == null) {
        throw CronException.emptyInterval(UNITS[i], null);
      }
      List<Integer> values = new ArrayList<>(rows[i].length);
      for (int v : rows[i]) {
        values.add(v);
      }
      fields[i] = fromValues(UNITS[i], values);
    }
    return new CronFields(fields[0], fields[1], fields[2], fields[3], fields[4]);
  }

  /**
   * Validates a collection of integers as the values of one field.
   *
   * @param unit the unit of the field
   * @param values the values, in any order and possibly repeated
   * @return the value set
   * @throws CronException if a value is missing or out of range, or no values are given
   */
  public static FieldValueSet fromValues(Unit unit, Collection<Integer> values)
      throws CronException {
    if (values == null) {
      throw CronException.emptyInterval(unit, null);
    }
    List<Integer> checked = new ArrayList<>(values.size());
    for (Integer value : values) {
      if (value == null) {
        throw CronException.invalidField(unit, "null");
      }
      checked.add(value);
    }
    List<Integer> sorted = sortUnique(unit, checked);
    if (sorted.isEmpty()) {
      throw CronException.emptyInterval(unit, null);
    }
    checkBounds(unit, sorted);
    return new FieldValueSet(unit, sorted);
  }

  /**
   * Parses the text of one field.
   *
   * <p>Accepted forms are {@code *}, {@code N}, {@code N-M} and comma separated lists of those,
   * optionally followed by {@code /S}. Month and weekday fields also accept three letter names.
   *
   * @param unit the unit of the field
   * @param text the field text
   * @return the value set
   * @throws CronException if the field is invalid
   */
  public static FieldValueSet parseField(Unit unit, String text) throws CronException {
    if (text == null) {
      throw CronException.invalidField(unit, "null");
    }
    String[] stepParts = text.split("/", -1);
    if (stepParts.length > 2) {
      throw CronException.invalidField(unit, text);
    }

    String rangeSpec = replaceAlternatives(unit, stepParts[0]);
    List<Integer> parsed;
    if (rangeSpec.equals("*")) {
      parsed = FieldValueSet.full(unit).values();
    } else {
      List<Integer> flat = new ArrayList<>();
      for (String segment : rangeSpec.split(",", -1)) {
        flat.addAll(parseRange(unit, segment, text));
      }
      parsed = sortUnique(unit, flat);
      checkBounds(unit, parsed);
    }

    List<Integer> values = parsed;
    if (stepParts.length == 2) {
      values = applyStep(parsed, parseStep(unit, stepParts[1]));
    }
    if (values.isEmpty()) {
      throw CronException.emptyInterval(unit, text);
    }
    return new FieldValueSet(unit, values);
  }

  /** Replace month and weekday names with their numbers. */
  private static String replaceAlternatives(Unit unit, String spec) {
    if (!unit.hasAlternatives()) {
      return spec;
    }
    Matcher m = WORD.matcher(spec);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String replacement = unit.parseName(m.group()).map(String::valueOf).orElse(m.group());
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /** Parse a single value {@code N} or an inclusive range {@code A-B}. */
  private static List<Integer> parseRange(Unit unit, String segment, String context)
      throws CronException {
    String[] bounds = segment.split("-", -1);
    if (bounds.length == 1) {
      return List.of(parseNumber(unit, bounds[0], context));
    }
    if (bounds.length != 2) {
      throw CronException.invalidField(unit, segment);
    }

    int from = parseNumber(unit, bounds[0], context);
    int to = parseNumber(unit, bounds[1], context);
    if (to < from) {
      throw CronException.invalidRange(unit, segment);
    }
    // Bounds are checked before expansion; weekday 7 is Sunday and folds to 0 later
    int upper = unit == Unit.WEEKDAY ? 7 : unit.max();
    if (from < unit.min()) {
      throw CronException.outOfRange(unit, from);
    }
    if (to > upper) {
      throw CronException.outOfRange(unit, to);
    }
    List<Integer> values = new ArrayList<>(to - from + 1);
    for (int v = from; v <= to; v++) {
      values.add(v);
    }
    return values;
  }

  private static int parseNumber(Unit unit, String token, String context) throws CronException {
    if (!NUMBER.matcher(token).matches()) {
      throw CronException.invalidField(unit, context);
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw CronException.invalidField(unit, context);
    }
  }

  private static int parseStep(Unit unit, String step) throws CronException {
    if (!NUMBER.matcher(step).matches()) {
      throw CronException.invalidStep(unit, step);
    }
    int parsed;
    try {
      parsed = Integer.parseInt(step);
    } catch (NumberFormatException e) {
      throw CronException.invalidStep(unit, step);
    }
    if (parsed < 1) {
      throw CronException.invalidStep(unit, step);
    }
    return parsed;
  }

  /** Keep the values congruent to the first value modulo the step. */
  private static List<Integer> applyStep(List<Integer> values, int step) {
    int first = values.get(0);
    List<Integer> stepped = new ArrayList<>();
    for (int value : values) {
      if (value % step == first % step || value == first) {
        stepped.add(value);
      }
    }
    return stepped;
  }

  /** Sort and deduplicate, folding weekday 7 into Sunday (0). */
  private static List<Integer> sortUnique(Unit unit, List<Integer> values) {
    TreeSet<Integer> set = new TreeSet<>();
    for (int value : values) {
      set.add(unit == Unit.WEEKDAY && value == 7 ? 0 : value);
    }
    return new ArrayList<>(set);
  }

  private static void checkBounds(Unit unit, List<Integer> sorted) throws CronException {
    int first = sorted.get(0);
    int last = sorted.get(sorted.size() - 1);
    if (first < unit.min()) {
      throw CronException.outOfRange(unit, first);
    }
    if (last > unit.max()) {
      throw CronException.outOfRange(unit, last);
    }
  }
}
