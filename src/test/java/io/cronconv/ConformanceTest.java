package io.cronconv;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronconv.display.Display;
import io.cronconv.field.FieldValueSet;
import io.cronconv.field.Unit;
import io.cronconv.parser.Parser;
import java.io.IOException;
import java.io.InputStream;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance/cron.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode CASES;

  @BeforeAll
  static void loadCases() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance/cron.json")) {
      assertNotNull(in, "conformance/cron.json not on the test classpath");
      CASES = MAPPER.readTree(in);
    }
  }

  // Parse tests

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("parse").get("tests")) {
      String input = tc.get("input").asText();
      String canonical = tc.get("canonical").asText();

      tests.add(
          DynamicTest.dynamicTest(
              "parse/" + tc.get("name").asText(),
              () -> {
                Cron cron = Cron.parse(input);
                assertEquals(canonical, cron.toString(), "parse(" + input + ").toString()");

                // Roundtrip test
                Cron again = Cron.parse(canonical);
                assertEquals(
                    canonical, again.toString(), "roundtrip: parse(" + canonical + ").toString()");
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> optionTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("options").get("tests")) {
      String input = tc.get("input").asText();
      CronOptions options =
          CronOptions.defaults()
              .withOutputHashes(tc.get("hashes").asBoolean())
              .withOutputWeekdayNames(tc.get("weekday_names").asBoolean())
              .withOutputMonthNames(tc.get("month_names").asBoolean());

      tests.add(
          DynamicTest.dynamicTest(
              "options/" + tc.get("name").asText(),
              () -> {
                Cron cron = Cron.parse(input, options);
                assertEquals(tc.get("canonical").asText(), cron.toString());
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> fieldTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("fields").get("tests")) {
      Unit unit = Unit.valueOf(tc.get("unit").asText().toUpperCase(Locale.ROOT));
      String input = tc.get("input").asText();
      List<Integer> values =
          MAPPER.convertValue(tc.get("values"), new TypeReference<List<Integer>>() {});
      String output = tc.get("output").asText();

      tests.add(
          DynamicTest.dynamicTest(
              "fields/" + unit + "/" + input,
              () -> {
                FieldValueSet field = Parser.parseField(unit, input);
                assertEquals(values, field.values(), "values of " + input);
                assertEquals(
                    output, Display.renderField(field, CronOptions.defaults()), "text of " + input);

                // The same values given as an array render identically
                FieldValueSet fromValues = Parser.fromValues(unit, values);
                assertEquals(field, fromValues);
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> errorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("errors").get("tests")) {
      String input = tc.get("input").asText();
      String kind = tc.get("kind").asText();

      tests.add(
          DynamicTest.dynamicTest(
              "errors/" + tc.get("name").asText(),
              () -> {
                CronException e =
                    assertThrows(
                        CronException.class,
                        () -> Cron.parse(input),
                        "expected parse error for: " + input);
                assertEquals(kind, e.kind().value(), "error kind for: " + input);
                if (tc.has("unit")) {
                  assertEquals(tc.get("unit").asText(), e.unit().map(Unit::displayName).orElse(null));
                  assertTrue(e.getMessage().endsWith(" for " + tc.get("unit").asText()));
                }
                if (tc.has("value")) {
                  assertEquals(tc.get("value").asText(), e.value().orElse(null));
                }
                assertFalse(Cron.validate(input));
              }));
    }
    return tests.stream();
  }

  // Eval tests

  @TestFactory
  Stream<DynamicTest> evalTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("eval").get("tests")) {
      String name = "eval/" + tc.get("name").asText();
      String expression = tc.get("expression").asText();
      ZonedDateTime now = ZonedDateTime.parse(tc.get("now").asText());

      tests.add(
          DynamicTest.dynamicTest(
              name + "/next",
              () -> {
                Seeker seeker = Cron.parse(expression).schedule(now);
                for (String expected : asStrings(tc.get("next"))) {
                  assertEquals(
                      ZonedDateTime.parse(expected).toInstant(),
                      seeker.next().toInstant(),
                      "next() of " + expression);
                }
              }));

      tests.add(
          DynamicTest.dynamicTest(
              name + "/prev",
              () -> {
                Seeker seeker = Cron.parse(expression).schedule(now);
                for (String expected : asStrings(tc.get("prev"))) {
                  assertEquals(
                      ZonedDateTime.parse(expected).toInstant(),
                      seeker.prev().toInstant(),
                      "prev() of " + expression);
                }
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> unschedulableTests() {
    ZonedDateTime now = ZonedDateTime.parse("2026-10-18T10:15:30Z");
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("unschedulable").get("tests")) {
      String expression = tc.get("expression").asText();

      tests.add(
          DynamicTest.dynamicTest(
              "unschedulable/" + tc.get("name").asText(),
              () -> {
                Cron cron = Cron.parse(expression);
                CronException next = assertThrows(CronException.class, () -> cron.nextFrom(now));
                assertEquals(ErrorKind.UNSCHEDULABLE, next.kind());
                CronException prev =
                    assertThrows(CronException.class, () -> cron.previousFrom(now));
                assertEquals(ErrorKind.UNSCHEDULABLE, prev.kind());
              }));
    }
    return tests.stream();
  }

  private static List<String> asStrings(JsonNode node) {
    return MAPPER.convertValue(node, new TypeReference<List<String>>() {});
  }
}
