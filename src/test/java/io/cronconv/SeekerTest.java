package io.cronconv;

import static org.junit.jupiter.api.Assertions.*;

import io.cronconv.eval.Evaluator;
import io.cronconv.field.CronFields;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

/**
 * Seeker-specific tests for {@code next()}, {@code prev()} and {@code reset()}.
 *
 * These tests verify the iteration protocol beyond the conformance cases:
 * - Monotonic sequences in both directions
 * - Lazy first step after construction and reset
 * - Handling of references that are not minute aligned
 */
class SeekerTest {

    private static final ZonedDateTime ALIGNED =
            ZonedDateTime.of(2026, 10, 18, 10, 15, 0, 0, ZoneOffset.UTC);
    private static final ZonedDateTime UNALIGNED =
            ZonedDateTime.of(2026, 10, 18, 10, 15, 30, 0, ZoneOffset.UTC);

    private static final String[] EXPRESSIONS = {
        "* * * * *",
        "*/7 */5 * * *",
        "0 9 * * 1-5",
        "15,45 8-18 1-7 * MON",
        "0 0 29 2 *",
        "5-30/5 22-23 * JAN,JUL SUN",
        "0 12 13 * FRI",
    };

    // =========================================================================
    // Sequence Tests
    // =========================================================================

    @Test
    void nextIsStrictlyIncreasing() throws CronException {
        for (String expression : EXPRESSIONS) {
            Cron cron = Cron.parse(expression);
            Seeker seeker = cron.schedule(UNALIGNED);
            ZonedDateTime last = UNALIGNED;
            for (int i = 0; i < 40; i++) {
                ZonedDateTime next = seeker.next();
                assertTrue(next.isAfter(last), expression + ": " + next + " after " + last);
                assertEquals(0, next.getSecond());
                assertEquals(0, next.getNano());
                assertTrue(Evaluator.matches(cron.fields(), next), expression + " matches " + next);
                last = next;
            }
        }
    }

    @Test
    void prevIsStrictlyDecreasing() throws CronException {
        for (String expression : EXPRESSIONS) {
            Cron cron = Cron.parse(expression);
            Seeker seeker = cron.schedule(UNALIGNED);
            ZonedDateTime last = seeker.anchor();
            for (int i = 0; i < 40; i++) {
                ZonedDateTime prev = seeker.prev();
                assertTrue(prev.isBefore(last), expression + ": " + prev + " before " + last);
                assertEquals(0, prev.getSecond());
                assertTrue(Evaluator.matches(cron.fields(), prev), expression + " matches " + prev);
                last = prev;
            }
        }
    }

    // =========================================================================
    // Reset Tests
    // =========================================================================

    @Test
    void resetRestartsFromAnchor() throws CronException {
        Seeker seeker = Cron.parse("*/15 * * * *").schedule(UNALIGNED);
        ZonedDateTime first = seeker.next();
        seeker.next();
        seeker.next();

        seeker.reset();
        assertEquals(seeker.anchor(), seeker.cursor());
        assertEquals(first, seeker.next());
    }

    @Test
    void resetAfterPrev() throws CronException {
        Seeker seeker = Cron.parse("0 * * * *").schedule(UNALIGNED);
        seeker.prev();
        seeker.prev();

        seeker.reset();
        ZonedDateTime prev = seeker.prev();
        assertFalse(prev.isAfter(seeker.anchor()));
        assertEquals(ZonedDateTime.of(2026, 10, 18, 10, 0, 0, 0, ZoneOffset.UTC), prev);

        seeker.reset();
        ZonedDateTime next = seeker.next();
        assertTrue(next.isAfter(UNALIGNED));
        assertEquals(ZonedDateTime.of(2026, 10, 18, 11, 0, 0, 0, ZoneOffset.UTC), next);
    }

    // =========================================================================
    // Pristine Tests
    // =========================================================================

    @Test
    void firstNextMayReturnAlignedReference() throws CronException {
        Seeker seeker = Cron.parse("15 10 * * *").schedule(ALIGNED);
        assertEquals(ALIGNED, seeker.next());
        assertEquals(ALIGNED.plusDays(1), seeker.next());
    }

    @Test
    void prevNeverEqualsNextFromSamePoint() throws CronException {
        Cron cron = Cron.parse("* * * * *");
        ZonedDateTime prev = cron.schedule(ALIGNED).prev();
        ZonedDateTime next = cron.schedule(ALIGNED).next();
        assertEquals(ALIGNED.minusMinutes(1), prev);
        assertEquals(ALIGNED, next);
        assertNotEquals(prev, next);
    }

    @Test
    void nextAfterPrevSteps() throws CronException {
        Seeker seeker = Cron.parse("* * * * *").schedule(ALIGNED);
        assertEquals(ALIGNED.minusMinutes(1), seeker.prev());
        assertEquals(ALIGNED, seeker.next());
        assertEquals(ALIGNED.plusMinutes(1), seeker.next());
    }

    // =========================================================================
    // Reference Tests
    // =========================================================================

    @Test
    void unalignedReferenceAdvancesOneMinute() throws CronException {
        Seeker seeker = Cron.parse("* * * * *").schedule(UNALIGNED);
        assertEquals(UNALIGNED.plusMinutes(1), seeker.anchor());
        assertEquals(ALIGNED.plusMinutes(1), seeker.next());

        seeker.reset();
        assertEquals(ALIGNED, seeker.prev());
    }

    @Test
    void subSecondReferenceAdvances() throws CronException {
        ZonedDateTime reference = ALIGNED.plusNanos(500_000_000);
        Seeker seeker = Cron.parse("15 10 * * *").schedule(reference);
        assertTrue(seeker.next().isAfter(reference));
    }

    @Test
    void referenceConvertedToZone() throws CronException {
        CronFields fields = Cron.parse("0 9 * * *").fields();
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        Seeker seeker = new Seeker(fields, UNALIGNED, berlin);
        assertEquals(berlin, seeker.anchor().getZone());
        assertEquals(ZonedDateTime.of(2026, 10, 19, 9, 0, 0, 0, berlin), seeker.next());
    }

    @Test
    void missingScheduleRejected() {
        CronException e =
                assertThrows(CronException.class, () -> new Seeker(null, ALIGNED, null));
        assertEquals(ErrorKind.NO_SCHEDULE, e.kind());
        assertEquals("No schedule found", e.getMessage());
    }

    @Test
    void missingReferenceRejected() {
        CronException e =
                assertThrows(
                        CronException.class,
                        () -> new Seeker(CronFields.everyMinute(), null, ZoneOffset.UTC));
        assertEquals(ErrorKind.INVALID_REFERENCE_DATE, e.kind());
    }

    @Test
    void independentSeekersDoNotShareCursor() throws CronException {
        Cron cron = Cron.parse("0 * * * *");
        Seeker a = cron.schedule(ALIGNED);
        Seeker b = cron.schedule(ALIGNED);
        a.next();
        a.next();
        a.next();
        assertEquals(ZonedDateTime.of(2026, 10, 18, 11, 0, 0, 0, ZoneOffset.UTC), b.next());
    }
}
