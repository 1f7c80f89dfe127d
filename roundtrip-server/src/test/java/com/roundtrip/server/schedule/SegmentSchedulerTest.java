package com.roundtrip.server.schedule;

import com.roundtrip.common.constant.ItineraryConstants;
import com.roundtrip.pojo.entity.Stop;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.roundtrip.server.testutil.ItineraryFixtures.d;
import static com.roundtrip.server.testutil.ItineraryFixtures.lockedStop;
import static com.roundtrip.server.testutil.ItineraryFixtures.stop;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SegmentSchedulerTest {

    private final AnchorResolver resolver = new AnchorResolver();
    private final SegmentScheduler scheduler = new SegmentScheduler();

    private String schedule(List<Stop> stops, LocalDate start, boolean startLocked) {
        return scheduler.schedule(stops, resolver.resolve(stops, start, startLocked).getAnchors(), start);
    }

    @Test
    void shouldForwardFillInSinglePassWhenNothingLocked() {
        List<Stop> stops = List.of(stop("a", 3), stop("b", 4), stop("c", 2));

        String mode = schedule(stops, d("2026-01-01"), false);

        assertEquals(ItineraryConstants.MODE_SIMPLE, mode);
        assertDates(stops.get(0), "2026-01-01", "2026-01-03");
        assertDates(stops.get(1), "2026-01-04", "2026-01-07");
        assertDates(stops.get(2), "2026-01-08", "2026-01-09");
    }

    @Test
    void shouldTreatMissingOrNonPositiveDurationAsOneDay() {
        List<Stop> stops = List.of(stop("a", null), stop("b", 0), stop("c", -3), stop("d", 2));

        schedule(stops, d("2026-01-30"), false);

        assertDates(stops.get(0), "2026-01-30", "2026-01-30");
        assertDates(stops.get(1), "2026-01-31", "2026-01-31");
        assertDates(stops.get(2), "2026-02-01", "2026-02-01");
        assertDates(stops.get(3), "2026-02-02", "2026-02-03");
    }

    @Test
    void shouldRestartCursorAfterEachLockedStop() {
        List<Stop> stops = List.of(
                stop("a", 3),
                lockedStop("b", 4, "2026-01-10", "2026-01-13"),
                stop("c", 2),
                stop("d", 1));

        String mode = schedule(stops, d("2026-01-01"), false);

        assertEquals(ItineraryConstants.MODE_SEGMENTED, mode);
        assertDates(stops.get(0), "2026-01-01", "2026-01-03");
        assertDates(stops.get(1), "2026-01-10", "2026-01-13");
        assertDates(stops.get(2), "2026-01-14", "2026-01-15");
        assertDates(stops.get(3), "2026-01-16", "2026-01-16");
    }

    @Test
    void shouldMirrorLockedDatesOntoAnchorStop() {
        Stop b = lockedStop("b", 2, "2026-03-01", "2026-03-05");
        b.setArrivalDate(d("2025-12-01"));
        b.setDepartureDate(d("2025-12-02"));
        List<Stop> stops = List.of(stop("a", 1), b);

        schedule(stops, d("2026-01-01"), false);

        // 锁定日期原样镜像，不按停留天数重算
        assertDates(b, "2026-03-01", "2026-03-05");
    }

    @Test
    void shouldSkipEmptySegmentsBetweenAdjacentLocks() {
        List<Stop> stops = List.of(
                lockedStop("a", 2, "2026-05-01", "2026-05-02"),
                lockedStop("b", 2, "2026-05-10", "2026-05-11"),
                stop("c", 3));

        schedule(stops, d("2026-01-01"), false);

        assertDates(stops.get(0), "2026-05-01", "2026-05-02");
        assertDates(stops.get(1), "2026-05-10", "2026-05-11");
        assertDates(stops.get(2), "2026-05-12", "2026-05-14");
    }

    @Test
    void lockedTripStartShouldUseSegmentedPathWithSameResult() {
        List<Stop> stops = List.of(stop("a", 3), stop("b", 4));

        String mode = schedule(stops, d("2026-01-01"), true);

        assertEquals(ItineraryConstants.MODE_SEGMENTED, mode);
        assertDates(stops.get(0), "2026-01-01", "2026-01-03");
        assertDates(stops.get(1), "2026-01-04", "2026-01-07");
    }

    @Test
    void degradedLockShouldBeForwardFilledLikeUnlockedStop() {
        List<Stop> stops = List.of(stop("a", 2), lockedStop("b", 3, "2026-04-01", null), stop("c", 1));

        String mode = schedule(stops, d("2026-01-01"), false);

        assertEquals(ItineraryConstants.MODE_SIMPLE, mode);
        assertDates(stops.get(1), "2026-01-03", "2026-01-05");
        assertDates(stops.get(2), "2026-01-06", "2026-01-06");
    }

    private static void assertDates(Stop stop, String arrival, String departure) {
        assertEquals(d(arrival), stop.getArrivalDate(), "arrival of " + stop.getId());
        assertEquals(d(departure), stop.getDepartureDate(), "departure of " + stop.getId());
    }
}
