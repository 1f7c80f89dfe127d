package com.roundtrip.server.schedule;

import com.roundtrip.pojo.entity.Stop;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.roundtrip.server.testutil.ItineraryFixtures.d;
import static com.roundtrip.server.testutil.ItineraryFixtures.lockedStop;
import static com.roundtrip.server.testutil.ItineraryFixtures.stop;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnchorResolverTest {

    private final AnchorResolver resolver = new AnchorResolver();

    @Test
    void shouldAlwaysEmitTripStartAnchor() {
        AnchorResolver.Resolution resolution = resolver.resolve(List.of(stop("a", 2)), d("2026-01-01"), false);

        assertEquals(1, resolution.getAnchors().size());
        Anchor start = resolution.getAnchors().get(0);
        assertEquals(-1, start.getPosition());
        assertEquals(d("2026-01-01"), start.getArrivalDate());
        assertNull(start.getDepartureDate());
        assertFalse(start.isLocked());
        assertFalse(resolution.hasStopAnchors());
    }

    @Test
    void shouldCarryStartDateLockFlag() {
        AnchorResolver.Resolution resolution = resolver.resolve(List.of(), d("2026-01-01"), true);
        assertTrue(resolution.getAnchors().get(0).isLocked());
    }

    @Test
    void shouldEmitLockedStopsInPositionOrder() {
        List<Stop> stops = List.of(
                stop("a", 2),
                lockedStop("b", 3, "2026-01-10", "2026-01-12"),
                stop("c", 1),
                lockedStop("d", 2, "2026-01-20", "2026-01-21"));

        List<Anchor> anchors = resolver.resolve(stops, d("2026-01-01"), false).getAnchors();

        assertEquals(3, anchors.size());
        assertEquals(-1, anchors.get(0).getPosition());
        assertEquals(1, anchors.get(1).getPosition());
        assertEquals(d("2026-01-10"), anchors.get(1).getArrivalDate());
        assertEquals(d("2026-01-12"), anchors.get(1).getDepartureDate());
        assertTrue(anchors.get(1).isLocked());
        assertEquals(3, anchors.get(2).getPosition());
    }

    @Test
    void shouldFallBackToCurrentDatesWhenLockedFieldsUnset() {
        Stop b = lockedStop("b", 3, null, null);
        b.setArrivalDate(d("2026-02-01"));
        b.setDepartureDate(d("2026-02-03"));

        AnchorResolver.Resolution resolution = resolver.resolve(List.of(stop("a", 1), b), d("2026-01-01"), false);

        Anchor anchor = resolution.getAnchors().get(1);
        assertEquals(d("2026-02-01"), anchor.getArrivalDate());
        assertEquals(d("2026-02-03"), anchor.getDepartureDate());
        assertTrue(resolution.getDegradedStops().isEmpty());
    }

    @Test
    void shouldDegradeLockedStopWithoutCompleteDatePair() {
        Stop onlyArrival = lockedStop("b", 3, "2026-02-01", null);
        Stop nothing = lockedStop("c", 2, null, null);

        AnchorResolver.Resolution resolution = resolver.resolve(
                List.of(stop("a", 1), onlyArrival, nothing), d("2026-01-01"), false);

        assertEquals(1, resolution.getAnchors().size());
        assertEquals(2, resolution.getDegradedStops().size());
        assertSame(onlyArrival, resolution.getDegradedStops().get(0));
        assertSame(nothing, resolution.getDegradedStops().get(1));
    }

    @Test
    void halfLockedPairShouldNotBorrowTheOtherDateFromCurrentDates() {
        Stop onlyArrival = lockedStop("b", 4, "2026-01-10", null);
        onlyArrival.setArrivalDate(d("2026-01-04"));
        onlyArrival.setDepartureDate(d("2026-01-07"));
        Stop onlyDeparture = lockedStop("c", 2, null, "2026-01-20");
        onlyDeparture.setArrivalDate(d("2026-01-08"));
        onlyDeparture.setDepartureDate(d("2026-01-09"));

        AnchorResolver.Resolution resolution = resolver.resolve(
                List.of(stop("a", 3), onlyArrival, onlyDeparture), d("2026-01-01"), false);

        assertFalse(resolution.hasStopAnchors());
        assertEquals(List.of(onlyArrival, onlyDeparture), resolution.getDegradedStops());
    }
}
