package com.trailtag.core.geo;

import com.trailtag.core.error.AlignmentException;
import com.trailtag.core.error.OutsideTrackException;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Track;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrackLocatorTest {

    private static final Instant T0 = Instant.parse("2022-08-01T06:00:00Z");

    private static Track track() {
        return Track.of(List.of(
                new GpsPoint(T0, 47.0, 8.0, 400.0, 350.0),
                new GpsPoint(T0.plusSeconds(10), 47.001, 8.002, 410.0, 10.0),
                new GpsPoint(T0.plusSeconds(20), 47.002, 8.004, null, null)));
    }

    @Test
    void locateAtSampleIsIdentity() throws Exception {
        Track t = track();
        TrackLocator locator = new TrackLocator();
        for (GpsPoint p : t.points()) {
            assertEquals(p, locator.locate(t, p.time()));
        }
    }

    @Test
    void interpolatesLinearlyAndHeadingByShortestArc() throws Exception {
        GpsPoint p = new TrackLocator().locate(track(), T0.plusSeconds(5));
        assertEquals(47.0005, p.lat(), 1e-9);
        assertEquals(8.001, p.lon(), 1e-9);
        assertEquals(405.0, p.alt(), 1e-9);
        assertEquals(0.0, p.heading(), 1e-9);
    }

    @Test
    void headingMidpointBetween350And10IsZero() {
        assertEquals(0.0, TrackLocator.interpolateHeading(350, 10, 0.5), 1e-9);
        assertEquals(0.0, TrackLocator.interpolateHeading(10, 350, 0.5), 1e-9);
        assertEquals(355.0, TrackLocator.interpolateHeading(350, 10, 0.25), 1e-9);
    }

    @Test
    void missingAltitudeFallsBackToKnownOne() throws Exception {
        GpsPoint p = new TrackLocator().locate(track(), T0.plusSeconds(15));
        assertEquals(410.0, p.alt());
        assertEquals(10.0, p.heading());
    }

    @Test
    void beforeTrackOutsideToleranceIsRejected() {
        OutsideTrackException e = assertThrows(OutsideTrackException.class,
                () -> new TrackLocator().locate(track(), T0.minusSeconds(3)));
        assertEquals("OutsideTrackError", e.errorType());
        assertTrue(e.getMessage().contains("3.000 seconds behind"), e.getMessage());
    }

    @Test
    void afterTrackOutsideToleranceIsRejected() {
        OutsideTrackException e = assertThrows(OutsideTrackException.class,
                () -> new TrackLocator().locate(track(), T0.plusSeconds(25)));
        assertTrue(e.getMessage().contains("beyond the track end point"));
    }

    @Test
    void captureCenturiesBeforeTrackIsOutsideTrack() {
        // 1700 год в EXIF против трека 2022 года: больше 292 лет в наносекундах не помещается
        Instant bogus = Instant.parse("1700-01-01T00:00:00Z");
        OutsideTrackException e = assertThrows(OutsideTrackException.class,
                () -> new TrackLocator().locate(track(), bogus));
        assertTrue(e.getMessage().contains("seconds behind"), e.getMessage());
    }

    @Test
    void secondsSurviveLongIntervals() {
        Instant a = Instant.parse("1700-01-01T00:00:00Z");
        Instant b = Instant.parse("2022-01-01T00:00:00.5Z");
        double s = Geo.seconds(a, b);
        assertEquals(b.getEpochSecond() - a.getEpochSecond() + 0.5, s, 1e-3);
        assertEquals(-s, Geo.seconds(b, a), 1e-3);
    }

    @Test
    void withinToleranceClampsToEndpoint() throws Exception {
        TrackLocator locator = new TrackLocator(2.0);
        GpsPoint p = locator.locate(track(), T0.minusSeconds(1));
        assertEquals(47.0, p.lat());
        assertEquals(T0.minusSeconds(1), p.time());
    }

    @Test
    void emptyTrackIsAlignmentError() {
        AlignmentException e = assertThrows(AlignmentException.class,
                () -> new TrackLocator().locate(Track.empty(), T0));
        assertEquals("AlignmentError", e.errorType());
    }

    @Test
    void negativeToleranceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TrackLocator(-1));
    }
}
