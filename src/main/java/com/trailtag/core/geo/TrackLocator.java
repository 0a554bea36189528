package com.trailtag.core.geo;

import com.trailtag.core.error.AlignmentException;
import com.trailtag.core.error.OutsideTrackException;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Track;

import java.time.Instant;
import java.util.List;

/**
 * Привязка момента времени к треку.
 *
 * Бинарный поиск пары (p0, p1) вокруг t, линейная интерполяция широты, долготы и высоты,
 * круговая интерполяция курса по кратчайшей дуге.
 * Время вне трека допускается только в пределах toleranceSeconds, тогда берётся крайняя точка.
 */
public final class TrackLocator {

    public static final double DEFAULT_TOLERANCE_SECONDS = 0.001;

    private final double toleranceSeconds;

    public TrackLocator() {
        this(DEFAULT_TOLERANCE_SECONDS);
    }

    public TrackLocator(double toleranceSeconds) {
        if (!(toleranceSeconds >= 0) || Double.isInfinite(toleranceSeconds)) {
            throw new IllegalArgumentException("toleranceSeconds must be finite and >= 0: " + toleranceSeconds);
        }
        this.toleranceSeconds = toleranceSeconds;
    }

    public double toleranceSeconds() {
        return toleranceSeconds;
    }

    public GpsPoint locate(Track track, Instant t) throws OutsideTrackException, AlignmentException {
        if (track == null || track.isEmpty()) {
            throw new AlignmentException("Cannot interpolate on an empty track");
        }
        if (t == null) {
            throw new AlignmentException("Capture time is unknown");
        }
        GpsPoint first = track.first();
        GpsPoint last = track.last();

        if (t.isBefore(first.time())) {
            double behind = Geo.seconds(t, first.time());
            if (behind > toleranceSeconds) {
                throw OutsideTrackException.before(t, first.time(), last.time(), behind);
            }
            return first.withTime(t);
        }
        if (t.isAfter(last.time())) {
            double beyond = Geo.seconds(last.time(), t);
            if (beyond > toleranceSeconds) {
                throw OutsideTrackException.beyond(t, first.time(), last.time(), beyond);
            }
            return last.withTime(t);
        }

        List<GpsPoint> points = track.points();
        int idx = search(points, t);
        if (idx >= 0) {
            // точное попадание в отсчёт
            return points.get(idx);
        }
        int hi = -idx - 1;
        int lo = hi - 1;
        if (lo < 0 || hi >= points.size()) {
            throw new AlignmentException("No bracketing points for " + t + " in " + track);
        }
        return interpolate(points.get(lo), points.get(hi), t);
    }

    static GpsPoint interpolate(GpsPoint p0, GpsPoint p1, Instant t) {
        double span = Geo.seconds(p0.time(), p1.time());
        double f = span == 0 ? 0.0 : Geo.seconds(p0.time(), t) / span;

        double lat = p0.lat() + f * (p1.lat() - p0.lat());
        double lon = p0.lon() + f * (p1.lon() - p0.lon());

        Double alt;
        if (p0.alt() != null && p1.alt() != null) {
            alt = p0.alt() + f * (p1.alt() - p0.alt());
        } else {
            alt = p0.alt() != null ? p0.alt() : p1.alt();
        }

        Double heading;
        if (p0.heading() != null && p1.heading() != null) {
            heading = interpolateHeading(p0.heading(), p1.heading(), f);
        } else {
            heading = p0.heading() != null ? p0.heading() : p1.heading();
        }
        return new GpsPoint(t, lat, lon, alt, heading);
    }

    /** Курс по кратчайшей дуге: 350° → 10° при f=0.5 даёт 0°, а не 180°. */
    public static double interpolateHeading(double h0, double h1, double f) {
        return Geo.normalize360(h0 + f * Geo.signedDelta(h0, h1));
    }

    private static int search(List<GpsPoint> points, Instant t) {
        int lo = 0;
        int hi = points.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int cmp = points.get(mid).time().compareTo(t);
            if (cmp < 0) {
                lo = mid + 1;
            } else if (cmp > 0) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -(lo + 1);
    }
}
