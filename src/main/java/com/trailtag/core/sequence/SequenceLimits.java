package com.trailtag.core.sequence;

import com.trailtag.core.error.SequenceLimitException;
import com.trailtag.core.geo.Geo;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Sequence;
import com.trailtag.core.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ограничения на последовательности и видео: точка (0, 0), средняя скорость выше предела,
 * для видео ещё и "стоячий" трек (все точки в радиусе от первой).
 */
public final class SequenceLimits {
    private static final Logger log = LoggerFactory.getLogger(SequenceLimits.class);

    public static final double DEFAULT_MAX_SPEED_KMH = 400;
    public static final double DEFAULT_STATIONARY_RADIUS_M = 10;

    private final double maxSpeedKmh;
    private final double stationaryRadius;

    public SequenceLimits() {
        this(DEFAULT_MAX_SPEED_KMH, DEFAULT_STATIONARY_RADIUS_M);
    }

    public SequenceLimits(double maxSpeedKmh, double stationaryRadius) {
        this.maxSpeedKmh = maxSpeedKmh;
        this.stationaryRadius = stationaryRadius;
    }

    /** Проверить последовательность; при нарушении все её записи получают ошибку. */
    public boolean check(Sequence sequence) {
        List<GpsPoint> points = new ArrayList<>(sequence.size());
        for (CaptureRecord r : sequence.members()) {
            points.add(new GpsPoint(r.time(), r.lat(), r.lon()));
        }
        try {
            checkNullIsland(points);
            checkSpeed(points);
            return true;
        } catch (SequenceLimitException e) {
            CaptureRecord first = sequence.members().get(0);
            log.error("{}/{}: {}", first.file().toAbsolutePath().getParent().getFileName(),
                    first.file().getFileName(), e.getMessage());
            for (CaptureRecord r : sequence.members()) {
                r.fail(e.toCaptureError());
            }
            return false;
        }
    }

    /** Проверка трека видео. */
    public void checkVideo(Track track) throws SequenceLimitException {
        if (isStationary(track.points())) {
            throw new SequenceLimitException(SequenceLimitException.Kind.STATIONARY_VIDEO, "Stationary video");
        }
        checkNullIsland(track.points());
        checkSpeed(track.points());
    }

    boolean isStationary(List<GpsPoint> points) {
        if (points.isEmpty()) {
            return true;
        }
        GpsPoint start = points.get(0);
        for (GpsPoint p : points) {
            if (Geo.distance(start, p) > stationaryRadius) {
                return false;
            }
        }
        return true;
    }

    private static void checkNullIsland(List<GpsPoint> points) throws SequenceLimitException {
        for (GpsPoint p : points) {
            if (p.lat() == 0 && p.lon() == 0) {
                throw new SequenceLimitException(SequenceLimitException.Kind.NULL_ISLAND,
                        "GPS coordinates in Null Island (0, 0)");
            }
        }
    }

    private void checkSpeed(List<GpsPoint> points) throws SequenceLimitException {
        if (points.size() < 2) {
            return;
        }
        double kmh = Geo.avgSpeed(points) * 3.6;
        if (kmh > maxSpeedKmh) {
            throw new SequenceLimitException(SequenceLimitException.Kind.CAPTURE_SPEED_TOO_FAST,
                    String.format(Locale.ROOT, "Capture speed %.3f km/h exceeds max allowed %.3f km/h", kmh, maxSpeedKmh));
        }
    }
}
