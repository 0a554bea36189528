package com.trailtag.core.geo;

import com.trailtag.core.model.GpsPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Геодезические функции на сфере: расстояние (haversine), начальный курс,
 * разность и сдвиг курсов.
 */
public final class Geo {

    // средний радиус Земли, м
    public static final double EARTH_RADIUS_M = 6_371_008.8;

    private Geo() {
        // no-op
    }

    /** Расстояние по большому кругу в метрах. */
    public static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(Math.max(0.0, 1 - a)));
        return EARTH_RADIUS_M * c;
    }

    public static double distance(GpsPoint a, GpsPoint b) {
        return haversine(a.lat(), a.lon(), b.lat(), b.lon());
    }

    /** Начальный курс от (lat1,lon1) на (lat2,lon2), градусы [0,360). */
    public static double bearing(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dLambda = Math.toRadians(lon2 - lon1);

        double y = Math.sin(dLambda) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLambda);
        return normalize360(Math.toDegrees(Math.atan2(y, x)));
    }

    public static double normalize360(double deg) {
        double r = deg % 360.0;
        if (r < 0) {
            r += 360.0;
        }
        // -1e-15 % 360 + 360 даёт ровно 360.0
        return r >= 360.0 ? 0.0 : r;
    }

    /** Знаковая кратчайшая разность from → to в (-180, 180]. */
    public static double signedDelta(double from, double to) {
        double d = normalize360(to - from);
        return d > 180.0 ? d - 360.0 : d;
    }

    /** Абсолютная разность курсов, [0, 180]. */
    public static double diffBearing(double b1, double b2) {
        double d = Math.abs(normalize360(b2) - normalize360(b1));
        return d > 180.0 ? 360.0 - d : d;
    }

    public static double offsetBearing(double bearing, double offset) {
        return normalize360(bearing + offset);
    }

    /** Средняя скорость по треку, м/с. 0 если точек меньше двух или время не идёт. */
    public static double avgSpeed(List<GpsPoint> points) {
        if (points == null || points.size() < 2) {
            return 0.0;
        }
        double total = 0.0;
        for (int i = 1; i < points.size(); i++) {
            total += distance(points.get(i - 1), points.get(i));
        }
        Duration span = Duration.between(points.get(0).time(), points.get(points.size() - 1).time());
        double seconds = seconds(span);
        if (seconds <= 0) {
            return total > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return total / seconds;
    }

    /** Интервал между моментами в секундах (b - a). */
    public static double seconds(Instant a, Instant b) {
        return seconds(Duration.between(a, b));
    }

    /** Точно и для интервалов длиннее ~292 лет, где toNanos переполняется. */
    public static double seconds(Duration d) {
        return d.getSeconds() + d.getNano() / 1e9;
    }
}
