package com.trailtag.core.model;

import com.trailtag.core.geo.Geo;

import java.time.Instant;
import java.util.Objects;

/**
 * Одна точка трека: время (UTC), координаты, опционально высота и курс.
 * Курс всегда нормализован в [0, 360).
 */
public record GpsPoint(
        Instant time,
        double lat,
        double lon,
        Double alt,        // метры, null если неизвестна
        Double heading     // градусы [0,360), null если неизвестен
) {

    public GpsPoint {
        Objects.requireNonNull(time, "time");
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            throw new IllegalArgumentException("Invalid coordinates: " + lat + "," + lon);
        }
        if (alt != null && !Double.isFinite(alt)) {
            alt = null;
        }
        if (heading != null) {
            heading = Double.isFinite(heading) ? Geo.normalize360(heading) : null;
        }
    }

    public GpsPoint(Instant time, double lat, double lon) {
        this(time, lat, lon, null, null);
    }

    public GpsPoint withTime(Instant t) {
        return new GpsPoint(t, lat, lon, alt, heading);
    }

    public GpsPoint withHeading(Double h) {
        return new GpsPoint(time, lat, lon, alt, h);
    }
}
