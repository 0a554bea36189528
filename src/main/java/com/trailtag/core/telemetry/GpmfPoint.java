package com.trailtag.core.telemetry;

/**
 * Точка GPS из потока GoPro до привязки к абсолютному времени.
 * time: секунды от начала трека; epochTime: секунды UTC из GPSU/GPS9, если есть.
 */
public record GpmfPoint(
        double time,
        Double epochTime,
        double lat,
        double lon,
        Double alt,
        Integer fix,          // 0 нет фиксации, 2 - 2D, 3 - 3D
        Double precision,     // DOP * 100
        Double groundSpeed    // м/с
) {

    public GpmfPoint withTime(double t) {
        return new GpmfPoint(t, epochTime, lat, lon, alt, fix, precision, groundSpeed);
    }

    public GpmfPoint withEpochTime(Double e) {
        return new GpmfPoint(time, e, lat, lon, alt, fix, precision, groundSpeed);
    }
}
