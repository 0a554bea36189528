package com.trailtag.core.pipeline;

import java.util.Locale;

/** Источник координат для изображений. */
public enum GeotagSource {
    EXIF,
    GPX,
    NMEA;

    public static GeotagSource fromName(String name) {
        if (name == null || name.isBlank()) {
            return EXIF;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown geotag source: " + name, e);
        }
    }
}
