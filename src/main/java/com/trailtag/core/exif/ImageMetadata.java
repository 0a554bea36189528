package com.trailtag.core.exif;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;

/**
 * То, что пайплайн берёт из EXIF изображения. Любое поле может быть null.
 *
 * Время: DateTimeOriginal (+SubSecTimeOriginal, OffsetTimeOriginal), затем GPSDateStamp+GPSTimeStamp
 * (кроме 1970-01-01), затем CreateDate. Координаты: Composite (со знаком), затем GPS с Ref.
 */
public record ImageMetadata(
        Instant time,
        Double lat,
        Double lon,
        Double alt,
        Double heading,
        Integer orientation,
        Double accuracyMeters,
        String make,
        String model
) {

    private static final LocalDate UNIX_EPOCH_DAY = LocalDate.of(1970, 1, 1);

    public boolean hasPosition() {
        return lat != null && lon != null;
    }

    public static ImageMetadata from(Map<String, String> tags) {
        Double lat = number(tags, "Composite:GPSLatitude");
        Double lon = number(tags, "Composite:GPSLongitude");
        if (lat == null || lon == null) {
            lat = signed(number(tags, "GPS:GPSLatitude", "XMP-exif:GPSLatitude"),
                    first(tags, "GPS:GPSLatitudeRef"), "S");
            lon = signed(number(tags, "GPS:GPSLongitude", "XMP-exif:GPSLongitude"),
                    first(tags, "GPS:GPSLongitudeRef"), "W");
        }
        if (lat != null && (lat < -90 || lat > 90)) {
            lat = null;
        }
        if (lon != null && (lon < -180 || lon > 180)) {
            lon = null;
        }

        Double alt = number(tags, "Composite:GPSAltitude");
        if (alt == null) {
            alt = number(tags, "GPS:GPSAltitude");
            if (alt != null && "1".equals(first(tags, "GPS:GPSAltitudeRef"))) {
                alt = -alt;
            }
        }

        Integer orientation = null;
        Double o = number(tags, "IFD0:Orientation", "ExifIFD:Orientation", "XMP-tiff:Orientation");
        if (o != null && o >= 1 && o <= 8) {
            orientation = o.intValue();
        }

        return new ImageMetadata(
                captureTime(tags),
                lat,
                lon,
                alt,
                number(tags, "GPS:GPSImgDirection", "GPS:GPSTrack", "XMP-exif:GPSImgDirection"),
                orientation,
                number(tags, "GPS:GPSHPositioningError", "XMP-exif:GPSHPositioningError"),
                trim(first(tags, "IFD0:Make", "ExifIFD:Make", "XMP-tiff:Make")),
                trim(first(tags, "IFD0:Model", "ExifIFD:Model", "XMP-tiff:Model", "GoPro:Model")));
    }

    static Instant captureTime(Map<String, String> tags) {
        Instant t = ExifTime.parse(first(tags, "ExifIFD:DateTimeOriginal", "XMP-exif:DateTimeOriginal"),
                first(tags, "ExifIFD:SubSecTimeOriginal", "XMP-exif:SubsecTimeOriginal"),
                first(tags, "ExifIFD:OffsetTimeOriginal", "XMP-exif:OffsetTimeOriginal"));
        if (t != null) {
            return t;
        }
        t = ExifTime.gps(first(tags, "GPS:GPSDateStamp", "XMP-exif:GPSDateStamp"),
                first(tags, "GPS:GPSTimeStamp", "XMP-exif:GPSTimeStamp"));
        if (t != null && !t.atOffset(ZoneOffset.UTC).toLocalDate().equals(UNIX_EPOCH_DAY)) {
            return t;
        }
        return ExifTime.parse(first(tags, "ExifIFD:CreateDate", "XMP-xmp:CreateDate"),
                first(tags, "ExifIFD:SubSecTimeDigitized"),
                first(tags, "ExifIFD:OffsetTimeDigitized"));
    }

    private static String first(Map<String, String> tags, String... keys) {
        for (String k : keys) {
            String v = tags.get(k);
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    private static Double number(Map<String, String> tags, String... keys) {
        String v = first(tags, keys);
        if (v == null) {
            return null;
        }
        try {
            double d = Double.parseDouble(v);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double signed(Double value, String ref, String negative) {
        if (value == null) {
            return null;
        }
        if (ref != null && ref.toUpperCase(Locale.ROOT).startsWith(negative)) {
            return -Math.abs(value);
        }
        return value;
    }

    private static String trim(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
