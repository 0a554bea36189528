package com.trailtag.core.error;

import java.time.Instant;
import java.util.Locale;

/** Время съёмки вне границ трека (с учётом допуска). */
public class OutsideTrackException extends GeotagException {

    private final Instant time;
    private final Instant trackStart;
    private final Instant trackEnd;

    public OutsideTrackException(String message, Instant time, Instant trackStart, Instant trackEnd) {
        super(message);
        this.time = time;
        this.trackStart = trackStart;
        this.trackEnd = trackEnd;
    }

    public static OutsideTrackException before(Instant time, Instant start, Instant end, double seconds) {
        return new OutsideTrackException(String.format(Locale.ROOT,
                "The image date time is %.3f seconds behind the track start point", seconds),
                time, start, end);
    }

    public static OutsideTrackException beyond(Instant time, Instant start, Instant end, double seconds) {
        return new OutsideTrackException(String.format(Locale.ROOT,
                "The image date time is %.3f seconds beyond the track end point", seconds),
                time, start, end);
    }

    public Instant time() { return time; }
    public Instant trackStart() { return trackStart; }
    public Instant trackEnd() { return trackEnd; }

    @Override
    public String errorType() {
        return "OutsideTrackError";
    }
}
