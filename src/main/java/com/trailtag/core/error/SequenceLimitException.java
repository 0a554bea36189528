package com.trailtag.core.error;

import java.util.Objects;

/** Последовательность или видео нарушают ограничения (скорость, null island, стоячее видео). */
public class SequenceLimitException extends GeotagException {

    public enum Kind {
        CAPTURE_SPEED_TOO_FAST("CaptureSpeedTooFastError"),
        NULL_ISLAND("NullIslandError"),
        STATIONARY_VIDEO("StationaryVideoError");

        private final String type;

        Kind(String type) {
            this.type = type;
        }
    }

    private final Kind kind;

    public SequenceLimitException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String errorType() {
        return kind.type;
    }
}
