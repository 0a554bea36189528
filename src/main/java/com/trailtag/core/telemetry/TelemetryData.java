package com.trailtag.core.telemetry;

import com.trailtag.core.model.Track;

import java.util.Objects;

/** Результат парсера: трек и (если известны) производитель и модель камеры. */
public record TelemetryData(Track track, String make, String model) {

    public TelemetryData {
        Objects.requireNonNull(track, "track");
    }

    public static TelemetryData of(Track track) {
        return new TelemetryData(track, null, null);
    }

    public TelemetryData withCamera(String make, String model) {
        return new TelemetryData(track, make, model);
    }
}
