package com.trailtag.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Состояние одного медиафайла в пределах одного прогона.
 *
 * Создаётся в начале пайплайна, дополняется стадиями геопривязки, последовательностей
 * и дублей, затем замораживается через {@link #freeze()} перед сборкой описаний.
 * Запись после заморозки бросает IllegalStateException.
 */
public final class CaptureRecord {

    /** Порядок внутри последовательности: время, затем имя файла. */
    public static final Comparator<CaptureRecord> BY_TIME = Comparator
            .comparing(CaptureRecord::time, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(r -> r.file().getFileName().toString());

    private final Path file;
    private final MediaType mediaType;

    private Instant rawTime;
    private Instant time;
    private Double lat;
    private Double lon;
    private Double alt;
    private Double heading;
    private Double accuracyMeters;
    private Integer orientation;
    private String make;
    private String model;
    private Track track;             // только для видео
    private String sequenceId;
    private boolean duplicate;
    private CaptureError error;

    private volatile boolean frozen;

    public CaptureRecord(Path file, MediaType mediaType) {
        this.file = Objects.requireNonNull(file, "file");
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType");
    }

    public Path file() { return file; }
    public MediaType mediaType() { return mediaType; }
    public Instant rawTime() { return rawTime; }
    public Instant time() { return time; }
    public Double lat() { return lat; }
    public Double lon() { return lon; }
    public Double alt() { return alt; }
    public Double heading() { return heading; }
    public Double accuracyMeters() { return accuracyMeters; }
    public Integer orientation() { return orientation; }
    public String make() { return make; }
    public String model() { return model; }
    public Track track() { return track; }
    public String sequenceId() { return sequenceId; }
    public boolean isDuplicate() { return duplicate; }
    public CaptureError error() { return error; }
    public boolean isFrozen() { return frozen; }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasPosition() {
        return lat != null && lon != null;
    }

    public void setRawTime(Instant rawTime) {
        ensureMutable();
        this.rawTime = rawTime;
    }

    public void setTime(Instant time) {
        ensureMutable();
        this.time = time;
    }

    /** Позиция из точки трека (время не трогаем). */
    public void setPosition(GpsPoint p) {
        ensureMutable();
        this.lat = p.lat();
        this.lon = p.lon();
        this.alt = p.alt();
        this.heading = p.heading();
    }

    public void setPosition(double lat, double lon, Double alt) {
        ensureMutable();
        this.lat = lat;
        this.lon = lon;
        this.alt = alt;
    }

    public void setHeading(Double heading) {
        ensureMutable();
        this.heading = heading;
    }

    public void setAccuracyMeters(Double accuracyMeters) {
        ensureMutable();
        this.accuracyMeters = accuracyMeters;
    }

    public void setOrientation(Integer orientation) {
        ensureMutable();
        this.orientation = orientation;
    }

    public void setCamera(String make, String model) {
        ensureMutable();
        this.make = blankToNull(make);
        this.model = blankToNull(model);
    }

    public void setTrack(Track track) {
        ensureMutable();
        this.track = track;
    }

    public void setSequenceId(String sequenceId) {
        ensureMutable();
        this.sequenceId = sequenceId;
    }

    public void markDuplicate() {
        ensureMutable();
        this.duplicate = true;
    }

    public void fail(CaptureError error) {
        ensureMutable();
        this.error = Objects.requireNonNull(error, "error");
    }

    public void freeze() {
        this.frozen = true;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("CaptureRecord is frozen: " + file);
        }
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    @Override
    public String toString() {
        return "CaptureRecord{" + file.getFileName() + ", time=" + time
                + (error != null ? ", error=" + error.type() : "")
                + (sequenceId != null ? ", seq=" + sequenceId : "") + "}";
    }
}
