package com.trailtag.core.pipeline;

import com.trailtag.core.geo.TrackLocator;
import com.trailtag.core.model.SourceKind;
import com.trailtag.core.model.SourceSpec;
import com.trailtag.core.sequence.SequenceBuilder;
import com.trailtag.core.sequence.SequenceLimits;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Неизменяемые параметры одного прогона. Передаются во все стадии,
 * глобального состояния нет.
 */
public record GeotagOptions(
        GeotagSource imageSource,
        Path imageSourcePath,          // трек GPX/NMEA, обязателен для этих источников
        List<SourceSpec> videoSources,
        double offsetSeconds,
        boolean useStartTime,
        double toleranceSeconds,
        double cutoffDistance,
        double cutoffTime,
        double duplicateDistance,
        double duplicateAngle,
        double offsetAngle,
        boolean interpolateDirections,
        int maxSequenceLength,
        double maxSpeedKmh,
        double stationaryRadius,
        boolean incrementalIds,
        int workers
) {

    public static final double DEFAULT_CUTOFF_DISTANCE = 600;
    public static final double DEFAULT_CUTOFF_TIME = 60;
    public static final double DEFAULT_DUPLICATE_DISTANCE = 0.1;
    public static final double DEFAULT_DUPLICATE_ANGLE = 5;

    public GeotagOptions {
        Objects.requireNonNull(imageSource, "imageSource");
        if (imageSource != GeotagSource.EXIF && imageSourcePath == null) {
            throw new IllegalArgumentException("geotag_source_path is required for geotag source " + imageSource);
        }
        videoSources = videoSources == null || videoSources.isEmpty()
                ? List.of(SourceSpec.of(SourceKind.VIDEO))
                : List.copyOf(videoSources);
        if (!Double.isFinite(offsetSeconds)) {
            throw new IllegalArgumentException("offsetSeconds must be finite");
        }
        if (cutoffDistance < 0 || cutoffTime < 0 || duplicateDistance < 0) {
            throw new IllegalArgumentException("cutoffs and duplicate distance must be >= 0");
        }
        if (maxSequenceLength < 1 || maxSequenceLength > SequenceBuilder.MAX_SEQUENCE_LENGTH) {
            throw new IllegalArgumentException("maxSequenceLength must be in [1, "
                    + SequenceBuilder.MAX_SEQUENCE_LENGTH + "]: " + maxSequenceLength);
        }
        if (workers < 0) {
            throw new IllegalArgumentException("workers must be >= 0: " + workers);
        }
    }

    public static GeotagOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.imageSource = imageSource;
        b.imageSourcePath = imageSourcePath;
        b.videoSources = videoSources;
        b.offsetSeconds = offsetSeconds;
        b.useStartTime = useStartTime;
        b.toleranceSeconds = toleranceSeconds;
        b.cutoffDistance = cutoffDistance;
        b.cutoffTime = cutoffTime;
        b.duplicateDistance = duplicateDistance;
        b.duplicateAngle = duplicateAngle;
        b.offsetAngle = offsetAngle;
        b.interpolateDirections = interpolateDirections;
        b.maxSequenceLength = maxSequenceLength;
        b.maxSpeedKmh = maxSpeedKmh;
        b.stationaryRadius = stationaryRadius;
        b.incrementalIds = incrementalIds;
        b.workers = workers;
        return b;
    }

    /** Число потоков с учётом 0 = по числу ядер. */
    public int effectiveWorkers() {
        return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public static final class Builder {
        private GeotagSource imageSource = GeotagSource.EXIF;
        private Path imageSourcePath;
        private List<SourceSpec> videoSources = List.of();
        private double offsetSeconds;
        private boolean useStartTime;
        private double toleranceSeconds = TrackLocator.DEFAULT_TOLERANCE_SECONDS;
        private double cutoffDistance = DEFAULT_CUTOFF_DISTANCE;
        private double cutoffTime = DEFAULT_CUTOFF_TIME;
        private double duplicateDistance = DEFAULT_DUPLICATE_DISTANCE;
        private double duplicateAngle = DEFAULT_DUPLICATE_ANGLE;
        private double offsetAngle;
        private boolean interpolateDirections;
        private int maxSequenceLength = SequenceBuilder.MAX_SEQUENCE_LENGTH;
        private double maxSpeedKmh = SequenceLimits.DEFAULT_MAX_SPEED_KMH;
        private double stationaryRadius = SequenceLimits.DEFAULT_STATIONARY_RADIUS_M;
        private boolean incrementalIds;
        private int workers;

        private Builder() {
        }

        public Builder imageSource(GeotagSource v) { this.imageSource = v; return this; }
        public Builder imageSourcePath(Path v) { this.imageSourcePath = v; return this; }
        public Builder videoSources(List<SourceSpec> v) { this.videoSources = v; return this; }
        public Builder offsetSeconds(double v) { this.offsetSeconds = v; return this; }
        public Builder useStartTime(boolean v) { this.useStartTime = v; return this; }
        public Builder toleranceSeconds(double v) { this.toleranceSeconds = v; return this; }
        public Builder cutoffDistance(double v) { this.cutoffDistance = v; return this; }
        public Builder cutoffTime(double v) { this.cutoffTime = v; return this; }
        public Builder duplicateDistance(double v) { this.duplicateDistance = v; return this; }
        public Builder duplicateAngle(double v) { this.duplicateAngle = v; return this; }
        public Builder offsetAngle(double v) { this.offsetAngle = v; return this; }
        public Builder interpolateDirections(boolean v) { this.interpolateDirections = v; return this; }
        public Builder maxSequenceLength(int v) { this.maxSequenceLength = v; return this; }
        public Builder maxSpeedKmh(double v) { this.maxSpeedKmh = v; return this; }
        public Builder stationaryRadius(double v) { this.stationaryRadius = v; return this; }
        public Builder incrementalIds(boolean v) { this.incrementalIds = v; return this; }
        public Builder workers(int v) { this.workers = v; return this; }

        public GeotagOptions build() {
            return new GeotagOptions(imageSource, imageSourcePath, videoSources, offsetSeconds, useStartTime,
                    toleranceSeconds, cutoffDistance, cutoffTime, duplicateDistance, duplicateAngle, offsetAngle,
                    interpolateDirections, maxSequenceLength, maxSpeedKmh, stationaryRadius, incrementalIds, workers);
        }
    }
}
