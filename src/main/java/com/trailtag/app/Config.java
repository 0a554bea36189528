package com.trailtag.app;

import com.trailtag.core.geo.TrackLocator;
import com.trailtag.core.model.SourceKind;
import com.trailtag.core.model.SourceSpec;
import com.trailtag.core.pipeline.GeotagOptions;
import com.trailtag.core.pipeline.GeotagSource;
import com.trailtag.core.sequence.SequenceBuilder;
import com.trailtag.core.sequence.SequenceLimits;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** application.yaml: все ключи необязательны, отсутствующие берутся по умолчанию. */
public record Config(Geotag geotag, SequenceConf sequence, Exiftool exiftool, Pipeline pipeline) {
    public record Geotag(String source, String sourcePath, List<SourceSpec> videoSources,
                         double offsetSeconds, boolean useStartTime, double toleranceSeconds,
                         double offsetAngle, boolean interpolateDirections) {}
    public record SequenceConf(double cutoffDistance, double cutoffTime, double duplicateDistance,
                               double duplicateAngle, int maxLength, double maxSpeedKmh,
                               double stationaryRadius, boolean incrementalIds) {}
    public record Exiftool(String path, int timeoutSeconds, String xmlPath) {}
    public record Pipeline(int workers) {}

    public static final String WORKERS_PROPERTY = "trailtag.workers";

    public static Config load() {
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            return parse(in);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application.yaml", e);
        }
    }

    public static Config load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load " + file, e);
        }
    }

    @SuppressWarnings("unchecked")
    static Config parse(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(in);
        if (root == null) {
            root = Map.of();
        }
        Map<String, Object> geo = (Map<String, Object>) root.getOrDefault("geotag", Map.of());
        Map<String, Object> seq = (Map<String, Object>) root.getOrDefault("sequence", Map.of());
        Map<String, Object> ex  = (Map<String, Object>) root.getOrDefault("exiftool", Map.of());
        Map<String, Object> pl  = (Map<String, Object>) root.getOrDefault("pipeline", Map.of());

        List<SourceSpec> videoSources = new ArrayList<>();
        List<Object> vs = (List<Object>) geo.getOrDefault("video_geotag_source", List.of());
        for (Object o : vs) {
            if (o instanceof String) {
                videoSources.add(SourceSpec.of(SourceKind.fromName((String) o)));
            } else {
                Map<String, Object> m = (Map<String, Object>) o;
                videoSources.add(new SourceSpec(SourceKind.fromName((String) m.get("source")), (String) m.get("pattern")));
            }
        }

        int workers = pl.get("workers") != null ? ((Number) pl.get("workers")).intValue() : 0;
        workers = Integer.getInteger(WORKERS_PROPERTY, workers);

        return new Config(
                new Geotag(
                        (String) geo.getOrDefault("geotag_source", "exif"),
                        (String) geo.get("geotag_source_path"),
                        videoSources,
                        number(geo, "interpolation_offset_time", 0),
                        Boolean.TRUE.equals(geo.get("interpolation_use_gpx_start_time")),
                        number(geo, "tolerance_seconds", TrackLocator.DEFAULT_TOLERANCE_SECONDS),
                        number(geo, "offset_angle", 0),
                        Boolean.TRUE.equals(geo.get("interpolate_directions"))),
                new SequenceConf(
                        number(seq, "cutoff_distance", GeotagOptions.DEFAULT_CUTOFF_DISTANCE),
                        number(seq, "cutoff_time", GeotagOptions.DEFAULT_CUTOFF_TIME),
                        number(seq, "duplicate_distance", GeotagOptions.DEFAULT_DUPLICATE_DISTANCE),
                        number(seq, "duplicate_angle", GeotagOptions.DEFAULT_DUPLICATE_ANGLE),
                        seq.get("max_length") != null ? ((Number) seq.get("max_length")).intValue() : SequenceBuilder.MAX_SEQUENCE_LENGTH,
                        number(seq, "max_speed_kmh", SequenceLimits.DEFAULT_MAX_SPEED_KMH),
                        number(seq, "stationary_radius", SequenceLimits.DEFAULT_STATIONARY_RADIUS_M),
                        Boolean.TRUE.equals(seq.get("incremental_ids"))),
                new Exiftool(
                        (String) ex.get("path"),
                        ex.get("timeout_seconds") != null ? ((Number) ex.get("timeout_seconds")).intValue() : 60,
                        (String) ex.get("xml_path")),
                new Pipeline(workers)
        );
    }

    private static double number(Map<String, Object> m, String key, double def) {
        return m.get(key) != null ? ((Number) m.get(key)).doubleValue() : def;
    }

    public GeotagOptions toOptions() {
        return GeotagOptions.builder()
                .imageSource(GeotagSource.fromName(geotag.source()))
                .imageSourcePath(geotag.sourcePath() != null ? Path.of(geotag.sourcePath()) : null)
                .videoSources(geotag.videoSources())
                .offsetSeconds(geotag.offsetSeconds())
                .useStartTime(geotag.useStartTime())
                .toleranceSeconds(geotag.toleranceSeconds())
                .offsetAngle(geotag.offsetAngle())
                .interpolateDirections(geotag.interpolateDirections())
                .cutoffDistance(sequence.cutoffDistance())
                .cutoffTime(sequence.cutoffTime())
                .duplicateDistance(sequence.duplicateDistance())
                .duplicateAngle(sequence.duplicateAngle())
                .maxSequenceLength(sequence.maxLength())
                .maxSpeedKmh(sequence.maxSpeedKmh())
                .stationaryRadius(sequence.stationaryRadius())
                .incrementalIds(sequence.incrementalIds())
                .workers(pipeline.workers())
                .build();
    }
}
