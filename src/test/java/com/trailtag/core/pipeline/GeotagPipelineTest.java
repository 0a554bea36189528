package com.trailtag.core.pipeline;

import com.trailtag.core.error.ExiftoolUnavailableException;
import com.trailtag.core.exif.MetadataReader;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.MediaType;
import com.trailtag.core.model.SourceKind;
import com.trailtag.core.model.SourceSpec;
import com.trailtag.core.telemetry.TelemetryParsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class GeotagPipelineTest {

    @TempDir
    Path dir;

    private Path photos;
    private final Map<String, Map<String, String>> exif = new HashMap<>();

    private final MetadataReader reader = file -> {
        String name = file.getFileName().toString();
        if (name.startsWith("boom")) {
            throw new IllegalStateException("boom");
        }
        return exif.getOrDefault(name, Map.of());
    };

    private final TelemetryParsers parsers = TelemetryParsers.defaults((args, file) -> {
        throw new ExiftoolUnavailableException("exiftool not found", null);
    });

    @BeforeEach
    void setUp() throws Exception {
        photos = Files.createDirectories(dir.resolve("photos"));
    }

    private void image(String name, String time, Double lat) throws Exception {
        Files.write(photos.resolve(name), new byte[0]);
        Map<String, String> tags = new HashMap<>();
        if (time != null) {
            tags.put("ExifIFD:DateTimeOriginal", time);
        }
        if (lat != null) {
            tags.put("Composite:GPSLatitude", String.valueOf(lat));
            tags.put("Composite:GPSLongitude", "8.0");
        }
        tags.put("IFD0:Make", "Canon");
        tags.put("IFD0:Model", "EOS R");
        exif.put(name, tags);
    }

    private Path gpx(Path file, int points) throws Exception {
        StringBuilder sb = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<gpx version=\"1.1\" creator=\"test\" xmlns=\"http://www.topografix.com/GPX/1/1\">\n<trk><trkseg>\n");
        for (int i = 0; i < points; i++) {
            sb.append(String.format(java.util.Locale.ROOT,
                    "<trkpt lat=\"%.6f\" lon=\"8.000000\"><time>2023-01-01T12:00:%02dZ</time></trkpt>\n",
                    47.0 + 0.0001 * i, i));
        }
        sb.append("</trkseg></trk>\n</gpx>\n");
        Files.writeString(file, sb.toString());
        return file;
    }

    private static CaptureRecord byName(List<CaptureRecord> records, String name) {
        return records.stream()
                .filter(r -> r.file().getFileName().toString().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void exifImagesAreSequencedAndFailuresIsolated() throws Exception {
        image("a.jpg", "2023:01:01 12:00:00", 47.0);
        image("b.jpg", "2023:01:01 12:00:01", 47.0001);
        image("c.jpg", "2023:01:01 12:00:02", 47.0002);
        image("broken.jpg", null, 47.0);
        image("nogps.jpg", "2023:01:01 12:00:03", null);
        image("boom.jpg", "2023:01:01 12:00:04", 47.0);
        Files.writeString(photos.resolve("notes.txt"), "skip me");

        GeotagOptions options = GeotagOptions.builder().workers(2).build();
        List<CaptureRecord> out = new GeotagPipeline(options, parsers, reader).run(List.of(photos));

        assertEquals(6, out.size());
        assertEquals("a.jpg", out.get(0).file().getFileName().toString());
        assertEquals("b.jpg", out.get(1).file().getFileName().toString());
        assertEquals("c.jpg", out.get(2).file().getFileName().toString());
        String seq = out.get(0).sequenceId();
        assertNotNull(seq);
        assertEquals(seq, out.get(2).sequenceId());
        assertEquals(0.0, out.get(0).heading(), 0.01);
        assertEquals("Canon", out.get(0).make());
        assertTrue(out.stream().allMatch(CaptureRecord::isFrozen));

        assertEquals("MetadataError", byName(out, "broken.jpg").error().type());
        assertEquals("GeotaggingError", byName(out, "nogps.jpg").error().type());
        CaptureRecord boom = byName(out, "boom.jpg");
        assertEquals("IllegalStateException", boom.error().type());
        assertEquals("boom", boom.error().message());
        for (int i = 3; i < 6; i++) {
            assertTrue(out.get(i).hasError());
        }
    }

    @Test
    void offsetShiftsExifTime() throws Exception {
        image("a.jpg", "2023:01:01 12:00:00", 47.0);

        GeotagOptions options = GeotagOptions.builder().offsetSeconds(-1.5).build();
        List<CaptureRecord> out = new GeotagPipeline(options, parsers, reader).run(List.of(photos));

        assertEquals(Instant.parse("2023-01-01T11:59:58.500Z"), out.get(0).time());
        assertEquals(Instant.parse("2023-01-01T12:00:00Z"), out.get(0).rawTime());
    }

    @Test
    void gpxTrackInterpolationAndOutsideTrack() throws Exception {
        Path track = gpx(dir.resolve("track.gpx"), 11);
        image("x.jpg", "2023:01:01 12:00:05", null);
        image("y.jpg", "2023:01:01 12:00:30", null);

        GeotagOptions options = GeotagOptions.builder()
                .imageSource(GeotagSource.GPX)
                .imageSourcePath(track)
                .build();
        List<CaptureRecord> out = new GeotagPipeline(options, parsers, reader).run(List.of(photos));

        CaptureRecord x = byName(out, "x.jpg");
        assertFalse(x.hasError());
        assertEquals(47.0005, x.lat(), 1e-9);
        CaptureRecord y = byName(out, "y.jpg");
        assertEquals("OutsideTrackError", y.error().type());
        assertTrue(y.error().message().contains("20.000 seconds beyond"));
    }

    @Test
    void gpxStartTimeAlignsEarliestImage() throws Exception {
        Path track = gpx(dir.resolve("track.gpx"), 11);
        image("x.jpg", "2023:01:01 08:00:00", null);
        image("y.jpg", "2023:01:01 08:00:04", null);

        GeotagOptions options = GeotagOptions.builder()
                .imageSource(GeotagSource.GPX)
                .imageSourcePath(track)
                .useStartTime(true)
                .build();
        List<CaptureRecord> out = new GeotagPipeline(options, parsers, reader).run(List.of(photos));

        assertEquals(Instant.parse("2023-01-01T12:00:00Z"), byName(out, "x.jpg").time());
        assertEquals(47.0004, byName(out, "y.jpg").lat(), 1e-9);
    }

    @Test
    void unreadableTrackFailsEveryImage() throws Exception {
        image("x.jpg", "2023:01:01 12:00:05", null);
        image("y.jpg", "2023:01:01 12:00:06", null);

        GeotagOptions options = GeotagOptions.builder()
                .imageSource(GeotagSource.GPX)
                .imageSourcePath(dir.resolve("missing.gpx"))
                .build();
        List<CaptureRecord> out = new GeotagPipeline(options, parsers, reader).run(List.of(photos));

        assertEquals(2, out.size());
        assertTrue(out.stream().allMatch(r -> "ParseError".equals(r.error().type())));
    }

    @Test
    void videoGeotaggedFromCompanionGpx() throws Exception {
        Path video = photos.resolve("ride.mp4");
        Files.writeString(video, "not a movie");
        gpx(photos.resolve("ride.gpx"), 11);
        image("a.jpg", "2023:01:01 12:00:00", 47.0);

        GeotagOptions options = GeotagOptions.builder()
                .videoSources(List.of(SourceSpec.of(SourceKind.VIDEO), SourceSpec.of(SourceKind.GPX)))
                .incrementalIds(true)
                .build();
        List<CaptureRecord> out = new GeotagPipeline(options, parsers, reader).run(List.of(photos));

        assertEquals(2, out.size());
        CaptureRecord v = out.get(1);
        assertEquals(MediaType.VIDEO, v.mediaType());
        assertFalse(v.hasError());
        assertEquals(11, v.track().size());
        assertEquals(Instant.parse("2023-01-01T12:00:00Z"), v.time());
        assertEquals(0.0, v.heading(), 0.01);
        assertNotNull(v.sequenceId());
        assertNotEquals(out.get(0).sequenceId(), v.sequenceId());
    }

    @Test
    void videoWithoutAnySourceIsGeotaggingError() throws Exception {
        Files.writeString(photos.resolve("ride.mp4"), "not a movie");

        List<CaptureRecord> out = new GeotagPipeline(GeotagOptions.defaults(), parsers, reader)
                .run(List.of(photos));

        assertEquals("GeotaggingError", out.get(0).error().type());
        assertNull(out.get(0).sequenceId());
    }

    @Test
    void exiftoolUnavailableAbortsRun() throws Exception {
        image("a.jpg", "2023:01:01 12:00:00", 47.0);
        MetadataReader noExiftool = file -> {
            throw new ExiftoolUnavailableException("exiftool not found", null);
        };

        GeotagPipeline pipeline = new GeotagPipeline(GeotagOptions.defaults(), parsers, noExiftool);
        assertThrows(ExiftoolUnavailableException.class, () -> pipeline.run(List.of(photos)));
    }

    @Test
    void fixedSourceForSeveralVideosRejected() throws Exception {
        Files.writeString(photos.resolve("a.mp4"), "x");
        Files.writeString(photos.resolve("b.mp4"), "x");

        GeotagOptions options = GeotagOptions.builder()
                .videoSources(List.of(new SourceSpec(SourceKind.GPX, "/tracks/all.gpx")))
                .build();
        GeotagPipeline pipeline = new GeotagPipeline(options, parsers, reader);
        assertThrows(IllegalArgumentException.class, () -> pipeline.run(List.of(photos)));
    }
}
