package com.trailtag.core.source;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SourcePatternTest {

    private static final Path MEDIA = Path.of("/data/trip/GH010001.MP4");

    @Test
    void placeholders() {
        assertEquals(Path.of("/data/trip/GH010001.gpx"), SourcePattern.resolve("%g.gpx", MEDIA));
        assertEquals(Path.of("/data/trip/GH010001.MP4"), SourcePattern.resolve("%f", MEDIA));
        assertEquals(Path.of("/data/trip/GH010001.MP4.xml"), SourcePattern.resolve("%g%e.xml", MEDIA));
    }

    @Test
    void relativePatternIsResolvedAgainstMediaDirectory() {
        assertEquals(Path.of("/data/gps/GH010001.nmea"), SourcePattern.resolve("../gps/%g.nmea", MEDIA));
    }

    @Test
    void absolutePatternIsKept() {
        assertEquals(Path.of("/tracks/all.gpx"), SourcePattern.resolve("/tracks/all.gpx", MEDIA));
    }

    @Test
    void hiddenFileHasNoExtension() {
        assertEquals(Path.of("/data/.hidden.gpx"), SourcePattern.resolve("%g%e.gpx", Path.of("/data/.hidden")));
    }

    @Test
    void placeholderDetection() {
        assertTrue(SourcePattern.hasPlaceholder("%g.gpx"));
        assertFalse(SourcePattern.hasPlaceholder("track.gpx"));
        assertThrows(IllegalArgumentException.class, () -> SourcePattern.resolve(" ", MEDIA));
    }
}
