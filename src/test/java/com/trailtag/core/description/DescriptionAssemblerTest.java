package com.trailtag.core.description;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trailtag.core.geo.TrackLocator;
import com.trailtag.core.model.CaptureError;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.MediaType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionAssemblerTest {

    private final DescriptionAssembler assembler = new DescriptionAssembler();

    @TempDir
    Path dir;

    private CaptureRecord located(String name, MediaType type) {
        CaptureRecord r = new CaptureRecord(dir.resolve(name), type);
        r.setTime(Instant.parse("2023-01-01T12:00:00.123456Z"));
        r.setPosition(47.123456789, 8.987654321, 500.12345);
        r.setHeading(90.12345);
        r.setSequenceId("seq-1");
        r.setCamera("GoPro", "HERO9 Black");
        return r;
    }

    private CaptureRecord failed(String name) {
        CaptureRecord r = new CaptureRecord(dir.resolve(name), MediaType.IMAGE);
        r.fail(new CaptureError("MetadataError", "Unable to extract timestamp from the image"));
        return r;
    }

    private static List<CaptureRecord> frozen(CaptureRecord... records) {
        for (CaptureRecord r : records) {
            r.freeze();
        }
        return List.of(records);
    }

    @Test
    void imageDescriptionFields() {
        CaptureRecord r = located("a.jpg", MediaType.IMAGE);
        r.setOrientation(1);
        r.markDuplicate();

        JsonNode d = assembler.toTree(assembler.assemble(frozen(r))).get(0);

        assertEquals(dir.resolve("a.jpg").toAbsolutePath().toString(), d.get("filename").asText());
        assertEquals(47.1234568, d.get("MAPLatitude").asDouble(), 1e-12);
        assertEquals(8.9876543, d.get("MAPLongitude").asDouble(), 1e-12);
        assertEquals(500.123, d.get("MAPAltitude").asDouble(), 1e-12);
        assertEquals("2023_01_01_12_00_00_123", d.get("MAPCaptureTime").asText());
        assertEquals(90.123, d.get("MAPCompassHeading").get("TrueHeading").asDouble(), 1e-12);
        assertEquals(90.123, d.get("MAPCompassHeading").get("MagneticHeading").asDouble(), 1e-12);
        assertEquals("seq-1", d.get("MAPSequenceUUID").asText());
        assertEquals(1, d.get("MAPOrientation").asInt());
        assertEquals("GoPro", d.get("MAPDeviceMake").asText());
        assertTrue(d.get("MAPMetaTags").get("duplicate").asBoolean());
        assertFalse(d.has("MAPGPSAccuracyMeters"));
    }

    @Test
    void errorsFirstThenImagesThenVideos() {
        List<Object> out = assembler.assemble(frozen(
                located("v.mp4", MediaType.VIDEO),
                located("a.jpg", MediaType.IMAGE),
                failed("b.jpg"),
                located("c.jpg", MediaType.IMAGE)));

        JsonNode tree = assembler.toTree(out);
        assertEquals(4, tree.size());
        assertEquals("MetadataError", tree.get(0).get("error").get("type").asText());
        assertTrue(tree.get(0).get("filename").asText().endsWith("b.jpg"));
        assertTrue(tree.get(1).get("filename").asText().endsWith("a.jpg"));
        assertTrue(tree.get(2).get("filename").asText().endsWith("c.jpg"));
        assertTrue(tree.get(3).get("filename").asText().endsWith("v.mp4"));
    }

    @Test
    void recordWithoutHeadingOmitsCompass() {
        CaptureRecord r = located("a.jpg", MediaType.IMAGE);
        r.setHeading(null);
        JsonNode d = assembler.toTree(assembler.assemble(frozen(r))).get(0);
        assertFalse(d.has("MAPCompassHeading"));
        assertFalse(d.has("MAPMetaTags"));
    }

    @Test
    void headingRoundedUpToFullCircleWrapsToZero() {
        CaptureRecord r = located("a.jpg", MediaType.IMAGE);
        r.setHeading(TrackLocator.interpolateHeading(359.999, 0.0004, 0.5));

        List<Object> out = assembler.assemble(frozen(r));
        JsonNode d = assembler.toTree(out).get(0);

        assertFalse(d.has("error"));
        assertEquals(0.0, d.get("MAPCompassHeading").get("TrueHeading").asDouble(), 1e-12);
        assertEquals(0.0, d.get("MAPCompassHeading").get("MagneticHeading").asDouble(), 1e-12);
    }

    @Test
    void unfrozenRecordRejected() {
        CaptureRecord r = located("a.jpg", MediaType.IMAGE);
        assertThrows(IllegalStateException.class, () -> assembler.assemble(List.of(r)));
    }

    @Test
    void writesJsonArrayToFile() throws Exception {
        Path out = dir.resolve("out/desc.json");
        assembler.write(assembler.assemble(frozen(located("a.jpg", MediaType.IMAGE), failed("b.jpg"))), out);

        JsonNode tree = new ObjectMapper().readTree(Files.readString(out));
        assertTrue(tree.isArray());
        assertEquals(2, tree.size());
    }

    @Test
    void writingToStreamLeavesItOpen() throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        assembler.write(assembler.assemble(frozen(failed("b.jpg"))), buf);
        buf.write('\n');
        String json = buf.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"error\""));
        assertTrue(json.endsWith("\n"));
    }
}
