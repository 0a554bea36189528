package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.model.Track;
import com.trailtag.core.mp4.Mp4Fixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CammParserTest {

    private static final Instant CREATED = Instant.parse("2023-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private static byte[] gps(int fix, double lat, double lon, float alt) {
        ByteBuffer b = ByteBuffer.allocate(4 + 8 + 4 + 8 + 8 + 4 + 6 * 4).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort((short) 0);
        b.putShort((short) CammParser.TYPE_GPS);
        b.putDouble(0);
        b.putInt(fix);
        b.putDouble(lat);
        b.putDouble(lon);
        b.putFloat(alt);
        return b.array();
    }

    private static byte[] minGps(double lat, double lon, double alt) {
        ByteBuffer b = ByteBuffer.allocate(4 + 24).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort((short) 0);
        b.putShort((short) CammParser.TYPE_MIN_GPS);
        b.putDouble(lat);
        b.putDouble(lon);
        b.putDouble(alt);
        return b.array();
    }

    private static byte[] gyro() {
        ByteBuffer b = ByteBuffer.allocate(4 + 12).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort((short) 0);
        b.putShort((short) CammParser.TYPE_GYRO);
        return b.array();
    }

    private static byte[] udtaString(String type, String value) {
        byte[] v = value.getBytes(StandardCharsets.UTF_8);
        ByteBuffer b = ByteBuffer.allocate(4 + v.length);
        b.putShort((short) v.length);
        b.putShort((short) 0x55c4);
        b.put(v);
        return Mp4Fixture.box(type, b.array());
    }

    private Path write(List<byte[]> samples, byte[] udta) throws Exception {
        byte[] file = Mp4Fixture.movie(Mp4Fixture.mp4Seconds(CREATED.getEpochSecond()), 1000, "camm",
                samples, 1000, udta);
        Path p = dir.resolve("camm.mp4");
        Files.write(p, file);
        return p;
    }

    @Test
    void gpsSamplesAnchoredAtCreationTime() throws Exception {
        Path p = write(List.of(
                        gps(3, 47.0, 8.0, 500f),
                        gyro(),
                        gps(0, 10.0, 10.0, 0f),
                        minGps(1.0, 1.0, 1.0),
                        gps(3, 47.001, 8.0, 510f)),
                Mp4Fixture.box("udta", udtaString("©mak", "Insta360"), udtaString("©mod", "ONE X2")));

        TelemetryData data = new CammParser().parse(p);
        Track t = data.track();

        // тип 5 не используется, если есть тип 6; fix 0 пропускается
        assertEquals(2, t.size());
        assertEquals(CREATED, t.first().time());
        assertEquals(CREATED.plusSeconds(4), t.last().time());
        assertEquals(47.001, t.last().lat(), 1e-9);
        assertEquals(510.0, t.last().alt(), 1e-3);
        assertEquals("Insta360", data.make());
        assertEquals("ONE X2", data.model());
    }

    @Test
    void minimalGpsWhenNoFullGps() throws Exception {
        Path p = write(List.of(minGps(47.0, 8.0, 400), minGps(47.0001, 8.0, 401)), null);

        TelemetryData data = new CammParser().parse(p);
        assertEquals(2, data.track().size());
        assertEquals(CREATED.plusSeconds(1), data.track().last().time());
        assertNull(data.make());
    }

    @Test
    void noCammTrackIsParseError() throws Exception {
        byte[] file = Mp4Fixture.movie(Mp4Fixture.mp4Seconds(CREATED.getEpochSecond()), 1000, "avc1",
                List.of(new byte[16]), 1000, null);
        Path p = dir.resolve("plain.mp4");
        Files.write(p, file);
        assertThrows(ParseException.class, () -> new CammParser().parse(p));
    }

    @Test
    void notAnMp4IsParseError() throws Exception {
        Path p = dir.resolve("text.mp4");
        Files.writeString(p, "definitely not a movie");
        assertThrows(ParseException.class, () -> new CammParser().parse(p));
    }

    @Test
    void truncatedSampleIsParseError() throws Exception {
        byte[] cut = Arrays.copyOf(gps(3, 47.0, 8.0, 500f), 10);
        assertThrows(ParseException.class,
                () -> CammParser.decode(cut, CREATED, new ArrayList<>(), new ArrayList<>()));

        Path p = write(List.of(gps(3, 47.0, 8.0, 500f), cut), null);
        assertThrows(ParseException.class, () -> new CammParser().parse(p));
    }

    @Test
    void nonFiniteCoordinatesAreParseError() {
        ParseException e = assertThrows(ParseException.class, () -> CammParser.decode(
                gps(3, Double.NaN, 8.0, 0f), CREATED, new ArrayList<>(), new ArrayList<>()));
        assertTrue(e.getMessage().startsWith("Invalid CAMM GPS values"), e.getMessage());
    }

    @Test
    void truncatedFileIsParseError() throws Exception {
        byte[] file = Mp4Fixture.movie(Mp4Fixture.mp4Seconds(CREATED.getEpochSecond()), 1000, "camm",
                List.of(gps(3, 47.0, 8.0, 500f)), 1000, null);
        Path p = dir.resolve("cut.mp4");
        Files.write(p, Arrays.copyOf(file, file.length / 2));
        assertThrows(ParseException.class, () -> new CammParser().parse(p));
    }

    @Test
    void sampleOutsideFileIsParseError() throws Exception {
        byte[] file = Mp4Fixture.movie(Mp4Fixture.mp4Seconds(CREATED.getEpochSecond()), 1000, "camm",
                List.of(gps(3, 47.0, 8.0, 500f)), 1000, null);
        Path p = dir.resolve("far.mp4");
        Files.write(p, Mp4Fixture.patch(file, "stco", 8, 0x7FFFFFF0));
        ParseException e = assertThrows(ParseException.class, () -> new CammParser().parse(p));
        assertTrue(e.getMessage().contains("out of file bounds"), e.getMessage());
    }
}
