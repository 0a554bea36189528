package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.model.Track;
import com.trailtag.core.mp4.Mp4Fixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlackVueParserTest {

    // 2023-06-14 12:15:00 по часам камеры (UTC+2)
    private static final long CAMERA_MS = 1_686_744_900_000L;

    @TempDir
    Path dir;

    @Test
    void readsRmcFromFreeBoxAndModelFromCprt() throws Exception {
        String nmea = "[" + CAMERA_MS + "]$GPRMC,101500.00,A,4700.0000,N,00800.0000,E,10.0,90.0,140623,,,A*5A\n"
                + "[" + CAMERA_MS + "]$GPGGA,101500.00,4700.0000,N,00800.0000,E,1,08,0.9,500.0,M,,M,,*78\n"
                + "[" + (CAMERA_MS + 1000) + "]$GPRMC,101501.00,A,4700.0000,N,00800.0100,E,10.0,90.0,140623,,,A*5A\n"
                + "[" + (CAMERA_MS + 1000) + "]$GPGGA,101501.00,4700.0000,N,00800.0100,E,1,08,0.9,500.0,M,,M,,*78\n";
        byte[] file = Mp4Fixture.concat(
                Mp4Fixture.box("ftyp", "isom".getBytes(StandardCharsets.ISO_8859_1), Mp4Fixture.ints(0)),
                Mp4Fixture.box("free",
                        Mp4Fixture.box("gps ", nmea.getBytes(StandardCharsets.ISO_8859_1)),
                        Mp4Fixture.box("cprt", "Pittasoft Co., Ltd.;DR900X-2CH;1.004;English\u0000"
                                .getBytes(StandardCharsets.ISO_8859_1))),
                Mp4Fixture.box("mdat"));
        Path p = dir.resolve("20230614_121500_NF.mp4");
        Files.write(p, file);

        TelemetryData data = new BlackVueParser().parse(p);
        Track t = data.track();

        assertEquals("BlackVue", data.make());
        assertEquals("DR900X-2CH", data.model());
        assertEquals(2, t.size());
        assertEquals(Instant.parse("2023-06-14T10:15:00Z"), t.first().time());
        assertEquals(Instant.parse("2023-06-14T10:15:01Z"), t.last().time());
        assertEquals(90.0, t.first().heading());
    }

    @Test
    void offsetWithoutDateIsNormalizedToHalfDay() {
        NmeaFix fix = new NmeaFix("GGA", null, LocalTime.of(10, 15), 47.0, 8.0, 500.0, null);
        long offset = BlackVueParser.offsetMs(List.of(new BlackVueParser.Stamped(CAMERA_MS, fix)));
        assertEquals(-2 * 3600 * 1000L, offset);
    }

    @Test
    void ggaIsUsedWithoutRmc() {
        List<BlackVueParser.Stamped> lines = BlackVueParser.parseLines(
                "[" + CAMERA_MS + "]$GPGGA,101500.00,4700.0000,N,00800.0000,E,1,08,0.9,500.0,M,,M,,*78\n"
                        + "not a line\n");
        Track t = BlackVueParser.toTrack(lines);
        assertEquals(1, t.size());
        assertEquals(Instant.parse("2023-06-14T10:15:00Z"), t.first().time());
        assertEquals(500.0, t.first().alt());
    }

    @Test
    void cameraModelFromJsonOrFields() {
        assertEquals("DR750X", BlackVueParser.cameraModel("{\"model\":\"DR750X\",\"fw\":\"1.0\"}"));
        assertEquals("DR900S", BlackVueParser.cameraModel("Pittasoft;DR900S;1.0"));
        assertNull(BlackVueParser.cameraModel("\u0000\u0000"));
    }

    private static final byte[] FTYP =
            Mp4Fixture.box("ftyp", "isom".getBytes(StandardCharsets.ISO_8859_1), Mp4Fixture.ints(0));

    private Path write(byte[]... boxes) throws Exception {
        Path p = dir.resolve("20230614_121500_NF.mp4");
        Files.write(p, Mp4Fixture.concat(FTYP, Mp4Fixture.concat(boxes)));
        return p;
    }

    @Test
    void gpsBoxLargerThanFreeIsParseError() throws Exception {
        // заголовок "gps " обещает 1000 байт, в free их меньше
        byte[] free = Mp4Fixture.box("free", Mp4Fixture.ints(1000), "gps ".getBytes(StandardCharsets.ISO_8859_1),
                ("[" + CAMERA_MS + "]$GPRMC,1015").getBytes(StandardCharsets.ISO_8859_1));
        Path p = write(free);
        assertThrows(ParseException.class, () -> new BlackVueParser().parse(p));
    }

    @Test
    void freeBoxCutByEndOfFileIsParseError() throws Exception {
        byte[] free = Mp4Fixture.box("free", Mp4Fixture.box("gps ",
                ("[" + CAMERA_MS + "]$GPRMC,101500.00,A,4700.0000,N,00800.0000,E,10.0,90.0,140623,,,A*5A\n")
                        .getBytes(StandardCharsets.ISO_8859_1)));
        Path p = write(Arrays.copyOf(free, free.length - 20));
        ParseException e = assertThrows(ParseException.class, () -> new BlackVueParser().parse(p));
        assertTrue(e.getMessage().startsWith("No BlackVue GPS box"), e.getMessage());
    }

    @Test
    void garbageLinesGiveNoPoints() throws Exception {
        String junk = "[12ab]$GPRMC,broken\n[" + CAMERA_MS + "]$GPRMC,,V,,,,,,,,,,N*53\n\u0000\u0000\u0000";
        Path p = write(Mp4Fixture.box("free", Mp4Fixture.box("gps ", junk.getBytes(StandardCharsets.ISO_8859_1))));
        ParseException e = assertThrows(ParseException.class, () -> new BlackVueParser().parse(p));
        assertTrue(e.getMessage().startsWith("No GPS points found"), e.getMessage());
    }
}
