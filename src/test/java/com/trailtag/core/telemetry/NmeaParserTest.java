package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.model.Track;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NmeaParserTest {

    @TempDir
    Path dir;

    private Path log(String... lines) throws Exception {
        Path p = dir.resolve("track.nmea");
        Files.writeString(p, String.join("\r\n", lines) + "\r\n", StandardCharsets.ISO_8859_1);
        return p;
    }

    @Test
    void ggaPositionsWithRmcDateAndCourse() throws Exception {
        Path p = log(
                "$GPRMC,120000.00,A,4700.0000,N,00800.0000,E,10.0,45.0,010523,,,A*53",
                "$GPGGA,120000.00,4700.0000,N,00800.0000,E,1,08,0.9,500.0,M,,M,,*7E",
                "$GPRMC,120001.00,A,4700.0060,N,00800.0000,E,10.0,0.0,010523,,,A*65",
                "$GPGGA,120001.00,4700.0060,N,00800.0000,E,1,08,0.9,501.0,M,,M,,*00",
                "$GPGGA,120001.00,4700.0060,N,00800.0000,E,1,08,0.9,501.0,M,,M,,*78",
                "$GPGGA,120002.00,4700.0120,N,00800.0000,E,0,00,,,M,,M,,*7A",
                "garbage line");

        Track t = new NmeaParser().parse(p).track();

        assertEquals(2, t.size());
        assertEquals(Instant.parse("2023-05-01T12:00:00Z"), t.first().time());
        assertEquals(Instant.parse("2023-05-01T12:00:01Z"), t.last().time());
        assertEquals(47.0001, t.last().lat(), 1e-9);
        assertEquals(8.0, t.last().lon(), 1e-9);
        assertEquals(500.0, t.first().alt());
        assertEquals(45.0, t.first().heading());
        assertEquals(0.0, t.last().heading());
    }

    @Test
    void midnightRolloverAdvancesDate() throws Exception {
        Path p = log(
                "$GPRMC,235958.00,A,4700.0000,N,00800.0000,E,10.0,45.0,010523,,,A*50",
                "$GPGGA,235959.00,4700.0000,N,00800.0000,E,1,08,0.9,500.0,M,,M,,*7C",
                "$GPGGA,000001.00,4700.0060,N,00800.0000,E,1,08,0.9,500.0,M,,M,,*7A");

        Track t = new NmeaParser().parse(p).track();

        assertEquals(2, t.size());
        assertEquals(Instant.parse("2023-05-01T23:59:59Z"), t.first().time());
        assertEquals(Instant.parse("2023-05-02T00:00:01Z"), t.last().time());
    }

    @Test
    void withoutRmcThereIsNoDate() throws Exception {
        Path p = log("$GPGGA,120000.00,4700.0000,N,00800.0000,E,1,08,0.9,500.0,M,,M,,*7E");
        ParseException e = assertThrows(ParseException.class, () -> new NmeaParser().parse(p));
        assertTrue(e.getMessage().contains("RMC sentences are required"));
    }

    @Test
    void checksumMismatchIsReported() {
        assertThrows(ParseException.class,
                () -> NmeaSentence.parse("$GPGGA,120000.00,4700.0000,N,00800.0000,E,1,08,0.9,500.0,M,,M,,*00"));
    }

    @Test
    void sentenceFields() throws Exception {
        NmeaSentence s = NmeaSentence.parse("$GNRMC,101500.00,A,4700.0000,N,00800.0000,E,10.0,90.0,140623,,,A");
        assertNotNull(s);
        assertEquals("RMC", s.type());
        assertEquals(47.0, s.coordinate(2, 3), 1e-9);
        assertNull(NmeaSentence.parse("no sentence here"));
    }
}
