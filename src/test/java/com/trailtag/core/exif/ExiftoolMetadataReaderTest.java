package com.trailtag.core.exif;

import com.trailtag.core.error.MetadataException;
import com.trailtag.core.error.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExiftoolMetadataReaderTest {

    @TempDir
    Path dir;

    static String rdf(String about, String time) {
        return "<?xml version='1.0' encoding='UTF-8'?>\n"
                + "<rdf:RDF xmlns:rdf='http://www.w3.org/1999/02/22-rdf-syntax-ns#'>\n"
                + "<rdf:Description rdf:about='" + about + "'\n"
                + "  xmlns:ExifIFD='http://ns.exiftool.org/EXIF/ExifIFD/1.0/'\n"
                + "  xmlns:Composite='http://ns.exiftool.org/Composite/1.0/'>\n"
                + " <ExifIFD:DateTimeOriginal>" + time + "</ExifIFD:DateTimeOriginal>\n"
                + " <Composite:GPSLatitude>47.0</Composite:GPSLatitude>\n"
                + "</rdf:Description>\n</rdf:RDF>\n";
    }

    @Test
    void xmlIndexResolvesAbsoluteAndRelativePaths() throws Exception {
        Path a = dir.resolve("a.jpg");
        Path xml = dir.resolve("meta.xml");
        String doc = rdf(a.toString(), "2023:01:01 12:00:00")
                .replace("</rdf:RDF>",
                        "<rdf:Description rdf:about='sub/../b.jpg'\n"
                                + "  xmlns:ExifIFD='http://ns.exiftool.org/EXIF/ExifIFD/1.0/'>\n"
                                + " <ExifIFD:DateTimeOriginal>2023:01:02 00:00:00</ExifIFD:DateTimeOriginal>\n"
                                + "</rdf:Description>\n</rdf:RDF>");
        Files.writeString(xml, doc);

        ExiftoolMetadataReader reader = ExiftoolMetadataReader.fromXml(xml);

        Map<String, String> ma = reader.read(a);
        assertEquals("2023:01:01 12:00:00", ma.get("ExifIFD:DateTimeOriginal"));
        assertEquals("47.0", ma.get("Composite:GPSLatitude"));
        assertEquals("2023:01:02 00:00:00", reader.read(dir.resolve("b.jpg")).get("ExifIFD:DateTimeOriginal"));
    }

    @Test
    void missingFileInIndexIsMetadataError() throws Exception {
        Path xml = dir.resolve("meta.xml");
        Files.writeString(xml, rdf(dir.resolve("a.jpg").toString(), "2023:01:01 12:00:00"));

        ExiftoolMetadataReader reader = ExiftoolMetadataReader.fromXml(xml);
        MetadataException e = assertThrows(MetadataException.class, () -> reader.read(dir.resolve("c.jpg")));
        assertEquals("MetadataError", e.errorType());
    }

    @Test
    void runtimeUsesImageArguments() throws Exception {
        ExiftoolMetadataReader reader = ExiftoolMetadataReader.runtime((args, file) -> {
            assertEquals(ExiftoolRunner.IMAGE_ARGS, args);
            return rdf(file.toString(), "2023:01:01 12:00:00").getBytes(StandardCharsets.UTF_8);
        });

        Map<String, String> m = reader.read(dir.resolve("a.jpg"));
        assertEquals("2023:01:01 12:00:00", m.get("ExifIFD:DateTimeOriginal"));
    }

    @Test
    void runnerFailureBecomesMetadataError() {
        ExiftoolMetadataReader reader = ExiftoolMetadataReader.runtime((args, file) -> {
            throw new ParseException("exiftool exited with 1");
        });

        MetadataException e = assertThrows(MetadataException.class, () -> reader.read(dir.resolve("a.jpg")));
        assertTrue(e.getMessage().contains("exiftool exited with 1"));
    }

    @Test
    void groupFromNamespace() {
        assertEquals("ExifIFD", ExiftoolXml.group("http://ns.exiftool.org/EXIF/ExifIFD/1.0/", "ExifIFD"));
        assertEquals("Track3", ExiftoolXml.group("http://ns.exiftool.org/QuickTime/Track3/1.0/", "x"));
        assertEquals("Composite", ExiftoolXml.group("http://ns.exiftool.org/Composite/1.0/", "x"));
        assertEquals("pfx", ExiftoolXml.group("", "pfx"));
    }
}
