package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.exif.ExifTime;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * GPX 1.0/1.1: все trkpt всех треков и сегментов. Время обязательно, ele и course необязательны.
 * Точка без времени или с битыми координатами пропускается.
 */
public final class GpxParser implements TelemetryParser {
    private static final Logger log = LoggerFactory.getLogger(GpxParser.class);

    @Override
    public TelemetryData parse(Path file) throws ParseException {
        Document doc;
        try (InputStream in = Files.newInputStream(file)) {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            doc = f.newDocumentBuilder().parse(in);
        } catch (ParserConfigurationException | SAXException e) {
            throw new ParseException("Invalid GPX " + file.getFileName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        int tracks = doc.getElementsByTagNameNS("*", "trk").getLength();
        if (tracks > 1) {
            log.warn("{} has {} tracks, merging them", file.getFileName(), tracks);
        }
        NodeList nodes = doc.getElementsByTagNameNS("*", "trkpt");
        List<GpsPoint> points = new ArrayList<>(nodes.getLength());
        int skipped = 0;
        for (int i = 0; i < nodes.getLength(); i++) {
            GpsPoint p = point((Element) nodes.item(i));
            if (p == null) {
                skipped++;
            } else {
                points.add(p);
            }
        }
        if (skipped > 0) {
            log.debug("gpx: skipped {} points without time or coordinates in {}", skipped, file.getFileName());
        }
        if (points.isEmpty()) {
            throw new ParseException("No track points found in " + file.getFileName());
        }
        return TelemetryData.of(Track.of(points));
    }

    static GpsPoint point(Element trkpt) {
        Double lat = number(trkpt.getAttribute("lat"));
        Double lon = number(trkpt.getAttribute("lon"));
        Instant t = ExifTime.parse(childText(trkpt, "time"));
        if (lat == null || lon == null || t == null) {
            return null;
        }
        return new GpsPoint(t, lat, lon, number(childText(trkpt, "ele")), number(childText(trkpt, "course")));
    }

    private static String childText(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && localName.equals(n.getLocalName())) {
                return n.getTextContent().trim();
            }
        }
        return null;
    }

    private static Double number(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        try {
            double v = Double.parseDouble(s.trim());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
