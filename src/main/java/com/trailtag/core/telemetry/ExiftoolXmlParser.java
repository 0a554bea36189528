package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.exif.ExifTime;
import com.trailtag.core.exif.ExiftoolXml;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * GPS-трек видео из вывода exiftool -X -ee.
 *
 * Порядок: теги QuickTime (GPSDateTime + координаты), затем Insta360, затем отсчёты
 * Track1..Track10 (SampleTime/SampleDuration, точки внутри отсчёта делят его длительность поровну).
 * Время отсчётов относительное, оно привязывается к первому TrackN:GPSDateTime или к QuickTime:CreateDate.
 */
public class ExiftoolXmlParser implements TelemetryParser {
    private static final Logger log = LoggerFactory.getLogger(ExiftoolXmlParser.class);

    static final int MAX_TRACK_ID = 10;

    private final GpsNoiseFilter noiseFilter;

    public ExiftoolXmlParser() {
        this(new GpsNoiseFilter());
    }

    public ExiftoolXmlParser(GpsNoiseFilter noiseFilter) {
        this.noiseFilter = noiseFilter;
    }

    @Override
    public TelemetryData parse(Path xml) throws ParseException {
        List<ExiftoolXml.Description> descriptions = ExiftoolXml.parse(xml);
        if (descriptions.isEmpty()) {
            throw new ParseException("No rdf:Description in " + xml.getFileName());
        }
        ParseException last = null;
        for (ExiftoolXml.Description d : descriptions) {
            try {
                return extract(d);
            } catch (ParseException e) {
                last = e;
            }
        }
        throw last;
    }

    /** Трек и камера из одного описания. */
    public TelemetryData extract(ExiftoolXml.Description d) throws ParseException {
        List<GpsPoint> points = quickTime(d, "QuickTime");
        if (points.isEmpty()) {
            points = quickTime(d, "Insta360");
        }
        if (points.isEmpty()) {
            points = sampledTracks(d);
        }
        if (points.isEmpty()) {
            throw new ParseException("No GPS track found in exiftool output"
                    + (d.about() != null ? " for " + d.about() : ""));
        }
        String[] camera = camera(d);
        return new TelemetryData(Track.of(points), camera[0], camera[1]);
    }

    static List<GpsPoint> quickTime(ExiftoolXml.Description d, String ns) throws ParseException {
        if (!d.hasAll(ns + ":GPSDateTime", ns + ":GPSLongitude", ns + ":GPSLatitude")) {
            return List.of();
        }
        List<String> times = d.all(ns + ":GPSDateTime");
        List<String> lons = d.all(ns + ":GPSLongitude");
        List<String> lats = d.all(ns + ":GPSLatitude");
        if (lons.size() != lats.size()) {
            throw new ParseException("Found different number of longitudes " + lons.size()
                    + " and latitudes " + lats.size());
        }
        if (times.size() != lats.size()) {
            throw new ParseException("Found different number of timestamps " + times.size()
                    + " and coordinates " + lats.size());
        }
        List<String> alts = d.all(ns + ":GPSAltitude");
        List<String> tracks = d.all(ns + ":GPSTrack");

        List<GpsPoint> out = new ArrayList<>();
        for (int i = 0; i < lats.size(); i++) {
            Instant t = ExifTime.parse(times.get(i));
            Double lat = number(lats.get(i));
            Double lon = number(lons.get(i));
            if (t == null || lat == null || lon == null) {
                continue;
            }
            out.add(new GpsPoint(t, lat, lon, at(alts, i), at(tracks, i)));
        }
        return dedupe(out);
    }

    /** Один отсчёт TrackN: время, длительность и координаты внутри. */
    private static final class Sample {
        double time;
        Double duration;
        final List<String> lons = new ArrayList<>();
        final List<String> lats = new ArrayList<>();
        final List<String> alts = new ArrayList<>();
        final List<String> tracks = new ArrayList<>();
        final List<String> speeds = new ArrayList<>();
        String fix;
        String precision;
    }

    List<GpsPoint> sampledTracks(ExiftoolXml.Description d) throws ParseException {
        for (int id = 1; id <= MAX_TRACK_ID; id++) {
            String ns = "Track" + id;
            if (!d.hasAll(ns + ":SampleTime", ns + ":SampleDuration", ns + ":GPSLongitude", ns + ":GPSLatitude")) {
                continue;
            }
            List<GpmfPoint> points = new ArrayList<>();
            Map<GpmfPoint, Double> headings = new IdentityHashMap<>();
            for (Sample s : samples(d, ns)) {
                if (s.lons.size() != s.lats.size()) {
                    throw new ParseException(ns + ": found different number of longitudes " + s.lons.size()
                            + " and latitudes " + s.lats.size());
                }
                int n = s.lats.size();
                if (n == 0 || s.duration == null) {
                    continue;
                }
                Integer fix = integer(s.fix);
                Double hpe = number(s.precision);
                Double precision = hpe == null ? null : hpe * 100;
                double step = s.duration / n;
                for (int i = 0; i < n; i++) {
                    Double lat = number(s.lats.get(i));
                    Double lon = number(s.lons.get(i));
                    if (lat == null || lon == null) {
                        continue;
                    }
                    GpmfPoint p = new GpmfPoint(s.time + step * i, null, lat, lon, at(s.alts, i),
                            fix, precision, at(s.speeds, i));
                    points.add(p);
                    headings.put(p, at(s.tracks, i));
                }
            }
            if (points.isEmpty()) {
                continue;
            }
            points.sort(Comparator.comparingDouble(GpmfPoint::time));
            points = noiseFilter.filter(points);
            if (points.isEmpty()) {
                continue;
            }
            Instant anchor = anchor(d, ns, points.get(0).time());
            List<GpsPoint> out = new ArrayList<>(points.size());
            for (GpmfPoint p : points) {
                out.add(new GpsPoint(anchor.plusNanos(Math.round(p.time() * 1e9)), p.lat(), p.lon(), p.alt(),
                        headings.get(p)));
            }
            log.debug("exiftool: {} points from {}", out.size(), ns);
            return dedupe(out);
        }
        return List.of();
    }

    private static List<Sample> samples(ExiftoolXml.Description d, String ns) {
        List<Sample> out = new ArrayList<>();
        Sample cur = null;
        for (ExiftoolXml.Tag t : d.tags()) {
            if (!ns.equals(t.group())) {
                continue;
            }
            if ("SampleTime".equals(t.name())) {
                Double time = number(t.text());
                cur = time == null ? null : new Sample();
                if (cur != null) {
                    cur.time = time;
                    out.add(cur);
                }
                continue;
            }
            if (cur == null) {
                continue;
            }
            switch (t.name()) {
                case "SampleDuration":
                    cur.duration = number(t.text());
                    break;
                case "GPSLongitude":
                    cur.lons.add(t.text());
                    break;
                case "GPSLatitude":
                    cur.lats.add(t.text());
                    break;
                case "GPSAltitude":
                    cur.alts.add(t.text());
                    break;
                case "GPSTrack":
                    cur.tracks.add(t.text());
                    break;
                case "GPSSpeed":
                    cur.speeds.add(t.text());
                    break;
                case "GPSMeasureMode":
                    cur.fix = t.text();
                    break;
                case "GPSHPositioningError":
                    cur.precision = t.text();
                    break;
                default:
                    break;
            }
        }
        return out;
    }

    /** Момент, соответствующий нулю относительного времени отсчётов. */
    static Instant anchor(ExiftoolXml.Description d, String ns, double firstTime) {
        Instant gps = ExifTime.parse(d.first(ns + ":GPSDateTime"));
        if (gps != null) {
            return gps.minusNanos(Math.round(firstTime * 1e9));
        }
        Instant created = ExifTime.parse(d.first("QuickTime:CreateDate", "QuickTime:MediaCreateDate"));
        if (created != null) {
            return created;
        }
        log.debug("exiftool: no anchor time for {}, using epoch", ns);
        return Instant.EPOCH;
    }

    /** make/model: GoPro, затем Insta360, затем IFD0/UserData/Keys. */
    static String[] camera(ExiftoolXml.Description d) {
        String model = d.first("GoPro:Model");
        if (model != null) {
            String make = d.first("GoPro:Make");
            return new String[]{make != null ? make.trim() : GpmfParser.MAKE, model.trim()};
        }
        model = d.first("Insta360:Model");
        if (model != null) {
            String make = d.first("Insta360:Make");
            return new String[]{make != null ? make.trim() : "Insta360", model.trim()};
        }
        String make = d.first("IFD0:Make", "UserData:Make", "Keys:Make");
        model = d.first("IFD0:Model", "UserData:Model", "Keys:Model");
        return new String[]{make == null ? null : make.trim(), model == null ? null : model.trim()};
    }

    /** Убрать подряд идущие точки с одинаковыми временем и координатами, отсортировать. */
    static List<GpsPoint> dedupe(List<GpsPoint> points) {
        List<GpsPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(GpsPoint::time));
        List<GpsPoint> out = new ArrayList<>(sorted.size());
        for (GpsPoint p : sorted) {
            if (!out.isEmpty()) {
                GpsPoint prev = out.get(out.size() - 1);
                if (prev.time().equals(p.time()) && prev.lat() == p.lat() && prev.lon() == p.lon()) {
                    continue;
                }
            }
            out.add(p);
        }
        return out;
    }

    private static Double at(List<String> values, int i) {
        return i < values.size() ? number(values.get(i)) : null;
    }

    static Double number(String s) {
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

    private static Integer integer(String s) {
        Double v = number(s);
        return v == null ? null : v.intValue();
    }
}
