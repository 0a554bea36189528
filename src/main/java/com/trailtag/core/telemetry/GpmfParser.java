package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Track;
import com.trailtag.core.mp4.Mp4BoxReader;
import com.trailtag.core.mp4.Mp4Movie;
import com.trailtag.core.mp4.Mp4Sample;
import com.trailtag.core.mp4.Mp4Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GoPro: GPS из GPMF-трека (описание "gpmd") внутри MP4.
 *
 * DEVC → STRM; в каждом STRM сначала GPS9, затем GPS5. Значения делятся на SCAL
 * (любой ноль в SCAL - поток пропускается). Время точки: время отсчёта + доля длительности.
 * Абсолютное время берётся из GPSU/GPS9 с заполнением вперёд и назад, иначе от времени создания mvhd.
 * Точки разных устройств (DVID) не смешиваются, используется первое устройство.
 */
public final class GpmfParser implements TelemetryParser {
    private static final Logger log = LoggerFactory.getLogger(GpmfParser.class);

    public static final String MAKE = "GoPro";

    // DVID - uint32, значение по умолчанию заведомо больше
    private static final long DEFAULT_DEVICE_ID = 1L << 32;
    private static final Instant EPOCH_2000 = Instant.parse("2000-01-01T00:00:00Z");
    private static final DateTimeFormatter GPSU_FORMAT =
            DateTimeFormatter.ofPattern("yyMMddHHmmss.SSS", Locale.ROOT);

    private final GpsNoiseFilter noiseFilter;

    public GpmfParser() {
        this(new GpsNoiseFilter());
    }

    public GpmfParser(GpsNoiseFilter noiseFilter) {
        this.noiseFilter = noiseFilter;
    }

    @Override
    public TelemetryData parse(Path file) throws ParseException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            Mp4Movie movie = Mp4Movie.read(raf, Mp4BoxReader.scanTopLevel(raf));
            for (Mp4Track track : movie.tracks()) {
                if (!track.hasFormat("gpmd")) {
                    continue;
                }
                Map<Long, String> deviceNames = new LinkedHashMap<>();
                List<GpmfPoint> points = extractPoints(raf, track.samplesOf("gpmd"), deviceNames);
                if (points.isEmpty()) {
                    continue;
                }
                points = noiseFilter.filter(points);
                if (points.isEmpty()) {
                    throw new ParseException("All GoPro GPS points were filtered out as noise");
                }
                Track t = toTrack(points, movie.creationTime());
                log.debug("gopro: {} points from {}", t.size(), file);
                return new TelemetryData(t, MAKE, cameraModel(deviceNames));
            }
        } catch (IOException e) {
            throw new ParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        throw new ParseException("No GoPro GPS data found in " + file.getFileName());
    }

    List<GpmfPoint> extractPoints(RandomAccessFile raf, List<Mp4Sample> samples,
                                  Map<Long, String> deviceNames) throws ParseException {
        Map<Long, List<GpmfPoint>> byDevice = new LinkedHashMap<>();
        for (Mp4Sample sample : samples) {
            byte[] bytes = Mp4BoxReader.readBytes(raf, sample.offset(), sample.size());
            for (GpmfKlv devc : GpmfKlv.parse(ByteBuffer.wrap(bytes))) {
                if (!"DEVC".equals(devc.key())) {
                    continue;
                }
                long deviceId = deviceId(devc.children());
                for (GpmfKlv klv : devc.children()) {
                    if ("DVNM".equals(klv.key())) {
                        deviceNames.put(deviceId, klv.text());
                    }
                }
                List<GpmfPoint> sp = firstGpsStream(devc.children());
                if (sp.isEmpty()) {
                    continue;
                }
                double step = sample.duration() / sp.size();
                // GPSU у GPS5 один на весь отсчёт и относится к первой точке
                boolean sharedEpoch = sp.size() > 1 && sp.get(0).epochTime() != null
                        && sp.get(0).epochTime().equals(sp.get(sp.size() - 1).epochTime());
                List<GpmfPoint> target = byDevice.computeIfAbsent(deviceId, k -> new ArrayList<>());
                for (int i = 0; i < sp.size(); i++) {
                    GpmfPoint p = sp.get(i).withTime(sample.time() + step * i);
                    if (sharedEpoch) {
                        p = p.withEpochTime(p.epochTime() + step * i);
                    }
                    target.add(p);
                }
            }
        }
        if (byDevice.isEmpty()) {
            return List.of();
        }
        List<GpmfPoint> points = byDevice.values().iterator().next();
        backfillEpoch(points);
        return points;
    }

    /** DVID бывает числом или FourCC. */
    static long deviceId(List<GpmfKlv> device) throws ParseException {
        for (GpmfKlv klv : device) {
            if ("DVID".equals(klv.key())) {
                if (klv.type() == 'F' || klv.type() == 'c') {
                    return Integer.toUnsignedLong(klv.text().hashCode());
                }
                return (long) klv.firstNumber();
            }
        }
        return DEFAULT_DEVICE_ID;
    }

    static List<GpmfPoint> firstGpsStream(List<GpmfKlv> device) throws ParseException {
        for (GpmfKlv klv : device) {
            if (!"STRM".equals(klv.key())) {
                continue;
            }
            List<GpmfPoint> points = gps9(klv.children());
            if (!points.isEmpty()) {
                return points;
            }
            points = gps5(klv.children());
            if (!points.isEmpty()) {
                return points;
            }
        }
        return List.of();
    }

    private static Map<String, GpmfKlv> index(List<GpmfKlv> stream) {
        Map<String, GpmfKlv> out = new LinkedHashMap<>();
        for (GpmfKlv k : stream) {
            out.put(k.key(), k);
        }
        return out;
    }

    /** Делители из SCAL, null если среди них есть ноль. */
    private static double[] scales(GpmfKlv scal) throws ParseException {
        List<double[]> rows = scal.numbers();
        List<Double> flat = new ArrayList<>();
        for (double[] row : rows) {
            for (double v : row) {
                flat.add(v);
            }
        }
        if (flat.isEmpty()) {
            return null;
        }
        double[] out = new double[flat.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = flat.get(i);
            if (out[i] == 0) {
                return null;
            }
        }
        return out;
    }

    /** Масштаб для i-го поля; один SCAL на все поля тоже допустим. */
    private static double scaleAt(double[] scales, int i) {
        return scales.length == 1 ? scales[0] : (i < scales.length ? scales[i] : 1.0);
    }

    static List<GpmfPoint> gps5(List<GpmfKlv> stream) throws ParseException {
        Map<String, GpmfKlv> idx = index(stream);
        GpmfKlv gps5 = idx.get("GPS5");
        GpmfKlv scal = idx.get("SCAL");
        if (gps5 == null || scal == null) {
            return List.of();
        }
        double[] s = scales(scal);
        if (s == null) {
            return List.of();
        }
        Integer fix = idx.containsKey("GPSF") ? (int) idx.get("GPSF").firstNumber() : null;
        Double precision = idx.containsKey("GPSP") ? idx.get("GPSP").firstNumber() : null;
        Double epoch = null;
        if (idx.containsKey("GPSU")) {
            epoch = parseGpsu(idx.get("GPSU").text());
        }

        List<GpmfPoint> out = new ArrayList<>();
        for (double[] v : gps5.numbers()) {
            if (v.length < 5) {
                throw new ParseException("GPS5 sample has " + v.length + " values");
            }
            double lat = v[0] / scaleAt(s, 0);
            double lon = v[1] / scaleAt(s, 1);
            double alt = v[2] / scaleAt(s, 2);
            double speed2d = v[3] / scaleAt(s, 3);
            out.add(new GpmfPoint(0, epoch, lat, lon, alt, fix, precision, speed2d));
        }
        return out;
    }

    static List<GpmfPoint> gps9(List<GpmfKlv> stream) throws ParseException {
        Map<String, GpmfKlv> idx = index(stream);
        GpmfKlv gps9 = idx.get("GPS9");
        GpmfKlv scal = idx.get("SCAL");
        if (gps9 == null || scal == null) {
            return List.of();
        }
        double[] s = scales(scal);
        if (s == null) {
            return List.of();
        }
        GpmfKlv typeKlv = idx.get("TYPE");
        if (typeKlv == null) {
            return List.of();
        }
        String types = typeKlv.text();
        if (types.length() != 9) {
            throw new ParseException("GPS9 complex type must have 9 fields, got '" + types + "'");
        }

        List<GpmfPoint> out = new ArrayList<>();
        for (double[] raw : gps9.numbers(types)) {
            double[] v = new double[9];
            for (int i = 0; i < 9; i++) {
                v[i] = raw[i] / scaleAt(s, i);
            }
            double epoch = EPOCH_2000.getEpochSecond() + v[5] * 86400.0 + v[6];
            out.add(new GpmfPoint(0, epoch, v[0], v[1], v[2], (int) v[8], v[7] * 100, v[3]));
        }
        return out;
    }

    /** GPSU: "yymmddhhmmss.sss" в UTC. */
    static Double parseGpsu(String text) {
        try {
            LocalDateTime dt = LocalDateTime.parse(text.trim(), GPSU_FORMAT);
            Instant i = dt.toInstant(ZoneOffset.UTC);
            return i.getEpochSecond() + i.getNano() / 1e9;
        } catch (DateTimeParseException e) {
            log.debug("bad GPSU '{}': {}", text, e.getMessage());
            return null;
        }
    }

    /** Заполнить epochTime вперёд, затем назад от первой точки, где он известен. */
    static void backfillEpoch(List<GpmfPoint> points) {
        fill(points, false);
        fill(points, true);
    }

    private static void fill(List<GpmfPoint> points, boolean reverse) {
        int n = points.size();
        GpmfPoint last = null;
        for (int k = 0; k < n; k++) {
            int i = reverse ? n - 1 - k : k;
            GpmfPoint p = points.get(i);
            if (last == null) {
                if (p.epochTime() != null) {
                    last = p;
                }
                continue;
            }
            if (p.epochTime() == null) {
                p = p.withEpochTime(last.epochTime() + (p.time() - last.time()));
                points.set(i, p);
            }
            last = p;
        }
    }

    private static Track toTrack(List<GpmfPoint> points, Instant creation) throws ParseException {
        List<GpsPoint> out = new ArrayList<>(points.size());
        for (GpmfPoint p : points) {
            Instant t;
            if (p.epochTime() != null) {
                t = ofSeconds(p.epochTime());
            } else {
                Instant base = creation != null ? creation : Instant.EPOCH;
                t = base.plusNanos(Math.round(p.time() * 1e9));
            }
            out.add(new GpsPoint(t, p.lat(), p.lon(), p.alt(), null));
        }
        return Track.of(out);
    }

    static Instant ofSeconds(double epochSeconds) throws ParseException {
        if (!(epochSeconds >= Instant.MIN.getEpochSecond() && epochSeconds <= Instant.MAX.getEpochSecond())) {
            throw new ParseException("GoPro GPS time out of range: " + epochSeconds);
        }
        long sec = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - sec) * 1e9);
        return Instant.ofEpochSecond(sec, nanos);
    }

    /** Имя камеры из DVNM: сначала содержащие "hero", затем "gopro". */
    static String cameraModel(Map<Long, String> deviceNames) {
        List<String> names = new ArrayList<>();
        for (String n : deviceNames.values()) {
            if (n != null && !n.isBlank()) {
                names.add(n.trim());
            }
        }
        if (names.isEmpty()) {
            return null;
        }
        names.sort(null);
        for (String n : names) {
            if (n.toLowerCase(Locale.ROOT).contains("hero")) {
                return n;
            }
        }
        for (String n : names) {
            if (n.toLowerCase(Locale.ROOT).contains("gopro")) {
                return n;
            }
        }
        return names.get(0);
    }
}
