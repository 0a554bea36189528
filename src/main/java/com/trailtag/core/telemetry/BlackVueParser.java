package com.trailtag.core.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trailtag.core.error.ParseException;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Track;
import com.trailtag.core.mp4.Mp4BoxReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BlackVue: NMEA в боксе free/"gps ", строки вида "[1623057074211]$GPGGA,...".
 *
 * Метка в скобках - часы камеры (мс), идут в локальном времени. Сдвиг до UTC считается по RMC
 * (дата+время минус часы камеры), без RMC - по времени суток GGA/GLL, приведённому к ±12 ч.
 * Тип точек по приоритету: RMC, GGA, GLL. Модель камеры из free/cprt.
 */
public final class BlackVueParser implements TelemetryParser {
    private static final Logger log = LoggerFactory.getLogger(BlackVueParser.class);

    public static final String MAKE = "BlackVue";

    private static final Pattern LINE = Pattern.compile("^\\s*\\[(\\d+)]\\s*(\\$\\w{5}[^\\[]*)");
    private static final long DAY_MS = 24L * 3600 * 1000;
    private static final ObjectMapper JSON = new ObjectMapper();

    /** Фиксация с меткой часов камеры. */
    record Stamped(long cameraMs, NmeaFix fix) {
    }

    @Override
    public TelemetryData parse(Path file) throws ParseException {
        ByteBuffer gps = null;
        ByteBuffer cprt = null;
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            for (Mp4BoxReader.BoxHeader h : Mp4BoxReader.scanTopLevel(raf)) {
                if (!"free".equals(h.type())) {
                    continue;
                }
                ByteBuffer free = Mp4BoxReader.readPayload(raf, h);
                for (Mp4BoxReader.Box b : Mp4BoxReader.children(free)) {
                    if ("gps ".equals(b.type()) && gps == null) {
                        gps = b.payload();
                    } else if ("cprt".equals(b.type()) && cprt == null) {
                        cprt = b.payload();
                    }
                }
                if (gps != null) {
                    break;
                }
            }
        } catch (IOException e) {
            throw new ParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        if (gps == null) {
            throw new ParseException("No BlackVue GPS box found in " + file.getFileName());
        }
        Track track = toTrack(parseLines(text(gps)));
        if (track.isEmpty()) {
            throw new ParseException("No GPS points found in BlackVue data of " + file.getFileName());
        }
        String model = cprt == null ? null : cameraModel(text(cprt));
        log.debug("blackvue: {} points, model={} from {}", track.size(), model, file);
        return new TelemetryData(track, MAKE, model);
    }

    static List<Stamped> parseLines(String data) {
        List<Stamped> out = new ArrayList<>();
        for (String line : data.split("\\r?\\n|\\r")) {
            Matcher m = LINE.matcher(line);
            if (!m.find()) {
                continue;
            }
            try {
                NmeaSentence s = NmeaSentence.parse(m.group(2));
                NmeaFix fix = s == null ? null : NmeaFix.of(s);
                if (fix != null && fix.time() != null) {
                    out.add(new Stamped(Long.parseLong(m.group(1)), fix));
                }
            } catch (ParseException | NumberFormatException e) {
                log.trace("skip BlackVue line '{}': {}", line, e.getMessage());
            }
        }
        return out;
    }

    static Track toTrack(List<Stamped> lines) {
        List<Stamped> rmc = ofType(lines, "RMC");
        List<Stamped> chosen = !rmc.isEmpty() ? rmc : ofType(lines, "GGA");
        if (chosen.isEmpty()) {
            chosen = ofType(lines, "GLL");
        }
        if (chosen.isEmpty()) {
            return Track.empty();
        }
        long offsetMs = offsetMs(rmc.isEmpty() ? chosen : rmc);
        List<GpsPoint> points = new ArrayList<>(chosen.size());
        for (Stamped s : chosen) {
            NmeaFix f = s.fix();
            Instant t = Instant.ofEpochMilli(s.cameraMs() + offsetMs);
            points.add(new GpsPoint(t, f.lat(), f.lon(), f.alt(), f.course()));
        }
        return Track.of(points);
    }

    private static List<Stamped> ofType(List<Stamped> lines, String type) {
        List<Stamped> out = new ArrayList<>();
        for (Stamped s : lines) {
            if (type.equals(s.fix().type())) {
                out.add(s);
            }
        }
        return out;
    }

    /** Сдвиг часов камеры до UTC по первой фиксации. */
    static long offsetMs(List<Stamped> lines) {
        Stamped first = lines.get(0);
        NmeaFix f = first.fix();
        if (f.date() != null) {
            long utcMs = f.date().atTime(f.time()).toInstant(ZoneOffset.UTC).toEpochMilli();
            return utcMs - first.cameraMs();
        }
        long gpsOfDay = f.time().toNanoOfDay() / 1_000_000L;
        long camOfDay = Math.floorMod(first.cameraMs(), DAY_MS);
        long diff = gpsOfDay - camOfDay;
        // к диапазону [-12 ч, 12 ч]
        if (diff > DAY_MS / 2) {
            diff -= DAY_MS;
        } else if (diff < -DAY_MS / 2) {
            diff += DAY_MS;
        }
        return diff;
    }

    /** cprt: JSON с полем model или строка "vendor;model;version;...". */
    static String cameraModel(String cprt) {
        String s = cprt.replace("\u0000", "").trim();
        if (s.isEmpty()) {
            return null;
        }
        if (s.startsWith("{")) {
            try {
                JsonNode node = JSON.readTree(s);
                JsonNode model = node.get("model");
                if (model != null && !model.asText().isBlank()) {
                    return model.asText().trim();
                }
                return null;
            } catch (JsonProcessingException e) {
                log.debug("cprt is not JSON: {}", e.getOriginalMessage());
            }
        }
        String[] fields = s.split(";");
        if (fields.length >= 2 && !fields[1].isBlank()) {
            return fields[1].trim();
        }
        return null;
    }

    private static String text(ByteBuffer b) {
        ByteBuffer d = b.duplicate();
        byte[] bytes = new byte[d.remaining()];
        d.get(bytes);
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }
}
