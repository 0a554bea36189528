package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Внешний NMEA-лог.
 *
 * Дата берётся из RMC и действует для последующих GGA (переход через полночь по скачку времени назад).
 * Позиции берутся из GGA с качеством фиксации ≥ 1, курс - из RMC с тем же временем.
 * Если GGA нет, используются сами RMC. Строки с неверной контрольной суммой пропускаются.
 */
public final class NmeaParser implements TelemetryParser {
    private static final Logger log = LoggerFactory.getLogger(NmeaParser.class);

    private static final int HALF_DAY_SECONDS = 12 * 3600;

    @Override
    public TelemetryData parse(Path file) throws ParseException {
        List<NmeaFix> fixes = new ArrayList<>();
        int rejected = 0;
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = r.readLine()) != null) {
                try {
                    NmeaSentence s = NmeaSentence.parse(line);
                    NmeaFix fix = s == null ? null : NmeaFix.of(s);
                    if (fix != null && fix.time() != null) {
                        fixes.add(fix);
                    }
                } catch (ParseException e) {
                    rejected++;
                    log.debug("skip NMEA line in {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        if (rejected > 0) {
            log.debug("nmea: {} rejected lines in {}", rejected, file.getFileName());
        }
        Track track = toTrack(fixes);
        if (track.isEmpty()) {
            throw new ParseException("No GPS points found in " + file.getFileName());
        }
        return TelemetryData.of(track);
    }

    /** Собрать трек из последовательности фиксаций в порядке файла. */
    static Track toTrack(List<NmeaFix> fixes) throws ParseException {
        LocalDate date = null;
        for (NmeaFix f : fixes) {
            if (f.date() != null) {
                date = f.date();
                break;
            }
        }
        if (date == null) {
            throw new ParseException("No date found in NMEA data: RMC sentences are required");
        }

        List<GpsPoint> gga = new ArrayList<>();
        List<GpsPoint> rmc = new ArrayList<>();
        Map<Instant, Double> courses = new HashMap<>();
        int prevSecond = -1;
        for (NmeaFix f : fixes) {
            int second = f.time().toSecondOfDay();
            if (f.date() != null) {
                date = f.date();
            } else if (prevSecond >= 0 && second + HALF_DAY_SECONDS < prevSecond) {
                date = date.plusDays(1);
            }
            prevSecond = second;

            Instant t = date.atTime(f.time()).toInstant(ZoneOffset.UTC);
            if ("RMC".equals(f.type())) {
                rmc.add(new GpsPoint(t, f.lat(), f.lon(), null, f.course()));
                if (f.course() != null) {
                    courses.put(t, f.course());
                }
            } else if ("GGA".equals(f.type())) {
                gga.add(new GpsPoint(t, f.lat(), f.lon(), f.alt(), null));
            }
        }
        if (gga.isEmpty()) {
            return Track.of(rmc);
        }
        List<GpsPoint> out = new ArrayList<>(gga.size());
        for (GpsPoint p : gga) {
            out.add(p.withHeading(courses.get(p.time())));
        }
        return Track.of(out);
    }
}
