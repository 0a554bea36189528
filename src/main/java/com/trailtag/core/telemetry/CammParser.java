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
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CAMM (Camera Motion Metadata): трек с описанием "camm".
 *
 * Отсчёт: 2 байта резерва, тип uint16 LE, данные LE. Точки дают только типы 5 (минимальный GPS)
 * и 6 (полный GPS); если есть тип 6, тип 5 не используется. Время отсчёта переводится
 * на шкалу показа через elst и в абсолютное время от времени создания (mvhd).
 */
public final class CammParser implements TelemetryParser {
    private static final Logger log = LoggerFactory.getLogger(CammParser.class);

    static final int TYPE_ANGLE_AXIS = 0;
    static final int TYPE_EXPOSURE = 1;
    static final int TYPE_GYRO = 2;
    static final int TYPE_ACCELERATION = 3;
    static final int TYPE_POSITION = 4;
    static final int TYPE_MIN_GPS = 5;
    static final int TYPE_GPS = 6;
    static final int TYPE_MAGNETIC_FIELD = 7;

    @Override
    public TelemetryData parse(Path file) throws ParseException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            Mp4Movie movie = Mp4Movie.read(raf, Mp4BoxReader.scanTopLevel(raf));
            if (movie.creationTime() == null) {
                log.debug("camm: no creation time in {}, using epoch", file);
            }
            Instant base = movie.creationTime() != null ? movie.creationTime() : Instant.EPOCH;
            for (Mp4Track track : movie.tracks()) {
                if (!track.hasFormat("camm")) {
                    continue;
                }
                List<Mp4Sample> samples = track.applyEdits(track.samplesOf("camm"), movie.timescale());
                List<GpsPoint> gps = new ArrayList<>();
                List<GpsPoint> minGps = new ArrayList<>();
                for (Mp4Sample s : samples) {
                    byte[] bytes = Mp4BoxReader.readBytes(raf, s.offset(), s.size());
                    Instant t = base.plusNanos(Math.round(s.time() * 1e9));
                    decode(bytes, t, gps, minGps);
                }
                List<GpsPoint> points = gps.isEmpty() ? minGps : gps;
                if (points.isEmpty()) {
                    continue;
                }
                String[] camera = camera(movie.moov());
                return new TelemetryData(Track.of(points), camera[0], camera[1]);
            }
        } catch (IOException e) {
            throw new ParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        throw new ParseException("No CAMM GPS data found in " + file.getFileName());
    }

    /** Разобрать один отсчёт CAMM; не-GPS типы пропускаются. */
    static void decode(byte[] bytes, Instant t, List<GpsPoint> gps, List<GpsPoint> minGps) throws ParseException {
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        try {
            b.getShort(); // reserved
            int type = b.getShort() & 0xFFFF;
            switch (type) {
                case TYPE_MIN_GPS: {
                    double lat = b.getDouble();
                    double lon = b.getDouble();
                    double alt = b.getDouble();
                    minGps.add(new GpsPoint(t, lat, lon, alt, null));
                    break;
                }
                case TYPE_GPS: {
                    b.getDouble(); // time_gps_epoch
                    int fixType = b.getInt();
                    double lat = b.getDouble();
                    double lon = b.getDouble();
                    float alt = b.getFloat();
                    // далее h/v accuracy, скорости и точность скорости: не нужны
                    if (fixType != 0) {
                        gps.add(new GpsPoint(t, lat, lon, (double) alt, null));
                    }
                    break;
                }
                case TYPE_ANGLE_AXIS:
                case TYPE_EXPOSURE:
                case TYPE_GYRO:
                case TYPE_ACCELERATION:
                case TYPE_POSITION:
                case TYPE_MAGNETIC_FIELD:
                    break;
                default:
                    log.trace("unknown CAMM type {}", type);
                    break;
            }
        } catch (BufferUnderflowException e) {
            throw new ParseException("Truncated CAMM sample", e);
        } catch (IllegalArgumentException e) {
            throw new ParseException("Invalid CAMM GPS values: " + e.getMessage(), e);
        }
    }

    /** make/model из moov/udta: ©mak/©mod, @mak/@mod, затем manu/modl. */
    static String[] camera(ByteBuffer moov) throws ParseException {
        Optional<Mp4BoxReader.Box> udta = Mp4BoxReader.find(moov, "udta");
        if (udta.isEmpty()) {
            return new String[2];
        }
        String make = null;
        String model = null;
        for (Mp4BoxReader.Box b : Mp4BoxReader.children(udta.get().data())) {
            switch (b.type()) {
                case "©mak":
                case "@mak":
                    make = firstNonNull(make, quickTimeString(b.payload()));
                    break;
                case "©mod":
                case "@mod":
                    model = firstNonNull(model, quickTimeString(b.payload()));
                    break;
                case "manu":
                    make = firstNonNull(make, rawString(b.payload()));
                    break;
                case "modl":
                    model = firstNonNull(model, rawString(b.payload()));
                    break;
                default:
                    break;
            }
        }
        return new String[]{make, model};
    }

    /** Строка QuickTime udta: size uint16 BE, язык 2 байта, данные. */
    private static String quickTimeString(ByteBuffer p) {
        if (p.remaining() < 4) {
            return null;
        }
        int size = p.getShort() & 0xFFFF;
        p.getShort();
        int n = Math.min(size, p.remaining());
        byte[] bytes = new byte[n];
        p.get(bytes);
        return clean(new String(bytes, StandardCharsets.UTF_8));
    }

    private static String rawString(ByteBuffer p) {
        byte[] bytes = new byte[p.remaining()];
        p.get(bytes);
        return clean(new String(bytes, StandardCharsets.UTF_8));
    }

    private static String clean(String s) {
        String t = s.replace("\u0000", "").trim();
        return t.isEmpty() ? null : t;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
