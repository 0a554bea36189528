package com.trailtag.core.mp4;

import com.trailtag.core.error.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.RandomAccessFile;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Разобранный moov: время создания (mvhd), шкала фильма и треки.
 * Треки с битой таблицей отсчётов пропускаются с предупреждением.
 */
public final class Mp4Movie {
    private static final Logger log = LoggerFactory.getLogger(Mp4Movie.class);

    // секунды между 1904-01-01 и 1970-01-01
    static final long MP4_EPOCH_OFFSET = 2_082_844_800L;

    private final Instant creationTime;   // null если 0 в mvhd
    private final long timescale;
    private final List<Mp4Track> tracks;
    private final ByteBuffer moov;

    private Mp4Movie(Instant creationTime, long timescale, List<Mp4Track> tracks, ByteBuffer moov) {
        this.creationTime = creationTime;
        this.timescale = timescale;
        this.tracks = List.copyOf(tracks);
        this.moov = moov;
    }

    public Instant creationTime() { return creationTime; }
    public long timescale() { return timescale; }
    public List<Mp4Track> tracks() { return tracks; }

    /** Копия payload'а moov для поиска udta и прочего. */
    public ByteBuffer moov() {
        return moov.duplicate();
    }

    public static Mp4Movie read(RandomAccessFile raf, List<Mp4BoxReader.BoxHeader> topLevel) throws ParseException {
        Mp4BoxReader.BoxHeader moovHeader = null;
        for (Mp4BoxReader.BoxHeader h : topLevel) {
            if ("moov".equals(h.type())) {
                moovHeader = h;
                break;
            }
        }
        if (moovHeader == null) {
            throw new ParseException("moov box not found");
        }
        return parse(Mp4BoxReader.readPayload(raf, moovHeader));
    }

    public static Mp4Movie parse(ByteBuffer moov) throws ParseException {
        Instant creation = null;
        long movieTimescale = 0;
        List<Mp4Track> tracks = new ArrayList<>();
        try {
            for (Mp4BoxReader.Box b : Mp4BoxReader.children(moov)) {
                if ("mvhd".equals(b.type())) {
                    ByteBuffer p = b.payload();
                    int version = p.get() & 0xFF;
                    p.position(4);
                    long created;
                    if (version == 1) {
                        created = p.getLong();
                        p.getLong(); // modification
                    } else {
                        created = Integer.toUnsignedLong(p.getInt());
                        p.getInt();
                    }
                    movieTimescale = Integer.toUnsignedLong(p.getInt());
                    creation = creationTime(created);
                } else if ("trak".equals(b.type())) {
                    try {
                        parseTrack(b.data()).ifPresent(tracks::add);
                    } catch (ParseException e) {
                        log.debug("skip broken trak: {}", e.getMessage());
                    }
                }
            }
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            // IllegalArgumentException: position() за пределами короткого бокса
            throw new ParseException("Truncated mvhd", e);
        }
        return new Mp4Movie(creation, movieTimescale, tracks, moov.duplicate());
    }

    private static Optional<Mp4Track> parseTrack(ByteBuffer trak) throws ParseException {
        Optional<Mp4BoxReader.Box> mdhd = Mp4BoxReader.find(trak, "mdia", "mdhd");
        Optional<Mp4BoxReader.Box> stbl = Mp4BoxReader.find(trak, "mdia", "minf", "stbl");
        if (mdhd.isEmpty() || stbl.isEmpty()) {
            return Optional.empty();
        }
        try {
            ByteBuffer p = mdhd.get().payload();
            int version = p.get() & 0xFF;
            p.position(version == 1 ? 4 + 16 : 4 + 8);
            long timescale = Integer.toUnsignedLong(p.getInt());

            String handler = "";
            Optional<Mp4BoxReader.Box> hdlr = Mp4BoxReader.find(trak, "mdia", "hdlr");
            if (hdlr.isPresent()) {
                ByteBuffer h = hdlr.get().payload();
                h.position(8);
                byte[] t = new byte[4];
                h.get(t);
                handler = new String(t, StandardCharsets.ISO_8859_1);
            }

            List<EditEntry> edits = new ArrayList<>();
            Optional<Mp4BoxReader.Box> elst = Mp4BoxReader.find(trak, "edts", "elst");
            if (elst.isPresent()) {
                ByteBuffer e = elst.get().payload();
                int v = e.get() & 0xFF;
                e.position(4);
                long count = Integer.toUnsignedLong(e.getInt());
                if (count * (v == 1 ? 20 : 12) > e.remaining()) {
                    throw new ParseException("Inconsistent elst entry count " + count);
                }
                for (long i = 0; i < count; i++) {
                    long duration = v == 1 ? e.getLong() : Integer.toUnsignedLong(e.getInt());
                    long mediaTime = v == 1 ? e.getLong() : e.getInt();
                    double rate = e.getShort() + (e.getShort() & 0xFFFF) / 65536.0;
                    edits.add(new EditEntry(duration, mediaTime, rate));
                }
            }
            SampleTable table = SampleTable.parse(stbl.get().data(), timescale);
            return Optional.of(new Mp4Track(handler, timescale, table, edits));
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new ParseException("Truncated track header", e);
        }
    }

    /** null для нуля и для значений, которые не помещаются в Instant. */
    static Instant creationTime(long mp4Seconds) {
        if (mp4Seconds <= 0) {
            return null;
        }
        long epoch = mp4Seconds - MP4_EPOCH_OFFSET;
        if (epoch < Instant.MIN.getEpochSecond() || epoch > Instant.MAX.getEpochSecond()) {
            log.debug("creation time out of range: {}", mp4Seconds);
            return null;
        }
        return Instant.ofEpochSecond(epoch);
    }
}
