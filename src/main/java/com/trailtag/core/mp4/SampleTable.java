package com.trailtag.core.mp4;

import com.trailtag.core.error.ParseException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Таблица отсчётов трека из stbl: описания (stsd) и отсчёты,
 * собранные из stsz, stco/co64, stsc и stts.
 */
public record SampleTable(List<SampleDescription> descriptions, List<Mp4Sample> samples) {

    // защита от мусорных счётчиков
    static final int MAX_ENTRIES = 10_000_000;

    /** Элемент stsd: формат (fourcc) и данные после заголовка. */
    public record SampleDescription(String format, ByteBuffer data) {
    }

    public SampleTable {
        descriptions = List.copyOf(descriptions);
        samples = List.copyOf(samples);
    }

    /** Формат описания для отсчёта, null если индекс мимо stsd. */
    public String formatOf(Mp4Sample s) {
        int idx = s.descriptionIndex() - 1;
        return idx >= 0 && idx < descriptions.size() ? descriptions.get(idx).format() : null;
    }

    public boolean hasFormat(String format) {
        for (SampleDescription d : descriptions) {
            if (d.format().equals(format)) {
                return true;
            }
        }
        return false;
    }

    public static SampleTable parse(ByteBuffer stbl, long timescale) throws ParseException {
        if (timescale <= 0) {
            throw new ParseException("Invalid track timescale: " + timescale);
        }
        try {
            List<SampleDescription> descriptions = List.of();
            long[] sizes = null;
            long[] chunkOffsets = null;
            long[][] stsc = null;
            long[] deltas = null;

            for (Mp4BoxReader.Box b : Mp4BoxReader.children(stbl)) {
                ByteBuffer p = b.payload();
                switch (b.type()) {
                    case "stsd":
                        descriptions = parseStsd(p);
                        break;
                    case "stsz":
                        sizes = parseStsz(p);
                        break;
                    case "stco":
                        chunkOffsets = parseChunkOffsets(p, false);
                        break;
                    case "co64":
                        chunkOffsets = parseChunkOffsets(p, true);
                        break;
                    case "stsc":
                        stsc = parseStsc(p);
                        break;
                    case "stts":
                        deltas = parseStts(p);
                        break;
                    default:
                        // ctts, stss и прочее не нужны для телеметрии
                        break;
                }
            }
            if (sizes == null || chunkOffsets == null || stsc == null) {
                return new SampleTable(descriptions, List.of());
            }
            return new SampleTable(descriptions, buildSamples(sizes, chunkOffsets, stsc, deltas, timescale));
        } catch (BufferUnderflowException e) {
            throw new ParseException("Truncated sample table", e);
        }
    }

    private static List<SampleDescription> parseStsd(ByteBuffer p) throws ParseException {
        p.getInt(); // version + flags
        long count = Integer.toUnsignedLong(p.getInt());
        checkCount(count, p.remaining(), 8, "stsd");
        List<SampleDescription> out = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            int start = p.position();
            long size = Integer.toUnsignedLong(p.getInt());
            byte[] f = new byte[4];
            p.get(f);
            if (size < 8 || start + size > p.limit()) {
                throw new ParseException("Invalid stsd entry size " + size);
            }
            ByteBuffer data = p.duplicate();
            data.position(start + 8);
            data.limit((int) (start + size));
            out.add(new SampleDescription(new String(f, StandardCharsets.ISO_8859_1), data.slice()));
            p.position((int) (start + size));
        }
        return out;
    }

    private static long[] parseStsz(ByteBuffer p) throws ParseException {
        p.getInt();
        long sampleSize = Integer.toUnsignedLong(p.getInt());
        long count = Integer.toUnsignedLong(p.getInt());
        if (sampleSize != 0) {
            if (count > MAX_ENTRIES) {
                throw new ParseException("Too many samples in stsz: " + count);
            }
            long[] out = new long[(int) count];
            Arrays.fill(out, sampleSize);
            return out;
        }
        checkCount(count, p.remaining(), 4, "stsz");
        long[] out = new long[(int) count];
        for (int i = 0; i < count; i++) {
            out[i] = Integer.toUnsignedLong(p.getInt());
        }
        return out;
    }

    private static long[] parseChunkOffsets(ByteBuffer p, boolean wide) throws ParseException {
        p.getInt();
        long count = Integer.toUnsignedLong(p.getInt());
        checkCount(count, p.remaining(), wide ? 8 : 4, wide ? "co64" : "stco");
        long[] out = new long[(int) count];
        for (int i = 0; i < count; i++) {
            out[i] = wide ? p.getLong() : Integer.toUnsignedLong(p.getInt());
        }
        return out;
    }

    private static long[][] parseStsc(ByteBuffer p) throws ParseException {
        p.getInt();
        long count = Integer.toUnsignedLong(p.getInt());
        checkCount(count, p.remaining(), 12, "stsc");
        long[][] out = new long[(int) count][3];
        for (int i = 0; i < count; i++) {
            out[i][0] = Integer.toUnsignedLong(p.getInt()); // first_chunk
            out[i][1] = Integer.toUnsignedLong(p.getInt()); // samples_per_chunk
            out[i][2] = Integer.toUnsignedLong(p.getInt()); // sample_description_index
        }
        return out;
    }

    private static long[] parseStts(ByteBuffer p) throws ParseException {
        p.getInt();
        long count = Integer.toUnsignedLong(p.getInt());
        checkCount(count, p.remaining(), 8, "stts");
        List<long[]> entries = new ArrayList<>();
        long total = 0;
        for (int i = 0; i < count; i++) {
            long n = Integer.toUnsignedLong(p.getInt());
            long delta = Integer.toUnsignedLong(p.getInt());
            total += n;
            if (total > MAX_ENTRIES) {
                throw new ParseException("Too many samples in stts: " + total);
            }
            entries.add(new long[]{n, delta});
        }
        long[] out = new long[(int) total];
        int k = 0;
        for (long[] e : entries) {
            for (long j = 0; j < e[0]; j++) {
                out[k++] = e[1];
            }
        }
        return out;
    }

    private static List<Mp4Sample> buildSamples(long[] sizes, long[] chunkOffsets, long[][] stsc,
                                                long[] deltas, long timescale) throws ParseException {
        List<Mp4Sample> out = new ArrayList<>(sizes.length);
        int sampleIdx = 0;
        long accumulated = 0;
        int entryIdx = 0;
        for (int c = 0; c < chunkOffsets.length && sampleIdx < sizes.length; c++) {
            long chunkNo = c + 1L;
            while (entryIdx + 1 < stsc.length && stsc[entryIdx + 1][0] <= chunkNo) {
                entryIdx++;
            }
            if (stsc.length == 0 || stsc[entryIdx][0] > chunkNo) {
                throw new ParseException("No stsc entry for chunk " + chunkNo);
            }
            long perChunk = stsc[entryIdx][1];
            int descIdx = (int) stsc[entryIdx][2];
            long offset = chunkOffsets[c];
            for (long s = 0; s < perChunk && sampleIdx < sizes.length; s++) {
                long size = sizes[sampleIdx];
                // stts короче числа отсчётов: недостающие дельты считаем нулевыми
                long delta = deltas != null && sampleIdx < deltas.length ? deltas[sampleIdx] : 0L;
                if (size > Integer.MAX_VALUE) {
                    throw new ParseException("Sample too large: " + size);
                }
                out.add(new Mp4Sample(offset, (int) size,
                        (double) accumulated / timescale, (double) delta / timescale, descIdx));
                offset += size;
                accumulated += delta;
                sampleIdx++;
            }
        }
        return out;
    }

    private static void checkCount(long count, int remaining, int entrySize, String box) throws ParseException {
        if (count > MAX_ENTRIES || count * entrySize > remaining) {
            throw new ParseException("Inconsistent entry count " + count + " in " + box);
        }
    }
}
