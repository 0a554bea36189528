package com.trailtag.core.mp4;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Сборка минимальных MP4 для тестов: ftyp, mdat с отсчётами, moov с одним треком. */
public final class Mp4Fixture {

    private Mp4Fixture() {
        // no-op
    }

    public static byte[] box(String type, byte[]... parts) {
        byte[] body = concat(parts);
        ByteBuffer b = ByteBuffer.allocate(8 + body.length);
        b.putInt(8 + body.length);
        b.put(type.getBytes(StandardCharsets.ISO_8859_1));
        b.put(body);
        return b.array();
    }

    public static byte[] fullBox(String type, byte[]... parts) {
        return box(type, concat(new byte[4], concat(parts)));
    }

    public static byte[] ints(long... values) {
        ByteBuffer b = ByteBuffer.allocate(4 * values.length);
        for (long v : values) {
            b.putInt((int) v);
        }
        return b.array();
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            out.writeBytes(p);
        }
        return out.toByteArray();
    }

    /**
     * Файл с одним треком формата format: все отсчёты в одном чанке,
     * каждый длительностью sampleDelta в шкале timescale. mp4Created - секунды от 1904 года.
     */
    public static byte[] movie(long mp4Created, long timescale, String format, List<byte[]> samples,
                               long sampleDelta, byte[] extraMoov) {
        byte[] ftyp = box("ftyp", "isom".getBytes(StandardCharsets.ISO_8859_1), ints(0));
        byte[] mdat = box("mdat", samples.toArray(new byte[0][]));
        long firstOffset = ftyp.length + 8L;

        long[] sizes = new long[samples.size() + 2];
        sizes[0] = 0;
        sizes[1] = samples.size();
        for (int i = 0; i < samples.size(); i++) {
            sizes[i + 2] = samples.get(i).length;
        }

        byte[] stbl = box("stbl",
                fullBox("stsd", ints(1), box(format, new byte[8])),
                fullBox("stts", ints(1, samples.size(), sampleDelta)),
                fullBox("stsc", ints(1, 1, samples.size(), 1)),
                fullBox("stsz", ints(sizes)),
                fullBox("stco", ints(1, firstOffset)));
        byte[] trak = box("trak",
                box("mdia",
                        fullBox("mdhd", ints(0, 0, timescale, sampleDelta * samples.size(), 0)),
                        fullBox("hdlr", ints(0), "meta".getBytes(StandardCharsets.ISO_8859_1), new byte[13]),
                        box("minf", stbl)));
        byte[] mvhd = fullBox("mvhd", ints(mp4Created, mp4Created, timescale, sampleDelta * samples.size()),
                new byte[80]);
        byte[] moov = box("moov", mvhd, trak, extraMoov == null ? new byte[0] : extraMoov);
        return concat(ftyp, mdat, moov);
    }

    /**
     * Переписать 32-битное поле бокса boxType в готовом файле: fieldOffset считается
     * от начала payload'а (сразу после типа).
     */
    public static byte[] patch(byte[] file, String boxType, int fieldOffset, int value) {
        byte[] type = boxType.getBytes(StandardCharsets.ISO_8859_1);
        for (int i = 4; i + 4 <= file.length; i++) {
            if (file[i] == type[0] && file[i + 1] == type[1] && file[i + 2] == type[2] && file[i + 3] == type[3]) {
                byte[] out = file.clone();
                ByteBuffer.wrap(out).putInt(i + 4 + fieldOffset, value);
                return out;
            }
        }
        throw new IllegalArgumentException("box '" + boxType + "' not found");
    }

    /** Секунды от 1904-01-01 для момента UTC в секундах от 1970. */
    public static long mp4Seconds(long epochSeconds) {
        return epochSeconds + Mp4Movie.MP4_EPOCH_OFFSET;
    }
}
