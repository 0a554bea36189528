package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Элемент GPMF (GoPro Metadata Format): FourCC, тип, размер структуры, число повторов, данные.
 * Данные выровнены на 4 байта. Тип 0 означает вложенный список элементов.
 */
public record GpmfKlv(String key, char type, int structSize, int repeat, ByteBuffer data, List<GpmfKlv> children) {

    public static final char NESTED = '\0';
    public static final char COMPLEX = '?';

    public GpmfKlv {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean isNested() {
        return type == NESTED;
    }

    public static List<GpmfKlv> parse(ByteBuffer buf) throws ParseException {
        ByteBuffer b = buf.duplicate();
        List<GpmfKlv> out = new ArrayList<>();
        try {
            while (b.remaining() >= 8) {
                byte[] k = new byte[4];
                b.get(k);
                if (k[0] == 0 && k[1] == 0 && k[2] == 0 && k[3] == 0) {
                    break; // хвостовое выравнивание
                }
                char type = (char) (b.get() & 0xFF);
                int structSize = b.get() & 0xFF;
                int repeat = b.getShort() & 0xFFFF;
                int len = structSize * repeat;
                if (len > b.remaining()) {
                    throw new ParseException("GPMF element " + new String(k, StandardCharsets.ISO_8859_1)
                            + " exceeds buffer: " + len + " > " + b.remaining());
                }
                ByteBuffer data = b.slice();
                data.limit(len);
                int padded = (len + 3) & ~3;
                b.position(b.position() + Math.min(padded, b.remaining()));

                List<GpmfKlv> children = type == NESTED ? parse(data) : List.of();
                out.add(new GpmfKlv(new String(k, StandardCharsets.ISO_8859_1), type, structSize, repeat,
                        data, children));
            }
        } catch (BufferUnderflowException e) {
            throw new ParseException("Truncated GPMF data", e);
        }
        return out;
    }

    /** Размер значения для типа GPMF, -1 для неизвестного. */
    static int sizeOf(char t) {
        switch (t) {
            case 'b': case 'B': case 'c':
                return 1;
            case 's': case 'S':
                return 2;
            case 'f': case 'F': case 'l': case 'L': case 'q':
                return 4;
            case 'd': case 'j': case 'J': case 'Q':
                return 8;
            case 'G': case 'U':
                return 16;
            default:
                return -1;
        }
    }

    /** Строковое значение (для 'c', 'U'): байты без нулевого хвоста. */
    public String text() {
        ByteBuffer d = data.duplicate();
        byte[] bytes = new byte[d.remaining()];
        d.get(bytes);
        int end = bytes.length;
        while (end > 0 && bytes[end - 1] == 0) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    /** Числовые значения по структурам, типы элементов повторяют type элемента. */
    public List<double[]> numbers() throws ParseException {
        int size = sizeOf(type);
        if (size <= 0 || type == 'c' || type == 'U' || type == 'G' || type == 'F') {
            throw new ParseException("GPMF element " + key + " is not numeric: type '" + type + "'");
        }
        if (structSize % size != 0) {
            throw new ParseException("GPMF element " + key + ": struct size " + structSize
                    + " is not a multiple of " + size);
        }
        return numbers(String.valueOf(type).repeat(structSize / size));
    }

    /** Числовые значения по структурам для составного типа (описание из TYPE). */
    public List<double[]> numbers(String types) throws ParseException {
        int total = 0;
        for (int i = 0; i < types.length(); i++) {
            int s = sizeOf(types.charAt(i));
            if (s <= 0) {
                throw new ParseException("Unknown GPMF type '" + types.charAt(i) + "' in " + key);
            }
            total += s;
        }
        if (total != structSize) {
            throw new ParseException("GPMF element " + key + ": types " + types + " need " + total
                    + " bytes, struct size is " + structSize);
        }
        ByteBuffer d = data.duplicate();
        List<double[]> out = new ArrayList<>(repeat);
        try {
            for (int r = 0; r < repeat; r++) {
                double[] row = new double[types.length()];
                for (int i = 0; i < types.length(); i++) {
                    row[i] = readNumber(d, types.charAt(i));
                }
                out.add(row);
            }
        } catch (BufferUnderflowException e) {
            throw new ParseException("Truncated GPMF element " + key, e);
        }
        return out;
    }

    public double firstNumber() throws ParseException {
        List<double[]> rows = numbers();
        if (rows.isEmpty() || rows.get(0).length == 0) {
            throw new ParseException("GPMF element " + key + " is empty");
        }
        return rows.get(0)[0];
    }

    private static double readNumber(ByteBuffer d, char t) throws ParseException {
        switch (t) {
            case 'b':
                return d.get();
            case 'B':
                return d.get() & 0xFF;
            case 's':
                return d.getShort();
            case 'S':
                return d.getShort() & 0xFFFF;
            case 'l':
                return d.getInt();
            case 'L':
                return Integer.toUnsignedLong(d.getInt());
            case 'f':
                return d.getFloat();
            case 'd':
                return d.getDouble();
            case 'j':
                return d.getLong();
            case 'J':
                return unsignedToDouble(d.getLong());
            case 'q':
                return d.getInt() / 65536.0;
            case 'Q':
                return d.getLong() / 4294967296.0;
            default:
                throw new ParseException("Non-numeric GPMF type '" + t + "'");
        }
    }

    private static double unsignedToDouble(long v) {
        double d = (double) (v >>> 1) * 2.0;
        return d + (v & 1L);
    }
}
