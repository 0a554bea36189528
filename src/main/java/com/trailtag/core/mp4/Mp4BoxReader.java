package com.trailtag.core.mp4;

import com.trailtag.core.error.ParseException;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Чтение ISO BMFF (MP4/MOV) боксов.
 *
 * Заголовок: size32 (BE) + type. size32 == 1: далее 64-битный размер;
 * size32 == 0: бокс до конца файла (только верхний уровень) или до конца родителя.
 * Тип читается как ISO-8859-1, поэтому 0xA9 'mak' даёт "©mak".
 */
public final class Mp4BoxReader {

    /** Верхний уровень читаем в память только до этого размера. */
    public static final int MAX_IN_MEMORY_BOX = 256 * 1024 * 1024;

    /** Заголовок бокса верхнего уровня в файле. */
    public record BoxHeader(String type, long offset, int headerSize, long size) {
        public long payloadOffset() {
            return offset + headerSize;
        }

        public long payloadSize() {
            return size - headerSize;
        }
    }

    /** Бокс в памяти: тип + payload без заголовка. */
    public record Box(String type, ByteBuffer data) {
        public ByteBuffer payload() {
            return data.duplicate();
        }
    }

    private Mp4BoxReader() {
        // no-op
    }

    public static List<BoxHeader> scanTopLevel(RandomAccessFile raf) throws ParseException {
        List<BoxHeader> out = new ArrayList<>();
        try {
            long fileLength = raf.length();
            long position = 0;
            byte[] header = new byte[16];
            while (position + 8 <= fileLength) {
                raf.seek(position);
                raf.readFully(header, 0, 8);
                long size = readUint32(header, 0);
                String type = new String(header, 4, 4, StandardCharsets.ISO_8859_1);
                int headerSize = 8;
                if (size == 1) {
                    if (position + 16 > fileLength) {
                        throw new ParseException("Truncated 64-bit box header at " + position);
                    }
                    raf.readFully(header, 8, 8);
                    size = ByteBuffer.wrap(header, 8, 8).getLong();
                    headerSize = 16;
                } else if (size == 0) {
                    size = fileLength - position;
                }
                if (size < headerSize || position + size > fileLength) {
                    // хвост обрезан: отдаём то, что успели прочитать
                    if (out.isEmpty()) {
                        throw new ParseException("Invalid box size " + size + " for '" + type + "' at " + position);
                    }
                    break;
                }
                out.add(new BoxHeader(type, position, headerSize, size));
                position += size;
            }
        } catch (IOException e) {
            throw new ParseException("Failed to read MP4 boxes: " + e.getMessage(), e);
        }
        if (out.isEmpty()) {
            throw new ParseException("No MP4 boxes found");
        }
        return out;
    }

    public static ByteBuffer readPayload(RandomAccessFile raf, BoxHeader h) throws ParseException {
        long n = h.payloadSize();
        if (n > MAX_IN_MEMORY_BOX) {
            throw new ParseException("Box '" + h.type() + "' too large: " + n + " bytes");
        }
        byte[] buf = new byte[(int) n];
        try {
            raf.seek(h.payloadOffset());
            raf.readFully(buf);
        } catch (IOException e) {
            throw new ParseException("Failed to read box '" + h.type() + "': " + e.getMessage(), e);
        }
        return ByteBuffer.wrap(buf);
    }

    public static byte[] readBytes(RandomAccessFile raf, long offset, int size) throws ParseException {
        if (size < 0 || size > MAX_IN_MEMORY_BOX) {
            throw new ParseException("Invalid sample size " + size + " at " + offset);
        }
        byte[] buf = new byte[size];
        try {
            if (offset < 0 || offset + size > raf.length()) {
                throw new ParseException("Sample out of file bounds: offset=" + offset + " size=" + size);
            }
            raf.seek(offset);
            raf.readFully(buf);
        } catch (IOException e) {
            throw new ParseException("Failed to read sample at " + offset + ": " + e.getMessage(), e);
        }
        return buf;
    }

    /** Дочерние боксы payload'а контейнера. */
    public static List<Box> children(ByteBuffer container) throws ParseException {
        ByteBuffer buf = container.duplicate();
        List<Box> out = new ArrayList<>();
        try {
            while (buf.remaining() >= 8) {
                int start = buf.position();
                long size = Integer.toUnsignedLong(buf.getInt());
                byte[] t = new byte[4];
                buf.get(t);
                String type = new String(t, StandardCharsets.ISO_8859_1);
                int headerSize = 8;
                if (size == 1) {
                    size = buf.getLong();
                    headerSize = 16;
                } else if (size == 0) {
                    size = buf.limit() - start;
                }
                if (size < headerSize || start + size > buf.limit()) {
                    throw new ParseException("Invalid box size " + size + " for '" + type + "' at " + start);
                }
                ByteBuffer data = buf.duplicate();
                data.position(start + headerSize);
                data.limit((int) (start + size));
                out.add(new Box(type, data.slice()));
                buf.position((int) (start + size));
            }
        } catch (BufferUnderflowException e) {
            throw new ParseException("Truncated box header", e);
        }
        return out;
    }

    /** Первый бокс по пути типов, например find(moov, "trak", "mdia", "mdhd"). */
    public static Optional<Box> find(ByteBuffer container, String... path) throws ParseException {
        ByteBuffer cur = container;
        Box found = null;
        for (String type : path) {
            found = null;
            for (Box b : children(cur)) {
                if (b.type().equals(type)) {
                    found = b;
                    break;
                }
            }
            if (found == null) {
                return Optional.empty();
            }
            cur = found.data();
        }
        return Optional.ofNullable(found);
    }

    public static List<Box> findAll(ByteBuffer container, String type) throws ParseException {
        List<Box> out = new ArrayList<>();
        for (Box b : children(container)) {
            if (b.type().equals(type)) {
                out.add(b);
            }
        }
        return out;
    }

    static long readUint32(byte[] b, int off) {
        return ((long) (b[off] & 0xFF) << 24)
                | ((long) (b[off + 1] & 0xFF) << 16)
                | ((long) (b[off + 2] & 0xFF) << 8)
                | ((long) (b[off + 3] & 0xFF));
    }
}
