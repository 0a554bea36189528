package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Одно NMEA-предложение: адрес ("GPRMC"), поля и проверка контрольной суммы.
 * Тип определяется по последним трём символам адреса, поэтому GNGGA и GPGGA равнозначны.
 */
public record NmeaSentence(String address, List<String> fields) {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("ddMMyy", Locale.ROOT);

    public NmeaSentence {
        fields = List.copyOf(fields);
    }

    /**
     * Разобрать строку вида "$GPGGA,...*hh". null если строка не NMEA.
     * Неверная контрольная сумма - ParseException.
     */
    public static NmeaSentence parse(String line) throws ParseException {
        if (line == null) {
            return null;
        }
        String s = line.trim();
        int start = s.indexOf('$');
        if (start < 0) {
            return null;
        }
        s = s.substring(start);
        String body;
        int star = s.indexOf('*');
        if (star >= 0) {
            body = s.substring(1, star);
            String sum = s.substring(star + 1).trim();
            if (sum.length() >= 2) {
                int expected;
                try {
                    expected = Integer.parseInt(sum.substring(0, 2), 16);
                } catch (NumberFormatException e) {
                    throw new ParseException("Invalid NMEA checksum '" + sum + "'", e);
                }
                int actual = checksum(body);
                if (actual != expected) {
                    throw new ParseException(String.format(Locale.ROOT,
                            "NMEA checksum mismatch: expected %02X, got %02X", expected, actual));
                }
            }
        } else {
            body = s.substring(1);
        }
        String[] parts = body.split(",", -1);
        if (parts.length < 2 || parts[0].length() < 3) {
            return null;
        }
        return new NmeaSentence(parts[0], Arrays.asList(parts).subList(1, parts.length));
    }

    static int checksum(String body) {
        int sum = 0;
        for (int i = 0; i < body.length(); i++) {
            sum ^= body.charAt(i);
        }
        return sum & 0xFF;
    }

    /** "RMC", "GGA", "GLL" и т.д. */
    public String type() {
        return address.substring(address.length() - 3).toUpperCase(Locale.ROOT);
    }

    public String field(int i) {
        return i < fields.size() ? fields.get(i).trim() : "";
    }

    public boolean isEmpty(int i) {
        return field(i).isEmpty();
    }

    public Double number(int i) throws ParseException {
        String f = field(i);
        if (f.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(f);
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid number '" + f + "' in " + address, e);
        }
    }

    /** ddmm.mmmm / dddmm.mmmm + полушарие в градусы. null если поле пустое. */
    public Double coordinate(int valueIdx, int hemisphereIdx) throws ParseException {
        String v = field(valueIdx);
        if (v.isEmpty()) {
            return null;
        }
        int dot = v.indexOf('.');
        int degDigits = (dot < 0 ? v.length() : dot) - 2;
        if (degDigits < 1) {
            throw new ParseException("Invalid coordinate '" + v + "' in " + address);
        }
        double deg;
        double min;
        try {
            deg = Integer.parseInt(v.substring(0, degDigits));
            min = Double.parseDouble(v.substring(degDigits));
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid coordinate '" + v + "' in " + address, e);
        }
        double out = deg + min / 60.0;
        String h = field(hemisphereIdx).toUpperCase(Locale.ROOT);
        if ("S".equals(h) || "W".equals(h)) {
            out = -out;
        }
        return out;
    }

    /** hhmmss(.sss) в UTC. */
    public LocalTime time(int i) throws ParseException {
        String v = field(i);
        if (v.length() < 6) {
            return null;
        }
        try {
            int h = Integer.parseInt(v.substring(0, 2));
            int m = Integer.parseInt(v.substring(2, 4));
            double sec = Double.parseDouble(v.substring(4));
            int whole = (int) Math.floor(sec);
            int nanos = (int) Math.round((sec - whole) * 1e9);
            return LocalTime.of(h, m, whole, Math.min(nanos, 999_999_999));
        } catch (NumberFormatException | DateTimeException e) {
            throw new ParseException("Invalid NMEA time '" + v + "' in " + address, e);
        }
    }

    /** ddmmyy. */
    public LocalDate date(int i) throws ParseException {
        String v = field(i);
        if (v.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(v, DATE);
        } catch (DateTimeParseException e) {
            throw new ParseException("Invalid NMEA date '" + v + "' in " + address, e);
        }
    }

    @Override
    public String toString() {
        return "$" + address + "," + String.join(",", fields);
    }
}
