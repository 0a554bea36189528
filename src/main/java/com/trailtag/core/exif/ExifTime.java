package com.trailtag.core.exif;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор дат EXIF, GPS и ISO-8601.
 *
 * Дата "2021:09:14 08:23:56" и "2021-09-14T08:23:56.5Z" разбираются одним выражением.
 * Время без зоны считается UTC. Некорректные значения дают null.
 */
public final class ExifTime {

    private static final Pattern DATE_TIME = Pattern.compile(
            "^(\\d{4})[:\\-](\\d{1,2})[:\\-](\\d{1,2})[ T](\\d{1,2}):(\\d{1,2}):(\\d{1,2})(?:\\.(\\d+))?\\s*(Z|[+\\-]\\d{1,2}(?::?\\d{2})?)?$");
    private static final Pattern DATE = Pattern.compile("^(\\d{4})[:\\-](\\d{1,2})[:\\-](\\d{1,2})$");
    private static final Pattern TIME = Pattern.compile("^(\\d{1,2})[: ](\\d{1,2})[: ](\\d{1,2})(?:\\.(\\d+))?(?:\\s*(Z|[+\\-]\\d{1,2}(?::?\\d{2})?))?$");

    private ExifTime() {
        // no-op
    }

    public static Instant parse(String value) {
        return parse(value, null, null);
    }

    /**
     * DateTimeOriginal + SubSecTimeOriginal + OffsetTimeOriginal.
     * Дробная часть из subsec заменяет дробную часть в значении; пробелы в subsec читаются как нули.
     */
    public static Instant parse(String value, String subsec, String offset) {
        if (value == null) {
            return null;
        }
        Matcher m = DATE_TIME.matcher(value.trim());
        if (!m.matches()) {
            return null;
        }
        try {
            LocalDateTime dt = LocalDateTime.of(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)), Integer.parseInt(m.group(6)));
            String fraction = m.group(7);
            if (subsec != null && !subsec.isBlank()) {
                String s = subsec.trim().replace(' ', '0');
                if (s.chars().allMatch(Character::isDigit)) {
                    fraction = s;
                }
            }
            dt = dt.withNano(fractionNanos(fraction));
            String zone = m.group(8);
            if (offset != null && !offset.isBlank()) {
                zone = offset.trim();
            }
            return dt.toInstant(zone(zone));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    /** GPSDateStamp ("2021:09:14") + GPSTimeStamp ("08:23:56.5" или "8 23 56.5"), UTC. */
    public static Instant gps(String date, String time) {
        if (date == null || time == null) {
            return null;
        }
        Matcher d = DATE.matcher(date.trim());
        Matcher t = TIME.matcher(time.trim());
        if (!d.matches() || !t.matches()) {
            return null;
        }
        try {
            LocalDate day = LocalDate.of(Integer.parseInt(d.group(1)), Integer.parseInt(d.group(2)),
                    Integer.parseInt(d.group(3)));
            LocalDateTime dt = day.atTime(Integer.parseInt(t.group(1)), Integer.parseInt(t.group(2)),
                    Integer.parseInt(t.group(3)), fractionNanos(t.group(4)));
            return dt.toInstant(ZoneOffset.UTC);
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    private static int fractionNanos(String fraction) {
        if (fraction == null || fraction.isEmpty()) {
            return 0;
        }
        String f = fraction.length() > 9 ? fraction.substring(0, 9) : fraction;
        StringBuilder sb = new StringBuilder(f);
        while (sb.length() < 9) {
            sb.append('0');
        }
        return Integer.parseInt(sb.toString());
    }

    static ZoneOffset zone(String z) {
        if (z == null || z.isEmpty() || "Z".equalsIgnoreCase(z)) {
            return ZoneOffset.UTC;
        }
        String s = z.replace(":", "");
        int sign = s.charAt(0) == '-' ? -1 : 1;
        String digits = s.charAt(0) == '-' || s.charAt(0) == '+' ? s.substring(1) : s;
        int hours;
        int minutes = 0;
        if (digits.length() <= 2) {
            hours = Integer.parseInt(digits);
        } else {
            hours = Integer.parseInt(digits.substring(0, digits.length() - 2));
            minutes = Integer.parseInt(digits.substring(digits.length() - 2));
        }
        return ZoneOffset.ofHoursMinutes(sign * hours, sign * minutes);
    }
}
