package com.trailtag.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Упорядоченный трек, строго возрастающий по времени.
 *
 * Точки с одинаковым временем разводятся на доли секунды при построении:
 * группа из k точек занимает интервал до следующей точки (но не дальше целой секунды).
 * После построения трек неизменяем.
 */
public final class Track {

    private static final Track EMPTY = new Track(List.of());

    private final List<GpsPoint> points;

    private Track(List<GpsPoint> points) {
        this.points = points;
    }

    public static Track empty() {
        return EMPTY;
    }

    /** Сортирует точки по времени и разводит совпадающие метки. */
    public static Track of(List<GpsPoint> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        List<GpsPoint> sorted = new ArrayList<>(raw);
        sorted.sort(Comparator.comparing(GpsPoint::time)); // стабильная сортировка

        List<GpsPoint> out = new ArrayList<>(sorted.size());
        int i = 0;
        final int n = sorted.size();
        while (i < n) {
            Instant t = sorted.get(i).time();
            int j = i + 1;
            while (j < n && sorted.get(j).time().equals(t)) {
                j++;
            }
            int group = j - i;
            if (group == 1) {
                out.add(sorted.get(i));
            } else {
                Instant wholeNext = Instant.ofEpochSecond(t.getEpochSecond() + 1);
                Instant next = j < n && sorted.get(j).time().isBefore(wholeNext)
                        ? sorted.get(j).time()
                        : wholeNext;
                long stepNanos = Duration.between(t, next).toNanos() / group;
                if (stepNanos <= 0) {
                    // некуда раздвигать, оставляем первую
                    out.add(sorted.get(i));
                } else {
                    for (int k = 0; k < group; k++) {
                        out.add(sorted.get(i + k).withTime(t.plusNanos(stepNanos * k)));
                    }
                }
            }
            i = j;
        }
        return new Track(List.copyOf(out));
    }

    public List<GpsPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public GpsPoint get(int idx) {
        return points.get(idx);
    }

    public GpsPoint first() {
        return points.get(0);
    }

    public GpsPoint last() {
        return points.get(points.size() - 1);
    }

    @Override
    public String toString() {
        if (points.isEmpty()) {
            return "Track[]";
        }
        return "Track[" + points.size() + " points, " + first().time() + " .. " + last().time() + "]";
    }
}
