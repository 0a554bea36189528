package com.trailtag.core.geo;

import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.GpsPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Курс по геометрии последовательности.
 *
 * Точке i присваивается начальный курс на точку i+1, последняя точка берёт курс предыдущего отрезка.
 * Существующий курс перезаписывается только при overwrite=true (interpolate_directions),
 * иначе заполняются пропуски. offsetAngle добавляется ко всем курсам с нормализацией в [0,360).
 */
public final class DirectionDeriver {

    private final double offsetAngle;
    private final boolean overwrite;

    public DirectionDeriver(double offsetAngle, boolean overwrite) {
        if (!Double.isFinite(offsetAngle)) {
            throw new IllegalArgumentException("offsetAngle must be finite: " + offsetAngle);
        }
        this.offsetAngle = offsetAngle;
        this.overwrite = overwrite;
    }

    /** records должны быть упорядочены по времени и иметь позицию. */
    public void derive(List<CaptureRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        final int n = records.size();
        double[] bearings = n >= 2 ? segmentBearings(records) : null;

        for (int i = 0; i < n; i++) {
            CaptureRecord r = records.get(i);
            Double heading = r.heading();
            if (bearings != null && (overwrite || heading == null)) {
                heading = bearings[i];
            }
            if (heading != null && offsetAngle != 0.0) {
                heading = Geo.offsetBearing(heading, offsetAngle);
            }
            r.setHeading(heading);
        }
    }

    private static double[] segmentBearings(List<CaptureRecord> records) {
        final int n = records.size();
        double[] out = new double[n];
        for (int i = 0; i < n - 1; i++) {
            CaptureRecord a = records.get(i);
            CaptureRecord b = records.get(i + 1);
            out[i] = Geo.bearing(a.lat(), a.lon(), b.lat(), b.lon());
        }
        out[n - 1] = out[n - 2];
        return out;
    }

    /** Для точек трека: заполнить только отсутствующие курсы, без сдвига. */
    public static List<GpsPoint> fillMissing(List<GpsPoint> points) {
        if (points == null || points.size() < 2) {
            return points;
        }
        final int n = points.size();
        List<GpsPoint> out = new ArrayList<>(n);
        double prev = 0.0;
        for (int i = 0; i < n; i++) {
            GpsPoint p = points.get(i);
            double b;
            if (i < n - 1) {
                GpsPoint q = points.get(i + 1);
                b = Geo.bearing(p.lat(), p.lon(), q.lat(), q.lon());
                prev = b;
            } else {
                b = prev;
            }
            out.add(p.heading() == null ? p.withHeading(b) : p);
        }
        return out;
    }
}
