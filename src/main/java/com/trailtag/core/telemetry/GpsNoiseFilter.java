package com.trailtag.core.telemetry;

import com.trailtag.core.geo.Geo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Фильтр шумных точек GoPro.
 *
 * 1) точки с известной фиксацией вне {2,3} и с DOP*100 выше порога отбрасываются;
 * 2) выбросы: трек режется там, где шаг длиннее верхнего "уса" (Q3 + 1.5*IQR) расстояний,
 *    куски склеиваются обратно, если скорость на стыке не выше уса скоростей,
 *    остаётся самый длинный кластер.
 */
public final class GpsNoiseFilter {
    private static final Logger log = LoggerFactory.getLogger(GpsNoiseFilter.class);

    public static final Set<Integer> DEFAULT_FIXES = Set.of(2, 3);
    public static final double DEFAULT_MAX_DOP100 = 1000;
    // точность GPS GoPro в метрах
    public static final double DEFAULT_GPS_PRECISION = 15;

    private final Set<Integer> fixes;
    private final double maxDop100;
    private final double gpsPrecision;

    public GpsNoiseFilter() {
        this(DEFAULT_FIXES, DEFAULT_MAX_DOP100, DEFAULT_GPS_PRECISION);
    }

    public GpsNoiseFilter(Set<Integer> fixes, double maxDop100, double gpsPrecision) {
        this.fixes = Set.copyOf(fixes);
        this.maxDop100 = maxDop100;
        this.gpsPrecision = gpsPrecision;
    }

    public List<GpmfPoint> filter(List<GpmfPoint> points) {
        int n = points.size();
        List<GpmfPoint> kept = new ArrayList<>(n);
        for (GpmfPoint p : points) {
            if (p.fix() != null && !fixes.contains(p.fix())) {
                continue;
            }
            if (p.precision() != null && p.precision() > maxDop100) {
                continue;
            }
            kept.add(p);
        }
        if (kept.size() < n) {
            log.debug("removed {} points by GPS fix/DOP", n - kept.size());
        }
        int before = kept.size();
        List<GpmfPoint> result = removeOutliers(kept);
        if (result.size() < before) {
            log.debug("removed {} outlier points", before - result.size());
        }
        return result;
    }

    List<GpmfPoint> removeOutliers(List<GpmfPoint> points) {
        if (points.size() < 3) {
            return points;
        }
        double[] distances = new double[points.size() - 1];
        for (int i = 1; i < points.size(); i++) {
            distances[i - 1] = distance(points.get(i - 1), points.get(i));
        }
        // шаг между двумя точками, поэтому точность удваивается
        double maxDistance = Math.max(gpsPrecision + gpsPrecision, upperWhisker(distances));

        List<List<GpmfPoint>> segments = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            if (i == 0 || distances[i - 1] > maxDistance) {
                segments.add(new ArrayList<>());
            }
            segments.get(segments.size() - 1).add(points.get(i));
        }

        double[] speeds = points.stream()
                .filter(p -> p.groundSpeed() != null)
                .mapToDouble(GpmfPoint::groundSpeed)
                .toArray();
        if (speeds.length < 2) {
            return points;
        }
        double maxSpeed = upperWhisker(speeds);

        // одномерный DBSCAN по кускам: правый кусок присоединяется к первому левому,
        // если скорость на стыке не выше maxSpeed
        Map<Integer, Integer> mergeTo = new LinkedHashMap<>();
        for (int left = 0; left < segments.size(); left++) {
            mergeTo.putIfAbsent(left, left);
            for (int right = left + 1; right < segments.size(); right++) {
                if (mergeTo.containsKey(right)) {
                    continue;
                }
                List<GpmfPoint> l = segments.get(left);
                if (speed(l.get(l.size() - 1), segments.get(right).get(0)) <= maxSpeed) {
                    mergeTo.put(right, mergeTo.get(left));
                    break;
                }
            }
        }
        Map<Integer, List<GpmfPoint>> clusters = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            clusters.computeIfAbsent(mergeTo.get(i), k -> new ArrayList<>()).addAll(segments.get(i));
        }
        List<GpmfPoint> best = List.of();
        for (List<GpmfPoint> c : clusters.values()) {
            if (c.size() > best.size()) {
                best = c;
            }
        }
        return best;
    }

    /** Q3 + 1.5 * IQR; квартили как медианы нижней и верхней половин. */
    static double upperWhisker(double[] values) {
        if (values.length < 2) {
            throw new IllegalArgumentException("at least 2 values are required for IQR");
        }
        double[] v = values.clone();
        Arrays.sort(v);
        int n = v.length;
        int mid = n / 2;
        double q1 = median(v, 0, mid);
        double q3 = n % 2 == 1 ? median(v, mid + 1, n) : median(v, mid, n);
        return q3 + (q3 - q1) * 1.5;
    }

    private static double median(double[] sorted, int from, int to) {
        int len = to - from;
        int m = from + len / 2;
        return len % 2 == 1 ? sorted[m] : (sorted[m - 1] + sorted[m]) / 2.0;
    }

    private static double distance(GpmfPoint a, GpmfPoint b) {
        return Geo.haversine(a.lat(), a.lon(), b.lat(), b.lon());
    }

    private static double speed(GpmfPoint a, GpmfPoint b) {
        double s = distance(a, b);
        double t = Math.abs(b.time() - a.time());
        return t == 0 ? Double.POSITIVE_INFINITY : s / t;
    }
}
