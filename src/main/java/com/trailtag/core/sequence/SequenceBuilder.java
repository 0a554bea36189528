package com.trailtag.core.sequence;

import com.trailtag.core.geo.Geo;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Разбиение записей на последовательности.
 *
 * Записи группируются по (каталог, make, model), сортируются по времени, совпадающие миллисекунды
 * разводятся, затем новая последовательность начинается, если Δt > cutoffTime, или расстояние
 * > cutoffDistance, или текущая уже содержит maxLength записей. Каждая последовательность получает id.
 */
public final class SequenceBuilder {
    private static final Logger log = LoggerFactory.getLogger(SequenceBuilder.class);

    public static final int MAX_SEQUENCE_LENGTH = 500;

    private final double cutoffDistance;
    private final double cutoffTime;
    private final int maxLength;
    private final Supplier<String> ids;

    public SequenceBuilder(double cutoffDistance, double cutoffTime, int maxLength, Supplier<String> ids) {
        if (maxLength < 1 || maxLength > MAX_SEQUENCE_LENGTH) {
            throw new IllegalArgumentException("maxLength must be in [1, " + MAX_SEQUENCE_LENGTH + "]: " + maxLength);
        }
        if (!(cutoffDistance >= 0) || !(cutoffTime >= 0)) {
            throw new IllegalArgumentException("cutoffs must be >= 0: distance=" + cutoffDistance + ", time=" + cutoffTime);
        }
        this.cutoffDistance = cutoffDistance;
        this.cutoffTime = cutoffTime;
        this.maxLength = maxLength;
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public static Supplier<String> uuidIds() {
        return () -> UUID.randomUUID().toString();
    }

    /** "0", "1", ... в порядке построения. */
    public static Supplier<String> incrementalIds() {
        AtomicLong counter = new AtomicLong();
        return () -> Long.toString(counter.getAndIncrement());
    }

    /** records - только записи со временем и позицией. */
    public List<Sequence> build(List<CaptureRecord> records) {
        List<Sequence> out = new ArrayList<>();
        for (List<CaptureRecord> group : groupByFolderAndCamera(records).values()) {
            group.sort(CaptureRecord.BY_TIME);
            SubsecondInterpolator.interpolate(group);
            for (List<CaptureRecord> part : split(group)) {
                String id = ids.get();
                for (CaptureRecord r : part) {
                    r.setSequenceId(id);
                }
                out.add(new Sequence(id, part));
            }
        }
        log.info("built {} sequences from {} images", out.size(), records.size());
        return out;
    }

    List<List<CaptureRecord>> split(List<CaptureRecord> sorted) {
        List<List<CaptureRecord>> out = new ArrayList<>();
        List<CaptureRecord> cur = new ArrayList<>();
        CaptureRecord prev = null;
        for (CaptureRecord r : sorted) {
            if (prev != null && shouldSplit(cur, prev, r)) {
                out.add(cur);
                cur = new ArrayList<>();
            }
            cur.add(r);
            prev = r;
        }
        if (!cur.isEmpty()) {
            out.add(cur);
        }
        return out;
    }

    private boolean shouldSplit(List<CaptureRecord> cur, CaptureRecord prev, CaptureRecord r) {
        if (cur.size() >= maxLength) {
            log.debug("split at {}: max sequence length {}", r.file().getFileName(), maxLength);
            return true;
        }
        double dt = Geo.seconds(prev.time(), r.time());
        if (dt > cutoffTime) {
            log.debug("split at {}: time gap {}s > {}s", r.file().getFileName(), dt, cutoffTime);
            return true;
        }
        double d = Geo.haversine(prev.lat(), prev.lon(), r.lat(), r.lon());
        if (d > cutoffDistance) {
            log.debug("split at {}: distance {}m > {}m", r.file().getFileName(), d, cutoffDistance);
            return true;
        }
        return false;
    }

    static Map<List<Object>, List<CaptureRecord>> groupByFolderAndCamera(List<CaptureRecord> records) {
        Map<List<Object>, List<CaptureRecord>> groups = new LinkedHashMap<>();
        for (CaptureRecord r : records) {
            Path dir = r.file().toAbsolutePath().getParent();
            List<Object> key = new ArrayList<>(3);
            key.add(dir);
            key.add(r.make());
            key.add(r.model());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        return groups;
    }
}
