package com.trailtag.core.sequence;

import com.trailtag.core.geo.Geo;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Отметка дублей внутри последовательности: запись сравнивается с непосредственно предыдущей.
 * Дубль, если расстояние < duplicateDistance и (при включённой проверке угла) разность курсов
 * < duplicateAngle. Угол 360 и больше (или не конечный) выключает проверку угла.
 * Если курс неизвестен у одной из записей, условие по углу считается выполненным.
 */
public final class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final double duplicateDistance;
    private final double duplicateAngle;

    public DuplicateDetector(double duplicateDistance, double duplicateAngle) {
        if (!(duplicateDistance >= 0)) {
            throw new IllegalArgumentException("duplicateDistance must be >= 0: " + duplicateDistance);
        }
        this.duplicateDistance = duplicateDistance;
        this.duplicateAngle = duplicateAngle;
    }

    public boolean angleCheckEnabled() {
        return Double.isFinite(duplicateAngle) && duplicateAngle < 360.0;
    }

    /** Возвращает число отмеченных дублей. */
    public int flag(Sequence sequence) {
        List<CaptureRecord> members = sequence.members();
        int flagged = 0;
        for (int i = 1; i < members.size(); i++) {
            CaptureRecord prev = members.get(i - 1);
            CaptureRecord cur = members.get(i);
            if (isDuplicate(prev, cur)) {
                cur.markDuplicate();
                flagged++;
            }
        }
        if (flagged > 0) {
            log.debug("sequence {}: {} duplicates", sequence.id(), flagged);
        }
        return flagged;
    }

    boolean isDuplicate(CaptureRecord prev, CaptureRecord cur) {
        double d = Geo.haversine(prev.lat(), prev.lon(), cur.lat(), cur.lon());
        if (!(d < duplicateDistance)) {
            return false;
        }
        if (!angleCheckEnabled() || prev.heading() == null || cur.heading() == null) {
            return true;
        }
        return Geo.diffBearing(prev.heading(), cur.heading()) < duplicateAngle;
    }
}
