package com.trailtag.core.sequence;

import com.trailtag.core.model.CaptureRecord;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Разведение совпадающих (с точностью до миллисекунды) времён съёмки.
 *
 * Группа из k записей с одной миллисекундой равномерно занимает интервал до следующей записи,
 * но не дальше следующей целой секунды: [1, 1, 1, 1, 1, 2] → [1.0, 1.2, 1.4, 1.6, 1.8, 2].
 * Вход должен быть отсортирован по времени.
 */
public final class SubsecondInterpolator {

    private SubsecondInterpolator() {
        // no-op
    }

    public static void interpolate(List<CaptureRecord> sorted) {
        final int n = sorted.size();
        int i = 0;
        while (i < n) {
            Instant t = sorted.get(i).time();
            long key = t.toEpochMilli();
            int j = i + 1;
            while (j < n && sorted.get(j).time().toEpochMilli() == key) {
                j++;
            }
            int group = j - i;
            if (group > 1) {
                Instant wholeNext = t.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
                Instant next = j < n && sorted.get(j).time().isBefore(wholeNext) ? sorted.get(j).time() : wholeNext;
                long stepNanos = Duration.between(t, next).toNanos() / group;
                for (int k = 1; k < group; k++) {
                    sorted.get(i + k).setTime(t.plusNanos(stepNanos * k));
                }
            }
            i = j;
        }
    }
}
