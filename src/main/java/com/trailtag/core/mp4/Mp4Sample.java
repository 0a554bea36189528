package com.trailtag.core.mp4;

/**
 * Отсчёт трека: позиция в файле, размер, время и длительность в секундах
 * от начала трека, индекс описания (1-based, из stsc).
 */
public record Mp4Sample(long offset, int size, double time, double duration, int descriptionIndex) {

    public Mp4Sample withTime(double t) {
        return new Mp4Sample(offset, size, t, duration, descriptionIndex);
    }
}
