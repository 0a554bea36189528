package com.trailtag.core.mp4;

/**
 * Запись elst. segmentDuration в шкале фильма (mvhd), mediaTime в шкале трека;
 * mediaTime == -1 означает пустую правку (сдвиг).
 */
public record EditEntry(long segmentDuration, long mediaTime, double rate) {

    public boolean isEmptyEdit() {
        return mediaTime == -1;
    }
}
