package com.trailtag.core.mp4;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Трек из moov/trak: тип обработчика (hdlr), шкала времени (mdhd), отсчёты и правки (elst). */
public record Mp4Track(String handlerType, long timescale, SampleTable table, List<EditEntry> edits) {

    public Mp4Track {
        edits = edits == null ? List.of() : List.copyOf(edits);
    }

    public boolean hasFormat(String format) {
        return table.hasFormat(format);
    }

    /** Отсчёты с описанием заданного формата (например "gpmd", "camm"). */
    public List<Mp4Sample> samplesOf(String format) {
        List<Mp4Sample> out = new ArrayList<>();
        for (Mp4Sample s : table.samples()) {
            if (format.equals(table.formatOf(s))) {
                out.add(s);
            }
        }
        return out;
    }

    /**
     * Применить список правок: пустые правки сдвигают время, обычные
     * оставляют отсчёты внутри сегмента и переносят их на шкалу показа.
     */
    public List<Mp4Sample> applyEdits(List<Mp4Sample> samples, long movieTimescale) {
        if (edits.isEmpty() || movieTimescale <= 0) {
            return samples;
        }
        List<Mp4Sample> out = new ArrayList<>();
        double offset = 0.0;
        for (EditEntry e : edits) {
            double segment = (double) e.segmentDuration() / movieTimescale;
            if (e.isEmptyEdit()) {
                offset += segment;
                continue;
            }
            double mediaStart = (double) e.mediaTime() / timescale;
            double mediaEnd = segment > 0 ? mediaStart + segment : Double.POSITIVE_INFINITY;
            for (Mp4Sample s : samples) {
                if (s.time() >= mediaStart && s.time() < mediaEnd) {
                    out.add(s.withTime(offset + s.time() - mediaStart));
                }
            }
            offset += segment;
        }
        out.sort(Comparator.comparingDouble(Mp4Sample::time));
        return out;
    }
}
