package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Источник "video": по очереди CAMM, GoPro, BlackVue на одном и том же файле. */
public final class VideoParser implements TelemetryParser {
    private static final Logger log = LoggerFactory.getLogger(VideoParser.class);

    private final List<TelemetryParser> delegates;

    public VideoParser(CammParser camm, GpmfParser gopro, BlackVueParser blackvue) {
        this(List.of(camm, gopro, blackvue));
    }

    VideoParser(List<TelemetryParser> delegates) {
        if (delegates.isEmpty()) {
            throw new IllegalArgumentException("no video parsers");
        }
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public TelemetryData parse(Path file) throws ParseException {
        List<String> reasons = new ArrayList<>();
        for (TelemetryParser p : delegates) {
            try {
                return p.parse(file);
            } catch (ParseException e) {
                log.debug("video: {} failed on {}: {}", p.getClass().getSimpleName(), file.getFileName(), e.getMessage());
                reasons.add(e.getMessage());
            }
        }
        throw new ParseException("No supported telemetry in " + file.getFileName() + ": " + String.join("; ", reasons));
    }
}
