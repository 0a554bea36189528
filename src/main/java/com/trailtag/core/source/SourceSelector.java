package com.trailtag.core.source;

import com.trailtag.core.error.ExiftoolUnavailableException;
import com.trailtag.core.error.GeotaggingException;
import com.trailtag.core.error.ParseException;
import com.trailtag.core.model.SourceSpec;
import com.trailtag.core.model.Track;
import com.trailtag.core.telemetry.TelemetryData;
import com.trailtag.core.telemetry.TelemetryParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Перебор источников телеметрии для одного медиафайла в заданном порядке.
 *
 * Принимается первый трек хотя бы с одной точкой. Если камера ещё неизвестна,
 * её пробуют взять из оставшихся источников. Состояние между файлами не хранится.
 */
public final class SourceSelector {
    private static final Logger log = LoggerFactory.getLogger(SourceSelector.class);

    /** Выбранный источник: трек, камера, спецификация и файл, из которого он прочитан. */
    public record Selection(Track track, String make, String model, SourceSpec spec, Path source) {
        public Selection {
            Objects.requireNonNull(track, "track");
            Objects.requireNonNull(spec, "spec");
        }
    }

    private final TelemetryParsers parsers;

    public SourceSelector(TelemetryParsers parsers) {
        this.parsers = Objects.requireNonNull(parsers, "parsers");
    }

    public Selection select(Path media, List<SourceSpec> specs) throws GeotaggingException {
        if (specs == null || specs.isEmpty()) {
            throw new GeotaggingException("No geotag sources configured for " + media.getFileName());
        }
        List<String> reasons = new ArrayList<>();
        for (int i = 0; i < specs.size(); i++) {
            SourceSpec spec = specs.get(i);
            Path source = SourcePattern.resolve(spec.pattern(), media);
            try {
                TelemetryData data = tryParse(spec, source, specs.size() == 1);
                if (data.track().isEmpty()) {
                    throw new ParseException("Empty track");
                }
                log.debug("{}: {} points from {} ({})", media.getFileName(), data.track().size(), spec, source);
                String make = data.make();
                String model = data.model();
                if (make == null || model == null) {
                    String[] camera = cameraFromRest(media, specs.subList(i + 1, specs.size()), make, model);
                    make = camera[0];
                    model = camera[1];
                }
                return new Selection(data.track(), make, model, spec, source);
            } catch (ParseException e) {
                log.debug("{}: source {} failed: {}", media.getFileName(), spec, e.getMessage());
                reasons.add(spec + ": " + e.getMessage());
            }
        }
        throw new GeotaggingException("No GPS data found for " + media.getFileName()
                + " in the given sources [" + String.join("; ", reasons) + "]");
    }

    /**
     * exiftool без бинарника фатален, только если это единственный источник,
     * иначе источник пропускается как обычная ошибка разбора.
     */
    private TelemetryData tryParse(SourceSpec spec, Path source, boolean only) throws ParseException {
        if (!Files.isRegularFile(source)) {
            throw new ParseException("Source file not found: " + source);
        }
        try {
            return parsers.get(spec.kind()).parse(source);
        } catch (ExiftoolUnavailableException e) {
            if (only) {
                throw e;
            }
            throw new ParseException("exiftool is not available: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // парсер не должен падать на битом входе, но если упал - это тот же ParseError
            throw new ParseException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private String[] cameraFromRest(Path media, List<SourceSpec> rest, String make, String model) {
        for (SourceSpec spec : rest) {
            if (make != null && model != null) {
                break;
            }
            Path source = SourcePattern.resolve(spec.pattern(), media);
            try {
                TelemetryData d = tryParse(spec, source, false);
                make = make != null ? make : d.make();
                model = model != null ? model : d.model();
            } catch (ParseException e) {
                log.trace("{}: no camera from {}: {}", media.getFileName(), spec, e.getMessage());
            }
        }
        return new String[]{make, model};
    }

    /** Несколько видео и шаблон без подстановок: все видео получили бы один и тот же трек. */
    public static void checkCardinality(List<SourceSpec> specs, int mediaCount) {
        if (mediaCount <= 1) {
            return;
        }
        for (SourceSpec s : specs) {
            if (!SourcePattern.hasPlaceholder(s.pattern())) {
                throw new IllegalArgumentException("Multiple video files found: geotag source pattern for source "
                        + s.kind().configName() + " must include filename placeholders");
            }
        }
    }
}
