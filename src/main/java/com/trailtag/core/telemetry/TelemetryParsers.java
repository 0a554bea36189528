package com.trailtag.core.telemetry;

import com.trailtag.core.exif.ExiftoolRunner;
import com.trailtag.core.model.SourceKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/** Парсер для каждого типа источника. Набор фиксирован, порядок попыток задаёт конфигурация. */
public final class TelemetryParsers {

    private final Map<SourceKind, TelemetryParser> parsers;

    private TelemetryParsers(Map<SourceKind, TelemetryParser> parsers) {
        this.parsers = parsers;
    }

    public static TelemetryParsers defaults(ExiftoolRunner runner) {
        GpsNoiseFilter filter = new GpsNoiseFilter();
        CammParser camm = new CammParser();
        GpmfParser gopro = new GpmfParser(filter);
        BlackVueParser blackvue = new BlackVueParser();
        ExiftoolXmlParser xml = new ExiftoolXmlParser(filter);

        Map<SourceKind, TelemetryParser> m = new EnumMap<>(SourceKind.class);
        m.put(SourceKind.VIDEO, new VideoParser(camm, gopro, blackvue));
        m.put(SourceKind.CAMM, camm);
        m.put(SourceKind.GOPRO, gopro);
        m.put(SourceKind.BLACKVUE, blackvue);
        m.put(SourceKind.GPX, new GpxParser());
        m.put(SourceKind.NMEA, new NmeaParser());
        m.put(SourceKind.EXIFTOOL_XML, xml);
        m.put(SourceKind.EXIFTOOL_RUNTIME, new ExiftoolRuntimeParser(runner, xml));
        return new TelemetryParsers(m);
    }

    /** Для тестов: заменить парсер одного типа. */
    public TelemetryParsers with(SourceKind kind, TelemetryParser parser) {
        Map<SourceKind, TelemetryParser> m = new EnumMap<>(parsers);
        m.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(parser, "parser"));
        return new TelemetryParsers(m);
    }

    public TelemetryParser get(SourceKind kind) {
        TelemetryParser p = parsers.get(kind);
        if (p == null) {
            throw new IllegalArgumentException("No parser for " + kind);
        }
        return p;
    }
}
